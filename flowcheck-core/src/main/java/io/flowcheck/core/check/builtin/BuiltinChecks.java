package io.flowcheck.core.check.builtin;

import io.flowcheck.core.check.CheckRegistry;
import io.flowcheck.core.flow.StandardFlow;

/// Registers the six built-in validators under the node ids of {@link StandardFlow}.
public final class BuiltinChecks {

    private BuiltinChecks() {}

    public static void registerAll(CheckRegistry registry) {
        registry.register(StandardFlow.INTEGRITY, DataIntegrityCheck::new);
        registry.register(StandardFlow.CRUD, CrudBehaviorCheck::new);
        registry.register(StandardFlow.STATE, StateTransitionCheck::new);
        registry.register(StandardFlow.RELATIONSHIP, RelationshipCheck::new);
        registry.register(StandardFlow.AUDIT, AuditTrailCheck::new);
        registry.register(StandardFlow.PERFORMANCE, PerformanceCheck::new);
    }
}
