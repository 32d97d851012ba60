package io.flowcheck.core.flow;

import io.flowcheck.core.ValidationScope;
import io.flowcheck.core.check.CheckRegistry;
import java.util.List;

/// The standard validation swarm.
///
/// ```
///                 ┌──► crud ─────────┐
///                 ├──► state ────────┤
/// integrity ──────┼──► relationship ─┼──► performance
///                 └──► audit ────────┘
/// ```
///
/// `crud` and `state` drive the task service and run only in `FULL` scope.
/// `performance` additionally requires `includePerformance`.
public final class StandardFlow {

    public static final String INTEGRITY = "integrity";
    public static final String CRUD = "crud";
    public static final String STATE = "state";
    public static final String RELATIONSHIP = "relationship";
    public static final String AUDIT = "audit";
    public static final String PERFORMANCE = "performance";

    /// Value of the report's `flowType` field for this flow.
    public static final String FLOW_TYPE = "validation_swarm";

    private static final List<NodeDefinition> DEFINITIONS =
            List.of(
                    NodeDefinition.builder()
                            .id(INTEGRITY)
                            .name("Data Integrity Validator")
                            .build(),
                    NodeDefinition.builder()
                            .id(CRUD)
                            .name("CRUD Validator")
                            .dependsOn(INTEGRITY)
                            .scopes(ValidationScope.FULL)
                            .build(),
                    NodeDefinition.builder()
                            .id(STATE)
                            .name("State Transition Validator")
                            .dependsOn(INTEGRITY)
                            .scopes(ValidationScope.FULL)
                            .build(),
                    NodeDefinition.builder()
                            .id(RELATIONSHIP)
                            .name("Relationship Validator")
                            .dependsOn(INTEGRITY)
                            .build(),
                    NodeDefinition.builder()
                            .id(AUDIT)
                            .name("Audit Trail Validator")
                            .dependsOn(INTEGRITY)
                            .build(),
                    NodeDefinition.builder()
                            .id(PERFORMANCE)
                            .name("Performance Validator")
                            .dependsOn(CRUD, STATE, RELATIONSHIP, AUDIT)
                            .scopes(ValidationScope.FULL)
                            .performance(true)
                            .build());

    private StandardFlow() {}

    /// Returns the six standard node definitions.
    public static List<NodeDefinition> definitions() {
        return DEFINITIONS;
    }

    /// Builds a fresh standard graph.
    ///
    /// @param registry must resolve the six standard check ids, not null
    /// @return a new graph with every node `PENDING`, never null
    public static FlowGraph create(CheckRegistry registry) {
        return FlowGraph.build(DEFINITIONS, registry);
    }
}
