package io.flowcheck.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.flowcheck.core.check.CheckOutcome;
import io.flowcheck.core.check.Finding;
import io.flowcheck.core.report.FlowReport;
import io.flowcheck.serialization.mixin.DerivedFlagsMixin;
import io.flowcheck.serialization.mixin.FlowReportBuilderMixin;
import io.flowcheck.serialization.mixin.FlowReportMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers the flow report bindings in one place.
///
/// - `FlowReport` + `FlowReport.Builder`: builder-based deserialization of the
///   immutable report
/// - `CheckOutcome`, `Finding`: derived flags hidden from the written JSON
///
/// Records nested in the report (`NodeSummary`, `ValidationSummary`,
/// `FlowSummary`, `RunConfiguration`) bind through their canonical constructors
/// and need no registration.
///
/// @implNote All registrations are explicit. No classpath scanning.
/// @see FlowReportSerializer for the convenience factory API
public class FlowCheckJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 4471920387611502383L;

    public FlowCheckJacksonModule() {
        super("FlowCheckJacksonModule");
    }

    /// Applies mixin annotations to the report types.
    ///
    /// @param context the setup context provided by Jackson, not null
    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(FlowReport.class, FlowReportMixin.class);
        context.setMixInAnnotations(FlowReport.Builder.class, FlowReportBuilderMixin.class);

        context.setMixInAnnotations(CheckOutcome.class, DerivedFlagsMixin.class);
        context.setMixInAnnotations(Finding.class, DerivedFlagsMixin.class);
    }
}
