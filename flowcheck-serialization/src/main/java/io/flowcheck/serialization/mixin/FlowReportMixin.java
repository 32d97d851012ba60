package io.flowcheck.serialization.mixin;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.flowcheck.core.report.FlowReport;

/// Jackson mixin that binds `FlowReport` deserialization to its builder.
///
/// @apiNote The companion mixin {@link FlowReportBuilderMixin} must also be registered
/// so Jackson knows how to invoke the builder's setters and `build()` method.
///
/// @see io.flowcheck.serialization.FlowCheckJacksonModule
@JsonDeserialize(builder = FlowReport.Builder.class)
public abstract class FlowReportMixin {}
