package io.flowcheck.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

/// Jackson mixin for `FlowReport.Builder`. Maps JSON field names directly to
/// builder method names.
///
/// @see FlowReportMixin
@JsonPOJOBuilder(withPrefix = "")
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class FlowReportBuilderMixin {}
