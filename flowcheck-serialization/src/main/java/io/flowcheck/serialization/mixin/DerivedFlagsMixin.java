package io.flowcheck.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/// Keeps derived boolean accessors (`isBlocking()`, `isCritical()`) out of the
/// written JSON. Applied to `CheckOutcome` and `Finding`.
@JsonIgnoreProperties(
        value = {"blocking", "critical"},
        ignoreUnknown = true)
public abstract class DerivedFlagsMixin {}
