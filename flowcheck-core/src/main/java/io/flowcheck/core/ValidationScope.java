package io.flowcheck.core;

/// How much of the standard flow a run schedules.
public enum ValidationScope {
    /// Every check. Performance checks still need `includePerformance`.
    FULL,
    /// Store-only checks. Checks that drive the task service are skipped.
    QUICK;

    /// Parses a scope name case-insensitively.
    ///
    /// @param value `full` or `quick`, not null
    /// @return the scope, never null
    /// @throws IllegalArgumentException for any other value
    public static ValidationScope parse(String value) {
        for (ValidationScope scope : values()) {
            if (scope.name().equalsIgnoreCase(value.trim())) {
                return scope;
            }
        }
        throw new IllegalArgumentException(
                "Unknown validation scope: " + value + ". Expected full or quick");
    }
}
