package io.flowcheck.core.report;

/// Verdict of a whole flow run.
public enum OverallStatus {
    PASSED,
    PASSED_WITH_WARNINGS,
    DEGRADED,
    FAILED;

    /// Threshold of the success rate for `PASSED_WITH_WARNINGS`, in percent.
    public static final double WARNING_THRESHOLD = 90.0;

    /// Threshold of the success rate for `DEGRADED`, in percent.
    public static final double DEGRADED_THRESHOLD = 70.0;

    /// Derives the verdict, evaluating the rules in order:
    /// 1. any critical failure: `FAILED`
    /// 2. no failed assertion: `PASSED`
    /// 3. success rate `>= 90`: `PASSED_WITH_WARNINGS`
    /// 4. success rate `>= 70`: `DEGRADED`
    /// 5. otherwise: `FAILED`
    ///
    /// @param criticalFailures number of critical findings and node faults
    /// @param failed number of failed assertions
    /// @param successRate percentage of passed assertions, in `[0, 100]`
    /// @return the verdict, never null
    public static OverallStatus derive(int criticalFailures, int failed, double successRate) {
        if (criticalFailures > 0) {
            return FAILED;
        }
        if (failed == 0) {
            return PASSED;
        }
        if (successRate >= WARNING_THRESHOLD) {
            return PASSED_WITH_WARNINGS;
        }
        if (successRate >= DEGRADED_THRESHOLD) {
            return DEGRADED;
        }
        return FAILED;
    }

    /// Returns whether this verdict belongs to the success family.
    public boolean isSuccess() {
        return this == PASSED || this == PASSED_WITH_WARNINGS;
    }

    /// Maps the verdict to a process exit code: `0` for the success family, `1` otherwise.
    public int exitCode() {
        return isSuccess() ? 0 : 1;
    }
}
