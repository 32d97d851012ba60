package io.flowcheck.core.report;

/// Assertion counts summed across every node that executed.
///
/// @param totalChecks assertions evaluated
/// @param passed assertions that held
/// @param failed assertions that produced a finding, plus one per node fault
/// @param warnings warning findings
/// @param criticalFailures critical findings, plus one per node fault
/// @param successRate `passed / totalChecks * 100`, `0` when nothing was evaluated
public record ValidationSummary(
        int totalChecks,
        int passed,
        int failed,
        int warnings,
        int criticalFailures,
        double successRate) {

    /// Builds a summary, computing and clamping the success rate.
    public static ValidationSummary of(
            int totalChecks, int passed, int failed, int warnings, int criticalFailures) {
        double rate = totalChecks == 0 ? 0.0 : (double) passed / totalChecks * 100.0;
        rate = Math.max(0.0, Math.min(100.0, rate));
        return new ValidationSummary(totalChecks, passed, failed, warnings, criticalFailures, rate);
    }
}
