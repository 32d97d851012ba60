package io.flowcheck.core.check;

import java.util.List;

/// Verdict of a single check.
public enum OutcomeStatus {
    PASSED,
    PASSED_WITH_WARNINGS,
    FAILED;

    /// Derives the verdict from a findings list.
    ///
    /// Any critical finding gives `FAILED`, no findings give `PASSED`, and
    /// warnings alone give `PASSED_WITH_WARNINGS`.
    ///
    /// @param findings the findings, not null
    /// @return the derived verdict, never null
    public static OutcomeStatus fromFindings(List<Finding> findings) {
        if (findings.stream().anyMatch(Finding::isCritical)) {
            return FAILED;
        }
        return findings.isEmpty() ? PASSED : PASSED_WITH_WARNINGS;
    }
}
