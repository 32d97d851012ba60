package io.flowcheck.core.check;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Structured result of one {@link Check} run.
///
/// `failed` counts findings, `passed` counts assertions that held, and
/// `totalChecks` is their sum. `warnings` and `criticalCount` split the findings
/// by severity. `details` carries informational measurements (coverage ratios,
/// timings) that do not affect the verdict.
///
/// ### Contracts
/// - **Invariant**: `status` equals {@link OutcomeStatus#fromFindings(List)} for outcomes
///   built through {@link #of(int, List, Map)}
///
/// @param totalChecks number of assertions evaluated
/// @param passed assertions that held
/// @param failed assertions that produced a finding
/// @param warnings findings with {@link Severity#WARNING}
/// @param criticalCount findings with {@link Severity#CRITICAL}
/// @param findings every finding, in discovery order, never null
/// @param details informational measurements, never null
/// @param status derived verdict, never null
/// @see OutcomeRecorder
public record CheckOutcome(
        int totalChecks,
        int passed,
        int failed,
        int warnings,
        int criticalCount,
        List<Finding> findings,
        Map<String, Object> details,
        OutcomeStatus status) {

    public CheckOutcome {
        findings = findings == null ? List.of() : List.copyOf(findings);
        details =
                details == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    /// Builds an outcome whose counts and verdict are derived from the findings.
    ///
    /// @param passed number of assertions that held, not negative
    /// @param findings findings in discovery order, not null
    /// @param details informational measurements, not null
    /// @return the derived outcome, never null
    public static CheckOutcome of(int passed, List<Finding> findings, Map<String, Object> details) {
        int critical = (int) findings.stream().filter(Finding::isCritical).count();
        int failed = findings.size();
        return new CheckOutcome(
                passed + failed,
                passed,
                failed,
                failed - critical,
                critical,
                findings,
                details,
                OutcomeStatus.fromFindings(findings));
    }

    /// Returns whether this outcome disqualifies dependent nodes.
    public boolean isBlocking() {
        return status == OutcomeStatus.FAILED && criticalCount > 0;
    }
}
