package io.flowcheck.core.check;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Accumulates assertions and findings while a check runs, then freezes them
/// into a {@link CheckOutcome}.
///
/// {@snippet :
/// OutcomeRecorder recorder = new OutcomeRecorder("Data Integrity Validator");
/// recorder.pass();
/// recorder.critical(FindingCategory.DUPLICATE_KEY, "tasks", "id", "T-1", "id occurs twice");
/// CheckOutcome outcome = recorder.toOutcome();
/// }
///
/// @implNote **Not thread-safe**. One recorder belongs to one check invocation.
public final class OutcomeRecorder {

    private final String checkName;
    private final List<Finding> findings = new ArrayList<>();
    private final Map<String, Object> details = new LinkedHashMap<>();
    private int passed;

    /// @param checkName display name stamped on every finding, not null
    public OutcomeRecorder(String checkName) {
        this.checkName = checkName;
    }

    /// Records one assertion that held.
    public void pass() {
        passed++;
    }

    /// Records a critical finding.
    public void critical(
            FindingCategory category,
            String table,
            String field,
            String recordId,
            String description) {
        findings.add(
                new Finding(
                        checkName, category, Severity.CRITICAL, table, field, recordId, description));
    }

    /// Records a warning finding.
    public void warning(
            FindingCategory category,
            String table,
            String field,
            String recordId,
            String description) {
        findings.add(
                new Finding(
                        checkName, category, Severity.WARNING, table, field, recordId, description));
    }

    /// Records a pass when `holds` is true, otherwise a finding of the given severity.
    ///
    /// @return `holds`, for chaining into further assertions
    public boolean expect(
            boolean holds,
            Severity severity,
            FindingCategory category,
            String table,
            String field,
            String description) {
        if (holds) {
            pass();
        } else {
            findings.add(
                    new Finding(checkName, category, severity, table, field, null, description));
        }
        return holds;
    }

    /// Attaches an informational measurement.
    public void detail(String key, Object value) {
        details.put(key, value);
    }

    /// Number of findings recorded so far.
    public int findingCount() {
        return findings.size();
    }

    public String getCheckName() {
        return checkName;
    }

    /// Freezes the recorded state.
    ///
    /// @return the derived outcome, never null
    public CheckOutcome toOutcome() {
        return CheckOutcome.of(passed, findings, details);
    }
}
