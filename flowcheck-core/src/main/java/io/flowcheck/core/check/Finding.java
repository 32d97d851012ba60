package io.flowcheck.core.check;

/// One concrete issue discovered by a check.
///
/// Findings are observations only. Producing one never changes the inspected store.
///
/// @param checkName display name of the check that found the issue, not null
/// @param category kind of issue, not null
/// @param severity severity, not null
/// @param table table or resource the issue lives in, may be null
/// @param field column or attribute involved, may be null
/// @param recordId primary key of the offending record, may be null
/// @param description human-readable explanation, not null
public record Finding(
        String checkName,
        FindingCategory category,
        Severity severity,
        String table,
        String field,
        String recordId,
        String description) {

    /// Returns whether this finding gates downstream execution.
    public boolean isCritical() {
        return severity == Severity.CRITICAL;
    }
}
