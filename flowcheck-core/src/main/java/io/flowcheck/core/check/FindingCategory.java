package io.flowcheck.core.check;

/// Kind of data-quality issue a {@link Finding} describes.
public enum FindingCategory {
    FOREIGN_KEY_VIOLATION,
    MALFORMED_STRUCTURE,
    ORPHANED_REFERENCE,
    TIMESTAMP_INCONSISTENCY,
    DUPLICATE_KEY,
    STALE_SOFT_DELETE,
    DEPENDENCY_CYCLE,
    MISSING_RECIPROCAL,
    LIFECYCLE_VIOLATION,
    STATE_REQUIREMENT,
    API_CONTRACT,
    AUDIT_COVERAGE,
    EVIDENCE,
    PERFORMANCE_THRESHOLD
}
