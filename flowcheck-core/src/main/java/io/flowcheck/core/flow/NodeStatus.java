package io.flowcheck.core.flow;

/// Lifecycle state of a {@link FlowNode}.
///
/// ```
/// PENDING ──► RUNNING ──► COMPLETED
///    │                └─► FAILED
///    ├──► BLOCKED
///    └──► SKIPPED
/// ```
public enum NodeStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    BLOCKED,
    SKIPPED;

    /// Returns whether no further transition is allowed.
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == BLOCKED || this == SKIPPED;
    }

    /// Returns whether a node in this state has executed its check.
    public boolean hasExecuted() {
        return this == COMPLETED || this == FAILED;
    }
}
