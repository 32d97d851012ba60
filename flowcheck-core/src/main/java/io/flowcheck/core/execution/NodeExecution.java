package io.flowcheck.core.execution;

import io.flowcheck.core.check.CheckOutcome;
import java.time.Instant;

/// What a worker hands back to the coordinator after invoking one check.
///
/// Exactly one of `outcome` and `error` is set.
///
/// @param nodeId id of the executed node
/// @param startedAt time the check started on the worker
/// @param finishedAt time the check returned, faulted or timed out
/// @param outcome the structured outcome, null for a fault
/// @param error the fault description, null for an outcome
record NodeExecution(
        String nodeId, Instant startedAt, Instant finishedAt, CheckOutcome outcome, String error) {

    static NodeExecution completed(
            String nodeId, Instant startedAt, Instant finishedAt, CheckOutcome outcome) {
        return new NodeExecution(nodeId, startedAt, finishedAt, outcome, null);
    }

    static NodeExecution faulted(
            String nodeId, Instant startedAt, Instant finishedAt, String error) {
        return new NodeExecution(nodeId, startedAt, finishedAt, null, error);
    }

    boolean isFault() {
        return outcome == null;
    }
}
