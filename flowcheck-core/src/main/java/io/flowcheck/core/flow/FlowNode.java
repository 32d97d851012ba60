package io.flowcheck.core.flow;

import io.flowcheck.core.check.Check;
import io.flowcheck.core.check.CheckOutcome;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/// One scheduled unit of a {@link FlowGraph}: a check plus its execution state.
///
/// State moves through exactly one terminal transition:
/// `PENDING → RUNNING → COMPLETED | FAILED`, `PENDING → BLOCKED` or
/// `PENDING → SKIPPED`. Any other transition throws.
///
/// ### Contracts
/// - **Invariant**: `outcome` is present iff status is `COMPLETED`
/// - **Invariant**: `error` is present for `FAILED`, `BLOCKED` and `SKIPPED`
/// - **Invariant**: the node never depends on itself
///
/// @implNote **Not thread-safe**. Only the coordinating thread of
/// {@link io.flowcheck.core.execution.FlowExecutor} mutates a node, and only
/// between layers or after a worker has handed back its result. Workers read
/// nothing but the immutable {@link #getCheck()}.
public final class FlowNode {

    private final NodeDefinition definition;
    private final Check check;

    private NodeStatus status = NodeStatus.PENDING;
    private CheckOutcome outcome;
    private String error;
    private Instant startedAt;
    private Instant finishedAt;

    FlowNode(NodeDefinition definition, Check check) {
        this.definition = definition;
        this.check = check;
    }

    public String getId() {
        return definition.getId();
    }

    public String getName() {
        return definition.getName();
    }

    public Set<String> getDependencies() {
        return definition.getDependencies();
    }

    public NodeDefinition getDefinition() {
        return definition;
    }

    public Check getCheck() {
        return check;
    }

    public NodeStatus getStatus() {
        return status;
    }

    public Optional<CheckOutcome> getOutcome() {
        return Optional.ofNullable(outcome);
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    public Optional<Instant> getStartedAt() {
        return Optional.ofNullable(startedAt);
    }

    public Optional<Instant> getFinishedAt() {
        return Optional.ofNullable(finishedAt);
    }

    /// Returns `finishedAt - startedAt` when both are set.
    public Optional<Duration> getDuration() {
        if (startedAt == null || finishedAt == null) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(startedAt, finishedAt));
    }

    /// Moves `PENDING → RUNNING`.
    ///
    /// @param dispatchedAt time the node was handed to a worker; replaced by the
    /// worker's own start time on completion, not null
    public void markRunning(Instant dispatchedAt) {
        requireStatus(NodeStatus.PENDING, NodeStatus.RUNNING);
        this.status = NodeStatus.RUNNING;
        this.startedAt = dispatchedAt;
    }

    /// Moves `RUNNING → COMPLETED`.
    ///
    /// @param result the check outcome, not null
    /// @param started time the check actually started, null keeps the dispatch time
    /// @param finished time the check returned, not null
    public void complete(CheckOutcome result, Instant started, Instant finished) {
        requireStatus(NodeStatus.RUNNING, NodeStatus.COMPLETED);
        this.status = NodeStatus.COMPLETED;
        this.outcome = result;
        recordTimes(started, finished);
    }

    /// Moves `RUNNING → FAILED` for a fault or timeout.
    ///
    /// @param reason human-readable fault description, not null
    /// @param started time the check actually started, null keeps the dispatch time
    /// @param finished time the fault was observed, not null
    public void fail(String reason, Instant started, Instant finished) {
        requireStatus(NodeStatus.RUNNING, NodeStatus.FAILED);
        this.status = NodeStatus.FAILED;
        this.error = reason;
        recordTimes(started, finished);
    }

    /// Moves `PENDING → BLOCKED`. The check never runs.
    ///
    /// @param reason names the disqualifying dependency, not null
    public void block(String reason) {
        requireStatus(NodeStatus.PENDING, NodeStatus.BLOCKED);
        this.status = NodeStatus.BLOCKED;
        this.error = reason;
    }

    /// Moves `PENDING → SKIPPED`. The check never runs.
    ///
    /// @param reason why the node was excluded or aborted, not null
    public void skip(String reason) {
        requireStatus(NodeStatus.PENDING, NodeStatus.SKIPPED);
        this.status = NodeStatus.SKIPPED;
        this.error = reason;
    }

    private void recordTimes(Instant started, Instant finished) {
        if (started != null) {
            this.startedAt = started;
        }
        this.finishedAt = finished;
    }

    private void requireStatus(NodeStatus expected, NodeStatus target) {
        if (status != expected) {
            throw new IllegalStateException(
                    "Node '" + getId() + "' cannot move from " + status + " to " + target);
        }
    }

    @Override
    public String toString() {
        return "FlowNode{id=" + getId() + ", status=" + status + "}";
    }
}
