package io.flowcheck.core.report;

import io.flowcheck.core.check.CheckOutcome;
import io.flowcheck.core.flow.NodeStatus;
import java.time.Instant;
import java.util.List;

/// Terminal state of one node as recorded in the report.
///
/// @param id node id
/// @param name display name
/// @param status terminal status
/// @param dependencies dependency ids, sorted
/// @param startedAt start time, null if the node never ran
/// @param finishedAt finish time, null if the node never ran
/// @param durationSeconds elapsed seconds, null if the node never ran
/// @param error fault, block or skip reason, null for completed nodes
/// @param outcome check outcome, null unless `COMPLETED`
public record NodeSummary(
        String id,
        String name,
        NodeStatus status,
        List<String> dependencies,
        Instant startedAt,
        Instant finishedAt,
        Double durationSeconds,
        String error,
        CheckOutcome outcome) {

    public NodeSummary {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }
}
