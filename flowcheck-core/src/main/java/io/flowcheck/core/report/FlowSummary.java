package io.flowcheck.core.report;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// Node state counts of a flow run.
///
/// @param totalNodes nodes in the graph
/// @param completed nodes whose check returned an outcome
/// @param failed nodes whose check faulted or timed out
/// @param blocked nodes disqualified by a dependency
/// @param skipped nodes excluded by configuration or aborted
/// @param nodeDurations seconds spent per executed node, keyed by id in execution order
public record FlowSummary(
        int totalNodes,
        int completed,
        int failed,
        int blocked,
        int skipped,
        Map<String, Double> nodeDurations) {

    public FlowSummary {
        nodeDurations =
                nodeDurations == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(nodeDurations));
    }
}
