package io.flowcheck.core.report;

import io.flowcheck.core.FlowConfig;
import io.flowcheck.core.check.CheckOutcome;
import io.flowcheck.core.flow.FlowGraph;
import io.flowcheck.core.flow.FlowNode;
import io.flowcheck.core.flow.NodeStatus;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/// Merges the terminal state of every node into one {@link FlowReport}.
///
/// ### Counting
/// A `COMPLETED` node contributes its outcome's counts. A `FAILED` node has no
/// outcome and contributes one evaluated, failed and critical assertion, so a
/// fault can never read as a pass. `BLOCKED` and `SKIPPED` nodes contribute nothing.
///
/// Counting a fault departs from plain outcome summing, where a node without an
/// outcome adds nothing to the totals. Under plain summing a single
/// timed-out check next to clean siblings still yields `PASSED`; here it yields
/// `FAILED` with one critical failure.
///
/// ### Recommendations
/// Emitted in priority tiers, each tier in execution order:
/// 1. `[CRITICAL] <name> failed: <error>` per faulted node
/// 2. `[BLOCKED] <name> was blocked due to dependency failures` per blocked node
/// 3. `Address critical issues in <name>` per outcome with critical findings
/// 4. `Review <n> warning(s) reported by <name>` per outcome with warnings
///
/// The list is truncated to {@link FlowConfig#getMaxRecommendations()}.
///
/// @implNote Stateless and thread-safe.
public final class ReportAggregator {

    private static final Logger logger = Logger.getLogger(ReportAggregator.class.getName());

    /// Builds the report of a finished run.
    ///
    /// @param flowId id of the run, not null
    /// @param flowType label stored in the report, may be null
    /// @param startedAt run start, not null
    /// @param completedAt run end, not null
    /// @param graph the executed graph with every node terminal, not null
    /// @param config the run configuration, not null
    /// @return the immutable report, never null
    public FlowReport aggregate(
            String flowId,
            String flowType,
            Instant startedAt,
            Instant completedAt,
            FlowGraph graph,
            FlowConfig config) {
        int total = 0;
        int passed = 0;
        int failed = 0;
        int warnings = 0;
        int critical = 0;

        int completedNodes = 0;
        int failedNodes = 0;
        int blockedNodes = 0;
        int skippedNodes = 0;

        List<NodeSummary> summaries = new ArrayList<>();
        Map<String, Double> durations = new LinkedHashMap<>();

        for (FlowNode node : graph.getNodes()) {
            switch (node.getStatus()) {
                case COMPLETED -> {
                    completedNodes++;
                    CheckOutcome outcome = node.getOutcome().orElseThrow();
                    total += outcome.totalChecks();
                    passed += outcome.passed();
                    failed += outcome.failed();
                    warnings += outcome.warnings();
                    critical += outcome.criticalCount();
                }
                case FAILED -> {
                    failedNodes++;
                    total++;
                    failed++;
                    critical++;
                }
                case BLOCKED -> blockedNodes++;
                case SKIPPED -> skippedNodes++;
                default ->
                        throw new IllegalStateException(
                                "Node '" + node.getId() + "' is not terminal: " + node.getStatus());
            }
            Double seconds = node.getDuration().map(ReportAggregator::seconds).orElse(null);
            if (seconds != null) {
                durations.put(node.getId(), seconds);
            }
            summaries.add(summarize(node, seconds));
        }

        ValidationSummary validation = ValidationSummary.of(total, passed, failed, warnings, critical);
        OverallStatus status =
                OverallStatus.derive(
                        validation.criticalFailures(), validation.failed(), validation.successRate());

        logger.info(
                "Flow "
                        + flowId
                        + " aggregated: "
                        + passed
                        + "/"
                        + total
                        + " passed, "
                        + critical
                        + " critical, overall "
                        + status);

        return FlowReport.builder()
                .flowId(flowId)
                .flowType(flowType)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .durationSeconds(seconds(Duration.between(startedAt, completedAt)))
                .configuration(RunConfiguration.of(config))
                .executionOrder(graph.getExecutionOrder())
                .layers(graph.getLayers())
                .nodes(summaries)
                .validationSummary(validation)
                .flowSummary(
                        new FlowSummary(
                                graph.size(),
                                completedNodes,
                                failedNodes,
                                blockedNodes,
                                skippedNodes,
                                durations))
                .overallStatus(status)
                .recommendations(recommendations(graph, config.getMaxRecommendations()))
                .build();
    }

    /// Builds the prioritized recommendation list.
    ///
    /// @param graph the executed graph, not null
    /// @param limit maximum number of entries, not negative
    /// @return at most `limit` recommendations, never null
    List<String> recommendations(FlowGraph graph, int limit) {
        List<String> faulted = new ArrayList<>();
        List<String> blocked = new ArrayList<>();
        List<String> criticalOutcomes = new ArrayList<>();
        List<String> warningOutcomes = new ArrayList<>();

        for (FlowNode node : graph.getNodes()) {
            if (node.getStatus() == NodeStatus.FAILED) {
                faulted.add(
                        "[CRITICAL] "
                                + node.getName()
                                + " failed: "
                                + node.getError().orElse("unknown error"));
            } else if (node.getStatus() == NodeStatus.BLOCKED) {
                blocked.add("[BLOCKED] " + node.getName() + " was blocked due to dependency failures");
            } else if (node.getStatus() == NodeStatus.COMPLETED) {
                CheckOutcome outcome = node.getOutcome().orElseThrow();
                if (outcome.criticalCount() > 0) {
                    criticalOutcomes.add("Address critical issues in " + node.getName());
                } else if (outcome.warnings() > 0) {
                    warningOutcomes.add(
                            "Review "
                                    + outcome.warnings()
                                    + " warning(s) reported by "
                                    + node.getName());
                }
            }
        }

        List<String> all = new ArrayList<>(faulted);
        all.addAll(blocked);
        all.addAll(criticalOutcomes);
        all.addAll(warningOutcomes);
        return all.size() > limit ? List.copyOf(all.subList(0, limit)) : all;
    }

    private static NodeSummary summarize(FlowNode node, Double seconds) {
        return new NodeSummary(
                node.getId(),
                node.getName(),
                node.getStatus(),
                List.copyOf(node.getDependencies()),
                node.getStartedAt().orElse(null),
                node.getFinishedAt().orElse(null),
                seconds,
                node.getError().orElse(null),
                node.getOutcome().orElse(null));
    }

    private static double seconds(Duration duration) {
        return duration.toNanos() / 1_000_000_000.0;
    }
}
