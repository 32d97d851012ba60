package io.flowcheck.cli;

import io.flowcheck.core.FlowConfig;
import io.flowcheck.core.check.CheckOutcome;
import io.flowcheck.core.check.DefaultCheckRegistry;
import io.flowcheck.core.check.Finding;
import io.flowcheck.core.check.FindingCategory;
import io.flowcheck.core.check.Severity;
import io.flowcheck.core.flow.FlowGraph;
import io.flowcheck.core.flow.NodeDefinition;
import io.flowcheck.core.report.FlowReport;
import io.flowcheck.core.report.ReportAggregator;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/// Finished reports for printer and command tests.
public final class TestReports {

    public static final String FLOW_ID = "FLOW-20260301-CLI";

    private static final Instant START = Instant.parse("2026-03-01T08:00:00Z");

    private TestReports() {}

    /// Integrity completes with one orphan warning, relationship faults on a refused
    /// connection and state is blocked behind it.
    public static FlowReport failedRun() {
        var registry = new DefaultCheckRegistry();
        for (String id : List.of("integrity", "relationship", "state")) {
            registry.register(id, () -> context -> CheckOutcome.of(0, List.of(), Map.of()));
        }
        var graph =
                FlowGraph.build(
                        List.of(
                                NodeDefinition.builder()
                                        .id("integrity")
                                        .name("Data Integrity Validator")
                                        .build(),
                                NodeDefinition.builder()
                                        .id("relationship")
                                        .name("Relationship Validator")
                                        .dependsOn("integrity")
                                        .build(),
                                NodeDefinition.builder()
                                        .id("state")
                                        .name("State Transition Validator")
                                        .dependsOn("relationship")
                                        .build()),
                        registry);

        var orphan =
                new Finding(
                        "Data Integrity Validator",
                        FindingCategory.ORPHANED_REFERENCE,
                        Severity.WARNING,
                        "tasks",
                        "sprint_id",
                        "T-7",
                        "Task references missing sprint S-9");
        var integrity = graph.getNode("integrity");
        integrity.markRunning(START);
        integrity.complete(
                CheckOutcome.of(4, List.of(orphan), Map.of()), START, START.plusMillis(800));

        var relationship = graph.getNode("relationship");
        relationship.markRunning(START.plusSeconds(1));
        relationship.fail("Connection refused", START.plusSeconds(1), START.plusSeconds(2));

        graph.getNode("state").block("dependency 'relationship' ended FAILED");

        return new ReportAggregator()
                .aggregate(
                        FLOW_ID,
                        "validation",
                        START,
                        START.plusSeconds(3),
                        graph,
                        FlowConfig.builder().build());
    }
}
