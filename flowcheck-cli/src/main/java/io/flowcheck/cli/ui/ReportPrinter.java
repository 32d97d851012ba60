package io.flowcheck.cli.ui;

import io.flowcheck.core.report.FlowReport;
import io.flowcheck.core.report.NodeSummary;
import io.flowcheck.core.report.ValidationSummary;
import java.io.PrintStream;
import java.util.List;

/// Prints the human-readable summary of a {@link FlowReport}.
///
/// Shared by `run`, which prints it after the flow, and `show`, which prints a
/// persisted report.
public final class ReportPrinter {

    private final PrintStream out;
    private final AnsiStyles styles;

    public ReportPrinter(PrintStream out, boolean useColor) {
        this.out = out;
        this.styles = AnsiStyles.of(useColor);
    }

    /// Prints the verdict, counts, per-node table and recommendations.
    ///
    /// @param report the report, not null
    public void print(FlowReport report) {
        ValidationSummary summary = report.getValidationSummary();

        out.println();
        out.println(styles.rule());
        out.printf(
                "%s %s  %s%n",
                styles.bold("Flow"),
                styles.accent(report.getFlowId()),
                styles.verdict(report.getOverallStatus()));
        out.println(styles.rule());
        out.printf(
                "  Checks: %d %s Passed: %s %s Failed: %s %s Warnings: %s %s Critical: %s%n",
                summary.totalChecks(),
                styles.bullet(),
                styles.success(String.valueOf(summary.passed())),
                styles.bullet(),
                styles.error(String.valueOf(summary.failed())),
                styles.bullet(),
                styles.warn(String.valueOf(summary.warnings())),
                styles.bullet(),
                styles.error(String.valueOf(summary.criticalFailures())));
        out.printf(
                "  Success rate: %.1f%% %s Duration: %.2fs%n",
                summary.successRate(), styles.bullet(), report.getDurationSeconds());

        out.println();
        for (NodeSummary node : report.getNodes()) {
            out.printf(
                    "  %s %-24s %s%n",
                    styles.marker(node.status()),
                    node.name(),
                    styles.status(node.status()));
            if (node.error() != null) {
                out.printf("      %s%n", styles.gray(node.error()));
            }
        }

        List<String> recommendations = report.getRecommendations();
        if (!recommendations.isEmpty()) {
            out.printf("%n%s%n", styles.bold("  Recommendations:"));
            for (String recommendation : recommendations) {
                out.printf("  %s %s%n", styles.arrow(), recommendation);
            }
        }
    }
}
