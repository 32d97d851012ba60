package io.flowcheck.cli.execution;

import io.flowcheck.cli.ui.AnsiStyles;
import io.flowcheck.core.check.CheckOutcome;
import io.flowcheck.core.execution.FlowListener;
import io.flowcheck.core.flow.FlowGraph;
import io.flowcheck.core.flow.FlowNode;
import java.io.PrintStream;
import java.util.List;

/// Flow listener that prints progress to the terminal as layers and nodes finish.
///
/// ### Output Format
/// ```
/// Layer 1  crud, relationship, state
///   ✓ Relationship Validator  COMPLETED  12/12 passed
///   ✗ CRUD Validator          FAILED     Check timed out after 60s
///   ■ Performance Validator   BLOCKED    dependency 'crud' ended FAILED
/// ```
///
/// @implNote Callbacks arrive on the flow coordinator thread, so output never interleaves.
public class ConsoleFlowListener implements FlowListener {

    private static final int NAME_WIDTH = 26;

    private final PrintStream out;
    private final AnsiStyles styles;

    /// @param out stream to print to, typically `System.out`, not null
    /// @param useColor whether to emit ANSI codes
    public ConsoleFlowListener(PrintStream out, boolean useColor) {
        this.out = out;
        this.styles = AnsiStyles.of(useColor);
    }

    @Override
    public void onFlowStart(String flowId, FlowGraph graph) {
        out.printf(
                "%s %s %s%n",
                styles.bold("Flow"),
                styles.accent(flowId),
                styles.gray(
                        "(" + graph.size() + " nodes, " + graph.getLayers().size() + " layers)"));
    }

    @Override
    public void onLayerStart(int layerIndex, List<String> nodeIds) {
        out.printf(
                "%n%s  %s%n",
                styles.bold("Layer " + layerIndex),
                styles.gray(String.join(", ", nodeIds)));
    }

    @Override
    public void onNodeComplete(FlowNode node) {
        String detail =
                node.getOutcome()
                        .map(ConsoleFlowListener::describe)
                        .orElse(node.getError().orElse(""));
        print(node, detail);
    }

    @Override
    public void onNodeBlocked(FlowNode node) {
        print(node, node.getError().orElse(""));
    }

    @Override
    public void onNodeSkipped(FlowNode node) {
        print(node, node.getError().orElse(""));
    }

    private void print(FlowNode node, String detail) {
        out.printf(
                "  %s %s  %s  %s%n",
                styles.marker(node.getStatus()),
                pad(node.getName()),
                styles.status(node.getStatus()),
                styles.gray(detail));
    }

    static String describe(CheckOutcome outcome) {
        StringBuilder sb = new StringBuilder();
        sb.append(outcome.passed()).append('/').append(outcome.totalChecks()).append(" passed");
        if (outcome.warnings() > 0) {
            sb.append(", ").append(outcome.warnings()).append(" warning(s)");
        }
        if (outcome.criticalCount() > 0) {
            sb.append(", ").append(outcome.criticalCount()).append(" critical");
        }
        return sb.toString();
    }

    private static String pad(String text) {
        return text.length() >= NAME_WIDTH ? text : text + " ".repeat(NAME_WIDTH - text.length());
    }
}
