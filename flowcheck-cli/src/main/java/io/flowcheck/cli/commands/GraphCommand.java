package io.flowcheck.cli.commands;

import io.flowcheck.cli.visualizer.FlowGraphVisualizer;
import io.flowcheck.core.FlowFactory;
import io.flowcheck.core.flow.FlowGraph;
import io.flowcheck.core.flow.StandardFlow;
import jakarta.inject.Inject;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/// Prints the standard validation flow graph.
///
/// ### Usage
/// ```bash
/// flowcheck graph [--format text|mermaid]
/// ```
@Command(name = "graph", description = "Print the validation flow graph")
class GraphCommand extends FlowCheckCommand {

    @Option(
            names = "--format",
            defaultValue = "text",
            description = "Output format: text, mermaid (default: ${DEFAULT-VALUE})")
    String format = "text";

    @Inject FlowGraphVisualizer visualizer;

    @Override
    protected int execute() {
        try {
            FlowGraph graph = StandardFlow.create(FlowFactory.createBuiltinRegistry());
            System.out.println(visualizer.visualize(graph, format));
            return EXIT_OK;
        } catch (IllegalArgumentException | IllegalStateException e) {
            System.err.println(" [FAIL] Visualization failed: " + e.getMessage());
            return EXIT_USAGE;
        }
    }
}
