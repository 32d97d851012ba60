package io.flowcheck.cli.visualizer;

import io.flowcheck.core.ValidationScope;
import io.flowcheck.core.flow.FlowGraph;
import io.flowcheck.core.flow.FlowNode;
import jakarta.enterprise.context.ApplicationScoped;

/// Mermaid flowchart rendering of a flow graph, wrapped in a Markdown code block.
///
/// Edges point from a dependency to its dependent. Performance nodes use the
/// hexagon shape, and nodes that `QUICK` scope skips are drawn with a dashed border.
///
/// @implNote Thread-safe. Stateless rendering.
@ApplicationScoped
public class MermaidVisualizationFormat implements VisualizationFormat {

    @Override
    public String getName() {
        return "mermaid";
    }

    @Override
    public String render(FlowGraph graph) {
        StringBuilder sb = new StringBuilder();
        sb.append("```mermaid\n");
        sb.append("flowchart LR\n");

        for (String id : graph.getExecutionOrder()) {
            FlowNode node = graph.getNode(id);
            String label = node.getName().replace("\"", "'");
            String shape =
                    node.getDefinition().isPerformance()
                            ? "{{\"" + label + "\"}}"
                            : "[\"" + label + "\"]";
            sb.append("  ").append(sanitizeId(id)).append(shape).append('\n');
        }
        sb.append('\n');

        for (String id : graph.getExecutionOrder()) {
            for (String dependency : graph.getNode(id).getDependencies()) {
                sb.append("  ")
                        .append(sanitizeId(dependency))
                        .append(" --> ")
                        .append(sanitizeId(id))
                        .append('\n');
            }
        }

        sb.append('\n').append("  classDef fullOnly stroke-dasharray: 5 5\n");
        for (String id : graph.getExecutionOrder()) {
            if (!graph.getNode(id).getDefinition().getScopes().contains(ValidationScope.QUICK)) {
                sb.append("  class ").append(sanitizeId(id)).append(" fullOnly\n");
            }
        }

        sb.append("```\n");
        return sb.toString();
    }

    static String sanitizeId(String id) {
        return id.replaceAll("[^A-Za-z0-9_]", "_");
    }
}
