package io.flowcheck.cli.visualizer;

import io.flowcheck.cli.ui.AnsiStyles;
import io.flowcheck.core.ValidationScope;
import io.flowcheck.core.flow.FlowGraph;
import io.flowcheck.core.flow.FlowNode;
import io.flowcheck.core.flow.NodeDefinition;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.List;
import java.util.stream.Collectors;

/// Plain-text rendering of a flow graph, one block per layer.
///
/// ```
/// Layer 0
/// ┌─ integrity (Data Integrity Validator)
/// │  Check: integrity
/// │  Scopes: FULL, QUICK
/// └─
/// Layer 1
/// ┌─ crud (CRUD Validator)
/// │  Check: crud
/// │  Scopes: FULL
/// │  Depends on: → integrity
/// └─
/// ```
///
/// @implNote Thread-safe. Each render builds its own {@link AnsiStyles}.
@ApplicationScoped
public class TextVisualizationFormat implements VisualizationFormat {

    @Override
    public String getName() {
        return "text";
    }

    @Override
    public String render(FlowGraph graph) {
        return render(graph, true);
    }

    /// Renders the graph with optional ANSI color.
    ///
    /// @param graph the graph, not null
    /// @param useColor whether to emit ANSI codes
    /// @return rendered text, never null
    public String render(FlowGraph graph, boolean useColor) {
        AnsiStyles styles = AnsiStyles.of(useColor);
        String nl = System.lineSeparator();
        StringBuilder sb = new StringBuilder();
        sb.append(styles.bold("Flow graph: "))
                .append(styles.accent(graph.size() + " nodes"))
                .append(styles.gray(", " + graph.getLayers().size() + " layers"))
                .append(nl)
                .append(styles.rule())
                .append(nl);

        List<List<String>> layers = graph.getLayers();
        for (int i = 0; i < layers.size(); i++) {
            sb.append(nl).append(styles.bold("Layer " + i)).append(nl);
            for (String id : layers.get(i)) {
                renderNode(sb, graph.getNode(id), styles, nl);
            }
        }
        return sb.toString();
    }

    private static void renderNode(StringBuilder sb, FlowNode node, AnsiStyles styles, String nl) {
        NodeDefinition definition = node.getDefinition();
        sb.append(styles.boxTop())
                .append(' ')
                .append(styles.accent(node.getId()))
                .append(' ')
                .append(styles.gray("(" + node.getName() + ")"))
                .append(nl);
        sb.append(styles.boxMid()).append("  Check: ").append(definition.getCheckId()).append(nl);
        sb.append(styles.boxMid())
                .append("  Scopes: ")
                .append(
                        definition.getScopes().stream()
                                .map(ValidationScope::name)
                                .sorted()
                                .collect(Collectors.joining(", ")));
        if (definition.isPerformance()) {
            sb.append(' ').append(styles.warn("(requires --performance)"));
        }
        sb.append(nl);
        if (!node.getDependencies().isEmpty()) {
            sb.append(styles.boxMid()).append("  Depends on:");
            for (String dependency : node.getDependencies()) {
                sb.append(' ').append(styles.arrow()).append(' ').append(styles.bold(dependency));
            }
            sb.append(nl);
        }
        sb.append(styles.boxBottom()).append(nl);
    }
}
