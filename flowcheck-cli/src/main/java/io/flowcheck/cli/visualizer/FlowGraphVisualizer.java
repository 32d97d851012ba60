package io.flowcheck.cli.visualizer;

import io.flowcheck.core.flow.FlowGraph;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/// Registry and dispatcher for flow graph visualization formats.
///
/// @implNote Thread-safe after construction. The format map is immutable.
/// @see VisualizationFormat
@ApplicationScoped
public class FlowGraphVisualizer {

    private final Map<String, VisualizationFormat> formats;

    /// Creates a visualizer with every CDI-discovered format.
    ///
    /// @param formatInstances CDI-provided formats, not null
    @Inject
    public FlowGraphVisualizer(Instance<VisualizationFormat> formatInstances) {
        this(formatInstances.stream());
    }

    /// Creates a visualizer over an explicit list of formats.
    ///
    /// @param formats the formats, not null
    public FlowGraphVisualizer(List<VisualizationFormat> formats) {
        this(formats.stream());
    }

    private FlowGraphVisualizer(Stream<VisualizationFormat> formats) {
        this.formats =
                formats.collect(
                        Collectors.toMap(
                                VisualizationFormat::getName, f -> f, (a, b) -> a, TreeMap::new));
    }

    /// Renders the graph in the named format.
    ///
    /// @param graph the graph, not null
    /// @param formatName format name, not null
    /// @return rendered text, never null
    /// @throws IllegalArgumentException if no format has that name
    public String visualize(FlowGraph graph, String formatName) {
        VisualizationFormat format = formats.get(formatName);
        if (format == null) {
            throw new IllegalArgumentException(
                    "Unsupported format: "
                            + formatName
                            + ". Available: "
                            + String.join(", ", formats.keySet()));
        }
        return format.render(graph);
    }

    public Iterable<String> getAvailableFormats() {
        return formats.keySet();
    }
}
