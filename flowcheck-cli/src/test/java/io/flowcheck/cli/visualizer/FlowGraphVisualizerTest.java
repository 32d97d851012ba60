package io.flowcheck.cli.visualizer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.flowcheck.core.FlowFactory;
import io.flowcheck.core.flow.FlowGraph;
import io.flowcheck.core.flow.StandardFlow;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("FlowGraphVisualizer")
class FlowGraphVisualizerTest {

    private FlowGraphVisualizer visualizer;
    private FlowGraph graph;

    @BeforeEach
    void setUp() {
        visualizer =
                new FlowGraphVisualizer(
                        List.of(new TextVisualizationFormat(), new MermaidVisualizationFormat()));
        graph = StandardFlow.create(FlowFactory.createBuiltinRegistry());
    }

    @Test
    @DisplayName("dispatches to the format with the given name")
    void shouldDispatchByName() {
        assertThat(visualizer.visualize(graph, "mermaid")).startsWith("```mermaid");
        assertThat(visualizer.visualize(graph, "text")).contains("Flow graph");
    }

    @Test
    @DisplayName("lists available formats alphabetically")
    void shouldListFormats() {
        assertThat(visualizer.getAvailableFormats()).containsExactly("mermaid", "text");
    }

    @Test
    @DisplayName("rejects an unknown format and names the available ones")
    void shouldRejectUnknownFormat() {
        assertThatThrownBy(() -> visualizer.visualize(graph, "dot"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unsupported format: dot. Available: mermaid, text");
    }
}
