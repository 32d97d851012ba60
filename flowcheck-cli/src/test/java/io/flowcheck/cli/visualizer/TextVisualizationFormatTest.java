package io.flowcheck.cli.visualizer;

import static org.assertj.core.api.Assertions.assertThat;

import io.flowcheck.core.FlowFactory;
import io.flowcheck.core.flow.FlowGraph;
import io.flowcheck.core.flow.StandardFlow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TextVisualizationFormat")
class TextVisualizationFormatTest {

    private final TextVisualizationFormat format = new TextVisualizationFormat();
    private FlowGraph graph;

    @BeforeEach
    void setUp() {
        graph = StandardFlow.create(FlowFactory.createBuiltinRegistry());
    }

    @Test
    @DisplayName("is registered under the name 'text'")
    void shouldBeNamedText() {
        assertThat(format.getName()).isEqualTo("text");
    }

    @Test
    @DisplayName("prints a header with node and layer counts")
    void shouldPrintHeader() {
        assertThat(format.render(graph, false)).startsWith("Flow graph: 6 nodes, 3 layers");
    }

    @Test
    @DisplayName("groups nodes by layer in sorted order")
    void shouldGroupByLayer() {
        String output = format.render(graph, false);

        int layer1 = output.indexOf("Layer 1");
        assertThat(output.indexOf("Layer 0")).isLessThan(output.indexOf("┌─ integrity"));
        assertThat(output.indexOf("┌─ integrity")).isLessThan(layer1);
        assertThat(output.indexOf("┌─ audit"))
                .isGreaterThan(layer1)
                .isLessThan(output.indexOf("┌─ crud"));
        assertThat(output.indexOf("┌─ performance")).isGreaterThan(output.indexOf("Layer 2"));
    }

    @Test
    @DisplayName("shows scopes, dependencies and the performance flag")
    void shouldShowNodeDetails() {
        String output = format.render(graph, false);

        assertThat(output)
                .contains("┌─ crud (CRUD Validator)")
                .contains("│  Check: crud")
                .contains("│  Scopes: FULL\n".replace("\n", System.lineSeparator()))
                .contains("│  Scopes: FULL, QUICK")
                .contains("│  Depends on: → integrity")
                .contains("(requires --performance)");
    }

    @Test
    @DisplayName("renders with ANSI codes through the format interface")
    void shouldColorByDefault() {
        assertThat(format.render(graph)).contains("\033[");
        assertThat(format.render(graph, false)).doesNotContain("\033[");
    }
}
