package io.flowcheck.cli.visualizer;

import static org.assertj.core.api.Assertions.assertThat;

import io.flowcheck.core.FlowFactory;
import io.flowcheck.core.flow.StandardFlow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("MermaidVisualizationFormat")
class MermaidVisualizationFormatTest {

    private final MermaidVisualizationFormat format = new MermaidVisualizationFormat();

    private String renderStandardFlow() {
        return format.render(StandardFlow.create(FlowFactory.createBuiltinRegistry()));
    }

    @Test
    @DisplayName("wraps the flowchart in a mermaid code block")
    void shouldWrapInCodeBlock() {
        String output = renderStandardFlow();

        assertThat(output).startsWith("```mermaid\nflowchart LR\n").endsWith("```\n");
    }

    @Test
    @DisplayName("draws an edge from each dependency to its dependent")
    void shouldDrawEdges() {
        assertThat(renderStandardFlow())
                .contains("  integrity --> crud\n")
                .contains("  integrity --> audit\n")
                .contains("  crud --> performance\n")
                .contains("  audit --> performance\n")
                .doesNotContain("--> integrity");
    }

    @Test
    @DisplayName("uses the hexagon shape for the performance node")
    void shouldUseHexagonForPerformance() {
        assertThat(renderStandardFlow())
                .contains("  performance{{\"Performance Validator\"}}\n")
                .contains("  integrity[\"Data Integrity Validator\"]\n");
    }

    @Test
    @DisplayName("marks nodes outside quick scope with the fullOnly class")
    void shouldMarkFullOnlyNodes() {
        assertThat(renderStandardFlow())
                .contains("classDef fullOnly")
                .contains("  class crud fullOnly\n")
                .contains("  class state fullOnly\n")
                .contains("  class performance fullOnly\n")
                .doesNotContain("class integrity fullOnly")
                .doesNotContain("class audit fullOnly");
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({"integrity, integrity", "data-check, data_check", "a.b c, a_b_c"})
    @DisplayName("replaces characters Mermaid cannot use in node ids")
    void shouldSanitizeIds(String id, String expected) {
        assertThat(MermaidVisualizationFormat.sanitizeId(id)).isEqualTo(expected);
    }
}
