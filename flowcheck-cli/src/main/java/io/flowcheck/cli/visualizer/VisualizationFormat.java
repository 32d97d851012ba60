package io.flowcheck.cli.visualizer;

import io.flowcheck.core.flow.FlowGraph;

/// Strategy for rendering a flow graph in one output format.
///
/// Implementations are discovered via CDI and selected by name in {@link FlowGraphVisualizer}.
///
/// @see TextVisualizationFormat
/// @see MermaidVisualizationFormat
public interface VisualizationFormat {

    /// Returns the name used to select this format on the command line.
    ///
    /// @return format name, e.g. `text` or `mermaid`, never null
    String getName();

    /// Renders the graph.
    ///
    /// @param graph the graph to render, not null
    /// @return rendered text, never null
    String render(FlowGraph graph);
}
