package io.flowcheck.core.execution;

import io.flowcheck.core.flow.FlowGraph;
import io.flowcheck.core.flow.FlowNode;
import io.flowcheck.core.report.FlowReport;
import java.util.List;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Listener for flow lifecycle events.
///
/// All methods have default no-op implementations, allowing listeners to
/// override only the events they care about.
///
/// ### Callback Lifecycle
/// ```
/// onFlowStart(flowId, graph)
///   onLayerStart(index, ids)          - per layer, lowest first
///     onNodeSkipped(node)             - excluded by configuration or aborted
///     onNodeBlocked(node)             - disqualified by a dependency
///     onNodeStart(node)               - dispatched to a worker
///     onNodeComplete(node)            - COMPLETED or FAILED
/// onFlowComplete(report)
/// ```
///
/// @implNote Every callback is made from the coordinating thread, never from a
/// worker, so implementations need no synchronization of their own. A listener
/// that throws is logged and otherwise ignored.
/// @see FlowExecutor
public interface FlowListener {

    /// Called once before the first layer.
    ///
    /// @param flowId id of the run, not null
    /// @param graph the graph about to run, not null
    default void onFlowStart(String flowId, FlowGraph graph) {}

    /// Called before a layer's nodes are evaluated.
    ///
    /// @param layerIndex zero-based layer index
    /// @param nodeIds ids in the layer, sorted, not null
    default void onLayerStart(int layerIndex, List<String> nodeIds) {}

    /// Called when a node is dispatched to a worker.
    default void onNodeStart(FlowNode node) {}

    /// Called when a node reaches `COMPLETED` or `FAILED`.
    default void onNodeComplete(FlowNode node) {}

    /// Called when a node reaches `BLOCKED`.
    default void onNodeBlocked(FlowNode node) {}

    /// Called when a node reaches `SKIPPED`.
    default void onNodeSkipped(FlowNode node) {}

    /// Called once with the finished report.
    default void onFlowComplete(FlowReport report) {}

    /// No-op listener instance that ignores all events.
    FlowListener NOOP = new FlowListener() {};

    /// Combines listeners into one that notifies each in order and isolates
    /// the flow from listener failures.
    ///
    /// @param listeners the delegates, not null
    /// @return a listener fanning out to every delegate, never null
    static FlowListener composite(List<FlowListener> listeners) {
        if (listeners.isEmpty()) {
            return NOOP;
        }
        return new CompositeFlowListener(List.copyOf(listeners));
    }

    /// Fans every event out to a fixed list of delegates.
    final class CompositeFlowListener implements FlowListener {

        private static final Logger logger = Logger.getLogger(CompositeFlowListener.class.getName());

        private final List<FlowListener> delegates;

        private CompositeFlowListener(List<FlowListener> delegates) {
            this.delegates = delegates;
        }

        @Override
        public void onFlowStart(String flowId, FlowGraph graph) {
            each(l -> l.onFlowStart(flowId, graph));
        }

        @Override
        public void onLayerStart(int layerIndex, List<String> nodeIds) {
            each(l -> l.onLayerStart(layerIndex, nodeIds));
        }

        @Override
        public void onNodeStart(FlowNode node) {
            each(l -> l.onNodeStart(node));
        }

        @Override
        public void onNodeComplete(FlowNode node) {
            each(l -> l.onNodeComplete(node));
        }

        @Override
        public void onNodeBlocked(FlowNode node) {
            each(l -> l.onNodeBlocked(node));
        }

        @Override
        public void onNodeSkipped(FlowNode node) {
            each(l -> l.onNodeSkipped(node));
        }

        @Override
        public void onFlowComplete(FlowReport report) {
            each(l -> l.onFlowComplete(report));
        }

        private void each(Consumer<FlowListener> event) {
            for (FlowListener delegate : delegates) {
                try {
                    event.accept(delegate);
                } catch (RuntimeException e) {
                    logger.log(Level.WARNING, "Flow listener failed: " + delegate, e);
                }
            }
        }
    }
}
