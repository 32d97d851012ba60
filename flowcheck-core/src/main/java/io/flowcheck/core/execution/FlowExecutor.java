package io.flowcheck.core.execution;

import io.flowcheck.core.FlowConfig;
import io.flowcheck.core.check.Check;
import io.flowcheck.core.check.CheckContext;
import io.flowcheck.core.check.CheckOutcome;
import io.flowcheck.core.flow.FlowGraph;
import io.flowcheck.core.flow.FlowNode;
import io.flowcheck.core.flow.NodeStatus;
import io.flowcheck.core.flow.StandardFlow;
import io.flowcheck.core.report.FlowIds;
import io.flowcheck.core.report.FlowReport;
import io.flowcheck.core.report.ReportAggregator;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/// Executes a {@link FlowGraph} layer by layer and produces its {@link FlowReport}.
///
/// ### Scheduling
/// The calling thread coordinates. For each layer, lowest first, it evaluates
/// every node in id order:
/// 1. a node the configuration excludes becomes `SKIPPED`
/// 2. a node with a disqualifying dependency becomes `BLOCKED` (see {@link #evaluateReadiness})
/// 3. every other node is dispatched to the worker pool
///
/// It then waits for every dispatched node of the layer before evaluating the
/// next one. With `parallel=false` the ready nodes of a layer are dispatched one
/// at a time. Node state is only ever written by the coordinating thread.
///
/// ### Failure handling
/// - A check that throws or exceeds the check timeout ends `FAILED` with an error;
///   its siblings carry on.
/// - When the flow timeout passes, unfinished checks are cancelled and end
///   `FAILED`, and nodes that have not started end `SKIPPED`.
/// - With `failFast`, a layer containing a `FAILED` node or a failing outcome
///   ends scheduling; the remaining nodes end `SKIPPED`.
///
/// No check failure propagates out of {@link #execute}. Only an invalid graph,
/// rejected before this class is reached, prevents a report.
///
/// @implNote Thread-safe for sequential reuse. The worker pool and check runner
/// are owned by the caller, typically {@link io.flowcheck.core.FlowEnvironment}.
/// @see CheckInvoker
/// @see ReportAggregator
public class FlowExecutor {

    private static final Logger logger = Logger.getLogger(FlowExecutor.class.getName());

    private final ExecutorService workerPool;
    private final ExecutorService checkRunner;
    private final ReportAggregator aggregator;
    private final Clock clock;

    /// Creates an executor using the system UTC clock.
    ///
    /// @param workerPool bounded pool whose size caps concurrently executing checks, not null
    /// @param checkRunner executor the check bodies run on, not null
    public FlowExecutor(ExecutorService workerPool, ExecutorService checkRunner) {
        this(workerPool, checkRunner, new ReportAggregator(), Clock.systemUTC());
    }

    /// @param workerPool bounded pool whose size caps concurrently executing checks, not null
    /// @param checkRunner executor the check bodies run on, not null
    /// @param aggregator builds the final report, not null
    /// @param clock time source for node and flow timestamps, not null
    public FlowExecutor(
            ExecutorService workerPool,
            ExecutorService checkRunner,
            ReportAggregator aggregator,
            Clock clock) {
        this.workerPool = workerPool;
        this.checkRunner = checkRunner;
        this.aggregator = aggregator;
        this.clock = clock;
    }

    /// Runs every node of a freshly built graph.
    ///
    /// @param graph the graph, with every node `PENDING`, not null
    /// @param context store, service and configuration shared by all checks, not null
    /// @param listener lifecycle observer, not null (use {@link FlowListener#NOOP})
    /// @return the report, with every node in a terminal state, never null
    /// @throws IllegalStateException if a node of the graph is not `PENDING`
    public FlowReport execute(FlowGraph graph, CheckContext context, FlowListener listener) {
        for (FlowNode node : graph.getNodes()) {
            if (node.getStatus() != NodeStatus.PENDING) {
                throw new IllegalStateException(
                        "Graph was already executed: node '"
                                + node.getId()
                                + "' is "
                                + node.getStatus());
            }
        }

        FlowConfig config = context.getConfig();
        FlowListener events = FlowListener.composite(List.of(listener));
        CheckInvoker invoker = new CheckInvoker(checkRunner, config.getCheckTimeout(), clock);

        String flowId = FlowIds.next(clock);
        Instant startedAt = clock.instant();
        Instant deadline = startedAt.plus(config.getFlowTimeout());

        logger.info(
                "Starting flow "
                        + flowId
                        + ": "
                        + graph.size()
                        + " nodes, "
                        + graph.getLayers().size()
                        + " layers, scope="
                        + config.getScope()
                        + ", parallel="
                        + config.isParallel());
        events.onFlowStart(flowId, graph);

        String abortReason = null;
        List<List<String>> layers = graph.getLayers();
        for (int index = 0; index < layers.size() && abortReason == null; index++) {
            List<String> layer = layers.get(index);
            events.onLayerStart(index, layer);
            logger.fine("Layer " + index + ": " + layer);

            List<FlowNode> ready = new ArrayList<>();
            for (String id : layer) {
                FlowNode node = graph.getNode(id);
                Optional<String> exclusion = node.getDefinition().exclusionReason(config);
                if (exclusion.isPresent()) {
                    node.skip(exclusion.get());
                    logger.info("Node " + id + " skipped: " + exclusion.get());
                    events.onNodeSkipped(node);
                    continue;
                }
                Optional<String> blocker = evaluateReadiness(node, graph);
                if (blocker.isPresent()) {
                    node.block(blocker.get());
                    logger.warning("Node " + id + " blocked: " + blocker.get());
                    events.onNodeBlocked(node);
                    continue;
                }
                ready.add(node);
            }

            abortReason = runLayer(ready, invoker, context, deadline, events);
            if (abortReason == null && config.isFailFast() && hasFailure(ready)) {
                abortReason = "aborted: fail-fast after failure in layer " + index;
            }
        }

        if (abortReason != null) {
            logger.warning("Flow " + flowId + " " + abortReason);
            for (FlowNode node : graph.getNodes()) {
                if (node.getStatus() == NodeStatus.PENDING) {
                    node.skip(abortReason);
                    events.onNodeSkipped(node);
                }
            }
        }

        FlowReport report =
                aggregator.aggregate(
                        flowId, StandardFlow.FLOW_TYPE, startedAt, clock.instant(), graph, config);
        logger.info("Flow " + flowId + " finished: " + report.getOverallStatus());
        events.onFlowComplete(report);
        return report;
    }

    /// Decides whether a node may run.
    ///
    /// A node may run only when every dependency is `COMPLETED` and no dependency
    /// outcome is `FAILED` with critical findings. A dependency that only reported
    /// warnings does not block.
    ///
    /// @param node the node to evaluate, not null
    /// @param graph the graph holding its dependencies, not null
    /// @return the blocking reason, or empty if the node is ready
    public static Optional<String> evaluateReadiness(FlowNode node, FlowGraph graph) {
        for (String dependencyId : node.getDependencies()) {
            FlowNode dependency = graph.getNode(dependencyId);
            if (dependency.getStatus() != NodeStatus.COMPLETED) {
                return Optional.of(
                        "dependency '" + dependencyId + "' is " + dependency.getStatus());
            }
            CheckOutcome outcome = dependency.getOutcome().orElseThrow();
            if (outcome.isBlocking()) {
                return Optional.of(
                        "dependency '"
                                + dependencyId
                                + "' reported "
                                + outcome.criticalCount()
                                + " critical finding(s)");
            }
        }
        return Optional.empty();
    }

    private String runLayer(
            List<FlowNode> ready,
            CheckInvoker invoker,
            CheckContext context,
            Instant deadline,
            FlowListener events) {
        if (ready.isEmpty()) {
            return null;
        }
        if (context.getConfig().isParallel()) {
            Map<FlowNode, Future<NodeExecution>> inflight = new LinkedHashMap<>();
            for (FlowNode node : ready) {
                inflight.put(node, dispatch(node, invoker, context, events));
            }
            return awaitAll(inflight, deadline, context.getConfig(), events);
        }
        for (FlowNode node : ready) {
            Map<FlowNode, Future<NodeExecution>> single = new LinkedHashMap<>();
            single.put(node, dispatch(node, invoker, context, events));
            String abortReason = awaitAll(single, deadline, context.getConfig(), events);
            if (abortReason != null) {
                return abortReason;
            }
        }
        return null;
    }

    private Future<NodeExecution> dispatch(
            FlowNode node, CheckInvoker invoker, CheckContext context, FlowListener events) {
        String nodeId = node.getId();
        Check check = node.getCheck();
        node.markRunning(clock.instant());
        events.onNodeStart(node);
        return workerPool.submit(() -> invoker.invoke(nodeId, check, context));
    }

    /// Waits for dispatched nodes in dispatch order and applies their results.
    ///
    /// @return the abort reason if the flow deadline passed or the coordinator
    /// was interrupted, otherwise null
    private String awaitAll(
            Map<FlowNode, Future<NodeExecution>> inflight,
            Instant deadline,
            FlowConfig config,
            FlowListener events) {
        String abortReason = null;
        for (Map.Entry<FlowNode, Future<NodeExecution>> entry : inflight.entrySet()) {
            FlowNode node = entry.getKey();
            Future<NodeExecution> future = entry.getValue();
            long waitMillis =
                    abortReason == null
                            ? Math.max(0, Duration.between(clock.instant(), deadline).toMillis())
                            : 0;
            try {
                apply(node, future.get(waitMillis, TimeUnit.MILLISECONDS), events);
            } catch (TimeoutException e) {
                future.cancel(true);
                String timeout = CheckInvoker.describe(config.getFlowTimeout());
                if (abortReason == null) {
                    abortReason = "aborted: flow timeout of " + timeout + " exceeded";
                }
                failNode(node, "Flow timeout of " + timeout + " exceeded", events);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                failNode(node, CheckInvoker.describe(cause), events);
            } catch (CancellationException e) {
                failNode(node, "Check cancelled", events);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                abortReason = "aborted: flow interrupted";
                failNode(node, "Flow interrupted", events);
            }
        }
        return abortReason;
    }

    private void apply(FlowNode node, NodeExecution execution, FlowListener events) {
        if (execution.isFault()) {
            node.fail(execution.error(), execution.startedAt(), execution.finishedAt());
            logger.warning("Node " + node.getId() + " failed: " + execution.error());
        } else {
            node.complete(execution.outcome(), execution.startedAt(), execution.finishedAt());
            logger.info(
                    "Node "
                            + node.getId()
                            + " completed: "
                            + execution.outcome().status()
                            + " ("
                            + execution.outcome().passed()
                            + "/"
                            + execution.outcome().totalChecks()
                            + " passed)");
        }
        events.onNodeComplete(node);
    }

    private void failNode(FlowNode node, String reason, FlowListener events) {
        node.fail(reason, null, clock.instant());
        logger.warning("Node " + node.getId() + " failed: " + reason);
        events.onNodeComplete(node);
    }

    private static boolean hasFailure(List<FlowNode> nodes) {
        return nodes.stream()
                .anyMatch(
                        n ->
                                n.getStatus() == NodeStatus.FAILED
                                        || n.getOutcome().map(CheckOutcome::isBlocking).orElse(false));
    }
}
