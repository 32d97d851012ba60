package io.flowcheck.core;

import io.flowcheck.core.check.CheckContext;
import io.flowcheck.core.check.CheckRegistry;
import io.flowcheck.core.check.StructuredFieldParser;
import io.flowcheck.core.execution.FlowExecutor;
import io.flowcheck.core.execution.FlowListener;
import io.flowcheck.core.flow.FlowGraph;
import io.flowcheck.core.flow.StandardFlow;
import io.flowcheck.core.report.FlowReport;
import io.flowcheck.core.service.TaskServiceClient;
import io.flowcheck.core.store.TaskStore;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/// Container holding every component a validation run needs.
///
/// Owns the worker pool and the check runner and shuts both down on
/// {@link #close()}. The store and the task service client belong to the caller
/// and are left open.
///
/// ### Contracts
/// - **Invariant**: component references are immutable after construction
/// - **Postcondition**: every {@link #run()} builds a fresh graph, so one
///   environment can run the flow repeatedly
///
/// @apiNote Create instances via {@link FlowFactory#builder()} rather than direct
/// construction.
/// @see FlowFactory
public final class FlowEnvironment implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(FlowEnvironment.class.getName());

    private final FlowConfig config;
    private final CheckRegistry checkRegistry;
    private final FlowExecutor flowExecutor;
    private final TaskStore store;
    private final TaskServiceClient taskService;
    private final StructuredFieldParser parser;
    private final FlowListener listener;
    private final ExecutorService workerPool;
    private final ExecutorService checkRunner;

    FlowEnvironment(
            FlowConfig config,
            CheckRegistry checkRegistry,
            FlowExecutor flowExecutor,
            TaskStore store,
            TaskServiceClient taskService,
            StructuredFieldParser parser,
            FlowListener listener,
            ExecutorService workerPool,
            ExecutorService checkRunner) {
        this.config = config;
        this.checkRegistry = checkRegistry;
        this.flowExecutor = flowExecutor;
        this.store = store;
        this.taskService = taskService;
        this.parser = parser;
        this.listener = listener;
        this.workerPool = workerPool;
        this.checkRunner = checkRunner;
    }

    /// Builds a fresh standard graph from the registry.
    ///
    /// @return a graph with every node `PENDING`, never null
    /// @throws io.flowcheck.core.exception.FlowGraphException if a standard check id is
    /// not registered
    public FlowGraph createGraph() {
        return StandardFlow.create(checkRegistry);
    }

    /// Runs the standard flow.
    ///
    /// @return the report, never null
    public FlowReport run() {
        return run(createGraph());
    }

    /// Runs the given graph.
    ///
    /// @param graph freshly built graph, not null
    /// @return the report, never null
    public FlowReport run(FlowGraph graph) {
        CheckContext context = new CheckContext(store, taskService, config, parser);
        return flowExecutor.execute(graph, context, listener);
    }

    public FlowConfig getConfig() {
        return config;
    }

    public CheckRegistry getCheckRegistry() {
        return checkRegistry;
    }

    public FlowExecutor getFlowExecutor() {
        return flowExecutor;
    }

    public TaskStore getStore() {
        return store;
    }

    public Optional<TaskServiceClient> getTaskService() {
        return Optional.ofNullable(taskService);
    }

    /// Shuts down the worker pool and the check runner.
    ///
    /// Waits briefly for in-flight checks, then interrupts whatever is left.
    @Override
    public void close() {
        shutdown(workerPool);
        shutdown(checkRunner);
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warning("Executor did not terminate in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
