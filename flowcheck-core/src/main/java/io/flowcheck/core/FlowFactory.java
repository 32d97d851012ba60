package io.flowcheck.core;

import io.flowcheck.core.check.CheckRegistry;
import io.flowcheck.core.check.DefaultCheckRegistry;
import io.flowcheck.core.check.StructuredFieldParser;
import io.flowcheck.core.check.builtin.BuiltinChecks;
import io.flowcheck.core.execution.FlowExecutor;
import io.flowcheck.core.execution.FlowListener;
import io.flowcheck.core.report.ReportAggregator;
import io.flowcheck.core.service.TaskServiceClient;
import io.flowcheck.core.store.TaskStore;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/// Factory for creating and wiring {@link FlowEnvironment} instances.
///
/// {@snippet :
/// try (FlowEnvironment env = FlowFactory.builder()
///         .config(FlowConfig.builder().includePerformance(true).build())
///         .store(store)
///         .taskService(client)
///         .parser(new JacksonStructuredFieldParser())
///         .listener(new EvidenceWriter(evidenceDir))
///         .build()) {
///     FlowReport report = env.run();
/// }
/// }
///
/// @see FlowEnvironment
/// @see FlowConfig
public final class FlowFactory {

    private static final Logger logger = Logger.getLogger(FlowFactory.class.getName());

    private FlowFactory() {
        // Utility class - prevent instantiation
    }

    /// Creates a new builder.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Creates the registry holding the six built-in checks.
    ///
    /// @return a new registry, never null
    public static CheckRegistry createBuiltinRegistry() {
        CheckRegistry registry = new DefaultCheckRegistry();
        BuiltinChecks.registerAll(registry);
        return registry;
    }

    static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /// Fluent builder wiring a {@link FlowEnvironment}.
    ///
    /// Only the store and the structured-field parser are required. The registry
    /// defaults to the built-in checks and the configuration to {@link FlowConfig} defaults.
    public static class Builder {

        private FlowConfig config;
        private TaskStore store;
        private TaskServiceClient taskService;
        private StructuredFieldParser parser;
        private CheckRegistry checkRegistry;
        private final List<FlowListener> listeners = new ArrayList<>();
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        public Builder config(FlowConfig config) {
            this.config = config;
            return this;
        }

        public Builder store(TaskStore store) {
            this.store = store;
            return this;
        }

        /// Sets the client used by behavior checks. Optional.
        public Builder taskService(TaskServiceClient taskService) {
            this.taskService = taskService;
            return this;
        }

        public Builder parser(StructuredFieldParser parser) {
            this.parser = parser;
            return this;
        }

        public Builder checkRegistry(CheckRegistry checkRegistry) {
            this.checkRegistry = checkRegistry;
            return this;
        }

        /// Adds a lifecycle listener. Listeners are notified in the order added.
        public Builder listener(FlowListener listener) {
            this.listeners.add(listener);
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /// Wires the environment and starts its thread pools.
        ///
        /// @return the environment, never null
        /// @throws IllegalStateException if the store or parser is missing, or the
        /// configuration is invalid
        public FlowEnvironment build() {
            if (store == null) {
                throw new IllegalStateException("A task store is required");
            }
            if (parser == null) {
                throw new IllegalStateException("A structured field parser is required");
            }
            FlowConfig effectiveConfig = config != null ? config : new FlowConfig();
            effectiveConfig.validate();
            CheckRegistry registry = checkRegistry != null ? checkRegistry : createBuiltinRegistry();

            ExecutorService workerPool =
                    Executors.newFixedThreadPool(
                            effectiveConfig.getWorkerPoolSize(),
                            namedDaemonThreads("flowcheck-worker"));
            ExecutorService checkRunner =
                    Executors.newCachedThreadPool(namedDaemonThreads("flowcheck-check"));

            FlowExecutor executor =
                    new FlowExecutor(workerPool, checkRunner, new ReportAggregator(), clock);

            logger.info(
                    "Created flow environment: workers="
                            + effectiveConfig.getWorkerPoolSize()
                            + ", taskService="
                            + (taskService != null ? "configured" : "none"));

            return new FlowEnvironment(
                    effectiveConfig,
                    registry,
                    executor,
                    store,
                    taskService,
                    parser,
                    FlowListener.composite(listeners),
                    workerPool,
                    checkRunner);
        }
    }
}
