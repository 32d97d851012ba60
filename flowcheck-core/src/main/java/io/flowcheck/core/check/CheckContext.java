package io.flowcheck.core.check;

import io.flowcheck.core.FlowConfig;
import io.flowcheck.core.service.TaskServiceClient;
import io.flowcheck.core.store.StoreFilter;
import io.flowcheck.core.store.TaskStore;
import java.util.Objects;
import java.util.Optional;

/// Everything a {@link Check} may consult during one flow run.
///
/// One context is shared by every check of a run.
///
/// @implNote Thread-safe. All fields are final; the store and service client are
/// required to be safe for concurrent use.
public final class CheckContext {

    private final TaskStore store;
    private final TaskServiceClient taskService;
    private final FlowConfig config;
    private final StructuredFieldParser parser;

    /// @param store the store under inspection, not null
    /// @param taskService the task service client, may be null when no service is configured
    /// @param config the run configuration, not null
    /// @param parser parser for embedded-structure columns, not null
    public CheckContext(
            TaskStore store,
            TaskServiceClient taskService,
            FlowConfig config,
            StructuredFieldParser parser) {
        this.store = Objects.requireNonNull(store, "store");
        this.taskService = taskService;
        this.config = Objects.requireNonNull(config, "config");
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    public TaskStore getStore() {
        return store;
    }

    public Optional<TaskServiceClient> getTaskService() {
        return Optional.ofNullable(taskService);
    }

    /// Returns the task service client for checks that cannot run without one.
    ///
    /// @return the client, never null
    /// @throws IllegalStateException if no task service is configured
    public TaskServiceClient requireTaskService() {
        if (taskService == null) {
            throw new IllegalStateException("No task service configured for behavior checks");
        }
        return taskService;
    }

    public FlowConfig getConfig() {
        return config;
    }

    /// Shortcut for the configured store filter.
    public StoreFilter getFilter() {
        return config.getFilter();
    }

    public StructuredFieldParser getParser() {
        return parser;
    }
}
