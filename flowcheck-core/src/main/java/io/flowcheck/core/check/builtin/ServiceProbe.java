package io.flowcheck.core.check.builtin;

import io.flowcheck.core.service.ServiceResponse;
import io.flowcheck.core.service.TaskDraft;
import io.flowcheck.core.service.TaskServiceClient;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Logger;

/// Creates throwaway tasks through the task service and deletes them afterwards.
///
/// Behavior checks exercise the service with tasks of their own and never touch
/// existing records. Every task created through a probe is deleted by {@link #cleanup()}.
///
/// @implNote Thread-safe: the created-id list is synchronized so concurrent
/// benchmarks may share one probe.
final class ServiceProbe {

    private static final Logger logger = Logger.getLogger(ServiceProbe.class.getName());

    static final String OWNER = "flowcheck";

    private final TaskServiceClient client;
    private final String prefix;
    private final List<String> created = Collections.synchronizedList(new ArrayList<>());

    ServiceProbe(TaskServiceClient client, String prefix) {
        this.client = client;
        this.prefix = prefix;
    }

    TaskServiceClient client() {
        return client;
    }

    /// Returns a unique title for a probe task.
    String title(String label) {
        return prefix + "-" + label + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    /// Creates a task and remembers it for cleanup.
    ///
    /// @return the raw response, never null
    ServiceResponse create(TaskDraft draft) {
        ServiceResponse response = client.createTask(draft);
        idOf(response).ifPresent(created::add);
        return response;
    }

    /// Creates a task with the given title and returns its id when the service accepted it.
    Optional<String> createTask(String label) {
        return idOf(create(TaskDraft.minimal(title(label))));
    }

    /// Creates a task and walks it through the lifecycle to the given status.
    ///
    /// @return the task id, or empty if creation or any intermediate update was refused
    Optional<String> reach(TaskLifecycle lifecycle, String status) {
        Optional<List<String>> path = lifecycle.pathFromNew(status);
        if (path.isEmpty()) {
            return Optional.empty();
        }
        Optional<String> id = createTask("state-" + status);
        if (id.isEmpty()) {
            return Optional.empty();
        }
        for (String step : path.get()) {
            if (!client.updateTask(id.get(), transitionTo(step)).isSuccess()) {
                return Optional.empty();
            }
        }
        return id;
    }

    /// Builds the update that moves a task to a status, with the fields that status requires.
    static Map<String, Object> transitionTo(String status) {
        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put("status", status);
        if (TaskLifecycle.IN_PROGRESS.equals(status)) {
            changes.put("owner", OWNER);
        } else if (TaskLifecycle.BLOCKED.equals(status)) {
            changes.put("risk_notes", "blocked by validation probe");
        } else if (TaskLifecycle.DONE.equals(status)) {
            changes.put("done_date", LocalDate.now(ZoneOffset.UTC).toString());
        }
        return changes;
    }

    static Optional<String> idOf(ServiceResponse response) {
        if (!response.isSuccess()) {
            return Optional.empty();
        }
        return response.text("id");
    }

    /// Deletes every task this probe created. Failures are logged, not thrown.
    ///
    /// Runs with the interrupt flag cleared, since a check that timed out calls this
    /// from an interrupted thread and the HTTP client refuses to send from one. The
    /// flag is restored before returning.
    void cleanup() {
        List<String> ids;
        synchronized (created) {
            ids = new ArrayList<>(created);
            created.clear();
        }
        boolean interrupted = Thread.interrupted();
        try {
            deleteAll(ids);
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void deleteAll(List<String> ids) {
        for (String id : ids) {
            try {
                ServiceResponse response = client.deleteTask(id);
                if (!response.isSuccess() && response.statusCode() != 404) {
                    logger.warning(
                            "Could not delete probe task " + id + ": HTTP " + response.statusCode());
                }
            } catch (RuntimeException e) {
                logger.warning("Could not delete probe task " + id + ": " + e.getMessage());
            }
        }
    }

    /// Forgets a task that the check deleted itself.
    void forget(String id) {
        created.remove(id);
    }
}
