package io.flowcheck.core.check.builtin;

import io.flowcheck.core.FlowConfig;
import io.flowcheck.core.check.CheckContext;
import io.flowcheck.core.check.FakeStructuredFieldParser;
import io.flowcheck.core.service.TaskServiceClient;
import io.flowcheck.core.store.InMemoryTaskStore;
import io.flowcheck.core.store.ProjectRecord;
import io.flowcheck.core.store.SprintRecord;
import io.flowcheck.core.store.TaskRecord;

/// Shared records for built-in check tests.
final class Fixtures {

    static final String CREATED = "2026-01-02T09:00:00Z";
    static final String UPDATED = "2026-01-03 10:15:00";

    private Fixtures() {}

    static ProjectRecord project(String id) {
        return new ProjectRecord(id, "Project " + id, "active", CREATED, UPDATED);
    }

    static SprintRecord sprint(String id, String projectId, String status) {
        return new SprintRecord(id, "Sprint " + id, status, projectId, CREATED, UPDATED);
    }

    static TaskRecord.Builder task(String id) {
        return TaskRecord.builder()
                .id(id)
                .title("Task " + id)
                .status(TaskLifecycle.NEW)
                .priority("medium")
                .projectId("P1")
                .sprintId("S1")
                .dependsOn("[]")
                .blocks("[]")
                .assignees("[\"ana\"]")
                .createdAt(CREATED)
                .updatedAt(UPDATED)
                .auditTag("audit-" + id);
    }

    /// One project, one active sprint, two linked tasks with nothing wrong.
    static InMemoryTaskStore cleanStore() {
        return new InMemoryTaskStore()
                .addProject(project("P1"))
                .addSprint(sprint("S1", "P1", SprintRecord.ACTIVE))
                .addTask(task("T1").blocks("[\"T2\"]").build())
                .addTask(
                        task("T2")
                                .status(TaskLifecycle.IN_PROGRESS)
                                .owner("ana")
                                .dependsOn("[\"T1\"]")
                                .build());
    }

    static CheckContext context(InMemoryTaskStore store) {
        return context(store, null, FlowConfig.builder().build());
    }

    static CheckContext context(
            InMemoryTaskStore store, TaskServiceClient service, FlowConfig config) {
        return new CheckContext(store, service, config, new FakeStructuredFieldParser());
    }
}
