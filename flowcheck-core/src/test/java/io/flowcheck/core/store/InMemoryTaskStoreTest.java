package io.flowcheck.core.store;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryTaskStore")
class InMemoryTaskStoreTest {

    private InMemoryTaskStore store;

    @BeforeEach
    void setUp() {
        store =
                new InMemoryTaskStore()
                        .addSprint(new SprintRecord("S2", "Two", "active", "P1", null, null))
                        .addSprint(new SprintRecord("S1", "One", "closed", "P2", null, null))
                        .addTask(task("T2", "P1", "S2", "new"))
                        .addTask(task("T1", "P1", "S2", "in_progress"))
                        .addTask(task("T3", "P2", "S1", "new"));
    }

    private static TaskRecord task(String id, String project, String sprint, String status) {
        return TaskRecord.builder()
                .id(id)
                .title(id)
                .status(status)
                .projectId(project)
                .sprintId(sprint)
                .build();
    }

    @Test
    @DisplayName("returns filtered tasks sorted by id")
    void shouldFilterAndSort() {
        assertThat(store.findTasks(StoreFilter.of("P1", null)))
                .extracting(TaskRecord::id)
                .containsExactly("T1", "T2");
        assertThat(store.findTasks(StoreFilter.of("P1", null).withStatus("new")))
                .extracting(TaskRecord::id)
                .containsExactly("T2");
        assertThat(store.findSprints(StoreFilter.of(null, "S1")))
                .extracting(SprintRecord::id)
                .containsExactly("S1");
    }

    @Test
    @DisplayName("reports keys stored more than once")
    void shouldReportDuplicates() {
        store.addTask(task("T1", "P1", "S2", "new")).addTask(task("T1", "P1", "S2", "new"));

        assertThat(store.findDuplicateKeys()).containsExactly(new DuplicateKey("tasks", "T1", 3));
    }
}
