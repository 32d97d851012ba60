package io.flowcheck.core.check.builtin;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TaskLifecycle")
class TaskLifecycleTest {

    private final TaskLifecycle lifecycle = TaskLifecycle.standard();

    @Test
    @DisplayName("finds the shortest path from new")
    void shouldFindShortestPath() {
        assertThat(lifecycle.pathFromNew(TaskLifecycle.DONE))
                .contains(List.of("in_progress", "review", "done"));
        assertThat(lifecycle.pathFromNew(TaskLifecycle.NEW)).contains(List.of());
        assertThat(lifecycle.pathFromNew("archived")).isEmpty();
    }

    @Test
    @DisplayName("treats done and dropped as terminal")
    void shouldKnowTerminalStatuses() {
        assertThat(lifecycle.isTerminal(TaskLifecycle.DONE)).isTrue();
        assertThat(lifecycle.isTerminal(TaskLifecycle.DROPPED)).isTrue();
        assertThat(lifecycle.isTerminal(TaskLifecycle.REVIEW)).isFalse();
        assertThat(lifecycle.allows(TaskLifecycle.BLOCKED, TaskLifecycle.IN_PROGRESS)).isTrue();
        assertThat(lifecycle.allows(TaskLifecycle.NEW, TaskLifecycle.DONE)).isFalse();
        assertThat(lifecycle.structuralProblems()).isEmpty();
    }

    @Test
    @DisplayName("reports undefined targets and unreachable statuses")
    void shouldReportStructuralProblems() {
        Map<String, Set<String>> table = new LinkedHashMap<>();
        table.put("new", Set.of("ghost"));
        table.put("orphan", Set.of());

        assertThat(TaskLifecycle.of(table).structuralProblems())
                .containsExactly(
                        "Transition new -> ghost targets an undefined status",
                        "Status 'orphan' is unreachable from 'new'");
    }
}
