package io.flowcheck.core.store;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/// List-backed {@link TaskStore} for tests and dry runs.
///
/// Rows are kept in insertion lists rather than maps, so duplicate primary keys
/// can be seeded to simulate a corrupted table.
///
/// @implNote Thread-safe. Backed by {@link CopyOnWriteArrayList}; seeding while a
/// flow is running is allowed but the running checks may or may not observe it.
public class InMemoryTaskStore implements TaskStore {

    private final List<TaskRecord> tasks = new CopyOnWriteArrayList<>();
    private final List<SprintRecord> sprints = new CopyOnWriteArrayList<>();
    private final List<ProjectRecord> projects = new CopyOnWriteArrayList<>();

    public InMemoryTaskStore addTask(TaskRecord task) {
        tasks.add(task);
        return this;
    }

    public InMemoryTaskStore addSprint(SprintRecord sprint) {
        sprints.add(sprint);
        return this;
    }

    public InMemoryTaskStore addProject(ProjectRecord project) {
        projects.add(project);
        return this;
    }

    @Override
    public List<TaskRecord> findTasks(StoreFilter filter) {
        return tasks.stream()
                .filter(filter::matches)
                .sorted(Comparator.comparing(TaskRecord::id))
                .toList();
    }

    @Override
    public Optional<TaskRecord> findTask(String id) {
        return tasks.stream().filter(t -> t.id().equals(id)).findFirst();
    }

    @Override
    public List<SprintRecord> findSprints(StoreFilter filter) {
        return sprints.stream()
                .filter(filter::matches)
                .sorted(Comparator.comparing(SprintRecord::id))
                .toList();
    }

    @Override
    public List<ProjectRecord> findProjects() {
        return projects.stream().sorted(Comparator.comparing(ProjectRecord::id)).toList();
    }

    @Override
    public List<DuplicateKey> findDuplicateKeys() {
        List<DuplicateKey> duplicates = new ArrayList<>();
        duplicates.addAll(duplicates("tasks", tasks, TaskRecord::id));
        duplicates.addAll(duplicates("sprints", sprints, SprintRecord::id));
        duplicates.addAll(duplicates("projects", projects, ProjectRecord::id));
        return duplicates;
    }

    private static <T> List<DuplicateKey> duplicates(
            String table, List<T> rows, Function<T, String> key) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (T row : rows) {
            counts.merge(key.apply(row), 1, Integer::sum);
        }
        return counts.entrySet().stream()
                .filter(e -> e.getValue() > 1)
                .sorted(Map.Entry.comparingByKey())
                .map(e -> new DuplicateKey(table, e.getKey(), e.getValue()))
                .toList();
    }
}
