package io.flowcheck.core.check.builtin;

import io.flowcheck.core.check.Check;
import io.flowcheck.core.check.CheckContext;
import io.flowcheck.core.check.CheckOutcome;
import io.flowcheck.core.check.FindingCategory;
import io.flowcheck.core.check.OutcomeRecorder;
import io.flowcheck.core.check.StructuredFieldParser;
import io.flowcheck.core.exception.MalformedStructureException;
import io.flowcheck.core.store.DuplicateKey;
import io.flowcheck.core.store.ProjectRecord;
import io.flowcheck.core.store.SprintRecord;
import io.flowcheck.core.store.StoreFilter;
import io.flowcheck.core.store.TaskRecord;
import io.flowcheck.core.store.TaskStore;
import io.flowcheck.core.store.Timestamps;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/// Root check of the standard flow: structural soundness of the stored data.
///
/// Runs six groups of assertions. A clean group records one pass; a dirty group
/// records one finding per offending record.
///
/// | Group | Finding | Severity |
/// |-------|---------|----------|
/// | foreign keys | task → project, task → sprint, sprint → project points nowhere | critical |
/// | embedded structures | `depends_on` / `blocks` unparseable | critical |
/// | embedded structures | `assignees` unparseable | warning |
/// | orphaned dependencies | live task depends on a missing or deleted task | warning |
/// | timestamps | `created_at > updated_at` | critical |
/// | timestamps | `done` without `done_date`, unparseable timestamp text | warning |
/// | primary keys | duplicated id | critical |
/// | soft deletes | deleted task still in an active sprint | warning |
///
/// Parent lookups always consult the whole store; only the child rows are
/// restricted by the configured filter. Foreign keys are checked on live tasks
/// only, and a blank parent column counts as no reference.
public final class DataIntegrityCheck implements Check {

    public static final String NAME = "Data Integrity Validator";

    @Override
    public CheckOutcome validate(CheckContext context) {
        TaskStore store = context.getStore();
        StoreFilter filter = context.getFilter();
        OutcomeRecorder recorder = new OutcomeRecorder(NAME);

        List<TaskRecord> tasks = store.findTasks(filter);
        List<SprintRecord> sprints = store.findSprints(filter);
        Map<String, SprintRecord> allSprints =
                store.findSprints(StoreFilter.none()).stream()
                        .collect(Collectors.toMap(SprintRecord::id, s -> s, (a, b) -> a));
        Set<String> projectIds =
                store.findProjects().stream().map(ProjectRecord::id).collect(Collectors.toSet());

        group(recorder, r -> checkForeignKeys(r, tasks, sprints, allSprints.keySet(), projectIds));
        group(recorder, r -> checkEmbeddedStructures(r, tasks, context.getParser()));
        group(recorder, r -> checkOrphanedDependencies(r, tasks, store, context.getParser()));
        group(recorder, r -> checkTimestamps(r, tasks));
        group(recorder, r -> checkPrimaryKeys(r, store.findDuplicateKeys()));
        group(recorder, r -> checkSoftDeletes(r, tasks, allSprints));

        recorder.detail("tasksInspected", tasks.size());
        recorder.detail("sprintsInspected", sprints.size());
        return recorder.toOutcome();
    }

    private static void group(OutcomeRecorder recorder, Consumer<OutcomeRecorder> assertions) {
        int before = recorder.findingCount();
        assertions.accept(recorder);
        if (recorder.findingCount() == before) {
            recorder.pass();
        }
    }

    private static void checkForeignKeys(
            OutcomeRecorder recorder,
            List<TaskRecord> tasks,
            List<SprintRecord> sprints,
            Set<String> sprintIds,
            Set<String> projectIds) {
        for (TaskRecord task : tasks) {
            if (task.isDeleted()) {
                continue;
            }
            if (isReference(task.projectId()) && !projectIds.contains(task.projectId())) {
                recorder.critical(
                        FindingCategory.FOREIGN_KEY_VIOLATION,
                        "tasks",
                        "project_id",
                        task.id(),
                        "Task references non-existent project " + task.projectId());
            }
            if (isReference(task.sprintId()) && !sprintIds.contains(task.sprintId())) {
                recorder.critical(
                        FindingCategory.FOREIGN_KEY_VIOLATION,
                        "tasks",
                        "sprint_id",
                        task.id(),
                        "Task references non-existent sprint " + task.sprintId());
            }
        }
        for (SprintRecord sprint : sprints) {
            if (isReference(sprint.projectId()) && !projectIds.contains(sprint.projectId())) {
                recorder.critical(
                        FindingCategory.FOREIGN_KEY_VIOLATION,
                        "sprints",
                        "project_id",
                        sprint.id(),
                        "Sprint references non-existent project " + sprint.projectId());
            }
        }
    }

    /// A null or blank parent column means "no parent".
    private static boolean isReference(String parentId) {
        return parentId != null && !parentId.isBlank();
    }

    private static void checkEmbeddedStructures(
            OutcomeRecorder recorder, List<TaskRecord> tasks, StructuredFieldParser parser) {
        for (TaskRecord task : tasks) {
            malformedList(parser, task.dependsOn())
                    .ifPresent(
                            error ->
                                    recorder.critical(
                                            FindingCategory.MALFORMED_STRUCTURE,
                                            "tasks",
                                            "depends_on",
                                            task.id(),
                                            "Invalid depends_on list: " + error));
            malformedList(parser, task.blocks())
                    .ifPresent(
                            error ->
                                    recorder.critical(
                                            FindingCategory.MALFORMED_STRUCTURE,
                                            "tasks",
                                            "blocks",
                                            task.id(),
                                            "Invalid blocks list: " + error));
            malformedList(parser, task.assignees())
                    .ifPresent(
                            error ->
                                    recorder.warning(
                                            FindingCategory.MALFORMED_STRUCTURE,
                                            "tasks",
                                            "assignees",
                                            task.id(),
                                            "Invalid assignees list: " + error));
        }
    }

    private static Optional<String> malformedList(StructuredFieldParser parser, String text) {
        try {
            TaskLinks.ids(parser, text);
            return Optional.empty();
        } catch (MalformedStructureException e) {
            return Optional.of(e.getMessage());
        }
    }

    private static void checkOrphanedDependencies(
            OutcomeRecorder recorder,
            List<TaskRecord> tasks,
            TaskStore store,
            StructuredFieldParser parser) {
        for (TaskRecord task : tasks) {
            if (task.isDeleted()) {
                continue;
            }
            List<String> dependencies;
            try {
                dependencies = TaskLinks.ids(parser, task.dependsOn());
            } catch (MalformedStructureException e) {
                // reported by the embedded-structure group
                continue;
            }
            for (String dependencyId : dependencies) {
                Optional<TaskRecord> dependency = store.findTask(dependencyId);
                if (dependency.isEmpty()) {
                    recorder.warning(
                            FindingCategory.ORPHANED_REFERENCE,
                            "tasks",
                            "depends_on",
                            task.id(),
                            "Depends on missing task " + dependencyId);
                } else if (dependency.get().isDeleted()) {
                    recorder.warning(
                            FindingCategory.ORPHANED_REFERENCE,
                            "tasks",
                            "depends_on",
                            task.id(),
                            "Depends on deleted task " + dependencyId);
                }
            }
        }
    }

    private static void checkTimestamps(OutcomeRecorder recorder, List<TaskRecord> tasks) {
        for (TaskRecord task : tasks) {
            Optional<Instant> created = Timestamps.parse(task.createdAt());
            Optional<Instant> updated = Timestamps.parse(task.updatedAt());
            if (Timestamps.isMalformed(task.createdAt())) {
                recorder.warning(
                        FindingCategory.TIMESTAMP_INCONSISTENCY,
                        "tasks",
                        "created_at",
                        task.id(),
                        "Unparseable created_at: " + task.createdAt());
            }
            if (Timestamps.isMalformed(task.updatedAt())) {
                recorder.warning(
                        FindingCategory.TIMESTAMP_INCONSISTENCY,
                        "tasks",
                        "updated_at",
                        task.id(),
                        "Unparseable updated_at: " + task.updatedAt());
            }
            if (created.isPresent()
                    && updated.isPresent()
                    && created.get().isAfter(updated.get())) {
                recorder.critical(
                        FindingCategory.TIMESTAMP_INCONSISTENCY,
                        "tasks",
                        "created_at",
                        task.id(),
                        "created_at "
                                + task.createdAt()
                                + " is after updated_at "
                                + task.updatedAt());
            }
            if (TaskLifecycle.DONE.equals(task.status())
                    && (task.doneDate() == null || task.doneDate().isBlank())) {
                recorder.warning(
                        FindingCategory.TIMESTAMP_INCONSISTENCY,
                        "tasks",
                        "done_date",
                        task.id(),
                        "Task is done but has no done_date");
            }
        }
    }

    private static void checkPrimaryKeys(OutcomeRecorder recorder, List<DuplicateKey> duplicates) {
        for (DuplicateKey duplicate : duplicates) {
            recorder.critical(
                    FindingCategory.DUPLICATE_KEY,
                    duplicate.table(),
                    "id",
                    duplicate.id(),
                    "Primary key occurs " + duplicate.occurrences() + " times");
        }
    }

    private static void checkSoftDeletes(
            OutcomeRecorder recorder, List<TaskRecord> tasks, Map<String, SprintRecord> sprints) {
        for (TaskRecord task : tasks) {
            if (!task.isDeleted() || task.sprintId() == null) {
                continue;
            }
            SprintRecord sprint = sprints.get(task.sprintId());
            if (sprint != null && sprint.isActive()) {
                recorder.warning(
                        FindingCategory.STALE_SOFT_DELETE,
                        "tasks",
                        "deleted_at",
                        task.id(),
                        "Deleted task is still assigned to active sprint " + sprint.id());
            }
        }
    }
}
