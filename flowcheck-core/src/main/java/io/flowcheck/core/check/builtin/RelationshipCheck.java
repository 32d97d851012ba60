package io.flowcheck.core.check.builtin;

import io.flowcheck.core.check.Check;
import io.flowcheck.core.check.CheckContext;
import io.flowcheck.core.check.CheckOutcome;
import io.flowcheck.core.check.FindingCategory;
import io.flowcheck.core.check.OutcomeRecorder;
import io.flowcheck.core.check.StructuredFieldParser;
import io.flowcheck.core.exception.MalformedStructureException;
import io.flowcheck.core.store.StoreFilter;
import io.flowcheck.core.store.TaskRecord;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/// Checks the dependency links between live tasks.
///
/// - a dependency cycle among live tasks is critical
/// - `A depends_on B` without `B blocks A` is a warning
/// - a `done` task depending on an unfinished task is a warning
/// - a dependency on a missing or deleted task is a warning
///
/// Tasks whose link columns do not parse are left to the integrity check.
public final class RelationshipCheck implements Check {

    public static final String NAME = "Relationship Validator";

    private static final Logger logger = Logger.getLogger(RelationshipCheck.class.getName());

    @Override
    public CheckOutcome validate(CheckContext context) {
        OutcomeRecorder recorder = new OutcomeRecorder(NAME);
        StructuredFieldParser parser = context.getParser();

        Map<String, TaskRecord> everyTask =
                TaskLinks.byId(context.getStore().findTasks(StoreFilter.none()));
        Map<String, List<String>> dependsOn = new LinkedHashMap<>();
        Map<String, List<String>> blocks = new LinkedHashMap<>();
        for (TaskRecord task : context.getStore().findTasks(context.getFilter())) {
            if (task.isDeleted()) {
                continue;
            }
            try {
                dependsOn.put(task.id(), TaskLinks.ids(parser, task.dependsOn()));
                blocks.put(task.id(), TaskLinks.ids(parser, task.blocks()));
            } catch (MalformedStructureException e) {
                logger.fine("Skipping task with malformed links: " + task.id());
            }
        }

        checkCycles(recorder, dependsOn, everyTask);
        checkReciprocalLinks(recorder, dependsOn, everyTask, parser);
        checkCompletionOrder(recorder, dependsOn, everyTask);
        checkDanglingDependencies(recorder, dependsOn, everyTask);

        recorder.detail("tasksInspected", dependsOn.size());
        return recorder.toOutcome();
    }

    private static void checkCycles(
            OutcomeRecorder recorder,
            Map<String, List<String>> dependsOn,
            Map<String, TaskRecord> everyTask) {
        Set<String> done = new HashSet<>();
        Set<Set<String>> reported = new HashSet<>();
        List<List<String>> cycles = new ArrayList<>();
        for (String start : new TreeSet<>(dependsOn.keySet())) {
            findCycles(start, dependsOn, everyTask, new ArrayList<>(), done, reported, cycles);
        }
        for (List<String> cycle : cycles) {
            recorder.critical(
                    FindingCategory.DEPENDENCY_CYCLE,
                    "tasks",
                    "depends_on",
                    cycle.get(0),
                    "Dependency cycle: " + String.join(" -> ", cycle) + " -> " + cycle.get(0));
        }
        if (cycles.isEmpty()) {
            recorder.pass();
        }
    }

    private static void findCycles(
            String current,
            Map<String, List<String>> dependsOn,
            Map<String, TaskRecord> everyTask,
            List<String> path,
            Set<String> done,
            Set<Set<String>> reported,
            List<List<String>> cycles) {
        int index = path.indexOf(current);
        if (index >= 0) {
            List<String> cycle = List.copyOf(path.subList(index, path.size()));
            if (reported.add(new HashSet<>(cycle))) {
                cycles.add(cycle);
            }
            return;
        }
        if (done.contains(current)) {
            return;
        }
        path.add(current);
        for (String next : dependsOn.getOrDefault(current, List.of())) {
            TaskRecord target = everyTask.get(next);
            if (target != null && !target.isDeleted()) {
                findCycles(next, dependsOn, everyTask, path, done, reported, cycles);
            }
        }
        path.remove(path.size() - 1);
        done.add(current);
    }

    private static void checkReciprocalLinks(
            OutcomeRecorder recorder,
            Map<String, List<String>> dependsOn,
            Map<String, TaskRecord> everyTask,
            StructuredFieldParser parser) {
        int before = recorder.findingCount();
        dependsOn.forEach(
                (taskId, dependencies) -> {
                    for (String dependencyId : dependencies) {
                        TaskRecord dependency = everyTask.get(dependencyId);
                        if (dependency == null || dependency.isDeleted()) {
                            continue;
                        }
                        List<String> blocked = blockedBy(dependency, parser);
                        if (blocked != null && !blocked.contains(taskId)) {
                            recorder.warning(
                                    FindingCategory.MISSING_RECIPROCAL,
                                    "tasks",
                                    "blocks",
                                    dependencyId,
                                    "Task "
                                            + taskId
                                            + " depends on "
                                            + dependencyId
                                            + " but "
                                            + dependencyId
                                            + " does not list it in blocks");
                        }
                    }
                });
        if (recorder.findingCount() == before) {
            recorder.pass();
        }
    }

    /// Returns the parsed `blocks` list, or null when it does not parse.
    private static List<String> blockedBy(TaskRecord task, StructuredFieldParser parser) {
        try {
            return TaskLinks.ids(parser, task.blocks());
        } catch (MalformedStructureException e) {
            logger.fine("Skipping reciprocal check for malformed blocks: " + task.id());
            return null;
        }
    }

    private static void checkCompletionOrder(
            OutcomeRecorder recorder,
            Map<String, List<String>> dependsOn,
            Map<String, TaskRecord> everyTask) {
        int before = recorder.findingCount();
        dependsOn.forEach(
                (taskId, dependencies) -> {
                    TaskRecord task = everyTask.get(taskId);
                    if (!TaskLifecycle.DONE.equals(task.status())) {
                        return;
                    }
                    for (String dependencyId : dependencies) {
                        TaskRecord dependency = everyTask.get(dependencyId);
                        if (dependency != null
                                && !dependency.isDeleted()
                                && !TaskLifecycle.DONE.equals(dependency.status())
                                && !TaskLifecycle.DROPPED.equals(dependency.status())) {
                            recorder.warning(
                                    FindingCategory.LIFECYCLE_VIOLATION,
                                    "tasks",
                                    "status",
                                    taskId,
                                    "Task is done but its dependency "
                                            + dependencyId
                                            + " is "
                                            + dependency.status());
                        }
                    }
                });
        if (recorder.findingCount() == before) {
            recorder.pass();
        }
    }

    private static void checkDanglingDependencies(
            OutcomeRecorder recorder,
            Map<String, List<String>> dependsOn,
            Map<String, TaskRecord> everyTask) {
        int before = recorder.findingCount();
        dependsOn.forEach(
                (taskId, dependencies) -> {
                    for (String dependencyId : dependencies) {
                        TaskRecord dependency = everyTask.get(dependencyId);
                        if (dependency == null || dependency.isDeleted()) {
                            recorder.warning(
                                    FindingCategory.ORPHANED_REFERENCE,
                                    "tasks",
                                    "depends_on",
                                    taskId,
                                    "Depends on "
                                            + (dependency == null ? "missing" : "deleted")
                                            + " task "
                                            + dependencyId);
                        }
                    }
                });
        if (recorder.findingCount() == before) {
            recorder.pass();
        }
    }
}
