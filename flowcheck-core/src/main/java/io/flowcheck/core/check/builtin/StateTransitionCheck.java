package io.flowcheck.core.check.builtin;

import io.flowcheck.core.check.Check;
import io.flowcheck.core.check.CheckContext;
import io.flowcheck.core.check.CheckOutcome;
import io.flowcheck.core.check.FindingCategory;
import io.flowcheck.core.check.OutcomeRecorder;
import io.flowcheck.core.check.Severity;
import io.flowcheck.core.service.ServiceResponse;
import io.flowcheck.core.store.TaskRecord;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/// Checks the task lifecycle from three sides.
///
/// 1. **Table soundness**: every transition target is a declared status and
///    every status is reachable from `new`. Defects are critical.
/// 2. **Service enforcement**: every allowed transition is accepted (warning if
///    refused), every disallowed transition from a non-terminal status is
///    refused, and terminal statuses refuse every change. A wrongly accepted
///    change is critical.
/// 3. **Stored records**: `done` needs `done_date`, `in_progress` needs an
///    owner, `blocked` should carry risk notes, and statuses must be known.
///    Violations are warnings.
///
/// Requires a task service. Probe tasks are created per transition and deleted
/// afterwards.
public final class StateTransitionCheck implements Check {

    public static final String NAME = "State Transition Validator";

    private final TaskLifecycle lifecycle;

    public StateTransitionCheck() {
        this(TaskLifecycle.standard());
    }

    public StateTransitionCheck(TaskLifecycle lifecycle) {
        this.lifecycle = lifecycle;
    }

    @Override
    public CheckOutcome validate(CheckContext context) {
        OutcomeRecorder recorder = new OutcomeRecorder(NAME);
        ServiceProbe probe = new ServiceProbe(context.requireTaskService(), "flowcheck-state");

        checkTable(recorder);
        try {
            checkAllowedTransitions(recorder, probe);
            checkDisallowedTransitions(recorder, probe);
            checkTerminalStates(recorder, probe);
        } finally {
            probe.cleanup();
        }
        checkStoredRecords(recorder, context.getStore().findTasks(context.getFilter()));

        return recorder.toOutcome();
    }

    private void checkTable(OutcomeRecorder recorder) {
        List<String> problems = lifecycle.structuralProblems();
        for (String problem : problems) {
            recorder.critical(
                    FindingCategory.LIFECYCLE_VIOLATION, "lifecycle", "status", null, problem);
        }
        if (problems.isEmpty()) {
            recorder.pass();
        }
    }

    private void checkAllowedTransitions(OutcomeRecorder recorder, ServiceProbe probe) {
        for (String from : lifecycle.statuses()) {
            for (String to : lifecycle.targets(from)) {
                Optional<String> taskId = probe.reach(lifecycle, from);
                if (taskId.isEmpty()) {
                    recorder.warning(
                            FindingCategory.API_CONTRACT,
                            "tasks",
                            "status",
                            null,
                            "Could not bring a probe task to " + from + " to test -> " + to);
                    continue;
                }
                ServiceResponse response =
                        probe.client().updateTask(taskId.get(), ServiceProbe.transitionTo(to));
                recorder.expect(
                        response.isSuccess(),
                        Severity.WARNING,
                        FindingCategory.API_CONTRACT,
                        "tasks",
                        "status",
                        "Valid transition "
                                + from
                                + " -> "
                                + to
                                + " was refused with HTTP "
                                + response.statusCode());
            }
        }
    }

    private void checkDisallowedTransitions(OutcomeRecorder recorder, ServiceProbe probe) {
        for (String from : lifecycle.statuses()) {
            if (lifecycle.isTerminal(from)) {
                continue;
            }
            List<String> forbidden =
                    lifecycle.statuses().stream()
                            .filter(to -> !to.equals(from))
                            .filter(Predicate.not(to -> lifecycle.allows(from, to)))
                            .toList();
            attemptForbidden(recorder, probe, from, forbidden, "Invalid transition");
        }
    }

    private void checkTerminalStates(OutcomeRecorder recorder, ServiceProbe probe) {
        for (String terminal : lifecycle.statuses()) {
            if (!lifecycle.isTerminal(terminal)) {
                continue;
            }
            List<String> others =
                    lifecycle.statuses().stream().filter(to -> !to.equals(terminal)).toList();
            attemptForbidden(recorder, probe, terminal, others, "Terminal status change");
        }
    }

    private void attemptForbidden(
            OutcomeRecorder recorder,
            ServiceProbe probe,
            String from,
            List<String> targets,
            String label) {
        Optional<String> taskId = Optional.empty();
        for (String to : targets) {
            if (taskId.isEmpty()) {
                taskId = probe.reach(lifecycle, from);
                if (taskId.isEmpty()) {
                    recorder.warning(
                            FindingCategory.API_CONTRACT,
                            "tasks",
                            "status",
                            null,
                            "Could not bring a probe task to " + from);
                    return;
                }
            }
            ServiceResponse response =
                    probe.client().updateTask(taskId.get(), ServiceProbe.transitionTo(to));
            if (response.isSuccess()) {
                recorder.critical(
                        FindingCategory.LIFECYCLE_VIOLATION,
                        "tasks",
                        "status",
                        taskId.get(),
                        label + " " + from + " -> " + to + " was accepted");
                // the probe task moved; the next attempt needs a fresh one
                taskId = Optional.empty();
            } else {
                recorder.pass();
            }
        }
    }

    private void checkStoredRecords(OutcomeRecorder recorder, List<TaskRecord> tasks) {
        List<TaskRecord> live = tasks.stream().filter(t -> !t.isDeleted()).toList();
        requirement(
                recorder,
                live,
                t -> lifecycle.isKnown(t.status()),
                FindingCategory.LIFECYCLE_VIOLATION,
                "status",
                t -> "Unknown status '" + t.status() + "'");
        requirement(
                recorder,
                live,
                t -> !TaskLifecycle.DONE.equals(t.status()) || present(t.doneDate()),
                FindingCategory.STATE_REQUIREMENT,
                "done_date",
                t -> "Task is done but has no done_date");
        requirement(
                recorder,
                live,
                t -> !TaskLifecycle.IN_PROGRESS.equals(t.status()) || present(t.owner()),
                FindingCategory.STATE_REQUIREMENT,
                "owner",
                t -> "Task is in progress but has no owner");
        requirement(
                recorder,
                live,
                t -> !TaskLifecycle.BLOCKED.equals(t.status()) || present(t.riskNotes()),
                FindingCategory.STATE_REQUIREMENT,
                "risk_notes",
                t -> "Task is blocked but has no risk notes");
    }

    private static void requirement(
            OutcomeRecorder recorder,
            List<TaskRecord> tasks,
            Predicate<TaskRecord> holds,
            FindingCategory category,
            String field,
            Function<TaskRecord, String> description) {
        int before = recorder.findingCount();
        for (TaskRecord task : tasks) {
            if (!holds.test(task)) {
                recorder.warning(category, "tasks", field, task.id(), description.apply(task));
            }
        }
        if (recorder.findingCount() == before) {
            recorder.pass();
        }
    }

    private static boolean present(String value) {
        return value != null && !value.isBlank();
    }
}
