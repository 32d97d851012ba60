package io.flowcheck.core.check.builtin;

import io.flowcheck.core.check.Check;
import io.flowcheck.core.check.CheckContext;
import io.flowcheck.core.check.CheckOutcome;
import io.flowcheck.core.check.FindingCategory;
import io.flowcheck.core.check.OutcomeRecorder;
import io.flowcheck.core.check.Severity;
import io.flowcheck.core.service.ServiceResponse;
import io.flowcheck.core.service.TaskDraft;
import io.flowcheck.core.service.TaskServiceClient;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/// Exercises create, read, update and delete on the task service.
///
/// Every step works on probe tasks the check creates itself. Broken core
/// operations (create, read, update, delete, validation of bad input) are
/// critical; secondary contract details (404 for missing tasks, filtered
/// listings, read-back after delete) are warnings.
///
/// Requires a task service.
public final class CrudBehaviorCheck implements Check {

    public static final String NAME = "CRUD Validator";

    static final String INVALID_STATUS = "not_a_status";

    private static final String TABLE = "tasks";

    @Override
    public CheckOutcome validate(CheckContext context) {
        TaskServiceClient client = context.requireTaskService();
        OutcomeRecorder recorder = new OutcomeRecorder(NAME);
        ServiceProbe probe = new ServiceProbe(client, "flowcheck-crud");
        try {
            run(recorder, probe, client);
        } finally {
            probe.cleanup();
        }
        return recorder.toOutcome();
    }

    private void run(OutcomeRecorder recorder, ServiceProbe probe, TaskServiceClient client) {
        String minimalTitle = probe.title("minimal");
        ServiceResponse minimal = probe.create(TaskDraft.minimal(minimalTitle));
        Optional<String> minimalId = ServiceProbe.idOf(minimal);
        recorder.expect(
                minimalId.isPresent(),
                Severity.CRITICAL,
                FindingCategory.API_CONTRACT,
                TABLE,
                null,
                "Create with title only failed with HTTP " + minimal.statusCode());

        TaskDraft complete =
                new TaskDraft(
                        probe.title("complete"),
                        TaskLifecycle.NEW,
                        "high",
                        ServiceProbe.OWNER,
                        null,
                        null,
                        "created by the CRUD validator");
        ServiceResponse full = probe.create(complete);
        recorder.expect(
                full.isSuccess(),
                Severity.CRITICAL,
                FindingCategory.API_CONTRACT,
                TABLE,
                null,
                "Create with every field failed with HTTP " + full.statusCode());

        ServiceResponse badStatus =
                probe.create(TaskDraft.minimal(probe.title("invalid")).withStatus(INVALID_STATUS));
        recorder.expect(
                badStatus.isClientError(),
                Severity.CRITICAL,
                FindingCategory.API_CONTRACT,
                TABLE,
                "status",
                "Create with status '" + INVALID_STATUS + "' answered HTTP "
                        + badStatus.statusCode() + " instead of a 4xx rejection");

        ServiceResponse noTitle = probe.create(TaskDraft.minimal(null));
        recorder.expect(
                noTitle.isClientError(),
                Severity.CRITICAL,
                FindingCategory.API_CONTRACT,
                TABLE,
                "title",
                "Create without a title answered HTTP " + noTitle.statusCode()
                        + " instead of a 4xx rejection");

        checkListing(recorder, client, minimalId);

        if (minimalId.isEmpty()) {
            recorder.critical(
                    FindingCategory.API_CONTRACT,
                    TABLE,
                    null,
                    null,
                    "Read, update and delete were not exercised because create failed");
            return;
        }
        String id = minimalId.get();
        checkRead(recorder, client, id, minimalTitle);
        checkUpdate(recorder, client, id);
        checkDelete(recorder, probe, client, id);
    }

    private void checkListing(
            OutcomeRecorder recorder, TaskServiceClient client, Optional<String> createdId) {
        ServiceResponse all = client.listTasks(Map.of("per_page", "1000"));
        boolean listed =
                recorder.expect(
                        all.isSuccess(),
                        Severity.CRITICAL,
                        FindingCategory.API_CONTRACT,
                        TABLE,
                        null,
                        "Listing tasks failed with HTTP " + all.statusCode());
        if (listed && createdId.isPresent()) {
            recorder.expect(
                    containsId(all.items(), createdId.get()),
                    Severity.WARNING,
                    FindingCategory.API_CONTRACT,
                    TABLE,
                    "id",
                    "Created task " + createdId.get() + " is missing from the task listing");
        }

        ServiceResponse filtered = client.listTasks(Map.of("status", TaskLifecycle.NEW));
        boolean allMatch =
                filtered.isSuccess()
                        && filtered.items().stream()
                                .allMatch(item -> TaskLifecycle.NEW.equals(fieldOf(item, "status")));
        recorder.expect(
                allMatch,
                Severity.WARNING,
                FindingCategory.API_CONTRACT,
                TABLE,
                "status",
                "Listing filtered by status=new returned other statuses or HTTP "
                        + filtered.statusCode());
    }

    private void checkRead(
            OutcomeRecorder recorder, TaskServiceClient client, String id, String expectedTitle) {
        ServiceResponse read = client.getTask(id);
        recorder.expect(
                read.isSuccess() && read.text("title").filter(expectedTitle::equals).isPresent(),
                Severity.CRITICAL,
                FindingCategory.API_CONTRACT,
                TABLE,
                "title",
                "Reading task " + id + " answered HTTP " + read.statusCode()
                        + " without the created title");

        ServiceResponse missing = client.getTask(missingId());
        recorder.expect(
                missing.statusCode() == 404,
                Severity.WARNING,
                FindingCategory.API_CONTRACT,
                TABLE,
                "id",
                "Reading a missing task answered HTTP " + missing.statusCode() + " instead of 404");
    }

    private void checkUpdate(OutcomeRecorder recorder, TaskServiceClient client, String id) {
        ServiceResponse status =
                client.updateTask(id, ServiceProbe.transitionTo(TaskLifecycle.IN_PROGRESS));
        recorder.expect(
                status.isSuccess(),
                Severity.CRITICAL,
                FindingCategory.API_CONTRACT,
                TABLE,
                "status",
                "Updating status to in_progress failed with HTTP " + status.statusCode());

        ServiceResponse priority = client.updateTask(id, Map.of("priority", "low"));
        recorder.expect(
                priority.isSuccess(),
                Severity.WARNING,
                FindingCategory.API_CONTRACT,
                TABLE,
                "priority",
                "Updating priority failed with HTTP " + priority.statusCode());

        ServiceResponse invalid = client.updateTask(id, Map.of("status", INVALID_STATUS));
        recorder.expect(
                invalid.isClientError(),
                Severity.CRITICAL,
                FindingCategory.API_CONTRACT,
                TABLE,
                "status",
                "Updating status to '" + INVALID_STATUS + "' answered HTTP "
                        + invalid.statusCode() + " instead of a 4xx rejection");

        ServiceResponse missing = client.updateTask(missingId(), Map.of("priority", "low"));
        recorder.expect(
                missing.statusCode() == 404,
                Severity.WARNING,
                FindingCategory.API_CONTRACT,
                TABLE,
                "id",
                "Updating a missing task answered HTTP " + missing.statusCode() + " instead of 404");
    }

    private void checkDelete(
            OutcomeRecorder recorder, ServiceProbe probe, TaskServiceClient client, String id) {
        ServiceResponse deleted = client.deleteTask(id);
        boolean ok =
                recorder.expect(
                        deleted.isSuccess(),
                        Severity.CRITICAL,
                        FindingCategory.API_CONTRACT,
                        TABLE,
                        null,
                        "Deleting task " + id + " failed with HTTP " + deleted.statusCode());
        if (!ok) {
            return;
        }
        probe.forget(id);
        ServiceResponse readBack = client.getTask(id);
        recorder.expect(
                readBack.statusCode() == 404,
                Severity.WARNING,
                FindingCategory.API_CONTRACT,
                TABLE,
                "id",
                "Deleted task " + id + " still answers HTTP " + readBack.statusCode());
    }

    private static boolean containsId(List<?> items, String id) {
        return items.stream().anyMatch(item -> id.equals(fieldOf(item, "id")));
    }

    private static String fieldOf(Object item, String name) {
        if (item instanceof Map<?, ?> map) {
            return Objects.toString(map.get(name), null);
        }
        return null;
    }

    private static String missingId() {
        return "missing-" + UUID.randomUUID();
    }
}
