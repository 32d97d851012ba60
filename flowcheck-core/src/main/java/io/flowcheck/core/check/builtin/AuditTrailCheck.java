package io.flowcheck.core.check.builtin;

import io.flowcheck.core.check.Check;
import io.flowcheck.core.check.CheckContext;
import io.flowcheck.core.check.CheckOutcome;
import io.flowcheck.core.check.FindingCategory;
import io.flowcheck.core.check.OutcomeRecorder;
import io.flowcheck.core.check.Severity;
import io.flowcheck.core.check.StructuredFieldParser;
import io.flowcheck.core.exception.MalformedStructureException;
import io.flowcheck.core.store.TaskRecord;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/// Checks that task changes can be traced.
///
/// Measures how many live tasks carry an audit tag (warning below
/// {@value #MIN_AUDIT_COVERAGE}%) and reports correlation-hint coverage as a
/// detail. Then inspects the newest evidence files in the configured evidence
/// directory: each must be a JSON object with `agent`, `timestamp`, `action`
/// and `payload`. Every finding here is a warning.
public final class AuditTrailCheck implements Check {

    public static final String NAME = "Audit Trail Validator";

    static final double MIN_AUDIT_COVERAGE = 80.0;
    static final int MAX_EVIDENCE_FILES = 10;
    static final List<String> EVIDENCE_FIELDS = List.of("agent", "timestamp", "action", "payload");

    /// Orders `validation_<checkId>_<epochMillis>.json` files by their millis suffix,
    /// newest first. Files without a numeric suffix sort last.
    static final Comparator<Path> NEWEST_FIRST =
            Comparator.comparingLong(AuditTrailCheck::writtenAt)
                    .reversed()
                    .thenComparing(p -> p.getFileName().toString(), Comparator.reverseOrder());

    @Override
    public CheckOutcome validate(CheckContext context) {
        OutcomeRecorder recorder = new OutcomeRecorder(NAME);
        List<TaskRecord> live =
                context.getStore().findTasks(context.getFilter()).stream()
                        .filter(t -> !t.isDeleted())
                        .toList();

        double auditCoverage = coverage(live, TaskRecord::auditTag);
        double correlationCoverage = coverage(live, TaskRecord::correlationHint);
        recorder.detail("auditCoverage", auditCoverage);
        recorder.detail("correlationCoverage", correlationCoverage);
        recorder.expect(
                auditCoverage >= MIN_AUDIT_COVERAGE,
                Severity.WARNING,
                FindingCategory.AUDIT_COVERAGE,
                "tasks",
                "audit_tag",
                String.format(
                        "Only %.1f%% of tasks carry an audit tag (minimum %.0f%%)",
                        auditCoverage, MIN_AUDIT_COVERAGE));

        checkEvidence(recorder, context.getConfig().getEvidenceDirectory(), context.getParser());
        return recorder.toOutcome();
    }

    /// Percentage of tasks with a non-blank value. An empty list counts as fully covered.
    static double coverage(List<TaskRecord> tasks, Function<TaskRecord, String> field) {
        if (tasks.isEmpty()) {
            return 100.0;
        }
        long covered =
                tasks.stream().map(field).filter(v -> v != null && !v.isBlank()).count();
        return covered * 100.0 / tasks.size();
    }

    private void checkEvidence(
            OutcomeRecorder recorder, Optional<Path> directory, StructuredFieldParser parser) {
        if (directory.isEmpty()) {
            evidenceWarning(recorder, null, null, "No evidence directory configured");
            return;
        }
        Path dir = directory.get();
        if (!Files.isDirectory(dir)) {
            evidenceWarning(recorder, null, null, "Evidence directory " + dir + " does not exist");
            return;
        }
        recorder.pass();

        List<Path> files;
        try (Stream<Path> listing = Files.list(dir)) {
            files =
                    listing.filter(p -> p.getFileName().toString().endsWith(".json"))
                            .sorted(NEWEST_FIRST)
                            .limit(MAX_EVIDENCE_FILES)
                            .collect(Collectors.toList());
        } catch (IOException e) {
            evidenceWarning(
                    recorder,
                    null,
                    null,
                    "Could not list evidence directory " + dir + ": " + e.getMessage());
            return;
        }
        recorder.detail("evidenceFilesInspected", files.size());

        for (Path file : files) {
            inspect(recorder, file, parser);
        }
    }

    /// Epoch millis encoded after the last underscore of an evidence file name, or -1.
    static long writtenAt(Path file) {
        String name = file.getFileName().toString();
        int end = name.endsWith(".json") ? name.length() - ".json".length() : name.length();
        String suffix = name.substring(name.lastIndexOf('_') + 1, end);
        if (suffix.isEmpty() || !suffix.chars().allMatch(Character::isDigit)) {
            return -1;
        }
        try {
            return Long.parseLong(suffix);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private void inspect(OutcomeRecorder recorder, Path file, StructuredFieldParser parser) {
        String name = file.getFileName().toString();
        Map<String, Object> evidence;
        try {
            evidence = parser.parseObject(Files.readString(file));
        } catch (IOException | MalformedStructureException e) {
            evidenceWarning(recorder, name, null, "Evidence file is unreadable: " + e.getMessage());
            return;
        }
        List<String> missing =
                EVIDENCE_FIELDS.stream().filter(f -> !evidence.containsKey(f)).toList();
        if (missing.isEmpty()) {
            recorder.pass();
        } else {
            evidenceWarning(
                    recorder, name, String.join(",", missing), "Evidence file lacks " + missing);
        }
    }

    private static void evidenceWarning(
            OutcomeRecorder recorder, String file, String field, String description) {
        recorder.warning(FindingCategory.EVIDENCE, "evidence", field, file, description);
    }
}
