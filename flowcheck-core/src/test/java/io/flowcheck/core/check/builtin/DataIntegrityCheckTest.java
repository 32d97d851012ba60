package io.flowcheck.core.check.builtin;

import static io.flowcheck.core.check.builtin.Fixtures.cleanStore;
import static io.flowcheck.core.check.builtin.Fixtures.context;
import static io.flowcheck.core.check.builtin.Fixtures.sprint;
import static io.flowcheck.core.check.builtin.Fixtures.task;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import io.flowcheck.core.FlowConfig;
import io.flowcheck.core.check.CheckOutcome;
import io.flowcheck.core.check.Finding;
import io.flowcheck.core.check.FindingCategory;
import io.flowcheck.core.check.OutcomeStatus;
import io.flowcheck.core.check.Severity;
import io.flowcheck.core.store.InMemoryTaskStore;
import io.flowcheck.core.store.StoreFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("DataIntegrityCheck")
class DataIntegrityCheckTest {

    private DataIntegrityCheck check;

    @BeforeEach
    void setUp() {
        check = new DataIntegrityCheck();
    }

    private CheckOutcome validate(InMemoryTaskStore store) {
        return check.validate(context(store));
    }

    @Test
    @DisplayName("passes every group on a clean store")
    void shouldPassCleanStore() {
        var outcome = validate(cleanStore());

        assertThat(outcome.status()).isEqualTo(OutcomeStatus.PASSED);
        assertThat(outcome.passed()).isEqualTo(6);
        assertThat(outcome.details()).containsEntry("tasksInspected", 2);
    }

    @Nested
    @DisplayName("critical findings")
    class Critical {

        @Test
        @DisplayName("flags a task whose sprint does not exist")
        void shouldFlagMissingSprint() {
            var outcome = validate(cleanStore().addTask(task("T3").sprintId("S404").build()));

            assertThat(outcome.status()).isEqualTo(OutcomeStatus.FAILED);
            assertThat(outcome.findings())
                    .singleElement()
                    .satisfies(
                            f -> {
                                assertThat(f.category())
                                        .isEqualTo(FindingCategory.FOREIGN_KEY_VIOLATION);
                                assertThat(f.field()).isEqualTo("sprint_id");
                                assertThat(f.recordId()).isEqualTo("T3");
                                assertThat(f.severity()).isEqualTo(Severity.CRITICAL);
                            });
        }

        @Test
        @DisplayName("flags a sprint whose project does not exist")
        void shouldFlagSprintWithoutProject() {
            var outcome = validate(cleanStore().addSprint(sprint("S2", "P404", "planned")));

            assertThat(outcome.findings())
                    .extracting(Finding::table, Finding::field)
                    .containsExactly(tuple("sprints", "project_id"));
        }

        @Test
        @DisplayName("flags an unparseable dependency list")
        void shouldFlagMalformedDependsOn() {
            var outcome = validate(cleanStore().addTask(task("T3").dependsOn("T1,T2").build()));

            assertThat(outcome.criticalCount()).isEqualTo(1);
            assertThat(outcome.findings().get(0).category())
                    .isEqualTo(FindingCategory.MALFORMED_STRUCTURE);
        }

        @Test
        @DisplayName("flags a task created after its last update")
        void shouldFlagTimestampInversion() {
            var outcome =
                    validate(
                            cleanStore()
                                    .addTask(
                                            task("T3")
                                                    .createdAt("2026-02-01T00:00:00Z")
                                                    .updatedAt("2026-01-01")
                                                    .build()));

            assertThat(outcome.findings())
                    .singleElement()
                    .extracting(Finding::category, Finding::severity)
                    .containsExactly(FindingCategory.TIMESTAMP_INCONSISTENCY, Severity.CRITICAL);
        }

        @Test
        @DisplayName("flags a duplicated primary key")
        void shouldFlagDuplicateKey() {
            var outcome = validate(cleanStore().addTask(task("T1").build()));

            assertThat(outcome.findings())
                    .anySatisfy(
                            f -> {
                                assertThat(f.category()).isEqualTo(FindingCategory.DUPLICATE_KEY);
                                assertThat(f.description()).contains("2 times");
                            });
        }
    }

    @Nested
    @DisplayName("foreign key scope")
    class ForeignKeyScope {

        @Test
        @DisplayName("ignores dangling parents on soft-deleted tasks")
        void shouldIgnoreDeletedChild() {
            var store =
                    cleanStore()
                            .addTask(
                                    task("T9")
                                            .projectId("P404")
                                            .sprintId(null)
                                            .deletedAt("2026-01-04T00:00:00Z")
                                            .build());

            var outcome = validate(store);

            assertThat(outcome.criticalCount()).isZero();
            assertThat(outcome.findings())
                    .extracting(Finding::category)
                    .doesNotContain(FindingCategory.FOREIGN_KEY_VIOLATION);
        }

        @Test
        @DisplayName("treats blank parent columns as no reference")
        void shouldTreatBlankParentAsAbsent() {
            var store =
                    cleanStore()
                            .addTask(task("T8").projectId("").sprintId("").build())
                            .addSprint(sprint("S2", " ", "planned"));

            var outcome = validate(store);

            assertThat(outcome.criticalCount()).isZero();
            assertThat(outcome.status()).isEqualTo(OutcomeStatus.PASSED);
        }

        @Test
        @DisplayName("still flags a live task whose project does not exist")
        void shouldFlagLiveChild() {
            var outcome = validate(cleanStore().addTask(task("T7").projectId("P404").build()));

            assertThat(outcome.findings())
                    .extracting(Finding::recordId, Finding::field, Finding::severity)
                    .containsExactly(tuple("T7", "project_id", Severity.CRITICAL));
        }
    }

    @Nested
    @DisplayName("warnings")
    class Warnings {

        @Test
        @DisplayName("warns about malformed assignees, orphans and stale soft deletes")
        void shouldWarn() {
            var store =
                    cleanStore()
                            .addTask(task("T3").assignees("ana").build())
                            .addTask(task("T4").dependsOn("[\"T404\"]").build())
                            .addTask(task("T5").deletedAt("2026-01-04T00:00:00Z").build())
                            .addTask(task("T6").updatedAt("yesterday").build());

            var outcome = validate(store);

            assertThat(outcome.status()).isEqualTo(OutcomeStatus.PASSED_WITH_WARNINGS);
            assertThat(outcome.findings())
                    .extracting(Finding::category)
                    .containsExactlyInAnyOrder(
                            FindingCategory.MALFORMED_STRUCTURE,
                            FindingCategory.ORPHANED_REFERENCE,
                            FindingCategory.STALE_SOFT_DELETE,
                            FindingCategory.TIMESTAMP_INCONSISTENCY);
            assertThat(outcome.passed()).isEqualTo(2);
        }

        @Test
        @DisplayName("warns when a done task has no done date")
        void shouldWarnDoneWithoutDate() {
            var outcome =
                    validate(cleanStore().addTask(task("T3").status(TaskLifecycle.DONE).build()));

            assertThat(outcome.findings())
                    .singleElement()
                    .satisfies(f -> assertThat(f.field()).isEqualTo("done_date"));
        }
    }

    @Test
    @DisplayName("inspects only tasks inside the filter")
    void shouldRespectFilter() {
        var store = cleanStore().addTask(task("X1").sprintId("S404").projectId("P1").build());
        var config = FlowConfig.builder().filter(StoreFilter.of("P1", "S1")).build();

        var outcome = check.validate(context(store, null, config));

        assertThat(outcome.status()).isEqualTo(OutcomeStatus.PASSED);
        assertThat(outcome.details()).containsEntry("tasksInspected", 2);
    }
}
