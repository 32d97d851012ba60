package io.flowcheck.core.check.builtin;

import static io.flowcheck.core.check.builtin.Fixtures.cleanStore;
import static io.flowcheck.core.check.builtin.Fixtures.context;
import static io.flowcheck.core.check.builtin.Fixtures.task;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import io.flowcheck.core.FlowConfig;
import io.flowcheck.core.check.CheckContext;
import io.flowcheck.core.check.Finding;
import io.flowcheck.core.check.FindingCategory;
import io.flowcheck.core.check.OutcomeStatus;
import io.flowcheck.core.check.Severity;
import io.flowcheck.core.service.FakeTaskService;
import io.flowcheck.core.store.InMemoryTaskStore;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("StateTransitionCheck")
class StateTransitionCheckTest {

    private FakeTaskService service;

    @BeforeEach
    void setUp() {
        service = new FakeTaskService();
    }

    private static CheckContext withService(
            InMemoryTaskStore store, FakeTaskService service) {
        return context(store, service, FlowConfig.builder().build());
    }

    @Nested
    @DisplayName("service enforcement")
    class Enforcement {

        @Test
        @DisplayName("passes against a service that enforces the lifecycle")
        void shouldPassStrictService() {
            var outcome = new StateTransitionCheck().validate(withService(cleanStore(), service));

            assertThat(outcome.findings()).isEmpty();
            assertThat(outcome.status()).isEqualTo(OutcomeStatus.PASSED);
            // table + 10 allowed + 10 refused + 10 terminal + 4 stored requirements
            assertThat(outcome.passed()).isEqualTo(35);
            assertThat(service.size()).isZero();
        }

        @Test
        @DisplayName("fails when the service accepts forbidden transitions")
        void shouldFailPermissiveService() {
            service.permissiveTransitions();

            var outcome = new StateTransitionCheck().validate(withService(cleanStore(), service));

            assertThat(outcome.status()).isEqualTo(OutcomeStatus.FAILED);
            assertThat(outcome.criticalCount()).isEqualTo(20);
            assertThat(outcome.findings())
                    .extracting(Finding::description)
                    .contains(
                            "Invalid transition new -> done was accepted",
                            "Terminal status change done -> in_progress was accepted");
            assertThat(service.size()).isZero();
        }

        @Test
        @DisplayName("cannot run without a task service")
        void shouldRequireService() {
            assertThatThrownBy(() -> new StateTransitionCheck().validate(context(cleanStore())))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("No task service configured for behavior checks");
        }
    }

    @Nested
    @DisplayName("stored records")
    class StoredRecords {

        @Test
        @DisplayName("warns about records missing the fields their status needs")
        void shouldWarnAboutRequirements() {
            var store =
                    cleanStore()
                            .addTask(task("T3").status(TaskLifecycle.IN_PROGRESS).build())
                            .addTask(task("T4").status(TaskLifecycle.BLOCKED).build())
                            .addTask(task("T5").status("archived").build());

            var outcome = new StateTransitionCheck().validate(withService(store, service));

            assertThat(outcome.status()).isEqualTo(OutcomeStatus.PASSED_WITH_WARNINGS);
            assertThat(outcome.findings())
                    .extracting(Finding::recordId, Finding::field)
                    .containsExactlyInAnyOrder(
                            tuple("T3", "owner"),
                            tuple("T4", "risk_notes"),
                            tuple("T5", "status"));
            assertThat(outcome.findings())
                    .extracting(Finding::severity)
                    .containsOnly(Severity.WARNING);
        }
    }

    @Test
    @DisplayName("reports a defective transition table as critical")
    void shouldFlagDefectiveTable() {
        Map<String, Set<String>> table = new LinkedHashMap<>();
        table.put(TaskLifecycle.NEW, Set.of(TaskLifecycle.IN_PROGRESS));
        table.put(TaskLifecycle.IN_PROGRESS, Set.of());
        table.put("limbo", Set.of());

        var outcome =
                new StateTransitionCheck(TaskLifecycle.of(table))
                        .validate(
                                withService(
                                        new InMemoryTaskStore(), service.permissiveTransitions()));

        assertThat(outcome.findings())
                .filteredOn(f -> f.category() == FindingCategory.LIFECYCLE_VIOLATION)
                .extracting(Finding::description)
                .contains("Status 'limbo' is unreachable from 'new'");
    }
}
