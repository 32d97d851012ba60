package io.flowcheck.core.check.builtin;

import static io.flowcheck.core.check.builtin.Fixtures.cleanStore;
import static io.flowcheck.core.check.builtin.Fixtures.context;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.flowcheck.core.FlowConfig;
import io.flowcheck.core.check.Finding;
import io.flowcheck.core.check.FindingCategory;
import io.flowcheck.core.check.OutcomeStatus;
import io.flowcheck.core.check.Severity;
import io.flowcheck.core.service.FakeTaskService;
import io.flowcheck.core.service.ServiceResponse;
import io.flowcheck.core.service.TaskDraft;
import io.flowcheck.core.service.TaskServiceClient;
import io.flowcheck.core.service.TaskServiceException;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@DisplayName("CrudBehaviorCheck")
@ExtendWith(MockitoExtension.class)
class CrudBehaviorCheckTest {

    @Mock private TaskServiceClient brokenService;

    @Test
    @DisplayName("passes against a conforming service and deletes its probe tasks")
    void shouldPassConformingService() {
        var service = new FakeTaskService();

        var outcome =
                new CrudBehaviorCheck()
                        .validate(context(cleanStore(), service, FlowConfig.builder().build()));

        assertThat(outcome.findings()).isEmpty();
        assertThat(outcome.status()).isEqualTo(OutcomeStatus.PASSED);
        assertThat(outcome.passed()).isGreaterThanOrEqualTo(15);
        assertThat(service.size()).isZero();
    }

    @Test
    @DisplayName("fails when the service accepts invalid input")
    void shouldFailWhenValidationIsMissing() {
        var service = new FakeTaskService().noInputValidation();

        var outcome =
                new CrudBehaviorCheck()
                        .validate(context(cleanStore(), service, FlowConfig.builder().build()));

        assertThat(outcome.status()).isEqualTo(OutcomeStatus.FAILED);
        assertThat(outcome.findings())
                .extracting(Finding::field)
                .containsExactlyInAnyOrder("status", "title");
        assertThat(outcome.findings())
                .extracting(Finding::severity)
                .containsOnly(Severity.CRITICAL);
        assertThat(service.size()).isZero();
    }

    @Test
    @DisplayName("skips read, update and delete when create fails")
    void shouldStopWhenCreateFails() {
        when(brokenService.createTask(any(TaskDraft.class)))
                .thenReturn(new ServiceResponse(500, null));
        when(brokenService.listTasks(anyMap())).thenReturn(new ServiceResponse(200, List.of()));

        var outcome =
                new CrudBehaviorCheck()
                        .validate(context(cleanStore(), brokenService, FlowConfig.builder().build()));

        assertThat(outcome.criticalCount()).isEqualTo(5);
        assertThat(outcome.findings())
                .extracting(Finding::description)
                .contains("Read, update and delete were not exercised because create failed");
        assertThat(outcome.findings())
                .extracting(Finding::category)
                .containsOnly(FindingCategory.API_CONTRACT);
        verify(brokenService, never()).deleteTask(any());
    }

    @Nested
    @DisplayName("cleanup on an interrupted thread")
    class InterruptedCleanup {

        /// Refuses to send from an interrupted thread, like the JDK HTTP client.
        private final FakeTaskService service =
                new FakeTaskService() {
                    @Override
                    public ServiceResponse deleteTask(String id) {
                        if (Thread.currentThread().isInterrupted()) {
                            throw new TaskServiceException("Request interrupted");
                        }
                        return super.deleteTask(id);
                    }
                };

        @Test
        @DisplayName("still deletes created tasks and keeps the interrupt flag")
        void shouldDeleteAfterTimeoutInterrupt() {
            var tasks = new ServiceProbe(service, "cleanup");
            assertThat(tasks.createTask("a")).isPresent();
            assertThat(tasks.createTask("b")).isPresent();

            Thread.currentThread().interrupt();
            try {
                tasks.cleanup();
                assertThat(Thread.currentThread().isInterrupted()).isTrue();
            } finally {
                Thread.interrupted();
            }

            assertThat(service.size()).isZero();
        }

        @Test
        @DisplayName("leaves the flag clear when the thread was not interrupted")
        void shouldNotInventInterrupt() {
            var tasks = new ServiceProbe(service, "cleanup");
            tasks.createTask("a");

            tasks.cleanup();

            assertThat(Thread.currentThread().isInterrupted()).isFalse();
            assertThat(service.size()).isZero();
        }
    }
}
