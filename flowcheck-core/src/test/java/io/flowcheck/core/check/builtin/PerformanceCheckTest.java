package io.flowcheck.core.check.builtin;

import static io.flowcheck.core.check.builtin.Fixtures.cleanStore;
import static io.flowcheck.core.check.builtin.Fixtures.context;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import io.flowcheck.core.FlowConfig;
import io.flowcheck.core.PerformanceThresholds;
import io.flowcheck.core.check.Finding;
import io.flowcheck.core.check.FindingCategory;
import io.flowcheck.core.check.OutcomeStatus;
import io.flowcheck.core.check.Severity;
import io.flowcheck.core.service.FakeTaskService;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PerformanceCheck")
class PerformanceCheckTest {

    private static PerformanceThresholds generous(int bulk, int concurrent) {
        Duration budget = Duration.ofSeconds(30);
        return new PerformanceThresholds(budget, bulk, budget, budget, budget, budget, concurrent);
    }

    @Test
    @DisplayName("times store queries and skips service benchmarks without a service")
    void shouldBenchmarkStoreOnly() throws Exception {
        var config = FlowConfig.builder().performanceThresholds(generous(5, 2)).build();

        var outcome = new PerformanceCheck().validate(context(cleanStore(), null, config));

        assertThat(outcome.status()).isEqualTo(OutcomeStatus.PASSED);
        assertThat(outcome.passed()).isEqualTo(2);
        assertThat(outcome.details())
                .containsKeys("storeListAllMs", "storeFilteredQueryMs")
                .containsEntry("serviceBenchmarks", "skipped: no task service configured");
    }

    @Test
    @DisplayName("runs service benchmarks and cleans up their tasks")
    void shouldBenchmarkService() throws Exception {
        var service = new FakeTaskService();
        var config = FlowConfig.builder().performanceThresholds(generous(5, 3)).build();

        var outcome = new PerformanceCheck().validate(context(cleanStore(), service, config));

        assertThat(outcome.findings()).isEmpty();
        assertThat(outcome.details())
                .containsKeys(
                        "serviceBulkCreateMs",
                        "serviceListAllMs",
                        "serviceSingleUpdateMs",
                        "serviceFilteredQueryMs",
                        "serviceConcurrentCreateMs");
        assertThat(service.size()).isZero();
    }

    @Test
    @DisplayName("reports breached budgets as warnings only")
    void shouldWarnOnBreach() throws Exception {
        var zero =
                new PerformanceThresholds(
                        Duration.ZERO, 1, Duration.ZERO, Duration.ZERO, Duration.ZERO, Duration.ZERO, 1);
        var config = FlowConfig.builder().performanceThresholds(zero).build();

        var outcome = new PerformanceCheck().validate(context(cleanStore(), null, config));

        assertThat(outcome.status()).isEqualTo(OutcomeStatus.PASSED_WITH_WARNINGS);
        assertThat(outcome.findings())
                .hasSize(2)
                .extracting(Finding::category, Finding::severity)
                .containsOnly(
                        tuple(
                                FindingCategory.PERFORMANCE_THRESHOLD, Severity.WARNING));
    }
}
