package io.flowcheck.core.report;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("OverallStatus")
class OverallStatusTest {

    @ParameterizedTest(name = "critical={0}, failed={1}, rate={2} -> {3}")
    @CsvSource({
        "1, 1, 99.0, FAILED",
        "0, 0, 100.0, PASSED",
        "0, 0, 0.0, PASSED",
        "0, 1, 90.0, PASSED_WITH_WARNINGS",
        "0, 1, 89.9, DEGRADED",
        "0, 3, 70.0, DEGRADED",
        "0, 5, 69.9, FAILED"
    })
    @DisplayName("derives the verdict in priority order")
    void shouldDeriveVerdict(int critical, int failed, double rate, OverallStatus expected) {
        assertThat(OverallStatus.derive(critical, failed, rate)).isEqualTo(expected);
    }

    @Test
    @DisplayName("maps only the success family to exit code 0")
    void shouldMapExitCodes() {
        assertThat(OverallStatus.PASSED.exitCode()).isZero();
        assertThat(OverallStatus.PASSED_WITH_WARNINGS.exitCode()).isZero();
        assertThat(OverallStatus.DEGRADED.exitCode()).isEqualTo(1);
        assertThat(OverallStatus.FAILED.exitCode()).isEqualTo(1);
    }

    @Test
    @DisplayName("reports a zero success rate for an empty run")
    void shouldHandleEmptySummary() {
        var summary = ValidationSummary.of(0, 0, 0, 0, 0);

        assertThat(summary.successRate()).isZero();
    }
}
