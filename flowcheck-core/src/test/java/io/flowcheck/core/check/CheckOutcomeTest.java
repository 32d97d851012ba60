package io.flowcheck.core.check;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CheckOutcome")
class CheckOutcomeTest {

    private static Finding finding(Severity severity) {
        return new Finding(
                "probe", FindingCategory.EVIDENCE, severity, "tasks", "id", "T-1", "detail");
    }

    @Test
    @DisplayName("passes when no assertion produced a finding")
    void shouldPassWithoutFindings() {
        var outcome = CheckOutcome.of(4, List.of(), Map.of());

        assertThat(outcome.status()).isEqualTo(OutcomeStatus.PASSED);
        assertThat(outcome.totalChecks()).isEqualTo(4);
        assertThat(outcome.isBlocking()).isFalse();
    }

    @Test
    @DisplayName("passes with warnings when every finding is a warning")
    void shouldPassWithWarnings() {
        var outcome = CheckOutcome.of(3, List.of(finding(Severity.WARNING)), Map.of());

        assertThat(outcome.status()).isEqualTo(OutcomeStatus.PASSED_WITH_WARNINGS);
        assertThat(outcome.failed()).isEqualTo(1);
        assertThat(outcome.warnings()).isEqualTo(1);
        assertThat(outcome.criticalCount()).isZero();
        assertThat(outcome.isBlocking()).isFalse();
    }

    @Test
    @DisplayName("fails and blocks on any critical finding")
    void shouldFailOnCritical() {
        var outcome =
                CheckOutcome.of(
                        2,
                        List.of(finding(Severity.WARNING), finding(Severity.CRITICAL)),
                        Map.of("rows", 10));

        assertThat(outcome.status()).isEqualTo(OutcomeStatus.FAILED);
        assertThat(outcome.totalChecks()).isEqualTo(4);
        assertThat(outcome.criticalCount()).isEqualTo(1);
        assertThat(outcome.isBlocking()).isTrue();
        assertThat(outcome.details()).containsEntry("rows", 10);
    }

    @Test
    @DisplayName("records assertions through the recorder")
    void shouldRecordThroughRecorder() {
        var recorder = new OutcomeRecorder("Recorder");

        boolean held =
                recorder.expect(
                        false,
                        Severity.WARNING,
                        FindingCategory.API_CONTRACT,
                        "tasks",
                        "status",
                        "refused");
        recorder.pass();

        var outcome = recorder.toOutcome();
        assertThat(held).isFalse();
        assertThat(outcome.passed()).isEqualTo(1);
        assertThat(outcome.findings())
                .singleElement()
                .satisfies(
                        f -> {
                            assertThat(f.checkName()).isEqualTo("Recorder");
                            assertThat(f.recordId()).isNull();
                            assertThat(f.description()).isEqualTo("refused");
                        });
    }
}
