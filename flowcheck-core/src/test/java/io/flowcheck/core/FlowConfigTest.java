package io.flowcheck.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("FlowConfig")
class FlowConfigTest {

    @Test
    @DisplayName("starts from the documented defaults")
    void shouldApplyDefaults() {
        var config = new FlowConfig();

        assertThat(config.getScope()).isEqualTo(ValidationScope.FULL);
        assertThat(config.isIncludePerformance()).isFalse();
        assertThat(config.isParallel()).isTrue();
        assertThat(config.getWorkerPoolSize()).isEqualTo(4);
        assertThat(config.getCheckTimeout()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.getFlowTimeout()).isEqualTo(Duration.ofMinutes(10));
        assertThat(config.getMaxRecommendations()).isEqualTo(10);
        assertThat(config.getFilter().isEmpty()).isTrue();
        assertThat(config.getEvidenceDirectory()).isEmpty();
        assertThat(config.getPerformanceThresholds()).isEqualTo(PerformanceThresholds.defaults());
    }

    @Nested
    @DisplayName("validate")
    class Validate {

        @Test
        @DisplayName("rejects a non-positive worker pool")
        void shouldRejectWorkerPool() {
            assertThatThrownBy(() -> FlowConfig.builder().workerPoolSize(0).build())
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("Worker pool size");
        }

        @Test
        @DisplayName("rejects zero timeouts")
        void shouldRejectTimeouts() {
            assertThatThrownBy(() -> FlowConfig.builder().checkTimeout(Duration.ZERO).build())
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("Check timeout");
            assertThatThrownBy(
                            () -> FlowConfig.builder().flowTimeout(Duration.ofSeconds(-1)).build())
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("Flow timeout");
        }

        @Test
        @DisplayName("rejects a negative recommendation limit")
        void shouldRejectRecommendationLimit() {
            assertThatThrownBy(() -> FlowConfig.builder().maxRecommendations(-1).build())
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    @DisplayName("parses scopes case-insensitively")
    void shouldParseScope() {
        assertThat(ValidationScope.parse(" Quick ")).isEqualTo(ValidationScope.QUICK);
        assertThatThrownBy(() -> ValidationScope.parse("deep"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Expected full or quick");
    }
}
