package io.flowcheck.core.flow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.flowcheck.core.check.StubChecks;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("FlowNode")
class FlowNodeTest {

    private static final Instant T0 = Instant.parse("2026-01-05T10:00:00Z");

    private FlowNode node;

    @BeforeEach
    void setUp() {
        node =
                new FlowNode(
                        NodeDefinition.builder().id("integrity").name("Integrity").build(),
                        StubChecks.passing(1));
    }

    @Nested
    @DisplayName("transitions")
    class Transitions {

        @Test
        @DisplayName("completes after running and keeps the worker start time")
        void shouldComplete() {
            node.markRunning(T0);
            node.complete(StubChecks.outcome(3, 0, 0), T0.plusMillis(20), T0.plusSeconds(2));

            assertThat(node.getStatus()).isEqualTo(NodeStatus.COMPLETED);
            assertThat(node.getStartedAt()).contains(T0.plusMillis(20));
            assertThat(node.getDuration()).contains(Duration.ofMillis(1980));
            assertThat(node.getOutcome()).isPresent();
            assertThat(node.getError()).isEmpty();
        }

        @Test
        @DisplayName("keeps the dispatch time when a fault carries no start time")
        void shouldKeepDispatchTimeOnFault() {
            node.markRunning(T0);
            node.fail("Flow timeout of 1s exceeded", null, T0.plusSeconds(1));

            assertThat(node.getStatus()).isEqualTo(NodeStatus.FAILED);
            assertThat(node.getStartedAt()).contains(T0);
            assertThat(node.getError()).contains("Flow timeout of 1s exceeded");
            assertThat(node.getOutcome()).isEmpty();
        }

        @Test
        @DisplayName("blocks and skips only from pending, without timing")
        void shouldBlockAndSkipFromPending() {
            node.block("dependency 'a' is FAILED");

            assertThat(node.getStatus()).isEqualTo(NodeStatus.BLOCKED);
            assertThat(node.getDuration()).isEmpty();
            assertThat(node.getStatus().isTerminal()).isTrue();
            assertThat(node.getStatus().hasExecuted()).isFalse();
        }

        @Test
        @DisplayName("rejects completing a node that never ran")
        void shouldRejectCompleteFromPending() {
            assertThatThrownBy(() -> node.complete(StubChecks.outcome(1, 0, 0), T0, T0))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("cannot move from PENDING to COMPLETED");
        }

        @Test
        @DisplayName("rejects leaving a terminal state")
        void shouldRejectLeavingTerminalState() {
            node.skip("excluded by quick scope");

            assertThatThrownBy(() -> node.markRunning(T0))
                    .isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> node.block("late"))
                    .isInstanceOf(IllegalStateException.class);
        }
    }
}
