package io.flowcheck.core.check;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.flowcheck.core.check.builtin.BuiltinChecks;
import io.flowcheck.core.check.builtin.DataIntegrityCheck;
import io.flowcheck.core.exception.CheckNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DefaultCheckRegistry")
class DefaultCheckRegistryTest {

    private DefaultCheckRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new DefaultCheckRegistry();
    }

    @Test
    @DisplayName("creates a fresh check per lookup")
    void shouldCreateFreshCheck() throws Exception {
        BuiltinChecks.registerAll(registry);

        var first = registry.createCheck("integrity");
        var second = registry.createCheck("integrity");

        assertThat(first).isInstanceOf(DataIntegrityCheck.class).isNotSameAs(second);
        assertThat(registry.getCheckIds())
                .containsExactlyInAnyOrder(
                        "integrity", "crud", "state", "relationship", "audit", "performance");
    }

    @Test
    @DisplayName("replaces an existing registration")
    void shouldReplaceRegistration() throws Exception {
        Check replacement = StubChecks.passing(1);
        registry.register("integrity", () -> StubChecks.passing(2));
        registry.register("integrity", () -> replacement);

        assertThat(registry.createCheck("integrity")).isSameAs(replacement);
    }

    @Test
    @DisplayName("throws a checked exception for unknown ids")
    void shouldRejectUnknownId() {
        assertThat(registry.hasCheck("nope")).isFalse();
        assertThatThrownBy(() -> registry.createCheck("nope"))
                .isInstanceOf(CheckNotFoundException.class)
                .hasMessageContaining("nope");
    }
}
