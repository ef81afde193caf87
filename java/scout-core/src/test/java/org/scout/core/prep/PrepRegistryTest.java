package org.scout.core.prep;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PrepRegistryTest {

    private final PrepRegistry registry = new PrepRegistry();

    @Test
    void registersUnderParsedScope() {
        registry.register("Session", "db", () -> "connection");

        assertThat(registry.contains(PrepScope.SESSION, "db")).isTrue();
        assertThat(registry.lookup(PrepScope.SESSION, "db").scope()).isEqualTo(PrepScope.SESSION);
    }

    @Test
    void laterRegistrationWins() throws Exception {
        registry.register(PrepScope.METHOD, "value", () -> "first");
        registry.register(PrepScope.METHOD, "value", () -> "second");

        assertThat(registry.size()).isEqualTo(1);
        assertThat(registry.lookup(PrepScope.METHOD, "value").factory().create()).isEqualTo("second");
    }

    @Test
    void sameNameInDifferentScopesAreDistinct() {
        registry.register(PrepScope.SESSION, "shared", () -> 1);
        registry.register(PrepScope.CLASS, "shared", () -> 2);

        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    void unknownScopeIsRejected() {
        assertThatThrownBy(() -> registry.register("module", "x", () -> 1))
                .isInstanceOf(InvalidScopeException.class);
        assertThat(registry.size()).isZero();
    }

    @Test
    void lookupOfUnknownKeyFails() {
        assertThatThrownBy(() -> registry.lookup(PrepScope.CLASS, "missing"))
                .isInstanceOf(PrepNotFoundException.class)
                .hasMessageContaining("class:missing");
    }

    @Test
    void blankNamesAreRejected() {
        assertThatThrownBy(() -> registry.register(PrepScope.SESSION, " ", () -> 1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
