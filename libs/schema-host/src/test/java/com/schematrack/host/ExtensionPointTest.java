package com.schematrack.host;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.function.UnaryOperator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ExtensionPoint}: decorator ordering, idempotent install, exclusive claims and
 * freezing.
 */
@DisplayName("ExtensionPoint")
class ExtensionPointTest {

    private ExtensionPoint<UnaryOperator<String>> point;

    @BeforeEach
    void setUp() {
        point = new ExtensionPoint<>("greeting", s -> s);
    }

    private static UnaryOperator<UnaryOperator<String>> appending(String suffix) {
        return next -> s -> next.apply(s) + suffix;
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("should reject blank name")
        void shouldRejectBlankName() {
            assertThatThrownBy(() -> new ExtensionPoint<>(" ", "base"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("name");
        }

        @Test
        @DisplayName("should reject null base strategy")
        void shouldRejectNullBase() {
            assertThatThrownBy(() -> new ExtensionPoint<String>("p", null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("base");
        }

        @Test
        @DisplayName("current() is the base strategy before any install")
        void currentIsBase() {
            assertThat(point.current().apply("x")).isEqualTo("x");
            assertThat(point.owners()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Install")
    class Install {

        @Test
        @DisplayName("decorators wrap in install order")
        void decoratorsWrapInOrder() {
            point.install("a", appending("-a"), false);
            point.install("b", appending("-b"), false);

            assertThat(point.current().apply("x")).isEqualTo("x-a-b");
            assertThat(point.owners()).containsExactly("a", "b");
        }

        @Test
        @DisplayName("installing twice under the same owner does not wrap twice")
        void idempotentPerOwner() {
            assertThat(point.install("a", appending("-a"), false)).isTrue();
            assertThat(point.install("a", appending("-a"), false)).isFalse();

            assertThat(point.current().apply("x")).isEqualTo("x-a");
        }

        @Test
        @DisplayName("exclusive claim blocks other owners")
        void exclusiveBlocksOthers() {
            point.install("a", appending("-a"), true);

            assertThatThrownBy(() -> point.install("b", appending("-b"), false))
                    .isInstanceOf(ExtensionPointUnavailableException.class)
                    .hasMessageContaining("exclusively claimed by 'a'");
        }

        @Test
        @DisplayName("exclusive claim fails when another owner is already installed")
        void exclusiveFailsWhenUsed() {
            point.install("a", appending("-a"), false);

            assertThatThrownBy(() -> point.install("b", appending("-b"), true))
                    .isInstanceOf(ExtensionPointUnavailableException.class)
                    .satisfies(e -> {
                        var ex = (ExtensionPointUnavailableException) e;
                        assertThat(ex.extensionPoint()).isEqualTo("greeting");
                        assertThat(ex.owner()).isEqualTo("b");
                    });
        }

        @Test
        @DisplayName("frozen point rejects new owners but keeps existing ones")
        void frozenRejectsNewOwners() {
            point.install("a", appending("-a"), false);
            point.freeze();

            assertThat(point.isFrozen()).isTrue();
            assertThat(point.install("a", appending("-a"), false)).isFalse();
            assertThatThrownBy(() -> point.install("b", appending("-b"), false))
                    .isInstanceOf(ExtensionPointUnavailableException.class)
                    .hasMessageContaining("frozen");
            assertThat(point.current().apply("x")).isEqualTo("x-a");
        }
    }
}
