package io.narrata.core.variable;

import static io.narrata.core.TestFixtures.number;
import static io.narrata.core.TestFixtures.text;
import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class VariableStoreTest {

    @Test
    void shouldKeepDeclarationOrder() {
        VariableStore store =
                VariableStore.of(number("b", "x", 1), number("a", "y", 2), text("c", "z", "q"));

        assertThat(store.keys()).containsExactly("b.x", "a.y", "c.z");
        assertThat(store.size()).isEqualTo(3);
    }

    @Test
    void shouldReturnNewStoreOnWrite() {
        // Given
        VariableStore original = VariableStore.of(number("mc.jaime", "health", 50));
        Variable health = original.get("mc.jaime.health").orElseThrow();

        // When
        VariableStore updated =
                original.with(health.withValue(40L, VariableSource.INSTRUCTION));

        // Then
        assertThat(original.get("mc.jaime.health").orElseThrow().getValue()).isEqualTo(50L);
        assertThat(updated.get("mc.jaime.health").orElseThrow().getValue()).isEqualTo(40L);
        assertThat(updated).isNotEqualTo(original);
    }

    @Test
    void shouldKeepLongestSheetForDuplicateKeys() {
        // Given
        Variable shortSheet = number("a", "b.c", 1);
        Variable longSheet = number("a.b", "c", 2);

        // When
        VariableStore store = VariableStore.of(longSheet, shortSheet);

        // Then
        assertThat(store.size()).isEqualTo(1);
        assertThat(store.get("a.b.c").orElseThrow().getSheetShortcut()).isEqualTo("a.b");
    }

    @Test
    void shouldFindOnlyExactSheetAndName() {
        VariableStore store = VariableStore.of(number("a.b", "c", 2));

        assertThat(store.find("a.b", "c")).isPresent();
        assertThat(store.find("a", "b.c")).isEmpty();
    }

    @Test
    void shouldResetEveryVariableToInitialValue() {
        // Given
        VariableStore store = VariableStore.of(number("s", "x", 5));
        VariableStore changed =
                store.with(store.get("s.x").orElseThrow().withValue(9L, VariableSource.USER_OVERRIDE));

        // When
        Variable reset = changed.reset().get("s.x").orElseThrow();

        // Then
        assertThat(reset.getValue()).isEqualTo(5L);
        assertThat(reset.getSource()).isEqualTo(VariableSource.INITIAL);
        assertThat(reset.getPreviousValue()).isNull();
    }
}
