package com.ryuqq.statecheck.core.model;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

/**
 * State value object test.
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
class StateTest {

    enum Phase { IDLE, READY }

    @Test
    void of_SameContentDifferentInsertionOrder_AreEqual() {
        // Given
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("a", 50);
        first.put("b", 50);
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("b", 50);
        second.put("a", 50);

        // When
        State s1 = State.of(first);
        State s2 = State.of(second);

        // Then
        assertEquals(s1, s2);
        assertEquals(s1.hashCode(), s2.hashCode());
        assertEquals(s1.canonicalForm(), s2.canonicalForm());
    }

    @Test
    void of_IntegerAndLong_NormalizedToLong() {
        // When
        State fromInt = State.of("x", 7);
        State fromLong = State.of("x", 7L);

        // Then
        assertEquals(fromInt, fromLong);
        assertThat(fromInt.get("x")).isInstanceOf(Long.class);
        assertEquals(7L, fromInt.getLong("x"));
    }

    @Test
    void of_SetsWithDifferentIterationOrder_AreEqual() {
        // Given
        Set<Object> ascending = new LinkedHashSet<>(List.of(1, 2, 3));
        Set<Object> descending = new LinkedHashSet<>(List.of(3, 2, 1));

        // When & Then
        assertEquals(State.of("s", ascending), State.of("s", descending));
    }

    @Test
    void of_MapsWithDifferentIterationOrder_AreEqual() {
        // Given
        Map<String, Object> hashOrder = new LinkedHashMap<>();
        hashOrder.put("z", 1);
        hashOrder.put("a", 2);
        Map<String, Object> sorted = new TreeMap<>(hashOrder);

        // When & Then
        assertEquals(State.of("m", hashOrder), State.of("m", sorted));
    }

    @Test
    void of_ListOrderMatters() {
        assertNotEquals(State.of("l", List.of(1, 2)), State.of("l", List.of(2, 1)));
    }

    @Test
    void canonicalForm_StringAndNumberWithSameText_AreDistinct() {
        // When
        State text = State.of("v", "1");
        State number = State.of("v", 1);

        // Then
        assertNotEquals(text, number);
        assertNotEquals(text.canonicalForm(), number.canonicalForm());
    }

    @Test
    void canonicalForm_SeparatorInsideString_DoesNotCollide() {
        // Given: without length prefixes both would render as a=x;b=y
        State joined = State.of("a", "x;S1:b=y");
        State split = State.of("a", "x", "b", "y");

        // When & Then
        assertNotEquals(joined, split);
    }

    @Test
    void with_ReturnsNewStateAndLeavesOriginalUnchanged() {
        // Given
        State initial = State.of("a", 50, "b", 50);

        // When
        State next = initial.with("a", 20L);

        // Then
        assertEquals(50L, initial.getLong("a"));
        assertEquals(20L, next.getLong("a"));
        assertEquals(50L, next.getLong("b"));
    }

    @Test
    void getEnum_ReturnsConstant() {
        // Given
        State state = State.of("phase", Phase.READY, "flag", true);

        // When & Then
        assertEquals(Phase.READY, state.getEnum("phase", Phase.class));
        assertTrue(state.getBoolean("flag"));
        assertNotEquals(state, State.of("phase", Phase.IDLE, "flag", true));
    }

    @Test
    void get_UnknownVariable_ThrowsException() {
        State state = State.of("a", 1);

        assertThatThrownBy(() -> state.get("missing"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("missing");
    }

    @Test
    void getLong_WrongType_ThrowsException() {
        State state = State.of("a", "text");

        assertThatThrownBy(() -> state.getLong("a"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("not a Long");
    }

    @Test
    void of_UnsupportedValueType_ThrowsException() {
        assertThatThrownBy(() -> State.of("d", 1.5d))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unsupported state value type");
    }

    @Test
    void of_DuplicateName_ThrowsException() {
        assertThatThrownBy(() -> State.of("a", 1, "a", 2))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Duplicate variable name");
    }

    @Test
    void values_IsUnmodifiable() {
        State state = State.of("l", List.of(1));

        assertThatThrownBy(() -> state.values().put("b", 1L))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void of_NullValue_IsSupported() {
        State state = State.of("owner", null);

        assertTrue(state.has("owner"));
        assertNull(state.get("owner"));
        assertNotEquals(state, State.of("owner", "p1"));
    }
}
