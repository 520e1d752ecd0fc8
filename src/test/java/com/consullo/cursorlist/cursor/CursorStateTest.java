package com.consullo.cursorlist.cursor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for cursor state values.
 *
 * @since 1.0
 */
public class CursorStateTest {

  @Test
  @DisplayName("Should expose the element only for valid states")
  void value_OnlyValidCarriesElement() {
    assertThat(CursorState.valid("a").value()).contains("a");
    assertThat(CursorState.<String>maxOut().value()).isEmpty();
    assertThat(CursorState.<String>minOut().value()).isEmpty();
    assertThat(CursorState.<String>outOfRange().value()).isEmpty();
    assertThat(CursorState.<String>emptyContainer().value()).isEmpty();
  }

  @Test
  @DisplayName("Should compare by kind and element")
  void equals_KindAndElement() {
    assertThat(CursorState.valid(3)).isEqualTo(CursorState.valid(3));
    assertThat(CursorState.valid(3)).isNotEqualTo(CursorState.valid(4));
    assertThat(CursorState.<Integer>maxOut()).isEqualTo(CursorState.maxOut());
    assertThat(CursorState.<Integer>maxOut()).isNotEqualTo(CursorState.minOut());
    assertThat(CursorState.valid(3).hashCode()).isEqualTo(CursorState.valid(3).hashCode());
  }

  @Test
  @DisplayName("Should treat a null element as valid but without value")
  void value_NullElement_Empty() {
    final CursorState<String> state = CursorState.valid(null);

    assertThat(state.isValid()).isTrue();
    assertThat(state.value()).isEmpty();
  }

  @Test
  @DisplayName("Should render kind and element")
  void toString_Readable() {
    assertThat(CursorState.valid("x").toString()).isEqualTo("VALID(x)");
    assertThat(CursorState.outOfRange().toString()).isEqualTo("OUT_OF_RANGE");
  }
}
