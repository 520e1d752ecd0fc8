package com.consullo.cursorlist.cursor;

import java.util.Objects;
import java.util.Optional;

/**
 * State of a cursor after a read or a move.
 *
 * <p>Only {@link Kind#VALID} carries an element. Use {@link #value()} to collapse the state into an
 * {@link Optional}.
 *
 * @param <T> element type
 * @since 1.0
 */
public final class CursorState<T> {

  public enum Kind {
    MIN_OUT,
    EMPTY_CONTAINER,
    VALID,
    OUT_OF_RANGE,
    MAX_OUT
  }

  private final Kind kind;
  private final T element;

  private CursorState(Kind kind, T element) {
    this.kind = kind;
    this.element = element;
  }

  public static <T> CursorState<T> valid(T element) {
    return new CursorState<>(Kind.VALID, element);
  }

  public static <T> CursorState<T> emptyContainer() {
    return new CursorState<>(Kind.EMPTY_CONTAINER, null);
  }

  public static <T> CursorState<T> outOfRange() {
    return new CursorState<>(Kind.OUT_OF_RANGE, null);
  }

  public static <T> CursorState<T> maxOut() {
    return new CursorState<>(Kind.MAX_OUT, null);
  }

  public static <T> CursorState<T> minOut() {
    return new CursorState<>(Kind.MIN_OUT, null);
  }

  public Kind kind() {
    return kind;
  }

  public boolean isValid() {
    return kind == Kind.VALID;
  }

  /**
   * Returns the element for a valid state, empty otherwise (or when the element itself is null).
   *
   * @return element if valid
   */
  public Optional<T> value() {
    return kind == Kind.VALID ? Optional.ofNullable(element) : Optional.empty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CursorState)) {
      return false;
    }
    CursorState<?> other = (CursorState<?>) o;
    return kind == other.kind && Objects.equals(element, other.element);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, element);
  }

  @Override
  public String toString() {
    return kind == Kind.VALID ? "VALID(" + element + ")" : kind.name();
  }
}
