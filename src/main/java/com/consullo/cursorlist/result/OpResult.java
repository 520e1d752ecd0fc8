package com.consullo.cursorlist.result;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of an operation that can either succeed or fail without throwing.
 *
 * <p>Every success/failure-reporting operation of the library returns this type, so callers branch on
 * {@link #isOk()} the same way everywhere. A failed result carries a short human-readable reason.
 *
 * @since 1.0
 */
public final class OpResult {

  public static final String CURSOR_OUT_OF_RANGE = "Cursor out of range";
  public static final String EMPTY_CONTAINER = "Empty container";

  private static final OpResult OK = new OpResult(null);

  private final String message;

  private OpResult(String message) {
    this.message = message;
  }

  /**
   * Returns the successful result.
   *
   * @return ok result
   */
  public static OpResult ok() {
    return OK;
  }

  /**
   * Creates a failed result with the given reason.
   *
   * @param message failure description
   * @return error result
   */
  public static OpResult error(String message) {
    if (message == null) {
      throw new IllegalArgumentException("message must not be null.");
    }
    return new OpResult(message);
  }

  public boolean isOk() {
    return message == null;
  }

  public boolean isError() {
    return message != null;
  }

  /**
   * Returns the failure description, empty for a successful result.
   *
   * @return failure description
   */
  public Optional<String> message() {
    return Optional.ofNullable(message);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof OpResult)) {
      return false;
    }
    return Objects.equals(message, ((OpResult) o).message);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(message);
  }

  @Override
  public String toString() {
    return isOk() ? "Ok" : "Error(" + message + ")";
  }
}
