package com.consullo.cursorlist;

import com.consullo.cursorlist.cursor.Cursor;
import com.consullo.cursorlist.cursor.CursorState;
import com.consullo.cursorlist.result.OpResult;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Consumer;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resizable list with a built-in {@link Cursor} pointing at the current element.
 *
 * <p>
 * Cursor moves always respect the list bounds: a bounded move past either end reports
 * {@link CursorState.Kind#MAX_OUT} or {@link CursorState.Kind#MIN_OUT}, and a rotating cursor wraps.
 * </p>
 *
 * <p>
 * The backing list is exposed through {@link #container()} for direct edits. Direct edits do not update
 * the cursor; call {@link #updateCursor()} afterwards, or make the edit inside {@link #modify(Consumer)}.
 * Until then, reads may report {@link CursorState.Kind#OUT_OF_RANGE}.
 * </p>
 *
 * <p>
 * Not thread-safe. A single owner is expected to drive all calls.
 * </p>
 *
 * @param <T> element type
 * @since 1.0
 */
public final class CursorList<T> implements Iterable<T> {

  private static final Logger LOGGER = LoggerFactory.getLogger(CursorList.class);

  private List<T> elements;
  private final Cursor cursor;

  /**
   * Creates an empty list with a non-rotating cursor.
   */
  public CursorList() {
    this.elements = new ArrayList<>();
    this.cursor = new Cursor(0);
  }

  /**
   * Builder-style variant of {@link #setContainer(List)}.
   *
   * @param container elements to copy into the list
   * @return this list
   */
  public CursorList<T> withContainer(final List<T> container) {
    setContainer(container);
    return this;
  }

  /**
   * Builder-style variant of {@link #setRotatable(boolean)}.
   *
   * @param rotatable whether the cursor wraps around
   * @return this list
   */
  public CursorList<T> rotatable(final boolean rotatable) {
    setRotatable(rotatable);
    return this;
  }

  public void setRotatable(final boolean rotatable) {
    cursor.setRotation(rotatable);
  }

  public boolean isRotatable() {
    return cursor.isRotation();
  }

  /**
   * Replaces the whole backing list. The cursor index is kept if still in bounds, otherwise clamped.
   *
   * @param container elements to copy into the list
   */
  public void setContainer(final List<T> container) {
    Validate.notNull(container, "container must not be null");
    this.elements = new ArrayList<>(container);
    LOGGER.debug("setContainer: replaced container with {} elements", elements.size());
    updateCursor();
  }

  /**
   * Applies {@code mutator} to the backing list and resynchronizes the cursor.
   *
   * <p>The cursor is resynchronized exactly once, after the mutator returns or throws.
   *
   * @param mutator in-place edit of the backing list
   */
  public void modify(final Consumer<List<T>> mutator) {
    Validate.notNull(mutator, "mutator must not be null");
    final int before = elements.size();
    try {
      mutator.accept(elements);
    } finally {
      LOGGER.debug("modify: size {} -> {}", before, elements.size());
      updateCursor();
    }
  }

  /**
   * Recomputes the cursor capacity from the current list size.
   *
   * <p>Needed after editing {@link #container()} directly. Calling it repeatedly has no further effect.
   */
  public void updateCursor() {
    cursor.setCapacity(elements.size());
    LOGGER.debug("updateCursor: capacity={}, index={}", cursor.getCapacity(), cursor.getValue());
  }

  /**
   * Returns the element under the cursor.
   *
   * @return current state
   */
  public CursorState<T> getCurrent() {
    if (elements.isEmpty()) {
      return CursorState.emptyContainer();
    }
    return readCurrent();
  }

  public CursorState<T> moveNextAndGet() {
    return moveNextNthAndGet(1);
  }

  public CursorState<T> movePrevAndGet() {
    return movePrevNthAndGet(1);
  }

  /**
   * Moves the cursor forward {@code amount} times and returns the element reached.
   *
   * <p>Stops at the first failed step and reports {@link CursorState.Kind#MAX_OUT}; the cursor stays where
   * the last successful step left it.
   *
   * @param amount number of steps
   * @return resulting state
   */
  public CursorState<T> moveNextNthAndGet(final int amount) {
    Validate.isTrue(amount >= 0, "amount must not be negative: %d", amount);
    if (elements.isEmpty()) {
      return CursorState.emptyContainer();
    }
    if (!step(true, amount)) {
      return CursorState.maxOut();
    }
    return readCurrent();
  }

  /**
   * Moves the cursor backward {@code amount} times and returns the element reached.
   *
   * <p>Stops at the first failed step and reports {@link CursorState.Kind#MIN_OUT}.
   *
   * @param amount number of steps
   * @return resulting state
   */
  public CursorState<T> movePrevNthAndGet(final int amount) {
    Validate.isTrue(amount >= 0, "amount must not be negative: %d", amount);
    if (elements.isEmpty()) {
      return CursorState.emptyContainer();
    }
    if (!step(false, amount)) {
      return CursorState.minOut();
    }
    return readCurrent();
  }

  /**
   * Tries to move forward and returns the element under the cursor whether or not the move succeeded.
   *
   * @return current element, empty if the list is empty
   */
  public Optional<T> moveNextAndGetAlways() {
    return moveNextNthAndGetAlways(1);
  }

  public Optional<T> movePrevAndGetAlways() {
    return movePrevNthAndGetAlways(1);
  }

  /**
   * Tries to move forward {@code amount} times. Returns as soon as a step fails, with the element the
   * cursor is on at that point.
   *
   * @param amount maximum number of steps
   * @return current element, empty if the list is empty
   */
  public Optional<T> moveNextNthAndGetAlways(final int amount) {
    Validate.isTrue(amount >= 0, "amount must not be negative: %d", amount);
    if (elements.isEmpty()) {
      return Optional.empty();
    }
    step(true, amount);
    return readCurrent().value();
  }

  /**
   * Tries to move backward {@code amount} times. Returns as soon as a step fails, with the element the
   * cursor is on at that point.
   *
   * @param amount maximum number of steps
   * @return current element, empty if the list is empty
   */
  public Optional<T> movePrevNthAndGetAlways(final int amount) {
    Validate.isTrue(amount >= 0, "amount must not be negative: %d", amount);
    if (elements.isEmpty()) {
      return Optional.empty();
    }
    step(false, amount);
    return readCurrent().value();
  }

  public OpResult moveNext() {
    if (elements.isEmpty()) {
      return OpResult.error(OpResult.EMPTY_CONTAINER);
    }
    return cursor.increase();
  }

  public OpResult movePrev() {
    if (elements.isEmpty()) {
      return OpResult.error(OpResult.EMPTY_CONTAINER);
    }
    return cursor.decrease();
  }

  /**
   * Returns the cursor index, or empty when the list is empty.
   *
   * @return cursor index
   */
  public OptionalInt getCursor() {
    if (elements.isEmpty()) {
      return OptionalInt.empty();
    }
    return OptionalInt.of(cursor.getValue());
  }

  /**
   * Moves the cursor to {@code index}.
   *
   * @param index target index, must be below the cursor capacity
   * @return ok, or an error leaving the cursor unchanged
   */
  public OpResult setCursor(final int index) {
    return cursor.setValue(index);
  }

  /**
   * Returns the live backing list. Edits made through it leave the cursor stale until
   * {@link #updateCursor()} is called.
   *
   * @return backing list
   */
  public List<T> container() {
    return elements;
  }

  public int size() {
    return elements.size();
  }

  public boolean isEmpty() {
    return elements.isEmpty();
  }

  @Override
  public Iterator<T> iterator() {
    return elements.iterator();
  }

  @Override
  public String toString() {
    return "CursorList[elements=" + elements + ", cursor=" + cursor.getValue()
            + ", rotatable=" + cursor.isRotation() + "]";
  }

  private boolean step(boolean forward, int amount) {
    for (int i = 0; i < amount; i++) {
      OpResult r = forward ? cursor.increase() : cursor.decrease();
      if (r.isError()) {
        return false;
      }
    }
    return true;
  }

  private CursorState<T> readCurrent() {
    int index = cursor.getValue();
    if (index >= elements.size()) {
      return CursorState.outOfRange();
    }
    return CursorState.valid(elements.get(index));
  }
}
