package com.consullo.cursorlist.cursor;

import com.consullo.cursorlist.result.OpResult;

/**
 * Bounded position marker over a sequence of {@code capacity} slots.
 *
 * <p>The cursor never looks at the sequence itself; it only knows a capacity number. Whenever
 * {@code capacity > 0} the index satisfies {@code 0 <= index < capacity}. When the capacity is zero the
 * index is parked at 0 and carries no meaning.
 *
 * <p>With rotation enabled, moving past either end wraps to the opposite end instead of failing.
 *
 * @since 1.0
 */
public final class Cursor {

  private int capacity;
  private boolean rotation;
  private int index;

  /**
   * Creates a non-rotating cursor at index 0.
   *
   * @param capacity initial capacity
   */
  public Cursor(int capacity) {
    if (capacity < 0) {
      throw new IllegalArgumentException("capacity must not be negative.");
    }
    this.capacity = capacity;
    this.rotation = false;
    this.index = 0;
  }

  public int getCapacity() {
    return capacity;
  }

  /**
   * Sets the capacity and pulls the index back inside the new bounds.
   *
   * @param capacity new capacity
   */
  public void setCapacity(int capacity) {
    if (capacity < 0) {
      throw new IllegalArgumentException("capacity must not be negative.");
    }
    this.capacity = capacity;
    if (capacity == 0) {
      index = 0;
    } else if (index >= capacity) {
      index = capacity - 1;
    }
  }

  public boolean isRotation() {
    return rotation;
  }

  public void setRotation(boolean rotation) {
    this.rotation = rotation;
  }

  /**
   * Returns the current index verbatim. Callers must check the capacity separately.
   *
   * @return current index
   */
  public int getValue() {
    return index;
  }

  /**
   * Moves the cursor to {@code value} if it is a valid slot.
   *
   * @param value requested index
   * @return ok, or an error leaving the index unchanged
   */
  public OpResult setValue(int value) {
    if (value < 0 || value >= capacity) {
      return OpResult.error(OpResult.CURSOR_OUT_OF_RANGE);
    }
    index = value;
    return OpResult.ok();
  }

  /**
   * Advances one slot, wrapping to 0 from the last slot when rotating.
   *
   * @return ok, or an error leaving the index unchanged
   */
  public OpResult increase() {
    if (capacity == 0) {
      return OpResult.error(OpResult.EMPTY_CONTAINER);
    }
    if (index == capacity - 1) {
      if (!rotation) {
        return OpResult.error(OpResult.CURSOR_OUT_OF_RANGE);
      }
      index = 0;
    } else {
      index++;
    }
    return OpResult.ok();
  }

  /**
   * Retreats one slot, wrapping to the last slot from 0 when rotating.
   *
   * @return ok, or an error leaving the index unchanged
   */
  public OpResult decrease() {
    if (capacity == 0) {
      return OpResult.error(OpResult.EMPTY_CONTAINER);
    }
    if (index == 0) {
      if (!rotation) {
        return OpResult.error(OpResult.CURSOR_OUT_OF_RANGE);
      }
      index = capacity - 1;
    } else {
      index--;
    }
    return OpResult.ok();
  }

  @Override
  public String toString() {
    return "Cursor[index=" + index + ", capacity=" + capacity + ", rotation=" + rotation + "]";
  }
}
