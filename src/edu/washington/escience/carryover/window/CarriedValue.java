package edu.washington.escience.carryover.window;

import java.io.Serializable;
import java.util.Objects;

import javax.annotation.Nullable;

import net.jcip.annotations.Immutable;

/**
 * The output of a carry-forward evaluator for one row: the carried signal, or null.
 */
@Immutable
public final class CarriedValue implements Serializable {
  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;

  /** The null output: no signal carried yet, or a carrier row. */
  public static final CarriedValue NULL = new CarriedValue(null);

  /** The carried signal. */
  private final Object value;

  /**
   * @param value the carried signal.
   */
  private CarriedValue(@Nullable final Object value) {
    this.value = value;
  }

  /**
   * @param value a signal, possibly null.
   * @return the output carrying that signal.
   */
  public static CarriedValue of(@Nullable final Object value) {
    if (value == null) {
      return NULL;
    }
    return new CarriedValue(value);
  }

  /**
   * @return the carried signal, possibly null.
   */
  @Nullable
  public Object getValue() {
    return value;
  }

  /**
   * @return true if nothing is carried.
   */
  public boolean isNull() {
    return value == null;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CarriedValue)) {
      return false;
    }
    return Objects.equals(value, ((CarriedValue) o).value);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(value);
  }

  @Override
  public String toString() {
    return String.valueOf(value);
  }
}
