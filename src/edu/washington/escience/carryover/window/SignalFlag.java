package edu.washington.escience.carryover.window;

import javax.annotation.Nullable;

import edu.washington.escience.carryover.CarryoverConstants;
import edu.washington.escience.carryover.Type;

/**
 * The two-valued discriminator read from the flag column of every row.
 */
public enum SignalFlag {
  /** The row asks for the most recently carried signal. */
  SUBJECT(CarryoverConstants.FLAG_SUBJECT, false),
  /** The row supplies a new signal to carry forward. */
  CARRIER(CarryoverConstants.FLAG_CARRIER, true);

  /** Encoding in INT and LONG flag columns. */
  private final long integralValue;
  /** Encoding in BOOLEAN flag columns. */
  private final boolean booleanValue;

  /**
   * @param integralValue encoding in INT and LONG flag columns.
   * @param booleanValue encoding in BOOLEAN flag columns.
   */
  SignalFlag(final long integralValue, final boolean booleanValue) {
    this.integralValue = integralValue;
    this.booleanValue = booleanValue;
  }

  /**
   * @return a human readable form of the accepted encodings.
   */
  public String describe() {
    return integralValue + "/" + booleanValue;
  }

  /**
   * @param type the type of a flag column.
   * @return true if flags can be read from a column of that type.
   */
  public static boolean isFlagType(final Type type) {
    return type == Type.INT_TYPE || type == Type.LONG_TYPE || type == Type.BOOLEAN_TYPE;
  }

  /**
   * Decode a flag value. Never defaults: anything that is not exactly one of the two encodings is rejected.
   *
   * @param rowIndex index of the row within its partition, for error reporting.
   * @param value the raw flag value.
   * @return the decoded flag.
   * @throws InvalidFlagException if the value is null or not one of the two encodings.
   */
  public static SignalFlag decode(final long rowIndex, @Nullable final Object value)
      throws InvalidFlagException {
    if (value instanceof Boolean) {
      return (Boolean) value ? CARRIER : SUBJECT;
    }
    if (value instanceof Integer || value instanceof Long) {
      long v = ((Number) value).longValue();
      for (SignalFlag flag : values()) {
        if (flag.integralValue == v) {
          return flag;
        }
      }
    }
    throw new InvalidFlagException(rowIndex, value);
  }
}
