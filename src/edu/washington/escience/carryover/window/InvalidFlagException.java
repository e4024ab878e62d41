package edu.washington.escience.carryover.window;

import javax.annotation.Nullable;

import edu.washington.escience.carryover.EvaluatorException;

/**
 * A data error: the flag column of a row holds neither the subject nor the carrier value. Fatal for the partition being
 * evaluated.
 */
public class InvalidFlagException extends EvaluatorException {
  /** Required for serialization. */
  private static final long serialVersionUID = 1L;

  /** Index of the offending row within its partition. */
  private final long rowIndex;
  /** The offending flag value. */
  private final Object flag;

  /**
   * @param rowIndex index of the offending row within its partition.
   * @param flag the offending flag value, possibly null.
   */
  public InvalidFlagException(final long rowIndex, @Nullable final Object flag) {
    super(
        "row "
            + rowIndex
            + " has flag "
            + flag
            + ", expected "
            + SignalFlag.SUBJECT.describe()
            + " or "
            + SignalFlag.CARRIER.describe());
    this.rowIndex = rowIndex;
    this.flag = flag;
  }

  /**
   * @return index of the offending row within its partition.
   */
  public long getRowIndex() {
    return rowIndex;
  }

  /**
   * @return the offending flag value.
   */
  @Nullable
  public Object getFlag() {
    return flag;
  }
}
