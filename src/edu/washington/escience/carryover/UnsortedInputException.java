package edu.washington.escience.carryover;

/**
 * Thrown when rows of one partition arrive with a decreasing order key. The upstream sort is broken or unstable; no
 * output may be trusted for that partition.
 */
public class UnsortedInputException extends EvaluatorException {
  /** Required for serialization. */
  private static final long serialVersionUID = 1L;

  /** Index of the offending row within its partition. */
  private final long rowIndex;

  /**
   * @param rowIndex index of the offending row within its partition.
   * @param previous the order key of the previous row.
   * @param current the order key of the offending row.
   */
  public UnsortedInputException(final long rowIndex, final Object previous, final Object current) {
    super(
        "row "
            + rowIndex
            + " has order key "
            + current
            + " which sorts before the previous order key "
            + previous);
    this.rowIndex = rowIndex;
  }

  /**
   * @return index of the offending row within its partition.
   */
  public long getRowIndex() {
    return rowIndex;
  }
}
