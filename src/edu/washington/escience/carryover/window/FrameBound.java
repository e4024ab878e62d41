package edu.washington.escience.carryover.window;

/**
 * A window frame boundary. {@link #PRECEDING} and {@link #FOLLOWING} take an offset from the current row.
 */
public enum FrameBound {
  UNBOUNDED_PRECEDING,
  PRECEDING,
  CURRENT_ROW,
  FOLLOWING,
  UNBOUNDED_FOLLOWING;

  /**
   * @return true if this boundary takes an offset.
   */
  public boolean hasOffset() {
    return this == PRECEDING || this == FOLLOWING;
  }
}
