package edu.washington.escience.carryover.window;

import javax.annotation.Nullable;

import edu.washington.escience.carryover.EvaluatorException;

/**
 * A configuration error: the requested mode and frame cannot be evaluated by a carry-forward evaluator. Raised at
 * setup, before any state is allocated. Not retryable.
 */
public class UnsupportedModeException extends EvaluatorException {
  /** Required for serialization. */
  private static final long serialVersionUID = 1L;

  /** The rejected mode. */
  private final EvaluatorMode mode;
  /** The rejected frame, null if none was given. */
  private final WindowFrame frame;

  /**
   * @param mode the rejected mode.
   * @param frame the rejected frame.
   * @param reason why the combination is rejected.
   */
  public UnsupportedModeException(
      @Nullable final EvaluatorMode mode, @Nullable final WindowFrame frame, final String reason) {
    super("unsupported mode " + mode + " with frame " + frame + ": " + reason);
    this.mode = mode;
    this.frame = frame;
  }

  /**
   * @return the rejected mode.
   */
  @Nullable
  public EvaluatorMode getMode() {
    return mode;
  }

  /**
   * @return the rejected frame.
   */
  @Nullable
  public WindowFrame getFrame() {
    return frame;
  }
}
