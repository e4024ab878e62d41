package edu.washington.escience.carryover;

/** Generic carry-forward evaluation exception class. */
public class EvaluatorException extends Exception {
  /** Required for serialization. */
  private static final long serialVersionUID = 1L;

  /**
   * Standard String constructor.
   *
   * @param s a String describing the exception.
   */
  public EvaluatorException(final String s) {
    super(s);
  }

  /**
   * Standard Throwable constructor.
   *
   * @param e a different Throwable to be wrapped in an EvaluatorException.
   */
  public EvaluatorException(final Throwable e) {
    super(e);
  }

  /**
   * @param s a String describing the exception.
   * @param e the cause.
   */
  public EvaluatorException(final String s, final Throwable e) {
    super(s, e);
  }
}
