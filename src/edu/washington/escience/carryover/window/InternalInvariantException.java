package edu.washington.escience.carryover.window;

import edu.washington.escience.carryover.EvaluatorException;

/**
 * A defect in the evaluator itself, never caused by input data. Reported separately from {@link InvalidFlagException}
 * so that broken evaluators can be told apart from bad data.
 */
public class InternalInvariantException extends EvaluatorException {
  /** Required for serialization. */
  private static final long serialVersionUID = 1L;

  /**
   * @param s a String describing the violated invariant.
   */
  public InternalInvariantException(final String s) {
    super(s);
  }
}
