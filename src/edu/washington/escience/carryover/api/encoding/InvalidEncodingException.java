package edu.washington.escience.carryover.api.encoding;

/**
 * A JSON encoding that cannot be turned into a plan: missing fields, unknown columns, or malformed JSON.
 */
public class InvalidEncodingException extends IllegalArgumentException {
  /** Required for serialization. */
  private static final long serialVersionUID = 1L;

  /**
   * @param s a String describing the problem.
   */
  public InvalidEncodingException(final String s) {
    super(s);
  }

  /**
   * @param s a String describing the problem.
   * @param cause the cause.
   */
  public InvalidEncodingException(final String s, final Throwable cause) {
    super(s, cause);
  }
}
