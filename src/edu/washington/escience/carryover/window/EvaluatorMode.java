package edu.washington.escience.carryover.window;

/**
 * The lifecycle modes a host may request when setting up a window function evaluator. Only {@link #COMPLETE} and
 * {@link #STREAMING_INCREMENTAL} can be honored by a carry-forward evaluator; see {@link ModeGate}.
 */
public enum EvaluatorMode {
  /** Whole partition, raw rows in, final values out. */
  COMPLETE,
  /** Raw rows in, partial state out. */
  PARTIAL_INIT,
  /** Partial states in, partial state out. */
  PARTIAL_MERGE,
  /** Partial states in, final values out. */
  FINAL,
  /** One final value out per raw row in, as rows arrive. */
  STREAMING_INCREMENTAL;
}
