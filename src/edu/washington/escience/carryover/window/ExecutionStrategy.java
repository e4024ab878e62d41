package edu.washington.escience.carryover.window;

/**
 * The only two ways a carry-forward evaluator can run. Produced by {@link ModeGate} from a validated
 * {@link EvaluatorMode}.
 */
public enum ExecutionStrategy {
  /** Whole-partition materialization, outputs returned by {@link CarryForwardEvaluator#finish()}. */
  BUFFERED,
  /** One output per {@link CarryForwardEvaluator#process}, constant memory. */
  STREAMING;
}
