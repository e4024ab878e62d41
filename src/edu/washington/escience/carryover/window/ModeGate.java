package edu.washington.escience.carryover.window;

import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates the execution context of a carry-forward evaluator before any row flows. The carried value depends on the
 * full order of a partition, so there is no partial or merge form of it: those modes are refused here rather than being
 * mishandled later.
 */
public final class ModeGate {
  /** The logger for this class. */
  private static final Logger LOGGER = LoggerFactory.getLogger(ModeGate.class);

  /** Utility classes cannot be constructed. */
  private ModeGate() {}

  /**
   * Map a requested mode and frame onto an execution strategy.
   *
   * <ul>
   * <li>{@link EvaluatorMode#COMPLETE} with no frame, or with the unbounded-preceding to current-row frame, runs
   * {@link ExecutionStrategy#BUFFERED}.</li>
   * <li>{@link EvaluatorMode#STREAMING_INCREMENTAL} with the unbounded-preceding to current-row frame runs
   * {@link ExecutionStrategy#STREAMING}.</li>
   * </ul>
   *
   * @param mode the requested mode.
   * @param frame the requested frame, null if the host did not specify one.
   * @return the strategy to run.
   * @throws UnsupportedModeException for every other combination.
   */
  public static ExecutionStrategy check(
      @Nullable final EvaluatorMode mode, @Nullable final WindowFrame frame)
      throws UnsupportedModeException {
    if (mode == null) {
      throw reject(mode, frame, "no mode given");
    }
    switch (mode) {
      case COMPLETE:
        if (frame != null && !frame.isUnboundedPrecedingToCurrentRow()) {
          throw reject(
              mode,
              frame,
              "the carried value is only defined over " + WindowFrame.UNBOUNDED_PRECEDING_TO_CURRENT_ROW);
        }
        return ExecutionStrategy.BUFFERED;
      case STREAMING_INCREMENTAL:
        if (frame == null) {
          throw reject(mode, frame, "streaming needs an explicit frame");
        }
        if (!frame.isUnboundedPrecedingToCurrentRow()) {
          throw reject(mode, frame, "streaming needs " + WindowFrame.UNBOUNDED_PRECEDING_TO_CURRENT_ROW);
        }
        return ExecutionStrategy.STREAMING;
      case PARTIAL_INIT:
      case PARTIAL_MERGE:
      case FINAL:
        throw reject(mode, frame, "carry-forward has no partial or merge form");
      default:
        throw reject(mode, frame, "unknown mode");
    }
  }

  /**
   * @param mode the rejected mode.
   * @param frame the rejected frame.
   * @param reason why.
   * @return the exception to throw.
   */
  private static UnsupportedModeException reject(
      final EvaluatorMode mode, final WindowFrame frame, final String reason) {
    UnsupportedModeException e = new UnsupportedModeException(mode, frame, reason);
    LOGGER.warn("Rejecting evaluator setup: {}", e.getMessage());
    return e;
  }
}
