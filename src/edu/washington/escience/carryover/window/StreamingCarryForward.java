package edu.washington.escience.carryover.window;

import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableList;

import edu.washington.escience.carryover.Schema;

/**
 * Hands back the output of each row as soon as the row is processed. Only the carried signal is held, so memory does
 * not depend on the size of the partition. {@link #finish()} returns nothing but must still be called to close the
 * partition.
 *
 * @see BufferedCarryForward
 */
public final class StreamingCarryForward extends CarryForwardEvaluator {

  /**
   * @param inputSchema the schema of the rows of the partition.
   * @param flagColumn index of the flag column.
   * @param signalColumn index of the signal column.
   * @param nullSignalPolicy what a carrier with a null signal does.
   */
  StreamingCarryForward(
      final Schema inputSchema,
      final int flagColumn,
      final int signalColumn,
      final NullSignalPolicy nullSignalPolicy) {
    super(inputSchema, flagColumn, signalColumn, AggregationState.streaming(nullSignalPolicy));
  }

  @Override
  protected Optional<CarriedValue> emit(final CarriedValue output) {
    return Optional.of(output);
  }

  @Override
  protected List<CarriedValue> drain(final AggregationState state)
      throws InternalInvariantException {
    if (state.numBufferedOutputs() != 0) {
      throw new InternalInvariantException(
          "streaming evaluator holds " + state.numBufferedOutputs() + " outputs at partition end");
    }
    return ImmutableList.of();
  }

  @Override
  public ExecutionStrategy getStrategy() {
    return ExecutionStrategy.STREAMING;
  }
}
