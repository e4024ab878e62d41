package edu.washington.escience.carryover.window;

import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableList;

import edu.washington.escience.carryover.Schema;

/**
 * Keeps the output of every row of the partition and hands them all back at {@link #finish()}. Memory grows with the
 * partition, so this strategy is only for hosts that must materialize the whole partition anyway.
 *
 * @see StreamingCarryForward
 */
public final class BufferedCarryForward extends CarryForwardEvaluator {

  /**
   * @param inputSchema the schema of the rows of the partition.
   * @param flagColumn index of the flag column.
   * @param signalColumn index of the signal column.
   * @param nullSignalPolicy what a carrier with a null signal does.
   */
  BufferedCarryForward(
      final Schema inputSchema,
      final int flagColumn,
      final int signalColumn,
      final NullSignalPolicy nullSignalPolicy) {
    super(inputSchema, flagColumn, signalColumn, AggregationState.buffered(nullSignalPolicy));
  }

  @Override
  protected Optional<CarriedValue> emit(final CarriedValue output) {
    getState().record(output);
    return Optional.empty();
  }

  @Override
  protected List<CarriedValue> drain(final AggregationState state)
      throws InternalInvariantException {
    List<CarriedValue> outputs = state.getOutputs();
    if (outputs.size() != state.getRowsProcessed()) {
      throw new InternalInvariantException(
          "buffered "
              + outputs.size()
              + " outputs for "
              + state.getRowsProcessed()
              + " rows; every row must have exactly one output");
    }
    return ImmutableList.copyOf(outputs);
  }

  @Override
  public ExecutionStrategy getStrategy() {
    return ExecutionStrategy.BUFFERED;
  }
}
