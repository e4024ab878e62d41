package edu.washington.escience.carryover.window;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import javax.annotation.Nonnull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import edu.washington.escience.carryover.Row;
import edu.washington.escience.carryover.Schema;
import net.jcip.annotations.NotThreadSafe;

/**
 * Evaluates the carry-forward window function over the rows of exactly one partition. Rows must be given in final
 * order; each row's output depends on every row before it, so an evaluator is driven by a single thread. Create one
 * with {@link CarryForwardFunction#setup}; a new evaluator is needed for every partition.
 *
 * <p>
 * The two subclasses, {@link BufferedCarryForward} and {@link StreamingCarryForward}, produce identical outputs for the
 * same rows. They differ only in when outputs are handed back and in how much memory they hold.
 */
@NotThreadSafe
public abstract class CarryForwardEvaluator {
  /** The logger for this class. */
  private static final Logger LOGGER = LoggerFactory.getLogger(CarryForwardEvaluator.class);

  /** The schema of the rows of the partition. */
  private final Schema inputSchema;
  /** Index of the flag column. */
  private final int flagColumn;
  /** Index of the signal column. */
  private final int signalColumn;
  /** The state of the partition. */
  private final AggregationState state;
  /** Set by {@link #finish()}. */
  private boolean finished = false;
  /** Set when the partition was abandoned. */
  private boolean aborted = false;

  /**
   * Only the two strategies of this package may extend this class.
   *
   * @param inputSchema the schema of the rows of the partition.
   * @param flagColumn index of the flag column.
   * @param signalColumn index of the signal column.
   * @param state fresh state for the partition.
   */
  CarryForwardEvaluator(
      @Nonnull final Schema inputSchema,
      final int flagColumn,
      final int signalColumn,
      @Nonnull final AggregationState state) {
    this.inputSchema = Objects.requireNonNull(inputSchema, "inputSchema");
    Preconditions.checkElementIndex(flagColumn, inputSchema.numColumns(), "flagColumn");
    Preconditions.checkElementIndex(signalColumn, inputSchema.numColumns(), "signalColumn");
    this.flagColumn = flagColumn;
    this.signalColumn = signalColumn;
    this.state = Objects.requireNonNull(state, "state");
    Preconditions.checkArgument(state.getRowsProcessed() == 0, "state must be fresh");
  }

  /**
   * Feed the next row of the partition.
   *
   * @param row the next row, in final order.
   * @return the output of the row when streaming, empty when buffering.
   * @throws InvalidFlagException if the row's flag is invalid. The evaluator is aborted and its outputs discarded.
   */
  public final Optional<CarriedValue> process(@Nonnull final Row row) throws InvalidFlagException {
    Objects.requireNonNull(row, "row");
    checkUsable();
    Preconditions.checkArgument(
        row.getSchema().compatible(inputSchema),
        "row schema %s does not match partition schema %s",
        row.getSchema(),
        inputSchema);
    final SignalFlag flag;
    try {
      flag = SignalFlag.decode(state.getRowsProcessed(), row.getObject(flagColumn));
    } catch (InvalidFlagException e) {
      abort();
      throw e;
    }
    return emit(state.advance(flag, row.getObject(signalColumn)));
  }

  /**
   * Close the partition and release the state.
   *
   * @return every buffered output in arrival order; empty when streaming.
   * @throws InternalInvariantException if the evaluator lost track of its outputs.
   */
  public final List<CarriedValue> finish() throws InternalInvariantException {
    checkUsable();
    finished = true;
    try {
      List<CarriedValue> outputs = drain(state);
      if (LOGGER.isDebugEnabled()) {
        LOGGER.debug(
            "{} partition finished, #rows: {}, #outputs returned: {}",
            getStrategy(),
            state.getRowsProcessed(),
            outputs.size());
      }
      return outputs;
    } finally {
      state.release();
    }
  }

  /**
   * Abandon the partition, discarding all state. Used when evaluation fails for a reason outside this evaluator, such
   * as the row supply breaking. Calling it again has no effect.
   */
  public final void abort() {
    if (aborted || finished) {
      return;
    }
    aborted = true;
    state.release();
  }

  /**
   * Hand back the output of the row just processed.
   *
   * @param output the output of the row.
   * @return the output when streaming, empty when buffering.
   */
  protected abstract Optional<CarriedValue> emit(CarriedValue output);

  /**
   * Collect what is left at the end of the partition. The state is released by the caller afterwards.
   *
   * @param state the state of the partition.
   * @return the outputs still held.
   * @throws InternalInvariantException if the held outputs do not match the rows processed.
   */
  protected abstract List<CarriedValue> drain(AggregationState state)
      throws InternalInvariantException;

  /**
   * @return which strategy this evaluator runs.
   */
  public abstract ExecutionStrategy getStrategy();

  /**
   * Fail if this evaluator cannot accept calls anymore.
   */
  private void checkUsable() {
    Preconditions.checkState(!aborted, "evaluator was aborted; create a new one");
    Preconditions.checkState(!finished, "evaluator already finished; create a new one");
  }

  /**
   * @return the state of the partition.
   */
  final AggregationState getState() {
    return state;
  }

  /**
   * @return the schema of the rows of the partition.
   */
  public final Schema getInputSchema() {
    return inputSchema;
  }

  /**
   * @return the number of rows processed so far.
   */
  public final long getRowsProcessed() {
    return state.getRowsProcessed();
  }

  /**
   * @return true once {@link #finish()} has been called.
   */
  public final boolean isFinished() {
    return finished;
  }

  /**
   * @return true if the partition was abandoned.
   */
  public final boolean isAborted() {
    return aborted;
  }
}
