package edu.washington.escience.carryover.window;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import edu.washington.escience.carryover.CarryoverConstants;
import net.jcip.annotations.NotThreadSafe;

/**
 * The memory of one partition's carry-forward evaluation: the most recent carrier signal and, when buffering, one
 * output slot per row processed so far. Owned by exactly one evaluator; never reused across partitions.
 */
@NotThreadSafe
public final class AggregationState {

  /** What a carrier with a null signal does. */
  private final NullSignalPolicy nullSignalPolicy;
  /** The most recent carrier signal, {@link CarriedValue#NULL} before the first one. */
  private CarriedValue currentSignal = CarriedValue.NULL;
  /** Pending outputs in arrival order. Null when not buffering or once released. */
  @Nullable private List<CarriedValue> outputs;
  /** Whether this state buffers outputs. */
  private final boolean buffering;
  /** The number of rows that went through {@link #advance}. */
  private long rowsProcessed;
  /** Set once the state has been discarded. */
  private boolean released;

  /**
   * @param nullSignalPolicy what a carrier with a null signal does.
   * @param buffering whether outputs are kept until the end of the partition.
   */
  private AggregationState(final NullSignalPolicy nullSignalPolicy, final boolean buffering) {
    this.nullSignalPolicy = Objects.requireNonNull(nullSignalPolicy, "nullSignalPolicy");
    this.buffering = buffering;
    if (buffering) {
      outputs = new ArrayList<>(CarryoverConstants.BUFFERED_OUTPUT_INITIAL_CAPACITY);
    }
  }

  /**
   * @param nullSignalPolicy what a carrier with a null signal does.
   * @return a state that keeps every output until the end of the partition.
   */
  public static AggregationState buffered(final NullSignalPolicy nullSignalPolicy) {
    return new AggregationState(nullSignalPolicy, true);
  }

  /**
   * @param nullSignalPolicy what a carrier with a null signal does.
   * @return a state that keeps only the carried signal.
   */
  public static AggregationState streaming(final NullSignalPolicy nullSignalPolicy) {
    return new AggregationState(nullSignalPolicy, false);
  }

  /**
   * Apply one row to the state and compute its output. A subject row sees the signal as it stood before the row. A
   * carrier row first replaces the signal, then outputs null, so its own value only reaches later rows.
   *
   * @param flag the row's flag.
   * @param signal the row's signal; only read for carrier rows.
   * @return the output of the row.
   */
  public CarriedValue advance(final SignalFlag flag, @Nullable final Object signal) {
    Preconditions.checkState(!released, "aggregation state already released");
    ++rowsProcessed;
    switch (flag) {
      case SUBJECT:
        return currentSignal;
      case CARRIER:
        if (signal != null || nullSignalPolicy == NullSignalPolicy.OVERWRITE) {
          currentSignal = CarriedValue.of(signal);
        }
        return CarriedValue.NULL;
      default:
        throw new IllegalArgumentException("unknown flag " + flag);
    }
  }

  /**
   * Append one output to the buffer.
   *
   * @param output the output of the most recent row.
   */
  void record(final CarriedValue output) {
    Preconditions.checkState(buffering, "only buffering states record outputs");
    Preconditions.checkState(!released, "aggregation state already released");
    outputs.add(Objects.requireNonNull(output, "output"));
  }

  /**
   * @return the buffered outputs, in arrival order.
   */
  List<CarriedValue> getOutputs() {
    Preconditions.checkState(buffering, "only buffering states record outputs");
    Preconditions.checkState(!released, "aggregation state already released");
    return Collections.unmodifiableList(outputs);
  }

  /**
   * @return the most recent carrier signal.
   */
  public CarriedValue getCurrentSignal() {
    return currentSignal;
  }

  /**
   * @return the number of rows applied to this state.
   */
  public long getRowsProcessed() {
    return rowsProcessed;
  }

  /**
   * @return the number of outputs currently held.
   */
  public int numBufferedOutputs() {
    return outputs == null ? 0 : outputs.size();
  }

  /**
   * @return true if this state keeps outputs until the end of the partition.
   */
  public boolean isBuffering() {
    return buffering;
  }

  /**
   * @return true once the state has been discarded.
   */
  public boolean isReleased() {
    return released;
  }

  /**
   * Discard everything held by this state.
   */
  public void release() {
    released = true;
    outputs = null;
    currentSignal = CarriedValue.NULL;
  }
}
