package edu.washington.escience.carryover.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import edu.washington.escience.carryover.EvaluatorException;
import edu.washington.escience.carryover.Row;
import edu.washington.escience.carryover.Schema;
import edu.washington.escience.carryover.Type;
import edu.washington.escience.carryover.window.CarriedValue;
import edu.washington.escience.carryover.window.CarryForwardEvaluator;
import edu.washington.escience.carryover.window.CarryForwardFunction;
import edu.washington.escience.carryover.window.EvaluatorMode;
import edu.washington.escience.carryover.window.NullSignalPolicy;
import edu.washington.escience.carryover.window.WindowFrame;

public final class TestUtils {

  /** pk, ts, flag, signal. */
  public static final Schema SCHEMA =
      Schema.ofFields(
          Type.LONG_TYPE, "pk", Type.LONG_TYPE, "ts", Type.INT_TYPE, "flag", Type.STRING_TYPE, "signal");

  public static final int PK = 0;
  public static final int TS = 1;
  public static final int FLAG = 2;
  public static final int SIGNAL = 3;

  private static Random random = null;

  /** Utility classes cannot be constructed. */
  private TestUtils() {}

  private synchronized static Random getRandom() {
    if (random == null) {
      random = new Random(0x5eed);
    }
    return random;
  }

  /**
   * @return the carry-forward function over {@link #SCHEMA}.
   */
  public static CarryForwardFunction function() {
    return function(NullSignalPolicy.IGNORE);
  }

  /**
   * @param policy what a carrier with a null signal does.
   * @return the carry-forward function over {@link #SCHEMA}.
   */
  public static CarryForwardFunction function(final NullSignalPolicy policy) {
    return new CarryForwardFunction(SCHEMA, FLAG, SIGNAL, "carried", policy);
  }

  /**
   * @param pk the partition key of every row.
   * @param flags the flag of each row.
   * @param signals the signal of each row.
   * @return one row per flag, with ts counting from 0.
   */
  public static List<Row> partition(final long pk, final int[] flags, final String[] signals) {
    Preconditions.checkArgument(flags.length == signals.length);
    List<Row> rows = new ArrayList<>();
    for (int i = 0; i < flags.length; ++i) {
      rows.add(Row.of(SCHEMA, pk, (long) i, flags[i], signals[i]));
    }
    return rows;
  }

  /**
   * The partition of the reference scenario: subject, carrier 27, subject, subject, carrier 08, subject.
   *
   * @return the rows.
   */
  public static List<Row> scenario() {
    return partition(
        7L, new int[] {0, 1, 0, 0, 1, 0}, new String[] {"95", "27", "86", "24", "08", "76"});
  }

  /**
   * @param pk the partition key.
   * @param numRows the number of rows.
   * @param carrierPercent probability of a row being a carrier, in percent.
   * @return a random partition; some carrier signals are null.
   */
  public static List<Row> randomPartition(final long pk, final int numRows, final int carrierPercent) {
    Random r = getRandom();
    int[] flags = new int[numRows];
    String[] signals = new String[numRows];
    for (int i = 0; i < numRows; ++i) {
      flags[i] = r.nextInt(100) < carrierPercent ? 1 : 0;
      signals[i] = r.nextInt(10) == 0 ? null : String.format("%02d", r.nextInt(100));
    }
    return partition(pk, flags, signals);
  }

  /**
   * @param function the window function.
   * @param rows the rows of one partition.
   * @return the outputs of a buffered evaluator.
   * @throws EvaluatorException if evaluation fails.
   */
  public static List<CarriedValue> evaluateBuffered(
      final CarryForwardFunction function, final List<Row> rows) throws EvaluatorException {
    CarryForwardEvaluator evaluator = function.setup(EvaluatorMode.COMPLETE, null);
    for (Row row : rows) {
      Optional<CarriedValue> out = evaluator.process(row);
      Preconditions.checkState(!out.isPresent(), "buffered evaluator emitted early");
    }
    return evaluator.finish();
  }

  /**
   * @param function the window function.
   * @param rows the rows of one partition.
   * @return the outputs of a streaming evaluator, one per process call.
   * @throws EvaluatorException if evaluation fails.
   */
  public static List<CarriedValue> evaluateStreaming(
      final CarryForwardFunction function, final List<Row> rows) throws EvaluatorException {
    CarryForwardEvaluator evaluator =
        function.setup(
            EvaluatorMode.STREAMING_INCREMENTAL, WindowFrame.UNBOUNDED_PRECEDING_TO_CURRENT_ROW);
    List<CarriedValue> outputs = new ArrayList<>();
    for (Row row : rows) {
      outputs.add(evaluator.process(row).get());
    }
    Preconditions.checkState(evaluator.finish().isEmpty(), "streaming evaluator buffered outputs");
    return outputs;
  }

  /**
   * @param values raw output values, null for no carried signal.
   * @return the expected outputs.
   */
  public static List<CarriedValue> carried(final Object... values) {
    ImmutableList.Builder<CarriedValue> ret = ImmutableList.builder();
    for (Object v : values) {
      ret.add(CarriedValue.of(v));
    }
    return ret.build();
  }
}
