package edu.washington.escience.carryover.operator;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import edu.washington.escience.carryover.EvaluatorException;
import edu.washington.escience.carryover.Row;
import edu.washington.escience.carryover.Schema;
import edu.washington.escience.carryover.window.CarriedValue;
import edu.washington.escience.carryover.window.CarryForwardEvaluator;
import edu.washington.escience.carryover.window.CarryForwardFunction;
import edu.washington.escience.carryover.window.EvaluatorMode;
import edu.washington.escience.carryover.window.ExecutionStrategy;
import edu.washington.escience.carryover.window.InternalInvariantException;
import edu.washington.escience.carryover.window.ModeGate;
import edu.washington.escience.carryover.window.UnsupportedModeException;
import edu.washington.escience.carryover.window.WindowFrame;

/**
 * Drives a {@link CarryForwardFunction} over partitioned input and appends its output to every row. Each partition gets
 * its own evaluator, set up with the configured mode and frame. The mode and frame are also checked once when the
 * window is built, so a misconfigured window fails before it sees any input.
 */
public final class CarryForwardWindow {
  /** The logger for this class. */
  private static final Logger LOGGER = LoggerFactory.getLogger(CarryForwardWindow.class);

  /** The window function. */
  private final CarryForwardFunction function;
  /** The requested mode. */
  private final EvaluatorMode mode;
  /** The requested frame. */
  @Nullable private final WindowFrame frame;
  /** The strategy the mode and frame map to. */
  private final ExecutionStrategy strategy;
  /** Partition key columns. */
  private final int[] partitionColumns;
  /** The order column to check, or {@link SortedPartitionSplitter#NO_ORDER_COLUMN}. */
  private final int orderColumn;

  /**
   * @param function the window function.
   * @param mode the requested mode.
   * @param frame the requested frame, null for none.
   * @param partitionColumns partition key columns, used by {@link #evaluateAll(Iterator)}.
   * @param orderColumn the order column to check, or {@link SortedPartitionSplitter#NO_ORDER_COLUMN}.
   * @throws UnsupportedModeException if the mode and frame cannot be honored.
   */
  public CarryForwardWindow(
      @Nonnull final CarryForwardFunction function,
      @Nonnull final EvaluatorMode mode,
      @Nullable final WindowFrame frame,
      @Nonnull final int[] partitionColumns,
      final int orderColumn)
      throws UnsupportedModeException {
    this.function = Objects.requireNonNull(function, "function");
    this.mode = Objects.requireNonNull(mode, "mode");
    this.frame = frame;
    strategy = ModeGate.check(mode, frame);
    this.partitionColumns = Objects.requireNonNull(partitionColumns, "partitionColumns").clone();
    this.orderColumn = orderColumn;
  }

  /**
   * Evaluate one partition and push its output rows to a sink. When streaming, each row is pushed as soon as it is
   * evaluated; when buffering, all rows are pushed after the partition finished. If evaluation fails, the error is
   * thrown and nothing more is pushed; when streaming, rows pushed before the failure must be discarded by the caller.
   *
   * @param cursor the rows of the partition.
   * @param sink receives the input rows with the output column appended.
   * @return the number of rows evaluated.
   * @throws EvaluatorException if the partition fails.
   */
  public long evaluate(@Nonnull final PartitionCursor cursor, @Nonnull final RowSink sink)
      throws EvaluatorException {
    Objects.requireNonNull(cursor, "cursor");
    Objects.requireNonNull(sink, "sink");
    final Schema outputSchema = function.getOutputSchema();
    final CarryForwardEvaluator evaluator = function.setup(mode, frame);
    final List<Row> pending =
        evaluator.getStrategy() == ExecutionStrategy.BUFFERED ? new ArrayList<Row>() : null;
    try {
      Row row;
      while ((row = cursor.nextRow()) != null) {
        Optional<CarriedValue> output = evaluator.process(row);
        if (output.isPresent()) {
          sink.put(row.append(outputSchema, output.get().getValue()));
        } else {
          pending.add(row);
        }
      }
      List<CarriedValue> outputs = evaluator.finish();
      if (pending != null) {
        if (outputs.size() != pending.size()) {
          throw new InternalInvariantException(
              "evaluator returned " + outputs.size() + " outputs for " + pending.size() + " rows");
        }
        for (int i = 0; i < outputs.size(); ++i) {
          sink.put(pending.get(i).append(outputSchema, outputs.get(i).getValue()));
        }
      }
      if (LOGGER.isDebugEnabled()) {
        LOGGER.debug(
            "Partition {} evaluated, {} rows, strategy {}",
            cursor.getPartitionKey(),
            evaluator.getRowsProcessed(),
            strategy);
      }
      return evaluator.getRowsProcessed();
    } catch (EvaluatorException | RuntimeException e) {
      evaluator.abort();
      LOGGER.debug("Partition {} aborted: {}", cursor.getPartitionKey(), e.getMessage());
      throw e;
    }
  }

  /**
   * Evaluate one partition.
   *
   * @param cursor the rows of the partition.
   * @return the input rows with the output column appended. Nothing is returned if the partition fails.
   * @throws EvaluatorException if the partition fails.
   */
  public List<Row> evaluate(@Nonnull final PartitionCursor cursor) throws EvaluatorException {
    final List<Row> out = new ArrayList<>();
    evaluate(
        cursor,
        new RowSink() {
          @Override
          public void put(final Row row) {
            out.add(row);
          }
        });
    return out;
  }

  /**
   * Evaluate every partition of an input sorted on the partition columns, one after the other. Stops at the first
   * failing partition.
   *
   * @param sortedRows the input, sorted on the partition columns.
   * @return the output rows of all partitions, in input order.
   * @throws EvaluatorException if any partition fails.
   */
  public List<Row> evaluateAll(@Nonnull final Iterator<Row> sortedRows)
      throws EvaluatorException {
    SortedPartitionSplitter splitter = newSplitter(sortedRows);
    List<Row> out = new ArrayList<>();
    PartitionCursor cursor;
    while ((cursor = splitter.nextPartition()) != null) {
      out.addAll(evaluate(cursor));
    }
    return out;
  }

  /**
   * @param sortedRows the input, sorted on the partition columns.
   * @return a splitter cutting the input on this window's partition columns.
   */
  public SortedPartitionSplitter newSplitter(@Nonnull final Iterator<Row> sortedRows) {
    Preconditions.checkNotNull(sortedRows, "sortedRows");
    return new SortedPartitionSplitter(
        function.getInputSchema(), sortedRows, partitionColumns, orderColumn);
  }

  /**
   * @return the window function.
   */
  public CarryForwardFunction getFunction() {
    return function;
  }

  /**
   * @return the strategy every partition runs.
   */
  public ExecutionStrategy getStrategy() {
    return strategy;
  }

  /**
   * @return the schema of output rows.
   */
  public Schema getOutputSchema() {
    return function.getOutputSchema();
  }
}
