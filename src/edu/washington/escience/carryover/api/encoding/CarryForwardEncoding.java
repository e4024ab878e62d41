package edu.washington.escience.carryover.api.encoding;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.NoSuchElementException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.google.common.collect.ImmutableList;

import edu.washington.escience.carryover.CarryoverConstants;
import edu.washington.escience.carryover.Schema;
import edu.washington.escience.carryover.api.CarryoverJsonMapperProvider;
import edu.washington.escience.carryover.operator.CarryForwardWindow;
import edu.washington.escience.carryover.operator.PartitionedWindowRunner;
import edu.washington.escience.carryover.operator.SortedPartitionSplitter;
import edu.washington.escience.carryover.util.CarryoverUtils;
import edu.washington.escience.carryover.window.CarryForwardFunction;
import edu.washington.escience.carryover.window.EvaluatorMode;
import edu.washington.escience.carryover.window.NullSignalPolicy;
import edu.washington.escience.carryover.window.UnsupportedModeException;
import edu.washington.escience.carryover.window.WindowFrame;

/** JSON wrapper for a carry-forward window. Columns are referred to by name. */
public class CarryForwardEncoding extends CarryoverEncoding {
  /** The flag column. */
  @Required public String flagColumn;
  /** The signal column. */
  @Required public String signalColumn;
  /** The requested mode; absent means streaming. */
  public EvaluatorMode mode;
  /** Name of the appended output column. */
  public String outputColumn;
  /** Partition key columns; absent means one partition. */
  public List<String> partitionColumns;
  /** The order column to check; absent means no check. */
  public String orderColumn;
  /** The requested frame; absent means unbounded preceding to current row. */
  public WindowFrame frame;
  /** What a carrier with a null signal does. */
  public NullSignalPolicy nullSignalPolicy;
  /** The number of partition worker threads. */
  public Integer workers;

  /**
   * @param json the JSON text.
   * @return the validated encoding.
   * @throws InvalidEncodingException if the JSON is malformed or misses required fields.
   */
  public static CarryForwardEncoding fromJson(final String json) {
    CarryForwardEncoding encoding;
    try {
      encoding =
          CarryoverJsonMapperProvider.getReader().forType(CarryForwardEncoding.class).readValue(json);
    } catch (JsonProcessingException e) {
      throw new InvalidEncodingException("malformed carry-forward encoding: " + e.getMessage(), e);
    }
    encoding.validate();
    return encoding;
  }

  /**
   * @param json a stream of JSON text.
   * @return the validated encoding.
   * @throws IOException if the stream cannot be read.
   * @throws InvalidEncodingException if the JSON is malformed or misses required fields.
   */
  public static CarryForwardEncoding fromJson(final InputStream json) throws IOException {
    CarryForwardEncoding encoding;
    try {
      encoding =
          CarryoverJsonMapperProvider.getReader().forType(CarryForwardEncoding.class).readValue(json);
    } catch (JsonProcessingException e) {
      throw new InvalidEncodingException("malformed carry-forward encoding: " + e.getMessage(), e);
    }
    encoding.validate();
    return encoding;
  }

  /**
   * @return this encoding as JSON text, readable by {@link #fromJson(String)}.
   */
  public String toJson() {
    try {
      return CarryoverJsonMapperProvider.getWriter().writeValueAsString(this);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("cannot write carry-forward encoding", e);
    }
  }

  @Override
  protected void validateExtra() {
    if (workers != null && workers <= 0) {
      throw new InvalidEncodingException("workers must be positive, got " + workers);
    }
  }

  /**
   * Bind the encoding to the schema of its input.
   *
   * @param inputSchema the schema of input rows.
   * @return the window.
   * @throws InvalidEncodingException if a column is unknown or has the wrong type.
   * @throws UnsupportedModeException if the mode and frame cannot be honored.
   */
  public CarryForwardWindow construct(final Schema inputSchema) throws UnsupportedModeException {
    validate();
    final CarryForwardFunction function;
    final int[] partitionIndexes;
    final int orderIndex;
    try {
      function =
          new CarryForwardFunction(
              inputSchema,
              inputSchema.columnNameToIndex(flagColumn),
              inputSchema.columnNameToIndex(signalColumn),
              getOutputColumn(),
              getNullSignalPolicy());
      partitionIndexes = CarryoverUtils.columnIndexes(inputSchema, getPartitionColumns());
      orderIndex =
          orderColumn == null
              ? SortedPartitionSplitter.NO_ORDER_COLUMN
              : inputSchema.columnNameToIndex(orderColumn);
    } catch (NoSuchElementException | IllegalArgumentException e) {
      throw new InvalidEncodingException(
          "cannot bind carry-forward encoding to schema " + inputSchema + ": " + e.getMessage(), e);
    }
    return new CarryForwardWindow(function, getMode(), getFrame(), partitionIndexes, orderIndex);
  }

  /**
   * Bind the encoding to the schema of its input and start the partition workers it asks for.
   *
   * @param inputSchema the schema of input rows.
   * @return a runner of {@link #getNumWorkers()} workers. The caller closes it.
   * @throws InvalidEncodingException if a column is unknown or has the wrong type.
   * @throws UnsupportedModeException if the mode and frame cannot be honored.
   */
  public PartitionedWindowRunner newRunner(final Schema inputSchema) throws UnsupportedModeException {
    return new PartitionedWindowRunner(construct(inputSchema), getNumWorkers());
  }

  /**
   * @return the requested mode.
   */
  public EvaluatorMode getMode() {
    return mode == null ? EvaluatorMode.STREAMING_INCREMENTAL : mode;
  }

  /**
   * @return name of the appended output column.
   */
  public String getOutputColumn() {
    return outputColumn == null ? CarryoverConstants.DEFAULT_OUTPUT_COLUMN : outputColumn;
  }

  /**
   * @return the partition key columns.
   */
  public List<String> getPartitionColumns() {
    return partitionColumns == null ? ImmutableList.<String>of() : partitionColumns;
  }

  /**
   * @return the requested frame.
   */
  public WindowFrame getFrame() {
    return frame == null ? WindowFrame.UNBOUNDED_PRECEDING_TO_CURRENT_ROW : frame;
  }

  /**
   * @return what a carrier with a null signal does.
   */
  public NullSignalPolicy getNullSignalPolicy() {
    return nullSignalPolicy == null ? NullSignalPolicy.IGNORE : nullSignalPolicy;
  }

  /**
   * @return the number of partition worker threads.
   */
  public int getNumWorkers() {
    return workers == null ? Runtime.getRuntime().availableProcessors() : workers;
  }
}
