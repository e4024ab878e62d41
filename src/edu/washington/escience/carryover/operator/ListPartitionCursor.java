package edu.washington.escience.carryover.operator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import edu.washington.escience.carryover.EvaluatorException;
import edu.washington.escience.carryover.Row;

/**
 * A {@link PartitionCursor} over rows already held in memory.
 */
public final class ListPartitionCursor implements PartitionCursor {

  /** The partition key. */
  private final List<Object> partitionKey;
  /** The rows, in order. */
  private final List<Row> rows;
  /** Index of the next row to serve. */
  private int index = 0;

  /**
   * @param partitionKey the partition key.
   * @param rows the rows of the partition, in their final order.
   */
  public ListPartitionCursor(final List<Object> partitionKey, final List<Row> rows) {
    this.partitionKey = Collections.unmodifiableList(new ArrayList<>(partitionKey));
    this.rows = Objects.requireNonNull(rows, "rows");
  }

  /**
   * Read what is left of another cursor into memory.
   *
   * @param cursor the cursor to drain.
   * @return a cursor serving the same rows.
   * @throws EvaluatorException if the drained cursor fails.
   */
  public static ListPartitionCursor drain(final PartitionCursor cursor) throws EvaluatorException {
    List<Row> rows = new ArrayList<>();
    Row row;
    while ((row = cursor.nextRow()) != null) {
      rows.add(row);
    }
    return new ListPartitionCursor(cursor.getPartitionKey(), rows);
  }

  @Override
  public List<Object> getPartitionKey() {
    return partitionKey;
  }

  @Override
  public Row nextRow() {
    if (index >= rows.size()) {
      return null;
    }
    return rows.get(index++);
  }

  /**
   * @return the number of rows of this partition.
   */
  public int numRows() {
    return rows.size();
  }
}
