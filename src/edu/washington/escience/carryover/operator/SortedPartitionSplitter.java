package edu.washington.escience.carryover.operator;

import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import edu.washington.escience.carryover.Row;
import edu.washington.escience.carryover.Schema;
import edu.washington.escience.carryover.Type;
import edu.washington.escience.carryover.UnsortedInputException;
import net.jcip.annotations.NotThreadSafe;

/**
 * Cuts a row stream that is already sorted on the partition columns into one {@link PartitionCursor} per partition. A
 * new partition starts whenever the partition key changes. Nothing is sorted or buffered here: one row of lookahead is
 * all that is held.
 *
 * If an order column is given, each partition is also checked to arrive in non-decreasing order of that column. Equal
 * order keys are accepted and keep their arrival order; null order keys sort first.
 */
@NotThreadSafe
public final class SortedPartitionSplitter {
  /** The logger for this class. */
  private static final Logger LOGGER = LoggerFactory.getLogger(SortedPartitionSplitter.class);

  /** Value of {@code orderColumn} when order is not checked. */
  public static final int NO_ORDER_COLUMN = -1;

  /** The sorted input. */
  private final Iterator<Row> input;
  /** Partition key columns. Empty array means the whole input is one partition. */
  private final int[] partitionColumns;
  /** The order column, or {@link #NO_ORDER_COLUMN}. */
  private final int orderColumn;
  /** The type of the order column, null if not checked. */
  private final Type orderType;
  /** The first row of the next partition, already read from the input. */
  @Nullable private Row lookahead;
  /** The partition currently being served. */
  @Nullable private SplitCursor current;
  /** The number of partitions handed out. */
  private long numPartitions = 0;

  /**
   * @param schema the schema of the input rows.
   * @param input rows sorted on the partition columns.
   * @param partitionColumns the partition key columns.
   * @param orderColumn the order column to check, or {@link #NO_ORDER_COLUMN}.
   */
  public SortedPartitionSplitter(
      @Nonnull final Schema schema,
      @Nonnull final Iterator<Row> input,
      @Nonnull final int[] partitionColumns,
      final int orderColumn) {
    Objects.requireNonNull(schema, "schema");
    this.input = Objects.requireNonNull(input, "input");
    this.partitionColumns = Objects.requireNonNull(partitionColumns, "partitionColumns").clone();
    for (int column : partitionColumns) {
      Preconditions.checkElementIndex(column, schema.numColumns(), "partition column");
    }
    if (orderColumn == NO_ORDER_COLUMN) {
      orderType = null;
    } else {
      Preconditions.checkElementIndex(orderColumn, schema.numColumns(), "order column");
      orderType = schema.getColumnType(orderColumn);
    }
    this.orderColumn = orderColumn;
  }

  /**
   * Move to the next partition. Rows of the previous partition that were not read are skipped.
   *
   * @return a cursor over the next partition, or null at the end of the input.
   */
  @Nullable
  public PartitionCursor nextPartition() {
    if (current != null) {
      current.skipRemaining();
      current = null;
    }
    if (lookahead == null) {
      if (!input.hasNext()) {
        if (LOGGER.isDebugEnabled()) {
          LOGGER.debug("Input exhausted after {} partitions", numPartitions);
        }
        return null;
      }
      lookahead = input.next();
    }
    ++numPartitions;
    current = new SplitCursor(keyOf(lookahead));
    return current;
  }

  /**
   * @param row a row.
   * @return the values of its partition columns.
   */
  private List<Object> keyOf(final Row row) {
    Object[] key = new Object[partitionColumns.length];
    for (int i = 0; i < key.length; ++i) {
      key[i] = row.getObject(partitionColumns[i]);
    }
    return Collections.unmodifiableList(Arrays.asList(key));
  }

  /**
   * @return the number of partitions handed out so far.
   */
  public long getNumPartitions() {
    return numPartitions;
  }

  /**
   * The rows of one partition, read lazily from the shared input.
   */
  private final class SplitCursor implements PartitionCursor {
    /** The partition key. */
    private final List<Object> key;
    /** The order key of the previous row. */
    private Object previousOrderKey;
    /** The number of rows served. */
    private long numRows = 0;
    /** Set once the partition ended. */
    private boolean done = false;

    /**
     * @param key the partition key.
     */
    SplitCursor(final List<Object> key) {
      this.key = key;
    }

    @Override
    public List<Object> getPartitionKey() {
      return key;
    }

    /**
     * @return the next row of this partition, not checked for order.
     */
    @Nullable
    private Row advance() {
      if (done) {
        return null;
      }
      final Row row;
      if (lookahead != null) {
        row = lookahead;
        lookahead = null;
        if (!key.equals(keyOf(row))) {
          lookahead = row;
          done = true;
          return null;
        }
      } else if (input.hasNext()) {
        row = input.next();
        if (!key.equals(keyOf(row))) {
          lookahead = row;
          done = true;
          return null;
        }
      } else {
        done = true;
        return null;
      }
      ++numRows;
      return row;
    }

    @Override
    public Row nextRow() throws UnsortedInputException {
      Preconditions.checkState(current == this, "partition %s is no longer current", key);
      Row row = advance();
      if (row == null || orderType == null) {
        return row;
      }
      Object orderKey = row.getObject(orderColumn);
      if (numRows > 1 && sortsBefore(orderKey, previousOrderKey)) {
        throw new UnsortedInputException(numRows - 1, previousOrderKey, orderKey);
      }
      previousOrderKey = orderKey;
      return row;
    }

    /**
     * @param x an order key.
     * @param y another order key.
     * @return true if x sorts strictly before y.
     */
    private boolean sortsBefore(final Object x, final Object y) {
      if (x == null) {
        return y != null;
      }
      if (y == null) {
        return false;
      }
      return orderType.compareObjects(x, y) < 0;
    }

    /**
     * Read and drop the rest of this partition.
     */
    void skipRemaining() {
      long skipped = 0;
      while (advance() != null) {
        ++skipped;
      }
      if (skipped > 0 && LOGGER.isDebugEnabled()) {
        LOGGER.debug("Skipped {} unread rows of partition {}", skipped, key);
      }
    }
  }
}
