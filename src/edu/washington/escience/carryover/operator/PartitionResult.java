package edu.washington.escience.carryover.operator;

import java.util.List;
import java.util.Objects;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import edu.washington.escience.carryover.Row;
import net.jcip.annotations.Immutable;

/**
 * The outcome of evaluating one partition: either all of its output rows, or the error that aborted it. A failed
 * partition has no output rows at all.
 */
@Immutable
public final class PartitionResult {

  /** The partition key. */
  private final List<Object> partitionKey;
  /** The output rows, null if failed. */
  @Nullable private final List<Row> rows;
  /** The failure, null if succeeded. */
  @Nullable private final Throwable failure;

  /**
   * @param partitionKey the partition key.
   * @param rows the output rows.
   * @param failure the failure.
   */
  private PartitionResult(
      final List<Object> partitionKey,
      final List<Row> rows,
      final Throwable failure) {
    this.partitionKey = Objects.requireNonNull(partitionKey, "partitionKey");
    this.rows = rows;
    this.failure = failure;
  }

  /**
   * @param partitionKey the partition key.
   * @param rows the output rows.
   * @return a successful result.
   */
  public static PartitionResult success(
      final List<Object> partitionKey, final List<Row> rows) {
    return new PartitionResult(partitionKey, ImmutableList.copyOf(rows), null);
  }

  /**
   * @param partitionKey the partition key.
   * @param failure why the partition was aborted.
   * @return a failed result.
   */
  public static PartitionResult failure(final List<Object> partitionKey, final Throwable failure) {
    return new PartitionResult(partitionKey, null, Objects.requireNonNull(failure, "failure"));
  }

  /**
   * @return the partition key.
   */
  public List<Object> getPartitionKey() {
    return partitionKey;
  }

  /**
   * @return true if the partition was evaluated completely.
   */
  public boolean isSuccess() {
    return failure == null;
  }

  /**
   * @return the output rows.
   * @throws IllegalStateException if the partition failed.
   */
  public List<Row> getRows() {
    Preconditions.checkState(isSuccess(), "partition %s failed", partitionKey);
    return rows;
  }

  /**
   * @return the error that aborted the partition.
   * @throws IllegalStateException if the partition succeeded.
   */
  public Throwable getFailure() {
    Preconditions.checkState(!isSuccess(), "partition %s did not fail", partitionKey);
    return failure;
  }

  @Override
  public String toString() {
    if (isSuccess()) {
      return "PartitionResult(" + partitionKey + ", " + rows.size() + " rows)";
    }
    return "PartitionResult(" + partitionKey + ", failed: " + failure + ")";
  }
}
