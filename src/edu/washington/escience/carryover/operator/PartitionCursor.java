package edu.washington.escience.carryover.operator;

import java.util.List;

import javax.annotation.Nullable;

import edu.washington.escience.carryover.EvaluatorException;
import edu.washington.escience.carryover.Row;

/**
 * Supplies the rows of one partition in their final order. Rows of different partitions are never mixed.
 */
public interface PartitionCursor {

  /**
   * @return the values of the partition key columns shared by every row of this partition.
   */
  List<Object> getPartitionKey();

  /**
   * @return the next row of the partition, or null once the partition is exhausted.
   * @throws EvaluatorException if the row supply is broken.
   */
  @Nullable
  Row nextRow() throws EvaluatorException;
}
