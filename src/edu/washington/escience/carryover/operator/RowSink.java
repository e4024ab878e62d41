package edu.washington.escience.carryover.operator;

import edu.washington.escience.carryover.Row;

/**
 * Receives output rows.
 */
public interface RowSink {

  /**
   * @param row an output row.
   */
  void put(Row row);
}
