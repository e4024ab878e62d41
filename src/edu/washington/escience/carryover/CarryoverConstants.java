package edu.washington.escience.carryover;

/**
 * This class holds the constants for carry-forward evaluation.
 *
 */
public final class CarryoverConstants {
  /**
   * Flag value of a subject row in an integral flag column.
   */
  public static final long FLAG_SUBJECT = 0;

  /**
   * Flag value of a carrier row in an integral flag column.
   */
  public static final long FLAG_CARRIER = 1;

  /**
   * Name of the appended output column when none is configured.
   */
  public static final String DEFAULT_OUTPUT_COLUMN = "carried";

  /**
   * Prefix of the names of partition worker threads.
   */
  public static final String PARTITION_WORKER_THREAD_PREFIX = "carryover-partition-worker";

  /**
   * Initial capacity of the output buffer of a buffered evaluator.
   */
  public static final int BUFFERED_OUTPUT_INITIAL_CAPACITY = 64;

  /** Utility classes cannot be constructed. */
  private CarryoverConstants() {}
}
