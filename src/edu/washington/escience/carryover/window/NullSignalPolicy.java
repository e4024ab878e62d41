package edu.washington.escience.carryover.window;

/**
 * What a carrier row with a null signal does to the carried value.
 */
public enum NullSignalPolicy {
  /** The carried value is left unchanged. */
  IGNORE,
  /** The carried value is reset to null. */
  OVERWRITE;
}
