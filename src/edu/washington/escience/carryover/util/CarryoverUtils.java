package edu.washington.escience.carryover.util;

import java.util.List;
import java.util.Objects;

import com.google.common.base.Preconditions;

import edu.washington.escience.carryover.Schema;

/**
 * Generic utilities for Carryover.
 */
public final class CarryoverUtils {
  /**
   * Utility classes should not be instantiated.
   */
  private CarryoverUtils() {}

  /**
   * Throws a {@link NullPointerException} if the specified iterable contains a null value.
   *
   * @param <T> any object type that extends Iterable
   * @param iter the iterable
   * @param message a message to be included with the exception
   * @return the iterable, if it has no null elements.
   */
  public static <T extends Iterable<?>> T checkHasNoNulls(final T iter, final String message) {
    Objects.requireNonNull(iter, message);
    int i = 0;
    for (Object o : iter) {
      Preconditions.checkNotNull(o, "%s [element %s]", message, i);
      ++i;
    }
    return iter;
  }

  /**
   * Resolve column names against a schema.
   *
   * @param schema the schema holding the columns.
   * @param names the column names.
   * @return the column indexes, in the order of the names.
   * @throws java.util.NoSuchElementException if a name is not in the schema.
   */
  public static int[] columnIndexes(final Schema schema, final List<String> names) {
    Objects.requireNonNull(schema, "schema");
    checkHasNoNulls(names, "column names");
    int[] ret = new int[names.size()];
    for (int i = 0; i < ret.length; ++i) {
      ret[i] = schema.columnNameToIndex(names.get(i));
    }
    return ret;
  }
}
