package edu.washington.escience.carryover;

import org.joda.time.DateTime;

import com.google.common.base.Preconditions;

/**
 * The type of a column. Every type maps to the Java class its non-null values are instances of; all of them are
 * {@link Comparable}, which is how order keys are compared.
 */
public enum Type {
  /**
   * int type.
   * */
  INT_TYPE(Integer.class),

  /**
   * Double type.
   * */
  DOUBLE_TYPE(Double.class),

  /**
   * Boolean type.
   * */
  BOOLEAN_TYPE(Boolean.class),

  /**
   * String type.
   * */
  STRING_TYPE(String.class),

  /**
   * Long type.
   * */
  LONG_TYPE(Long.class),

  /**
   * date type.
   * */
  DATETIME_TYPE(DateTime.class);

  /** The class of non-null values. */
  private final Class<?> javaObjectType;

  /**
   * @param javaObjectType the class of non-null values.
   */
  Type(final Class<?> javaObjectType) {
    this.javaObjectType = javaObjectType;
  }

  /**
   * Compare two non-null values of this type.
   *
   * @param x the first value, an instance of {@link #toJavaObjectType()}.
   * @param y the second value, an instance of {@link #toJavaObjectType()}.
   * @return a negative number, zero, or a positive number as x is less than, equal to, or greater than y.
   */
  @SuppressWarnings("unchecked")
  public int compareObjects(final Object x, final Object y) {
    Preconditions.checkArgument(
        javaObjectType.isInstance(x) && javaObjectType.isInstance(y),
        "cannot compare %s and %s as %s",
        x,
        y,
        this);
    return ((Comparable<Object>) x).compareTo(y);
  }

  /**
   * @param value a candidate column value.
   * @return true if the value may be stored in a column of this type. Null is allowed in every column.
   */
  public boolean accepts(final Object value) {
    return value == null || javaObjectType.isInstance(value);
  }

  /**
   * @return the non primitive java type
   */
  public Class<?> toJavaObjectType() {
    return javaObjectType;
  }
}
