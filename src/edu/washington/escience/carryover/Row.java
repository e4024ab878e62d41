package edu.washington.escience.carryover;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import org.joda.time.DateTime;

import com.google.common.base.Preconditions;

import net.jcip.annotations.Immutable;

/**
 * A single row flowing through a partition. Rows are never modified; {@link #append(Schema, Object)} builds a new row.
 */
@Immutable
public final class Row implements Serializable {
  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;

  /** The schema. */
  private final Schema schema;

  /** The data of the row. Individual values may be null. */
  private final Object[] data;

  /**
   * @param schema the schema of the row.
   * @param values one value per column, each either null or an instance of the column's Java object type.
   * @return the new row.
   */
  public static Row of(@Nonnull final Schema schema, final Object... values) {
    return new Row(schema, values.clone());
  }

  /**
   * @param schema the schema of the row.
   * @param data the values, already copied.
   */
  private Row(final Schema schema, final Object[] data) {
    this.schema = Objects.requireNonNull(schema, "schema");
    Preconditions.checkArgument(
        data.length == schema.numColumns(),
        "row has %s values but schema has %s columns",
        data.length,
        schema.numColumns());
    for (int i = 0; i < data.length; ++i) {
      Type type = schema.getColumnType(i);
      if (!type.accepts(data[i])) {
        throw new IllegalArgumentException(
            "value "
                + data[i]
                + " of class "
                + data[i].getClass().getSimpleName()
                + " does not match column "
                + schema.getColumnName(i)
                + " of type "
                + type);
      }
    }
    this.data = data;
  }

  /**
   * @return the schema
   */
  public Schema getSchema() {
    return schema;
  }

  /**
   * @return the number of columns.
   */
  public int numColumns() {
    return data.length;
  }

  /**
   * Returns a value and checks the column type.
   *
   * @param column the column index.
   * @param type the expected column type.
   * @return the value at the desired position.
   */
  private Object getValue(final int column, final Type type) {
    Preconditions.checkElementIndex(column, numColumns());
    Preconditions.checkArgument(
        schema.getColumnType(column) == type,
        "column %s is of type %s, not %s",
        column,
        schema.getColumnType(column),
        type);
    Object value = data[column];
    Preconditions.checkState(value != null, "column %s is null", column);
    return value;
  }

  /**
   * @param column the column index.
   * @return the value, possibly null.
   */
  @Nullable
  public Object getObject(final int column) {
    Preconditions.checkElementIndex(column, numColumns());
    return data[column];
  }

  /**
   * @param column the column index.
   * @return true if the value is null.
   */
  public boolean isNull(final int column) {
    return getObject(column) == null;
  }

  public boolean getBoolean(final int column) {
    return (boolean) getValue(column, Type.BOOLEAN_TYPE);
  }

  public double getDouble(final int column) {
    return (double) getValue(column, Type.DOUBLE_TYPE);
  }

  public int getInt(final int column) {
    return (int) getValue(column, Type.INT_TYPE);
  }

  public long getLong(final int column) {
    return (long) getValue(column, Type.LONG_TYPE);
  }

  public String getString(final int column) {
    return (String) getValue(column, Type.STRING_TYPE);
  }

  public DateTime getDateTime(final int column) {
    return (DateTime) getValue(column, Type.DATETIME_TYPE);
  }

  /**
   * @return an unmodifiable view of the values of this row.
   */
  public List<Object> getValues() {
    return Collections.unmodifiableList(Arrays.asList(data));
  }

  /**
   * Build a new row holding the columns of this row followed by one more value.
   *
   * @param outputSchema the schema of the new row; its leading columns must match this row's schema.
   * @param value the value of the new last column, possibly null.
   * @return the new row.
   */
  public Row append(@Nonnull final Schema outputSchema, @Nullable final Object value) {
    Preconditions.checkArgument(
        outputSchema.numColumns() == data.length + 1,
        "output schema must have exactly one more column than %s",
        schema);
    Preconditions.checkArgument(
        outputSchema.startsWithTypesOf(schema),
        "output schema %s does not start with the column types of %s",
        outputSchema,
        schema);
    Object[] extended = Arrays.copyOf(data, data.length + 1);
    extended[data.length] = value;
    return new Row(outputSchema, extended);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Row)) {
      return false;
    }
    final Row other = (Row) o;
    return schema.equals(other.schema) && Arrays.equals(data, other.data);
  }

  @Override
  public int hashCode() {
    return Objects.hash(schema, Arrays.hashCode(data));
  }

  @Override
  public String toString() {
    return Arrays.toString(data);
  }
}
