package edu.washington.escience.carryover;

import java.io.Serializable;
import java.util.HashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import edu.washington.escience.carryover.util.CarryoverUtils;
import net.jcip.annotations.Immutable;

/**
 * The columns of the rows a window reads or writes: one name and one {@link Type} per column. Names are unique so that
 * encodings can refer to flag, signal, partition and order columns by name.
 */
@Immutable
public final class Schema implements Serializable {

  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;

  /** What a column name must look like. */
  public static final String VALID_NAME_REGEX = "^[a-zA-Z_]\\w*$";
  /** Compiled {@link #VALID_NAME_REGEX}. */
  private static final Pattern VALID_NAME_PATTERN = Pattern.compile(VALID_NAME_REGEX);

  /** Column types, in column order. */
  private final ImmutableList<Type> columnTypes;
  /** Column names, parallel to {@link #columnTypes}. */
  private final ImmutableList<String> columnNames;

  /**
   * Create a Schema whose columns are named col0, col1, ....
   *
   * @param types the column types.
   */
  public Schema(final List<Type> types) {
    this(types, defaultNames(Objects.requireNonNull(types, "types").size()));
  }

  /**
   * @param columnTypes the column types.
   * @param columnNames the column names, one per type, each matching {@link #VALID_NAME_REGEX} and all distinct.
   * @throws IllegalArgumentException if the lists differ in length or a name is invalid or repeated.
   */
  public Schema(final List<Type> columnTypes, final List<String> columnNames) {
    Objects.requireNonNull(columnTypes, "columnTypes");
    Objects.requireNonNull(columnNames, "columnNames");
    Preconditions.checkArgument(
        columnTypes.size() == columnNames.size(),
        "%s column types but %s column names",
        columnTypes.size(),
        columnNames.size());
    CarryoverUtils.checkHasNoNulls(columnTypes, "columnTypes may not contain null elements");
    CarryoverUtils.checkHasNoNulls(columnNames, "columnNames may not contain null elements");
    Set<String> seen = new HashSet<>();
    for (String name : columnNames) {
      Preconditions.checkArgument(
          VALID_NAME_PATTERN.matcher(name).matches(),
          "column name %s does not match %s",
          name,
          VALID_NAME_REGEX);
      Preconditions.checkArgument(seen.add(name), "column name %s is used twice", name);
    }
    this.columnTypes = ImmutableList.copyOf(columnTypes);
    this.columnNames = ImmutableList.copyOf(columnNames);
  }

  /**
   * @param numColumns how many names.
   * @return col0 up to col(numColumns - 1).
   */
  private static List<String> defaultNames(final int numColumns) {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (int i = 0; i < numColumns; ++i) {
      names.add("col" + i);
    }
    return names.build();
  }

  /**
   * The schema of a window's output: the input columns followed by the carried column.
   *
   * @param schema the input schema.
   * @param type the type of the new last column.
   * @param name the name of the new last column. It must not clash with an input column.
   * @return the widened schema.
   */
  public static Schema appendColumn(final Schema schema, final Type type, final String name) {
    return new Schema(
        ImmutableList.<Type>builder().addAll(schema.columnTypes).add(type).build(),
        ImmutableList.<String>builder().addAll(schema.columnNames).add(name).build());
  }

  /**
   * Build a Schema from {@link Type} and {@link String} arguments. Types and names may be interleaved freely; the
   * i-th type goes with the i-th name. Without any name the columns are named col0, col1, ....
   *
   * @param fields types and names.
   * @return the Schema.
   * @throws IllegalArgumentException if a field is neither a type nor a name.
   */
  public static Schema ofFields(final Object... fields) {
    ImmutableList.Builder<Type> types = ImmutableList.builder();
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (Object field : fields) {
      Objects.requireNonNull(field, "field");
      if (field instanceof Type) {
        types.add((Type) field);
      } else if (field instanceof String) {
        names.add((String) field);
      } else {
        throw new IllegalArgumentException(
            "expected a Type or a column name, got " + field.getClass().getSimpleName() + " " + field);
      }
    }
    List<String> nameList = names.build();
    if (nameList.isEmpty()) {
      return new Schema(types.build());
    }
    return new Schema(types.build(), nameList);
  }

  /**
   * @param name a column name.
   * @return the index of that column.
   * @throws NoSuchElementException if there is no such column.
   */
  public int columnNameToIndex(final String name) {
    int index = columnNames.indexOf(name);
    if (index < 0) {
      throw new NoSuchElementException("No column named " + name + " in " + this);
    }
    return index;
  }

  /**
   * Rows of compatible schemas can be fed to the same evaluator: the column types agree, the names may not.
   *
   * @param other the other schema.
   * @return true if both schemas have the same column types in the same order.
   */
  public boolean compatible(final Schema other) {
    return columnTypes.equals(other.columnTypes);
  }

  /**
   * @param prefix a candidate prefix.
   * @return true if the first columns of this schema have the types of prefix's columns.
   */
  public boolean startsWithTypesOf(final Schema prefix) {
    return prefix.numColumns() <= numColumns()
        && columnTypes.subList(0, prefix.numColumns()).equals(prefix.columnTypes);
  }

  /**
   * @param index a column index.
   * @return the name of that column.
   */
  public String getColumnName(final int index) {
    return columnNames.get(index);
  }

  /**
   * @return the column names, in order.
   */
  public List<String> getColumnNames() {
    return columnNames;
  }

  /**
   * @param index a column index.
   * @return the type of that column.
   */
  public Type getColumnType(final int index) {
    return columnTypes.get(index);
  }

  /**
   * @return the column types, in order.
   */
  public List<Type> getColumnTypes() {
    return columnTypes;
  }

  /**
   * @return the number of columns.
   */
  public int numColumns() {
    return columnTypes.size();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Schema)) {
      return false;
    }
    Schema other = (Schema) o;
    return columnTypes.equals(other.columnTypes) && columnNames.equals(other.columnNames);
  }

  @Override
  public int hashCode() {
    return Objects.hash(columnTypes, columnNames);
  }

  /** @return "name (TYPE), name (TYPE), ...". */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < columnTypes.size(); ++i) {
      sb.append(i == 0 ? "" : ", ").append(columnNames.get(i)).append(" (").append(columnTypes.get(i)).append(')');
    }
    return sb.toString();
  }
}
