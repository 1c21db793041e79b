package com.github.simbo1905.pathstore;

import java.util.Arrays;
import java.util.Objects;

/// The fixed layout of one table column: the dimension it grows along, its element type
/// and the shape of a single row. An empty shape is a scalar.
public record ColumnDefinition(
    String name, String dimension, VariableType type, int[] shape, String description) {

  public ColumnDefinition {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(dimension, "dimension");
    Objects.requireNonNull(type, "type");
    shape = shape == null ? new int[0] : shape.clone();
    for (int extent : shape) {
      if (extent < 1) {
        throw new IllegalArgumentException(
            String.format("Column %s has non-positive extent in shape %s", name, Arrays.toString(shape)));
      }
    }
    description = description == null ? "" : description;
  }

  /// Number of payload bytes in one row.
  public int rowBytes() {
    int elements = 1;
    for (int extent : shape) {
      elements = Math.multiplyExact(elements, extent);
    }
    return Math.multiplyExact(elements, type.getWidth());
  }

  /// One row of the type's fill value, returned for rows that were never written.
  public byte[] fillRow() {
    return type.fill(rowBytes());
  }

  @Override
  public int[] shape() {
    return shape.clone();
  }

  /// Descriptions are documentation only so they take no part in layout equality.
  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    ColumnDefinition that = (ColumnDefinition) o;
    return name.equals(that.name)
        && dimension.equals(that.dimension)
        && type == that.type
        && Arrays.equals(shape, that.shape);
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hash(name, dimension, type) + Arrays.hashCode(shape);
  }

  @Override
  public String toString() {
    return String.format(
        "ColumnDefinition[name=%s, dimension=%s, type=%s, shape=%s]",
        name, dimension, type, Arrays.toString(shape));
  }
}
