package com.github.simbo1905.pathstore;

import java.nio.ByteBuffer;
import java.util.function.Function;
import java.util.function.ToIntFunction;
import lombok.Getter;

/// A named, typed variable contributed by a {@link Feature}. The shape of one row is a
/// function of the sizing metadata so that a feature can be declared before the system is
/// known.
///
/// @param <V> the in memory type of one row
public final class Variable<V> {

  @Getter private final String name;

  @Getter private final VariableType type;

  private final Function<SizingMetadata, int[]> shape;

  @Getter private final VariableCodec<V> codec;

  @Getter private final String description;

  public Variable(
      String name,
      VariableType type,
      Function<SizingMetadata, int[]> shape,
      VariableCodec<V> codec,
      String description) {
    this.name = name;
    this.type = type;
    this.shape = shape;
    this.codec = codec;
    this.description = description;
  }

  /// A float32 matrix whose extents are derived from the sizing metadata.
  public static Variable<float[][]> float32Matrix(
      String name,
      ToIntFunction<SizingMetadata> rows,
      ToIntFunction<SizingMetadata> cols,
      String description) {
    return new Variable<>(
        name,
        VariableType.FLOAT32,
        m -> new int[] {rows.applyAsInt(m), cols.applyAsInt(m)},
        VariableCodec.float32Matrix(),
        description);
  }

  public static Variable<Long> int64(String name, String description) {
    return new Variable<>(name, VariableType.INT64, m -> new int[0], VariableCodec.int64(), description);
  }

  public static Variable<Boolean> bool(String name, String description) {
    return new Variable<>(name, VariableType.BOOL, m -> new int[0], VariableCodec.bool(), description);
  }

  public static Variable<String> utf8(String name, int maxBytes, String description) {
    return new Variable<>(
        name,
        VariableType.CHAR,
        m -> new int[] {Short.BYTES + maxBytes},
        VariableCodec.utf8(),
        description);
  }

  public int[] shape(SizingMetadata metadata) {
    return shape.apply(metadata);
  }

  public FieldKey<V> getKey() {
    return FieldKey.of(name);
  }

  byte[] encode(V value, SizingMetadata metadata, int rowBytes) {
    final var buffer = ByteBuffer.allocate(rowBytes);
    codec.encode(value, shape(metadata), buffer);
    return buffer.array();
  }

  V decode(byte[] row, SizingMetadata metadata) {
    return codec.decode(shape(metadata), ByteBuffer.wrap(row));
  }

  @Override
  public String toString() {
    return "Variable[" + name + " " + type + "]";
  }
}
