package com.github.simbo1905.pathstore;

import java.nio.ByteBuffer;
import java.util.Arrays;

/// Element types a table column can hold. The code byte is what the directory
/// persists so that reordering the constants never changes the file format.
public enum VariableType {
  BOOL((byte) 1, 1),
  CHAR((byte) 2, 1),
  INT32((byte) 3, Integer.BYTES),
  INT64((byte) 4, Long.BYTES),
  FLOAT32((byte) 5, Float.BYTES),
  FLOAT64((byte) 6, Double.BYTES);

  final byte code;
  final int width;

  VariableType(byte code, int width) {
    this.code = code;
    this.width = width;
  }

  /// Width of one element in bytes.
  public int getWidth() {
    return width;
  }

  /// A row of `rowBytes` holding the fill value that stands for "never written": NaN for the
  /// floating point types, zero for the others.
  byte[] fill(int rowBytes) {
    final var row = ByteBuffer.allocate(rowBytes);
    if (this == FLOAT32) {
      while (row.hasRemaining()) {
        row.putFloat(Float.NaN);
      }
    } else if (this == FLOAT64) {
      while (row.hasRemaining()) {
        row.putDouble(Double.NaN);
      }
    }
    return row.array();
  }

  static VariableType fromCode(byte code) {
    return Arrays.stream(values())
        .filter(t -> t.code == code)
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown variable type code " + code));
  }
}
