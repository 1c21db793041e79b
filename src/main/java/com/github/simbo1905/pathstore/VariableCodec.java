package com.github.simbo1905.pathstore;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/// Converts one row of a variable between its in memory value and the bytes of a table row.
/// Codecs are stateless; the row shape is resolved from the sizing metadata by the caller.
///
/// @param <V> the in memory type
public interface VariableCodec<V> {

  void encode(V value, int[] shape, ByteBuffer out);

  V decode(int[] shape, ByteBuffer in);

  /// A rank two float32 array. A null value is stored as NaN fill and reads back as null, the
  /// way an unset netCDF variable reads as its fill value.
  static VariableCodec<float[][]> float32Matrix() {
    return new VariableCodec<>() {
      @Override
      public void encode(float[][] value, int[] shape, ByteBuffer out) {
        final int rows = shape[0];
        final int cols = shape[1];
        if (value == null) {
          for (int i = 0; i < rows * cols; i++) {
            out.putFloat(Float.NaN);
          }
          return;
        }
        if (value.length != rows) {
          throw new IllegalArgumentException(
              String.format("Expected %d rows but got %d", rows, value.length));
        }
        for (float[] row : value) {
          if (row.length != cols) {
            throw new IllegalArgumentException(
                String.format("Expected %d columns but got %d", cols, row.length));
          }
          for (float v : row) {
            out.putFloat(v);
          }
        }
      }

      @Override
      public float[][] decode(int[] shape, ByteBuffer in) {
        final float[][] value = new float[shape[0]][shape[1]];
        for (float[] row : value) {
          for (int c = 0; c < row.length; c++) {
            row[c] = in.getFloat();
          }
        }
        return Float.isNaN(value[0][0]) ? null : value;
      }
    };
  }

  static VariableCodec<Boolean> bool() {
    return new VariableCodec<>() {
      @Override
      public void encode(Boolean value, int[] shape, ByteBuffer out) {
        if (value == null) {
          throw new IllegalArgumentException("Boolean variables cannot be null");
        }
        out.put(value ? (byte) 1 : (byte) 0);
      }

      @Override
      public Boolean decode(int[] shape, ByteBuffer in) {
        return in.get() != 0;
      }
    };
  }

  static VariableCodec<Long> int64() {
    return new VariableCodec<>() {
      @Override
      public void encode(Long value, int[] shape, ByteBuffer out) {
        if (value == null) {
          throw new IllegalArgumentException("Index variables cannot be null");
        }
        out.putLong(value);
      }

      @Override
      public Long decode(int[] shape, ByteBuffer in) {
        return in.getLong();
      }
    };
  }

  /// A length prefixed UTF-8 string in a CHAR row of `shape[0]` bytes. The prefix is a signed
  /// short where -1 marks null.
  static VariableCodec<String> utf8() {
    return new VariableCodec<>() {
      @Override
      public void encode(String value, int[] shape, ByteBuffer out) {
        if (value == null) {
          out.putShort((short) -1);
          return;
        }
        final byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        if (bytes.length > shape[0] - Short.BYTES) {
          throw new IllegalArgumentException(
              String.format(
                  "String of %d bytes exceeds the %d bytes permitted",
                  bytes.length, shape[0] - Short.BYTES));
        }
        out.putShort((short) bytes.length);
        out.put(bytes);
      }

      @Override
      public String decode(int[] shape, ByteBuffer in) {
        final short length = in.getShort();
        if (length < 0) {
          return null;
        }
        final byte[] bytes = new byte[length];
        in.get(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
      }
    };
  }
}
