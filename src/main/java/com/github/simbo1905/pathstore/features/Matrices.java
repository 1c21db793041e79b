package com.github.simbo1905.pathstore.features;

/// Checks and copies for the `float[atoms][spatial]` matrices that features store.
final class Matrices {

  private Matrices() {}

  /// Returns a deep copy after checking the matrix is rectangular, non-empty and finite.
  ///
  /// @throws IllegalArgumentException if the matrix is null, ragged, empty or holds NaN or
  /// infinity
  static float[][] checkedCopy(String field, float[][] value) {
    if (value == null) {
      throw new IllegalArgumentException(field + " must not be null");
    }
    if (value.length == 0 || value[0] == null || value[0].length == 0) {
      throw new IllegalArgumentException(field + " must not be empty");
    }
    final int cols = value[0].length;
    final float[][] copy = new float[value.length][];
    for (int r = 0; r < value.length; r++) {
      final float[] row = value[r];
      if (row == null || row.length != cols) {
        throw new IllegalArgumentException(
            String.format("%s row %d has %s values, expected %d",
                field, r, row == null ? "no" : Integer.toString(row.length), cols));
      }
      for (int c = 0; c < cols; c++) {
        if (!Float.isFinite(row[c])) {
          throw new IllegalArgumentException(
              String.format("%s[%d][%d] is not finite: %s", field, r, c, row[c]));
        }
      }
      copy[r] = row.clone();
    }
    return copy;
  }

  /// Deep copy; null stays null.
  static float[][] copy(float[][] value) {
    if (value == null) {
      return null;
    }
    final float[][] copy = new float[value.length][];
    for (int r = 0; r < value.length; r++) {
      copy[r] = value[r].clone();
    }
    return copy;
  }

  static float[][] negate(float[][] value) {
    final float[][] negated = new float[value.length][];
    for (int r = 0; r < value.length; r++) {
      negated[r] = new float[value[r].length];
      for (int c = 0; c < value[r].length; c++) {
        negated[r][c] = -value[r][c];
      }
    }
    return negated;
  }
}
