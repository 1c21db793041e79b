package com.github.simbo1905.pathstore;

/// Typed name of a feature field. Two keys are the same field when their names match.
///
/// @param <V> the in memory type of the field value
public record FieldKey<V>(String name) {

  public static <V> FieldKey<V> of(String name) {
    return new FieldKey<>(name);
  }

  @Override
  public String toString() {
    return name;
  }
}
