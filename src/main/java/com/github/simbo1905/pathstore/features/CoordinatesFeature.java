package com.github.simbo1905.pathstore.features;

import com.github.simbo1905.pathstore.Feature;
import com.github.simbo1905.pathstore.FieldKey;
import com.github.simbo1905.pathstore.Fields;
import com.github.simbo1905.pathstore.SizingMetadata;
import com.github.simbo1905.pathstore.Variable;
import java.util.List;

/// Atomic positions stored inline as float32 `[atoms, spatial]`. Positions are the same in
/// both directions of time.
public final class CoordinatesFeature implements Feature {

  public static final Variable<float[][]> VARIABLE =
      Variable.float32Matrix(
          "coordinates",
          SizingMetadata::atomCount,
          SizingMetadata::spatialDimensions,
          "coordinate of atom '{ix[1]}' in dimension '{ix[2]}' of configuration '{ix[0]}'");

  public static final FieldKey<float[][]> COORDINATES = VARIABLE.getKey();

  @Override
  public String getName() {
    return "coordinates";
  }

  @Override
  public List<Variable<?>> getVariables() {
    return List.of(VARIABLE);
  }

  @Override
  public void validate(Fields fields) {
    Matrices.checkedCopy(COORDINATES.name(), fields.get(COORDINATES));
  }

  @Override
  @SuppressWarnings("unchecked")
  public <V> V copy(FieldKey<V> key, V value) {
    return COORDINATES.equals(key) ? (V) Matrices.copy((float[][]) value) : value;
  }
}
