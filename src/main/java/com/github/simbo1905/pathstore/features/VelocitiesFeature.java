package com.github.simbo1905.pathstore.features;

import com.github.simbo1905.pathstore.Feature;
import com.github.simbo1905.pathstore.FieldKey;
import com.github.simbo1905.pathstore.Fields;
import com.github.simbo1905.pathstore.SizingMetadata;
import com.github.simbo1905.pathstore.Variable;
import java.util.List;

/// Atomic velocities stored inline as float32 `[atoms, spatial]`. The time reversed twin of a
/// snapshot sees them negated.
public final class VelocitiesFeature implements Feature {

  public static final Variable<float[][]> VARIABLE =
      Variable.float32Matrix(
          "velocities",
          SizingMetadata::atomCount,
          SizingMetadata::spatialDimensions,
          "velocity of atom '{ix[1]}' in dimension '{ix[2]}' of momentum '{ix[0]}'");

  public static final FieldKey<float[][]> VELOCITIES = VARIABLE.getKey();

  @Override
  public String getName() {
    return "velocities";
  }

  @Override
  public List<Variable<?>> getVariables() {
    return List.of(VARIABLE);
  }

  @Override
  public void validate(Fields fields) {
    Matrices.checkedCopy(VELOCITIES.name(), fields.get(VELOCITIES));
  }

  @Override
  @SuppressWarnings("unchecked")
  public <V> V copy(FieldKey<V> key, V value) {
    return VELOCITIES.equals(key) ? (V) Matrices.copy((float[][]) value) : value;
  }

  @Override
  @SuppressWarnings("unchecked")
  public <V> V reverse(FieldKey<V> key, V value) {
    if (!VELOCITIES.equals(key) || value == null) {
      return value;
    }
    return (V) Matrices.negate((float[][]) value);
  }
}
