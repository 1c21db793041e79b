package com.github.simbo1905.pathstore.features;

import com.github.simbo1905.pathstore.Feature;
import com.github.simbo1905.pathstore.FieldKey;
import com.github.simbo1905.pathstore.Fields;
import com.github.simbo1905.pathstore.SizingMetadata;
import com.github.simbo1905.pathstore.Variable;
import java.util.List;

/// Periodic box vectors stored as float32 `[spatial, spatial]`. A null value marks a
/// non-periodic frame.
public final class BoxVectorsFeature implements Feature {

  public static final Variable<float[][]> VARIABLE =
      Variable.float32Matrix(
          "box_vectors",
          SizingMetadata::spatialDimensions,
          SizingMetadata::spatialDimensions,
          "box vector '{ix[1]}' in dimension '{ix[2]}' of configuration '{ix[0]}'");

  public static final FieldKey<float[][]> BOX_VECTORS = VARIABLE.getKey();

  @Override
  public String getName() {
    return "box_vectors";
  }

  @Override
  public List<Variable<?>> getVariables() {
    return List.of(VARIABLE);
  }

  @Override
  public void validate(Fields fields) {
    final float[][] box = fields.get(BOX_VECTORS);
    if (box != null) {
      Matrices.checkedCopy(BOX_VECTORS.name(), box);
    }
  }

  @Override
  @SuppressWarnings("unchecked")
  public <V> V copy(FieldKey<V> key, V value) {
    return BOX_VECTORS.equals(key) ? (V) Matrices.copy((float[][]) value) : value;
  }
}
