package com.github.simbo1905.pathstore.features;

import com.github.simbo1905.pathstore.Fields;
import com.github.simbo1905.pathstore.ObjectStore;
import java.io.IOException;
import java.util.List;

/// Holds {@link Configuration}s by name in the `configurations` dimension.
public class ConfigurationStore extends ObjectStore<Configuration> {

  public static final String NAME = "configurations";

  public ConfigurationStore() {
    this(NAME);
  }

  public ConfigurationStore(String name) {
    super(name, Configuration.class, List.of(new CoordinatesFeature(), new BoxVectorsFeature()), true);
  }

  @Override
  protected Fields toFields(Configuration configuration) {
    return Fields.builder()
        .put(CoordinatesFeature.COORDINATES, configuration.coordinatesView())
        .put(BoxVectorsFeature.BOX_VECTORS, configuration.boxVectorsView())
        .build();
  }

  @Override
  protected Configuration fromFields(Fields fields, long index, String name) {
    return new Configuration(
        fields.get(CoordinatesFeature.COORDINATES), fields.get(BoxVectorsFeature.BOX_VECTORS), name);
  }

  /// Coordinates of several frames as one `[frames][atoms][spatial]` block.
  ///
  /// @param frames the store indices to read, in output order
  /// @param atoms the atom indices to keep, or null for every atom
  /// @throws com.github.simbo1905.pathstore.RecordNotFoundException if a frame is not stored
  public float[][][] coordinatesAsArray(long[] frames, int[] atoms) throws IOException {
    final float[][][] block = new float[frames.length][][];
    for (int f = 0; f < frames.length; f++) {
      block[f] = Features.selectAtoms(load(frames[f]).coordinatesView(), atoms);
    }
    return block;
  }
}
