package com.github.simbo1905.pathstore.features;

import com.github.simbo1905.pathstore.Fields;
import com.github.simbo1905.pathstore.ObjectStore;
import java.io.IOException;
import java.util.List;

/// Holds {@link Momentum}s in the `momenta` dimension.
public class MomentumStore extends ObjectStore<Momentum> {

  public static final String NAME = "momenta";

  public MomentumStore() {
    this(NAME);
  }

  public MomentumStore(String name) {
    super(name, Momentum.class, List.of(new VelocitiesFeature()), true);
  }

  @Override
  protected Fields toFields(Momentum momentum) {
    return Fields.builder().put(VelocitiesFeature.VELOCITIES, momentum.velocitiesView()).build();
  }

  @Override
  protected Momentum fromFields(Fields fields, long index, String name) {
    return new Momentum(fields.get(VelocitiesFeature.VELOCITIES), name);
  }

  /// Velocities of several frames as one `[frames][atoms][spatial]` block.
  ///
  /// @param frames the store indices to read, in output order
  /// @param atoms the atom indices to keep, or null for every atom
  public float[][][] velocitiesAsArray(long[] frames, int[] atoms) throws IOException {
    final float[][][] block = new float[frames.length][][];
    for (int f = 0; f < frames.length; f++) {
      block[f] = Features.selectAtoms(load(frames[f]).velocitiesView(), atoms);
    }
    return block;
  }
}
