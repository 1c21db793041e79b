package com.github.simbo1905.pathstore.features;

import com.github.simbo1905.pathstore.ObjectStore;

/// References a {@link Momentum} in the `momenta` child store. The index is the same in both
/// directions of time; {@link Features#velocities} negates on access for reversed snapshots.
public final class MomentumFeature extends ReferenceFeature<Momentum> {

  public MomentumFeature() {
    super("momentum", Momentum.class, "index of the momentum of snapshot '{idx}'");
  }

  @Override
  protected ObjectStore<Momentum> createChildStore() {
    return new MomentumStore();
  }
}
