package com.github.simbo1905.pathstore.features;

import com.github.simbo1905.pathstore.StorableObject;

/// Atomic velocities of one frame, as `[atoms][spatial]`.
public final class Momentum extends StorableObject {

  private final float[][] velocities;

  public Momentum(float[][] velocities) {
    this(velocities, null);
  }

  /// @throws IllegalArgumentException if the matrix is ragged or not finite
  public Momentum(float[][] velocities, String name) {
    super(name);
    this.velocities = Matrices.checkedCopy(VelocitiesFeature.VELOCITIES.name(), velocities);
  }

  public float[][] getVelocities() {
    return Matrices.copy(velocities);
  }

  public int getAtomCount() {
    return velocities.length;
  }

  float[][] velocitiesView() {
    return velocities;
  }

  @Override
  public String toString() {
    return String.format("Momentum[%s atoms=%d]", getName().orElse("-"), getAtomCount());
  }
}
