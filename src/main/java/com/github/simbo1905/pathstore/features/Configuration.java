package com.github.simbo1905.pathstore.features;

import com.github.simbo1905.pathstore.SizingMetadata;
import com.github.simbo1905.pathstore.StorableObject;

/// Atomic positions of one frame and, for periodic systems, the box vectors.
///
/// Values are copied on the way in and on the way out so a saved configuration cannot change.
public final class Configuration extends StorableObject {

  private final float[][] coordinates;

  private final float[][] boxVectors;

  public Configuration(float[][] coordinates) {
    this(coordinates, null, null);
  }

  public Configuration(float[][] coordinates, float[][] boxVectors) {
    this(coordinates, boxVectors, null);
  }

  /// @param coordinates positions as `[atoms][spatial]`
  /// @param boxVectors `[spatial][spatial]` box vectors, or null for a non-periodic system
  /// @param name optional name the configuration store persists
  /// @throws IllegalArgumentException if a matrix is ragged, mis-shaped or not finite
  public Configuration(float[][] coordinates, float[][] boxVectors, String name) {
    super(name);
    this.coordinates = Matrices.checkedCopy(CoordinatesFeature.COORDINATES.name(), coordinates);
    if (boxVectors != null) {
      final float[][] box = Matrices.checkedCopy(BoxVectorsFeature.BOX_VECTORS.name(), boxVectors);
      final int spatial = getSpatialDimensions();
      if (box.length != spatial || box[0].length != spatial) {
        throw new IllegalArgumentException(
            String.format(
                "box_vectors must be %dx%d, got %dx%d", spatial, spatial, box.length, box[0].length));
      }
      this.boxVectors = box;
    } else {
      this.boxVectors = null;
    }
  }

  public float[][] getCoordinates() {
    return Matrices.copy(coordinates);
  }

  /// @return a copy of the box vectors, or null for a non-periodic system
  public float[][] getBoxVectors() {
    return boxVectors == null ? null : Matrices.copy(boxVectors);
  }

  public int getAtomCount() {
    return coordinates.length;
  }

  public int getSpatialDimensions() {
    return coordinates[0].length;
  }

  /// Sizing taken from this configuration, for initializing a registry from a template frame.
  public SizingMetadata getSizingMetadata() {
    return SizingMetadata.of(getAtomCount(), getSpatialDimensions());
  }

  float[][] coordinatesView() {
    return coordinates;
  }

  float[][] boxVectorsView() {
    return boxVectors;
  }

  @Override
  public String toString() {
    return String.format(
        "Configuration[%s atoms=%d spatial=%d periodic=%b]",
        getName().orElse("-"), getAtomCount(), getSpatialDimensions(), boxVectors != null);
  }
}
