package com.github.simbo1905.pathstore.features;

import com.github.simbo1905.pathstore.Feature;
import com.github.simbo1905.pathstore.Fields;
import com.github.simbo1905.pathstore.LazyProxy;
import com.github.simbo1905.pathstore.Snapshot;
import com.github.simbo1905.pathstore.SnapshotKind;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// The provided features by name and the snapshot kinds built from them.
public final class Features {

  public static final CoordinatesFeature COORDINATES = new CoordinatesFeature();
  public static final VelocitiesFeature VELOCITIES = new VelocitiesFeature();
  public static final BoxVectorsFeature BOX_VECTORS = new BoxVectorsFeature();
  public static final ConfigurationFeature CONFIGURATION = new ConfigurationFeature();
  public static final MomentumFeature MOMENTUM = new MomentumFeature();

  /// Snapshots referencing a stored configuration and momentum.
  public static final SnapshotKind FULL = SnapshotKind.of("snapshot", CONFIGURATION, MOMENTUM);

  /// Snapshots of toy models that keep positions and velocities inline.
  public static final SnapshotKind TOY = SnapshotKind.of("toy_snapshot", COORDINATES, VELOCITIES);

  private static final Map<String, Feature> BY_NAME = new LinkedHashMap<>();

  static {
    for (Feature feature : List.of(COORDINATES, VELOCITIES, BOX_VECTORS, CONFIGURATION, MOMENTUM)) {
      BY_NAME.put(feature.getName(), feature);
    }
  }

  private Features() {}

  /// @throws IllegalArgumentException if no provided feature has the name
  public static Feature byName(String name) {
    final Feature feature = BY_NAME.get(name);
    if (feature == null) {
      throw new IllegalArgumentException(
          "Unknown feature " + name + ", expected one of " + BY_NAME.keySet());
    }
    return feature;
  }

  /// A snapshot kind from provided feature names, in the given order.
  public static SnapshotKind kind(String name, String... featureNames) {
    final List<Feature> features = new ArrayList<>(featureNames.length);
    for (String featureName : featureNames) {
      features.add(byName(featureName));
    }
    return new SnapshotKind(name, features);
  }

  /// A forward {@link #FULL} snapshot of in memory or stored records.
  public static Snapshot snapshot(Configuration configuration, Momentum momentum) {
    return snapshot(LazyProxy.of(configuration), LazyProxy.of(momentum));
  }

  public static Snapshot snapshot(LazyProxy<Configuration> configuration, LazyProxy<Momentum> momentum) {
    return Snapshot.create(
        FULL,
        Fields.builder()
            .put(CONFIGURATION.getKey(), configuration)
            .put(MOMENTUM.getKey(), momentum)
            .build());
  }

  /// A forward {@link #TOY} snapshot.
  public static Snapshot toySnapshot(float[][] coordinates, float[][] velocities) {
    return Snapshot.create(
        TOY,
        Fields.builder()
            .put(CoordinatesFeature.COORDINATES, coordinates)
            .put(VelocitiesFeature.VELOCITIES, velocities)
            .build());
  }

  /// Positions of a snapshot of any kind that carries them inline or by reference.
  ///
  /// @throws IllegalArgumentException if the kind has neither
  public static float[][] coordinates(Snapshot snapshot) {
    if (snapshot.getKind().featureFor(CoordinatesFeature.COORDINATES).isPresent()) {
      return snapshot.get(CoordinatesFeature.COORDINATES);
    }
    if (snapshot.getKind().featureFor(CONFIGURATION.getKey()).isPresent()) {
      return snapshot.get(CONFIGURATION.getKey()).get().getCoordinates();
    }
    throw new IllegalArgumentException("Snapshot kind " + snapshot.getKind() + " has no coordinates");
  }

  /// Velocities of a snapshot in its own direction of time. Referenced momenta are stored once
  /// for both halves of a pair so they are negated here for a reversed snapshot.
  ///
  /// @throws IllegalArgumentException if the kind has no velocities
  public static float[][] velocities(Snapshot snapshot) {
    if (snapshot.getKind().featureFor(VelocitiesFeature.VELOCITIES).isPresent()) {
      return snapshot.get(VelocitiesFeature.VELOCITIES);
    }
    if (snapshot.getKind().featureFor(MOMENTUM.getKey()).isPresent()) {
      final float[][] velocities = snapshot.get(MOMENTUM.getKey()).get().velocitiesView();
      return snapshot.isReversed() ? Matrices.negate(velocities) : Matrices.copy(velocities);
    }
    throw new IllegalArgumentException("Snapshot kind " + snapshot.getKind() + " has no velocities");
  }

  static float[][] selectAtoms(float[][] matrix, int[] atoms) {
    if (atoms == null) {
      return Matrices.copy(matrix);
    }
    final float[][] selected = new float[atoms.length][];
    for (int a = 0; a < atoms.length; a++) {
      selected[a] = matrix[atoms[a]].clone();
    }
    return selected;
  }
}
