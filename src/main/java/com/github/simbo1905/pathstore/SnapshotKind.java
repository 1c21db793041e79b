package com.github.simbo1905.pathstore;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import lombok.Getter;

/// Names a class of snapshot and the ordered features its records carry. A registry keeps one
/// {@link SnapshotStore} per kind.
///
/// Two kinds are equal when they have the same name and the same feature names in the same
/// order.
public final class SnapshotKind {

  @Getter private final String name;

  @Getter private final List<Feature> features;

  private final Map<String, Feature> featureByField = new HashMap<>();

  public SnapshotKind(String name, List<Feature> features) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("Snapshot kind needs a name");
    }
    if (features.isEmpty()) {
      throw new IllegalArgumentException("Snapshot kind " + name + " declares no features");
    }
    this.name = name;
    this.features = List.copyOf(features);
    for (Feature feature : this.features) {
      for (FieldKey<?> key : feature.getFieldKeys()) {
        final Feature previous = featureByField.putIfAbsent(key.name(), feature);
        if (previous != null) {
          throw new SchemaConflictException(
              String.format(
                  "Field %s of snapshot kind %s is declared by both %s and %s",
                  key, name, previous.getName(), feature.getName()));
        }
      }
    }
  }

  public static SnapshotKind of(String name, Feature... features) {
    return new SnapshotKind(name, List.of(features));
  }

  /// The fields a snapshot of this kind carries, in feature order.
  public List<FieldKey<?>> getFieldKeys() {
    final List<FieldKey<?>> keys = new ArrayList<>();
    for (Feature feature : features) {
      keys.addAll(feature.getFieldKeys());
    }
    return keys;
  }

  public Optional<Feature> featureFor(FieldKey<?> key) {
    return Optional.ofNullable(featureByField.get(key.name()));
  }

  public List<String> getFeatureNames() {
    return features.stream().map(Feature::getName).toList();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof SnapshotKind)) return false;
    final SnapshotKind that = (SnapshotKind) o;
    return name.equals(that.name) && getFeatureNames().equals(that.getFeatureNames());
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, getFeatureNames());
  }

  @Override
  public String toString() {
    return "SnapshotKind[" + name + " " + getFeatureNames() + "]";
  }
}
