package com.github.simbo1905.pathstore;

import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import lombok.Getter;

/// A point in phase space built from the features of its {@link SnapshotKind}. Every snapshot
/// has a time reversed twin that shares its stored payload. {@link #get(FieldKey)} applies the
/// reversal transform of the owning feature on access, so a reversed snapshot reports negated
/// velocities while its payload stays in the orientation it was created in.
public final class Snapshot extends StorableObject {

  @Getter private final SnapshotKind kind;

  /// Field values in stored orientation.
  private final Fields fields;

  private final boolean reversed;

  private final SnapshotPair pair;

  private Snapshot(SnapshotKind kind, Fields fields, boolean reversed, SnapshotPair pair) {
    super(null);
    this.kind = kind;
    this.fields = fields;
    this.reversed = reversed;
    this.pair = pair;
  }

  /// Creates a forward snapshot.
  ///
  /// @throws IllegalArgumentException if a field of the kind is missing, an unknown field is
  /// supplied, or a feature rejects a value
  public static Snapshot create(SnapshotKind kind, Fields fields) {
    return create(kind, fields, false);
  }

  /// Creates a snapshot whose fields are given in stored orientation.
  public static Snapshot create(SnapshotKind kind, Fields fields, boolean reversed) {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(fields, "fields");
    final Set<String> expected = new HashSet<>();
    for (FieldKey<?> key : kind.getFieldKeys()) {
      if (!fields.contains(key)) {
        throw new IllegalArgumentException(
            String.format("Snapshot of kind %s is missing field %s", kind.getName(), key));
      }
      expected.add(key.name());
    }
    for (String name : fields.names()) {
      if (!expected.contains(name)) {
        throw new IllegalArgumentException(
            String.format("Snapshot kind %s has no field %s", kind.getName(), name));
      }
    }
    for (Feature feature : kind.getFeatures()) {
      feature.validate(fields);
    }
    final var copies = Fields.builder();
    for (FieldKey<?> key : kind.getFieldKeys()) {
      copyField(kind, key, fields, copies);
    }
    return new Snapshot(kind, copies.build(), reversed, new SnapshotPair());
  }

  private static <V> void copyField(
      SnapshotKind kind, FieldKey<V> key, Fields from, Fields.Builder to) {
    to.put(key, kind.featureFor(key).orElseThrow().copy(key, from.get(key)));
  }

  static Snapshot restore(SnapshotKind kind, Fields fields, boolean reversed, SnapshotPair pair) {
    return new Snapshot(kind, fields, reversed, pair);
  }

  /// The value of a field as seen in this snapshot's direction of time. Mutable values are
  /// returned as copies.
  public <V> V get(FieldKey<V> key) {
    final V raw = getRaw(key);
    if (!reversed) {
      return raw;
    }
    return kind.featureFor(key).orElseThrow().reverse(key, raw);
  }

  /// The value of a field in stored orientation, copied like {@link #get(FieldKey)}.
  public <V> V getRaw(FieldKey<V> key) {
    return kind.featureFor(key).orElseThrow().copy(key, fields.get(key));
  }

  public boolean isReversed() {
    return reversed;
  }

  /// The time reversed twin. It shares this snapshot's payload and pair token so saving both
  /// writes the payload once.
  public Snapshot reversed() {
    return new Snapshot(kind, fields, !reversed, pair);
  }

  /// Whether the other snapshot is this one or its twin.
  public boolean isTwinOf(Snapshot other) {
    return pair == other.pair;
  }

  /// Falls back to the pair token so a twin that was never saved itself still knows its index.
  @Override
  public Optional<Long> indexIn(ObjectStore<?> store) {
    final Optional<Long> own = super.indexIn(store);
    return own.isPresent() ? own : pair.indexIn(store, reversed);
  }

  Optional<Long> ownIndexIn(ObjectStore<?> store) {
    return super.indexIn(store);
  }

  Fields getFields() {
    return fields;
  }

  SnapshotPair getPair() {
    return pair;
  }

  @Override
  public String toString() {
    return String.format("Snapshot[%s reversed=%b %s]", kind.getName(), reversed, fields);
  }
}
