package com.github.simbo1905.pathstore;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.WeakHashMap;

/// A logical record that an {@link ObjectStore} can persist. Instances are immutable once
/// saved. Equality is identity: the cache hands out one instance per stored index.
public abstract class StorableObject {

  /// The longest name, in UTF-8 bytes, a store can persist.
  public static final int MAX_NAME_BYTES = 64;

  private final String name;

  /// Index of this instance in every store that has saved or loaded it.
  private final Map<ObjectStore<?>, Long> indices =
      Collections.synchronizedMap(new WeakHashMap<>());

  protected StorableObject(String name) {
    if (name != null && name.getBytes(StandardCharsets.UTF_8).length > MAX_NAME_BYTES) {
      throw new IllegalArgumentException(
          String.format("Name longer than %d UTF-8 bytes: %s", MAX_NAME_BYTES, name));
    }
    this.name = name;
  }

  public Optional<String> getName() {
    return Optional.ofNullable(name);
  }

  /// The index of this object in the given store, if it was saved there or loaded from there.
  public Optional<Long> indexIn(ObjectStore<?> store) {
    return Optional.ofNullable(indices.get(store));
  }

  void assignIndex(ObjectStore<?> store, long index) {
    final Long previous = indices.putIfAbsent(store, index);
    if (previous != null && previous != index) {
      throw new InconsistentStateException(
          String.format(
              "%s already holds index %d in store %s, cannot assign %d",
              getClass().getSimpleName(), previous, store.getName(), index));
    }
  }
}
