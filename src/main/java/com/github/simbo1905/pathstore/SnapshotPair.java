package com.github.simbo1905.pathstore;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.WeakHashMap;

/// Token shared by a snapshot and its time reversed twin. It records, per store, the even index
/// of the pair and the orientation stored there, which is enough to find either half without
/// the two snapshots pointing at each other.
final class SnapshotPair {

  /// Where a pair lives in one store.
  ///
  /// @param baseIndex the even index of the pair
  /// @param baseReversed the reversal flag of the snapshot at the even index
  record Slot(long baseIndex, boolean baseReversed) {
    long indexOf(boolean reversed) {
      return reversed == baseReversed ? baseIndex : baseIndex + 1;
    }
  }

  private final Map<ObjectStore<?>, Slot> slots = Collections.synchronizedMap(new WeakHashMap<>());

  Optional<Slot> slot(ObjectStore<?> store) {
    return Optional.ofNullable(slots.get(store));
  }

  /// The index of the half with the given orientation, if the pair is stored in the store.
  Optional<Long> indexIn(ObjectStore<?> store, boolean reversed) {
    return slot(store).map(slot -> slot.indexOf(reversed));
  }

  void bind(ObjectStore<?> store, long baseIndex, boolean baseReversed) {
    if ((baseIndex & 1L) != 0) {
      throw new IllegalArgumentException("Pair base index must be even, got " + baseIndex);
    }
    final var slot = new Slot(baseIndex, baseReversed);
    final Slot previous = slots.putIfAbsent(store, slot);
    if (previous != null && !previous.equals(slot)) {
      throw new InconsistentStateException(
          String.format(
              "Pair already stored in %s as %s, cannot rebind as %s",
              store.getName(), previous, slot));
    }
  }
}
