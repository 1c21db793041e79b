package com.github.simbo1905.pathstore.features;

import com.github.simbo1905.pathstore.JulLoggingConfig;
import com.github.simbo1905.pathstore.SizingMetadata;
import com.github.simbo1905.pathstore.Snapshot;
import com.github.simbo1905.pathstore.SnapshotStore;
import com.github.simbo1905.pathstore.StoreRegistry;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Size;
import org.junit.Assert;

/// Property-based checks of the paired index encoding: whatever mix of forward and reversed
/// snapshots is saved, and whichever order indices are loaded in or the cache forgets them, the
/// two halves of every pair disagree on direction and see the same payload.
public class PairedIndexPropertiesTest extends JulLoggingConfig {

  @Property(tries = 40)
  void siblingsAreAlwaysTimeReversed(
      @ForAll @Size(min = 1, max = 12) List<Boolean> directions,
      @ForAll @IntRange(min = 1, max = 8) int cacheSize,
      @ForAll long seed)
      throws IOException {
    try (var registry =
        StoreRegistry.builder().tempFile("paired", ".db").cacheSize(cacheSize).chunkRows(3).open()) {
      final var store = registry.register(new SnapshotStore("toy", Features.TOY));
      registry.initialize(SizingMetadata.of(3, 3));

      final List<Snapshot> saved = new ArrayList<>();
      for (int k = 0; k < directions.size(); k++) {
        final Snapshot forward = Features.toySnapshot(SnapshotStoreTest.matrix(k), SnapshotStoreTest.matrix(-k));
        final Snapshot snapshot = directions.get(k) ? forward.reversed() : forward;
        Assert.assertEquals(2L * k, store.save(snapshot));
        saved.add(snapshot);
      }
      Assert.assertEquals(2L * directions.size(), store.size());

      final var random = new Random(seed);
      for (int draw = 0; draw < 3 * directions.size(); draw++) {
        final long index = random.nextInt((int) store.size());
        final Snapshot loaded = store.load(index);
        final Snapshot expected = saved.get((int) (index >> 1));
        final boolean expectedReversed = (index & 1L) == 0 ? expected.isReversed() : !expected.isReversed();
        Assert.assertEquals(expectedReversed, loaded.isReversed());
        Assert.assertNotEquals(loaded.isReversed(), store.load(index ^ 1L).isReversed());
        Assert.assertArrayEquals(
            SnapshotStoreTest.matrix(index >> 1)[1],
            Features.coordinates(loaded)[1],
            0f);
        final float[][] velocities = Features.velocities(loaded);
        final float sign = loaded.isReversed() ? -1f : 1f;
        Assert.assertEquals(sign * SnapshotStoreTest.matrix(-(index >> 1))[2][1], velocities[2][1], 0f);
      }
    }
  }
}
