package com.github.simbo1905.pathstore;

import java.io.IOException;
import java.util.AbstractList;
import java.util.ArrayList;
import java.util.List;
import java.util.RandomAccess;

/// An immutable, ordered sequence of snapshot proxies. Frames are loaded only when a proxy is
/// dereferenced.
public final class Trajectory extends AbstractList<LazyProxy<Snapshot>> implements RandomAccess {

  private final List<LazyProxy<Snapshot>> frames;

  public Trajectory(List<LazyProxy<Snapshot>> frames) {
    this.frames = List.copyOf(frames);
  }

  /// A trajectory over stored indices of one snapshot store.
  public static Trajectory of(SnapshotStore store, long... indices) {
    final List<LazyProxy<Snapshot>> frames = new ArrayList<>(indices.length);
    for (long index : indices) {
      frames.add(store.proxy(index));
    }
    return new Trajectory(frames);
  }

  /// A trajectory over snapshots that may not be stored yet.
  public static Trajectory ofSnapshots(List<Snapshot> snapshots) {
    final List<LazyProxy<Snapshot>> frames = new ArrayList<>(snapshots.size());
    for (Snapshot snapshot : snapshots) {
      frames.add(LazyProxy.of(snapshot));
    }
    return new Trajectory(frames);
  }

  @Override
  public LazyProxy<Snapshot> get(int index) {
    return frames.get(index);
  }

  @Override
  public int size() {
    return frames.size();
  }

  /// The loaded snapshot of one frame.
  public Snapshot snapshot(int frame) {
    return frames.get(frame).get();
  }

  /// The same path run backwards: frames in reverse order, each replaced by its time reversed
  /// twin. Stored frames map to their sibling index so nothing is read.
  public Trajectory reversed() {
    final List<LazyProxy<Snapshot>> result = new ArrayList<>(frames.size());
    for (int i = frames.size() - 1; i >= 0; i--) {
      final LazyProxy<Snapshot> frame = frames.get(i);
      if (frame.isAttached()) {
        result.add(frame.getStore().proxy(frame.getIndex() ^ 1L));
      } else {
        result.add(LazyProxy.of(frame.get().reversed()));
      }
    }
    return new Trajectory(result);
  }

  /// The index of every frame in a store, saving frames that are not stored there yet.
  public long[] save(SnapshotStore store) throws IOException {
    final long[] indices = new long[frames.size()];
    for (int i = 0; i < indices.length; i++) {
      final LazyProxy<Snapshot> frame = frames.get(i);
      indices[i] = frame.isAttachedTo(store) ? frame.getIndex() : store.save(frame.get());
    }
    return indices;
  }

  @Override
  public String toString() {
    return "Trajectory[" + frames.size() + " frames]";
  }
}
