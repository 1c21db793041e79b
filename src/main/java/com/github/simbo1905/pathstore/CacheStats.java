package com.github.simbo1905.pathstore;

/// Point in time counters of an {@link ObjectCache}.
public record CacheStats(long hits, long misses, long evictions, int size, int maxSize) {

  public double hitRatio() {
    final long lookups = hits + misses;
    return lookups == 0 ? 0.0 : (double) hits / lookups;
  }

  @Override
  public String toString() {
    return String.format(
        "CacheStats[size=%d/%d, hits=%d, misses=%d, evictions=%d]",
        size, maxSize, hits, misses, evictions);
  }
}
