package com.github.simbo1905.pathstore;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import lombok.Getter;
import lombok.Synchronized;

/// Bounded identity map from store index to the one live instance for that index. Eviction is
/// least recently used by access order.
///
/// @param <T> the cached record type
public final class ObjectCache<T> {

  private static final Logger logger = Logger.getLogger(ObjectCache.class.getName());

  @Getter private final String storeName;

  @Getter private final int maxSize;

  private final Map<Long, T> entries;

  private long hits;
  private long misses;
  private long evictions;

  public ObjectCache(String storeName, int maxSize) {
    if (maxSize < 1) {
      throw new IllegalArgumentException("Cache size must be positive, got " + maxSize);
    }
    this.storeName = storeName;
    this.maxSize = maxSize;
    this.entries =
        new LinkedHashMap<>(Math.min(maxSize, 1024), 0.75f, true) {
          @Override
          protected boolean removeEldestEntry(Map.Entry<Long, T> eldest) {
            if (size() > ObjectCache.this.maxSize) {
              evictions++;
              logger.log(
                  Level.FINEST,
                  () -> String.format("evict %s[%d]", ObjectCache.this.storeName, eldest.getKey()));
              return true;
            }
            return false;
          }
        };
  }

  /// Looks up an index, counting a hit or a miss and refreshing its recency.
  @Synchronized
  public Optional<T> get(long index) {
    final T value = entries.get(index);
    if (value == null) {
      misses++;
    } else {
      hits++;
    }
    return Optional.ofNullable(value);
  }

  @Synchronized
  public boolean contains(long index) {
    return entries.containsKey(index);
  }

  /// Inserts an instance. Inserting the instance already held for the index is a no-op.
  ///
  /// @throws InconsistentStateException if a different instance is cached for the index;
  /// callers replace an entry only after {@link #invalidate(long)}
  @Synchronized
  public void put(long index, T value) {
    final T existing = entries.get(index);
    if (existing == value) {
      return;
    }
    if (existing != null) {
      throw new InconsistentStateException(
          String.format("Index %d of store %s is cached with another instance", index, storeName));
    }
    entries.put(index, value);
  }

  @Synchronized
  public void invalidate(long index) {
    entries.remove(index);
  }

  @Synchronized
  public void clear() {
    entries.clear();
  }

  @Synchronized
  public int size() {
    return entries.size();
  }

  @Synchronized
  public CacheStats stats() {
    return new CacheStats(hits, misses, evictions, entries.size(), maxSize);
  }
}
