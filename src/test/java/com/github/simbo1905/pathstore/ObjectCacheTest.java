package com.github.simbo1905.pathstore;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

import java.util.Optional;
import org.junit.Assert;
import org.junit.Test;

public class ObjectCacheTest extends JulLoggingConfig {

  @Test
  public void testPutSameInstanceIsIdempotent() {
    final var cache = new ObjectCache<String>("test", 4);
    final String value = new String("a");
    cache.put(0, value);
    cache.put(0, value);
    Assert.assertEquals(1, cache.size());
    Assert.assertSame(value, cache.get(0).orElseThrow());
  }

  @Test
  public void testPutDifferentInstanceNeedsInvalidate() {
    final var cache = new ObjectCache<String>("test", 4);
    cache.put(0, new String("a"));
    Assert.assertThrows(InconsistentStateException.class, () -> cache.put(0, new String("a")));
    cache.invalidate(0);
    final String replacement = new String("b");
    cache.put(0, replacement);
    Assert.assertSame(replacement, cache.get(0).orElseThrow());
  }

  @Test
  public void testLeastRecentlyUsedIsEvicted() {
    final var cache = new ObjectCache<String>("test", 2);
    cache.put(0, "zero");
    cache.put(1, "one");
    // touching 0 leaves 1 as the eldest
    cache.get(0);
    cache.put(2, "two");

    Assert.assertTrue(cache.contains(0));
    Assert.assertFalse(cache.contains(1));
    Assert.assertTrue(cache.contains(2));
    Assert.assertEquals(1, cache.stats().evictions());
  }

  @Test
  public void testStatsCountHitsAndMisses() {
    final var cache = new ObjectCache<String>("test", 2);
    cache.put(0, "zero");
    cache.get(0);
    cache.get(0);
    assertThat(cache.get(5), is(Optional.empty()));

    final CacheStats stats = cache.stats();
    Assert.assertEquals(2, stats.hits());
    Assert.assertEquals(1, stats.misses());
    Assert.assertEquals(1, stats.size());
    Assert.assertEquals(2, stats.maxSize());
    Assert.assertEquals(2.0 / 3.0, stats.hitRatio(), 1e-9);
  }

  @Test
  public void testNonPositiveSizeIsRejected() {
    Assert.assertThrows(IllegalArgumentException.class, () -> new ObjectCache<String>("test", 0));
  }
}
