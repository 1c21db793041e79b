package com.github.simbo1905.pathstore;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

public class LazyProxyTest extends JulLoggingConfig {

  private Path file;

  private CountingFileOperations counting;

  private StoreRegistry registry;

  private Reading.Store store;

  @Before
  public void openRegistry() throws IOException {
    file = Files.createTempFile("lazy-proxy", ".db");
    registry =
        StoreRegistry.builder()
            .path(file)
            .fileOperationsDecorator(ops -> counting = new CountingFileOperations(ops))
            .open();
    store = registry.register(new Reading.Store("readings"));
    registry.initialize(SizingMetadata.of(1, 1));
  }

  @After
  public void closeRegistry() throws IOException {
    registry.close();
    Files.deleteIfExists(file);
  }

  @Test
  public void testResolvesOnceThroughCache() throws Exception {
    store.save(new Reading(3));
    store.invalidate(0);
    counting.resetCounts();

    final LazyProxy<Reading> proxy = store.proxy(0);
    Assert.assertEquals(LazyProxy.State.UNRESOLVED, proxy.getState());
    Assert.assertEquals(0, counting.getReads());

    final Reading first = proxy.get();
    final int readsAfterFirst = counting.getReads();
    Assert.assertTrue(readsAfterFirst > 0);
    Assert.assertSame(first, proxy.get());
    Assert.assertSame(first, store.proxy(0).get());
    Assert.assertEquals(readsAfterFirst, counting.getReads());
    Assert.assertTrue(proxy.isResolved());
  }

  @Test
  public void testFailureIsRemembered() {
    final LazyProxy<Reading> proxy = store.proxy(5);
    final var first = Assert.assertThrows(RecordNotFoundException.class, proxy::get);
    Assert.assertEquals(LazyProxy.State.FAILED, proxy.getState());

    final var second = Assert.assertThrows(RecordNotFoundException.class, proxy::get);
    Assert.assertSame(first, second.getCause());
    Assert.assertEquals(5, second.getIndex());
  }

  @Test
  public void testFailedProxyStaysFailedAfterIndexIsWritten() throws Exception {
    final LazyProxy<Reading> proxy = store.proxy(0);
    Assert.assertThrows(RecordNotFoundException.class, proxy::get);
    store.save(new Reading(1));
    Assert.assertThrows(RecordNotFoundException.class, proxy::get);
    Assert.assertEquals(1L, store.proxy(0).get().value);
  }

  @Test
  public void testDetachedProxyWrapsValue() {
    final var reading = new Reading(9);
    final LazyProxy<Reading> proxy = LazyProxy.of(reading);
    Assert.assertTrue(proxy.isResolved());
    Assert.assertFalse(proxy.isAttached());
    Assert.assertSame(reading, proxy.get());
    Assert.assertThrows(IllegalStateException.class, proxy::getIndex);
    Assert.assertNotEquals(proxy, LazyProxy.of(reading));
  }

  @Test
  public void testAttachedProxiesAreEqualByStoreAndIndex() {
    Assert.assertEquals(store.proxy(2), store.proxy(2));
    Assert.assertEquals(store.proxy(2).hashCode(), store.proxy(2).hashCode());
    Assert.assertNotEquals(store.proxy(2), store.proxy(3));
    Assert.assertTrue(store.proxy(2).isAttachedTo(store));
  }
}
