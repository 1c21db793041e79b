package com.github.simbo1905.pathstore;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import lombok.Synchronized;

/// A cheap stand in for a stored record that carries only its store and index. The record is
/// loaded on the first {@link #get()}, which goes through the store's cache so an index that
/// is already in memory is never read from the table again.
///
/// A proxy whose index turns out not to exist fails permanently: every later access throws
/// {@link RecordNotFoundException} without asking the store again. An I/O failure leaves the
/// proxy unresolved so a later access may try again.
///
/// @param <T> the record type
public final class LazyProxy<T extends StorableObject> implements Supplier<T> {

  private static final Logger logger = Logger.getLogger(LazyProxy.class.getName());

  public enum State {
    UNRESOLVED,
    RESOLVING,
    RESOLVED,
    FAILED
  }

  private final ObjectStore<T> store;

  private final long index;

  private volatile State state;

  private T value;

  private RecordNotFoundException failure;

  LazyProxy(ObjectStore<T> store, long index) {
    this.store = Objects.requireNonNull(store, "store");
    this.index = index;
    this.state = State.UNRESOLVED;
  }

  private LazyProxy(T value) {
    this.store = null;
    this.index = -1;
    this.value = Objects.requireNonNull(value, "value");
    this.state = State.RESOLVED;
  }

  /// Wraps an in memory record that has no store yet. Saving a snapshot that references it
  /// saves the record into the matching child store.
  public static <T extends StorableObject> LazyProxy<T> of(T value) {
    return new LazyProxy<>(value);
  }

  /// Returns the record, loading it on first access.
  ///
  /// @throws RecordNotFoundException if the index was never committed
  /// @throws UncheckedIOException if the table could not be read
  @Override
  @Synchronized
  public T get() {
    switch (state) {
      case RESOLVED:
        return value;
      case FAILED:
        throw new RecordNotFoundException(failure);
      case RESOLVING:
        throw new IllegalStateException(
            String.format("Recursive resolution of %s[%d]", store.getName(), index));
      default:
        break;
    }
    state = State.RESOLVING;
    try {
      value = store.load(index);
      state = State.RESOLVED;
      logger.log(Level.FINEST, () -> String.format("resolved %s[%d]", store.getName(), index));
      return value;
    } catch (RecordNotFoundException e) {
      failure = e;
      state = State.FAILED;
      throw e;
    } catch (IOException e) {
      state = State.UNRESOLVED;
      throw new UncheckedIOException(e);
    } catch (RuntimeException e) {
      state = State.UNRESOLVED;
      throw e;
    }
  }

  public State getState() {
    return state;
  }

  public boolean isResolved() {
    return state == State.RESOLVED;
  }

  /// Whether this proxy refers to a stored record rather than wrapping an in memory one.
  public boolean isAttached() {
    return store != null;
  }

  public boolean isAttachedTo(ObjectStore<?> other) {
    return store != null && store == other;
  }

  /// @throws IllegalStateException for a proxy made by {@link #of(StorableObject)}
  public ObjectStore<T> getStore() {
    if (store == null) {
      throw new IllegalStateException("Proxy wraps an unsaved record");
    }
    return store;
  }

  /// @throws IllegalStateException for a proxy made by {@link #of(StorableObject)}
  public long getIndex() {
    if (store == null) {
      throw new IllegalStateException("Proxy wraps an unsaved record");
    }
    return index;
  }

  /// Attached proxies are equal when they name the same store and index.
  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof LazyProxy)) return false;
    final LazyProxy<?> that = (LazyProxy<?>) o;
    if (store == null || that.store == null) {
      return false;
    }
    return store == that.store && index == that.index;
  }

  @Override
  public int hashCode() {
    return store == null ? System.identityHashCode(this) : 31 * System.identityHashCode(store) + Long.hashCode(index);
  }

  @Override
  public String toString() {
    return store == null
        ? String.format("LazyProxy[unsaved %s]", value.getClass().getSimpleName())
        : String.format("LazyProxy[%s[%d] %s]", store.getName(), index, state);
  }
}
