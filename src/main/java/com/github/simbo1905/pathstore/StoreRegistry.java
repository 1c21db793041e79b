package com.github.simbo1905.pathstore;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;
import lombok.Getter;
import lombok.Synchronized;

/// Composes object stores into one {@link VariableTable} file. Stores are looked up by the
/// class they hold, or for snapshot stores by their {@link SnapshotKind}.
///
/// Registering a store first registers the child stores its features depend on, so stores are
/// always initialized children first. Lookups do not take the registry lock; only
/// registration and initialization do.
///
/// Example usage:
/// <pre>
/// try (StoreRegistry registry = StoreRegistry.builder().path("paths.db").open()) {
///     registry.register(new SnapshotStore("snapshots", Features.FULL));
///     registry.initialize(SizingMetadata.of(22, 3));
///     long index = registry.save(snapshot);
/// }
/// </pre>
public final class StoreRegistry implements AutoCloseable {

  private static final Logger logger = Logger.getLogger(StoreRegistry.class.getName());

  /// System property overriding the default cache size per store.
  public static final String CACHE_SIZE_PROPERTY = StoreRegistry.class.getName() + ".cacheSize";

  /// System property overriding the default rows per chunk of new columns.
  public static final String CHUNK_ROWS_PROPERTY = StoreRegistry.class.getName() + ".chunkRows";

  public static final int DEFAULT_CACHE_SIZE = 10_000;

  public static final int DEFAULT_CHUNK_ROWS = 64;

  @Getter private final VariableTable table;

  /// Maximum cached records per store.
  @Getter private final int cacheSize;

  private final Map<Object, ObjectStore<?>> storesByKey = new ConcurrentHashMap<>();

  private final Map<String, ObjectStore<?>> storesByName = new ConcurrentHashMap<>();

  /// Registration order, which puts children before the stores that reference them.
  private final List<ObjectStore<?>> stores = new CopyOnWriteArrayList<>();

  private volatile SizingMetadata metadata;

  StoreRegistry(VariableTable table, int cacheSize) {
    this.table = Objects.requireNonNull(table, "table");
    if (cacheSize < 1) {
      throw new IllegalArgumentException("cacheSize must be positive, got " + cacheSize);
    }
    this.cacheSize = cacheSize;
  }

  public static StoreRegistryBuilder builder() {
    return new StoreRegistryBuilder();
  }

  /// Registers a store and, before it, every child store its features declare that is not
  /// registered yet. A store registered after {@link #initialize(SizingMetadata)} is
  /// initialized at once.
  ///
  /// @return the store
  /// @throws SchemaConflictException if another store already uses the name or key
  @Synchronized
  public <S extends ObjectStore<?>> S register(S store) throws IOException {
    Objects.requireNonNull(store, "store");
    if (stores.contains(store)) {
      return store;
    }
    for (Feature feature : store.getFeatures()) {
      for (ObjectStore<?> child : feature.createChildStores()) {
        if (storesByKey.containsKey(child.getStoreKey())) {
          logger.log(
              Level.FINE,
              () ->
                  String.format(
                      "child store for %s of feature %s already registered",
                      child.getStoreKey(), feature.getName()));
          continue;
        }
        register(child);
      }
    }
    final ObjectStore<?> byName = storesByName.get(store.getName());
    if (byName != null) {
      throw new SchemaConflictException(
          String.format("Store name %s is already used by %s", store.getName(), byName));
    }
    final ObjectStore<?> byKey = storesByKey.get(store.getStoreKey());
    if (byKey != null) {
      throw new SchemaConflictException(
          String.format("A store for %s is already registered: %s", store.getStoreKey(), byKey));
    }
    store.attach(this, cacheSize);
    storesByName.put(store.getName(), store);
    storesByKey.put(store.getStoreKey(), store);
    stores.add(store);
    logger.log(Level.FINE, () -> String.format("registered %s", store));
    if (metadata != null) {
      store.initialize(metadata);
    }
    return store;
  }

  /// Fixes the sizing of every registered store, children first, and persists it with the
  /// topology description in the file.
  ///
  /// @throws SchemaConflictException if the registry or the file was initialized differently
  @Synchronized
  public void initialize(SizingMetadata metadata) throws IOException {
    Objects.requireNonNull(metadata, "metadata");
    if (this.metadata != null && !this.metadata.equals(metadata)) {
      throw new SchemaConflictException(
          String.format("Registry initialized with %s, cannot reinitialize with %s", this.metadata, metadata));
    }
    final Optional<SizingMetadata> persisted = SizingMetadata.restore(table);
    if (persisted.isPresent() && !persisted.get().equals(metadata)) {
      throw new SchemaConflictException(
          String.format(
              "File %s was initialized with %s, cannot initialize with %s",
              table.getFilePath(), persisted.get(), metadata));
    }
    metadata.persist(table);
    this.metadata = metadata;
    for (ObjectStore<?> store : stores) {
      store.initialize(metadata);
    }
    logger.log(
        Level.FINE,
        () -> String.format("initialized %d stores with %s", stores.size(), metadata));
  }

  /// Initializes with the metadata persisted by an earlier session.
  ///
  /// @throws IllegalStateException if the file holds no metadata
  @Synchronized
  public SizingMetadata initializeFromFile() throws IOException {
    final SizingMetadata restored =
        SizingMetadata.restore(table)
            .orElseThrow(
                () ->
                    new IllegalStateException(
                        "File " + table.getFilePath() + " holds no sizing metadata"));
    initialize(restored);
    return restored;
  }

  public Optional<SizingMetadata> getSizingMetadata() {
    return Optional.ofNullable(metadata);
  }

  /// @throws UnknownClassException if no store holds the class
  @SuppressWarnings("unchecked")
  public <T extends StorableObject> ObjectStore<T> getStore(Class<T> type) {
    final ObjectStore<?> store = storesByKey.get(type);
    if (store == null) {
      throw new UnknownClassException(type);
    }
    return (ObjectStore<T>) store;
  }

  /// @throws UnknownClassException if no store holds the kind
  public SnapshotStore getSnapshotStore(SnapshotKind kind) {
    final ObjectStore<?> store = storesByKey.get(kind);
    if (!(store instanceof SnapshotStore)) {
      throw new UnknownClassException(kind);
    }
    return (SnapshotStore) store;
  }

  /// @throws UnknownClassException if no store has the name
  public ObjectStore<?> getStore(String name) {
    final ObjectStore<?> store = storesByName.get(name);
    if (store == null) {
      throw new UnknownClassException(name);
    }
    return store;
  }

  /// Registered stores, children before the stores that reference them.
  public List<ObjectStore<?>> getStores() {
    return new ArrayList<>(stores);
  }

  /// Saves a record into the store for its class, or for a snapshot the store for its kind.
  ///
  /// @throws UnknownClassException if no store holds the record
  public <T extends StorableObject> long save(T object) throws IOException {
    return storeFor(object).save(object);
  }

  public boolean isReadOnly() {
    return table.isReadOnly();
  }

  /// Writes the table directory and forces the file to the storage device.
  public void sync() throws IOException {
    table.sync();
  }

  @Override
  public void close() throws IOException {
    logger.log(Level.FINE, () -> String.format("close called on %s", table.getFilePath()));
    table.close();
  }

  @SuppressWarnings("unchecked")
  private <T extends StorableObject> ObjectStore<T> storeFor(T object) {
    final Object key = object instanceof Snapshot ? ((Snapshot) object).getKind() : object.getClass();
    final ObjectStore<?> store = storesByKey.get(key);
    if (store == null) {
      throw new UnknownClassException(key);
    }
    return (ObjectStore<T>) store;
  }

  @Override
  public String toString() {
    return String.format("StoreRegistry[%s stores=%s]", table.getFilePath(), storesByName.keySet());
  }
}
