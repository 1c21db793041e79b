package com.github.simbo1905.pathstore;

import java.io.IOException;
import java.util.AbstractList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.RandomAccess;
import java.util.logging.Level;
import java.util.logging.Logger;
import lombok.Getter;
import lombok.Synchronized;

/// Manages the records of one class inside a {@link StoreRegistry}: allocates indices, drives
/// the declared {@link Feature}s to read and write each record, and keeps the cache that makes
/// `load(i)` return the same instance while `i` stays cached.
///
/// Indices are allocated append only starting at zero. A store writes only through its own
/// columns; the table itself belongs to the registry.
///
/// One writer at a time. Saves, loads and the cache check-then-insert run under one lock per
/// store so concurrent readers still observe a single instance per index.
///
/// @param <T> the record type
public abstract class ObjectStore<T extends StorableObject> {

  private static final Logger logger = Logger.getLogger(ObjectStore.class.getName());

  /// Reserved variable holding the optional record name in named stores.
  public static final String NAME_VARIABLE = "name";

  private static final Variable<String> NAME =
      Variable.utf8(NAME_VARIABLE, StorableObject.MAX_NAME_BYTES, "the name of record '{idx}'");

  /// Store name, also the prefix of its columns.
  @Getter private final String name;

  @Getter private final Class<T> contentClass;

  @Getter private final List<Feature> features;

  /// Whether the store persists record names.
  @Getter private final boolean named;

  private StoreRegistry registry;

  private ObjectCache<T> cache;

  private SizingMetadata metadata;

  private StoreContext context;

  /// Number of committed indices.
  private long count;

  protected ObjectStore(String name, Class<T> contentClass, List<Feature> features, boolean named) {
    if (name == null || name.isEmpty() || name.contains(".")) {
      throw new IllegalArgumentException("Store name must be non-empty without dots: " + name);
    }
    this.name = name;
    this.contentClass = Objects.requireNonNull(contentClass, "contentClass");
    this.features = List.copyOf(features);
    this.named = named;
  }

  /// Field values of a record in the orientation they are stored.
  protected abstract Fields toFields(T object);

  /// Builds a record from fields read from the table.
  ///
  /// @param index the index being loaded
  /// @param name the persisted name, null for unnamed records and stores
  protected abstract T fromFields(Fields fields, long index, String name) throws IOException;

  /// The key a registry files this store under. Plain stores are keyed by their content class.
  public Object getStoreKey() {
    return contentClass;
  }

  /// Dimension with one row per index.
  protected String indexDimension() {
    return name;
  }

  /// Dimension with one row per physical payload.
  protected String payloadDimension() {
    return name;
  }

  /// The payload row holding the feature data of an index.
  protected long payloadRow(long index) {
    return index;
  }

  /// Variable names that the store itself uses and features may not declare.
  protected List<String> reservedVariableNames() {
    return named ? List.of(NAME_VARIABLE) : List.of();
  }

  /// Allocates columns the store needs beyond those of its features.
  protected void initializeReserved(StoreContext context) {
    if (named) {
      context.createIndexColumn(NAME);
    }
  }

  @Synchronized
  void attach(StoreRegistry registry, int cacheSize) {
    if (this.registry != null) {
      throw new IllegalStateException(
          String.format("Store %s is already attached to %s", name, this.registry));
    }
    this.registry = registry;
    this.cache = new ObjectCache<>(name, cacheSize);
  }

  /// Fixes the variable shapes of this store. Must be called once before any save or load.
  /// Calling again with identical metadata is a no-op.
  ///
  /// @throws SchemaConflictException if the metadata differs from an earlier call or from the
  /// metadata persisted in the file, or if two features declare the same variable
  @Synchronized
  public void initialize(SizingMetadata metadata) throws IOException {
    Objects.requireNonNull(metadata, "metadata");
    ensureAttached();
    if (this.metadata != null) {
      if (this.metadata.equals(metadata)) {
        logger.log(Level.FINE, () -> String.format("initialize %s repeated, no-op", name));
        return;
      }
      throw new SchemaConflictException(
          String.format(
              "Store %s initialized with %s, cannot reinitialize with %s",
              name, this.metadata, metadata));
    }
    checkVariableNames();

    final var table = registry.getTable();
    final String sizingAttribute = name + ".sizing";
    final var persisted = table.getAttribute(sizingAttribute);
    if (persisted.isPresent() && !persisted.get().equals(metadata.encodeShape())) {
      throw new SchemaConflictException(
          String.format(
              "Store %s was created with %s, cannot initialize with %s",
              name, persisted.get(), metadata.encodeShape()));
    }
    if (persisted.isEmpty() && table.isReadOnly()) {
      throw new IllegalStateException(
          String.format("Store %s is not present in read-only file %s", name, table.getFilePath()));
    }

    table.createDimension(indexDimension());
    table.createDimension(payloadDimension());
    final var newContext =
        new StoreContext(registry, metadata, name, indexDimension(), payloadDimension());
    for (Feature feature : features) {
      feature.initialize(newContext);
    }
    initializeReserved(newContext);
    table.setAttribute(sizingAttribute, metadata.encodeShape());

    this.context = newContext;
    this.count = table.dimensionLength(indexDimension());
    this.metadata = metadata;
    logger.log(
        Level.FINE,
        () ->
            String.format(
                "initialized store %s features=%s count=%d",
                name, featureNames(), count));
  }

  /// Saves a record. A record this store already holds is rewritten in place at its index;
  /// any other record gets the next free index.
  ///
  /// @return the index of the record in this store
  /// @throws InconsistentStateException if the record does not belong in this store
  /// @throws IllegalStateException if the store has not been initialized
  @Synchronized
  public long save(T object) throws IOException {
    Objects.requireNonNull(object, "object");
    ensureInitialized();
    if (registry.isReadOnly()) {
      throw new UnsupportedOperationException("Cannot save into read-only store " + name);
    }
    checkContent(object);
    final long index = saveRecord(object);
    logger.log(Level.FINE, () -> String.format("save %s[%d]", name, index));
    return index;
  }

  /// Returns the record at an index, from the cache when present.
  ///
  /// @throws RecordNotFoundException if the index was never committed
  @Synchronized
  public T load(long index) throws IOException {
    ensureInitialized();
    if (index < 0 || index >= count) {
      throw new RecordNotFoundException(name, index, count);
    }
    final Optional<T> cached = cache.get(index);
    if (cached.isPresent()) {
      return cached.get();
    }
    logger.log(Level.FINE, () -> String.format("load %s[%d]", name, index));
    final T object = loadRecord(index);
    object.assignIndex(this, index);
    cache.put(index, object);
    return object;
  }

  /// A lazy proxy for one index. Nothing is read until the proxy is dereferenced.
  public LazyProxy<T> proxy(long index) {
    return new LazyProxy<>(this, index);
  }

  /// A lazy, restartable view of the records committed when this method is called, in index
  /// order. Every element access creates a fresh unresolved proxy; nothing is read until a
  /// proxy is dereferenced.
  public List<LazyProxy<T>> all() {
    final long size = size();
    if (size > Integer.MAX_VALUE) {
      throw new IllegalStateException("Store " + name + " holds too many records for a list view");
    }
    return new ProxyList<>(this, (int) size);
  }

  /// Number of committed indices.
  @Synchronized
  public long size() {
    ensureInitialized();
    return count;
  }

  public boolean isEmpty() {
    return size() == 0;
  }

  public boolean contains(long index) {
    return index >= 0 && index < size();
  }

  /// The index of a record in this store, if it was saved here or loaded from here.
  public Optional<Long> indexOf(T object) {
    return object.indexIn(this);
  }

  /// Finds the first record with the given name.
  ///
  /// @throws UnsupportedOperationException if this store does not persist names
  @Synchronized
  public Optional<LazyProxy<T>> find(String recordName) throws IOException {
    ensureInitialized();
    if (!named) {
      throw new UnsupportedOperationException("Store " + name + " does not persist names");
    }
    for (long index = 0; index < count; index++) {
      final var cached = cache.get(index);
      final String candidate =
          cached.isPresent() ? cached.get().getName().orElse(null) : context.read(NAME, index);
      if (recordName.equals(candidate)) {
        return Optional.of(proxy(index));
      }
    }
    return Optional.empty();
  }

  /// Drops an index from the cache so the next load reads it from the table.
  @Synchronized
  public void invalidate(long index) {
    ensureAttached();
    cache.invalidate(index);
  }

  @Synchronized
  public CacheStats getCacheStats() {
    ensureAttached();
    return cache.stats();
  }

  public boolean isInitialized() {
    return metadata != null;
  }

  public Optional<SizingMetadata> getSizingMetadata() {
    return Optional.ofNullable(metadata);
  }

  /// Rejects a record of the wrong class. Subclasses add checks for finer class tags.
  protected void checkContent(T object) {
    if (!contentClass.isInstance(object)) {
      throw new InconsistentStateException(
          String.format(
              "Store %s holds %s, cannot save %s",
              name, contentClass.getSimpleName(), object.getClass().getSimpleName()));
    }
  }

  /// Writes a record and returns its index. Runs under the store lock.
  protected long saveRecord(T object) throws IOException {
    final Optional<Long> existing = object.indexIn(this);
    final long index = existing.orElse(count);
    writePayload(payloadRow(index), toFields(object));
    if (named) {
      context.write(NAME, index, object.getName().orElse(null));
    }
    if (existing.isPresent()) {
      logger.log(Level.FINE, () -> String.format("rewrote %s[%d] in place", name, index));
      cache.invalidate(index);
    } else {
      count = index + 1;
    }
    object.assignIndex(this, index);
    cache.put(index, object);
    return index;
  }

  /// Reads a record that is not cached. Runs under the store lock.
  protected T loadRecord(long index) throws IOException {
    final Fields fields = readPayload(payloadRow(index));
    final String recordName = named ? context.read(NAME, index) : null;
    return fromFields(fields, index, recordName);
  }

  /// Composite write: every feature in declaration order.
  protected final void writePayload(long row, Fields fields) throws IOException {
    for (Feature feature : features) {
      feature.write(context, row, fields);
    }
  }

  /// Composite read: every feature in declaration order.
  protected final Fields readPayload(long row) throws IOException {
    final var builder = Fields.builder();
    for (Feature feature : features) {
      feature.read(context, row, builder);
    }
    return builder.build();
  }

  protected final ObjectCache<T> cache() {
    return cache;
  }

  protected final StoreContext context() {
    return context;
  }

  protected final long count() {
    return count;
  }

  protected final void setCount(long count) {
    this.count = count;
  }

  protected final StoreRegistry registry() {
    return registry;
  }

  List<String> featureNames() {
    return features.stream().map(Feature::getName).toList();
  }

  private void checkVariableNames() {
    final Map<String, String> owners = new HashMap<>();
    for (String reserved : reservedVariableNames()) {
      owners.put(reserved, "store " + name);
    }
    for (Feature feature : features) {
      for (Variable<?> variable : feature.getVariables()) {
        final String previous = owners.putIfAbsent(variable.getName(), "feature " + feature.getName());
        if (previous != null) {
          throw new SchemaConflictException(
              String.format(
                  "Variable %s of feature %s in store %s is already declared by %s",
                  variable.getName(), feature.getName(), name, previous));
        }
      }
    }
  }

  private void ensureAttached() {
    if (registry == null) {
      throw new IllegalStateException("Store " + name + " is not registered with a registry");
    }
  }

  private void ensureInitialized() {
    ensureAttached();
    if (metadata == null) {
      throw new IllegalStateException("Store " + name + " has not been initialized");
    }
  }

  @Override
  public String toString() {
    return String.format(
        "%s[%s %s]", getClass().getSimpleName(), name, contentClass.getSimpleName());
  }

  private static final class ProxyList<T extends StorableObject> extends AbstractList<LazyProxy<T>>
      implements RandomAccess {
    private final ObjectStore<T> store;
    private final int size;

    ProxyList(ObjectStore<T> store, int size) {
      this.store = store;
      this.size = size;
    }

    @Override
    public LazyProxy<T> get(int index) {
      if (index < 0 || index >= size) {
        throw new IndexOutOfBoundsException("Index " + index + " size " + size);
      }
      return store.proxy(index);
    }

    @Override
    public int size() {
      return size;
    }
  }
}
