package com.github.simbo1905.pathstore;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import lombok.Getter;

/// Stores snapshots of one {@link SnapshotKind} in index pairs. Indices `2k` and `2k+1` hold a
/// snapshot and its time reversed twin. Feature columns grow along a separate pair dimension so
/// the payload is written once per pair at row `k`; only the `is_reversed` flag is stored per
/// index, and the two flags of a pair are always negations of each other.
///
/// The snapshot a caller saves first takes the even index. Saving its twin later returns the odd
/// index without writing anything. Loading an index whose sibling is cached reads only the flag.
public class SnapshotStore extends ObjectStore<Snapshot> {

  private static final Logger logger = Logger.getLogger(SnapshotStore.class.getName());

  /// Reserved variable holding the reversal flag of every index.
  public static final String REVERSED_VARIABLE = "is_reversed";

  private static final Variable<Boolean> REVERSED =
      Variable.bool(REVERSED_VARIABLE, "whether snapshot '{idx}' runs backwards in time");

  @Getter private final SnapshotKind kind;

  public SnapshotStore(String name, SnapshotKind kind) {
    super(name, Snapshot.class, kind.getFeatures(), false);
    this.kind = kind;
  }

  /// Snapshot stores are keyed by kind, not by class.
  @Override
  public Object getStoreKey() {
    return kind;
  }

  @Override
  protected String payloadDimension() {
    return getName() + ".pairs";
  }

  @Override
  protected long payloadRow(long index) {
    return index >> 1;
  }

  @Override
  protected List<String> reservedVariableNames() {
    final List<String> names = new ArrayList<>(super.reservedVariableNames());
    names.add(REVERSED_VARIABLE);
    return names;
  }

  @Override
  protected void initializeReserved(StoreContext context) {
    super.initializeReserved(context);
    context.createIndexColumn(REVERSED);
  }

  @Override
  protected void checkContent(Snapshot snapshot) {
    super.checkContent(snapshot);
    if (!kind.equals(snapshot.getKind())) {
      throw new InconsistentStateException(
          String.format(
              "Store %s holds %s, cannot save %s", getName(), kind, snapshot.getKind()));
    }
  }

  @Override
  protected Fields toFields(Snapshot snapshot) {
    return snapshot.getFields();
  }

  @Override
  protected Snapshot fromFields(Fields fields, long index, String name) throws IOException {
    final boolean reversed = context().read(REVERSED, index);
    final var pair = new SnapshotPair();
    pair.bind(this, index & ~1L, (index & 1L) == 0 ? reversed : !reversed);
    return Snapshot.restore(kind, fields, reversed, pair);
  }

  @Override
  protected long saveRecord(Snapshot snapshot) throws IOException {
    final Optional<Long> own = snapshot.ownIndexIn(this);
    if (own.isPresent()) {
      return rewrite(snapshot, own.get());
    }
    final Optional<Long> twin = snapshot.getPair().indexIn(this, snapshot.isReversed());
    if (twin.isPresent()) {
      return saveTwin(snapshot, twin.get());
    }
    final long index = count();
    writePair(snapshot, index);
    setCount(index + 2);
    snapshot.getPair().bind(this, index, snapshot.isReversed());
    snapshot.assignIndex(this, index);
    cache().put(index, snapshot);
    return index;
  }

  /// Loads from the cached sibling when there is one, reading only this index's flag.
  @Override
  protected Snapshot loadRecord(long index) throws IOException {
    final long sibling = index ^ 1L;
    final Optional<Snapshot> cached = cache().get(sibling);
    if (cached.isEmpty()) {
      return super.loadRecord(index);
    }
    final Snapshot other = cached.get();
    final boolean reversed = context().read(REVERSED, index);
    if (reversed == other.isReversed()) {
      throw new InconsistentStateException(
          String.format(
              "Store %s indices %d and %d both have is_reversed=%b", getName(), index, sibling, reversed));
    }
    logger.log(
        Level.FINE, () -> String.format("load %s[%d] from cached sibling %d", getName(), index, sibling));
    return other.reversed();
  }

  /// A proxy for the time reversed twin of an index. Nothing is read.
  public LazyProxy<Snapshot> reversedProxy(long index) {
    return proxy(index ^ 1L);
  }

  private long rewrite(Snapshot snapshot, long index) throws IOException {
    final long base = index & ~1L;
    final boolean baseReversed = (index & 1L) == 0 ? snapshot.isReversed() : !snapshot.isReversed();
    final var slot = snapshot.getPair().slot(this);
    if (slot.isPresent() && slot.get().baseReversed() != baseReversed) {
      throw new InconsistentStateException(
          String.format("Snapshot at %s[%d] changed direction since it was saved", getName(), index));
    }
    writePair(snapshot, index);
    final long sibling = index ^ 1L;
    cache().invalidate(index);
    cache().invalidate(sibling);
    snapshot.getPair().bind(this, base, baseReversed);
    cache().put(index, snapshot);
    logger.log(Level.FINE, () -> String.format("rewrote %s pair %d in place", getName(), base >> 1));
    return index;
  }

  private long saveTwin(Snapshot snapshot, long index) throws IOException {
    final boolean stored = context().read(REVERSED, index);
    if (stored != snapshot.isReversed()) {
      throw new InconsistentStateException(
          String.format(
              "Store %s holds is_reversed=%b at %d, cannot save a snapshot with is_reversed=%b there",
              getName(), stored, index, snapshot.isReversed()));
    }
    snapshot.assignIndex(this, index);
    if (!cache().contains(index)) {
      cache().put(index, snapshot);
    }
    logger.log(Level.FINE, () -> String.format("twin of %s[%d] already stored", getName(), index ^ 1L));
    return index;
  }

  /// Writes the payload once at the pair row and both flags, the given index taking the
  /// snapshot's orientation.
  private void writePair(Snapshot snapshot, long index) throws IOException {
    writePayload(payloadRow(index), toFields(snapshot));
    final long base = index & ~1L;
    final boolean atBase = (index & 1L) == 0 ? snapshot.isReversed() : !snapshot.isReversed();
    context().write(REVERSED, base, atBase);
    context().write(REVERSED, base + 1, !atBase);
  }
}
