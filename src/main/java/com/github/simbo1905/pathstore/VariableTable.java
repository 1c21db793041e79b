package com.github.simbo1905.pathstore;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.zip.CRC32;
import lombok.Getter;
import lombok.Synchronized;

/// Named, typed, chunked columns of fixed shape values held in a single random access file.
/// Columns grow along named unlimited dimensions and never shrink.
///
/// File layout:
/// <ul>
///   <li>64 byte header: magic number, format version, flags, directory pointer, directory
///   length and the CRC32 of the directory</li>
///   <li>chunk region: each chunk holds `chunkRows` rows of one column, optionally each row
///   followed by the CRC32 of its payload. New chunks are filled with the column's fill value</li>
///   <li>directory: dimensions, columns with their chunk offsets, and string attributes. Every
///   {@link #sync()} and {@link #close()} appends a fresh copy at the end of the file and then
///   points the header at it</li>
/// </ul>
///
/// Chunks allocated after a directory was written go after it, so the directory the header
/// names is never overwritten. A crash loses only what was written since the last sync.
public class VariableTable implements AutoCloseable {

  private static final Logger logger = Logger.getLogger(VariableTable.class.getName());

  /// Magic number identifying a table file ("PATHSTOR").
  static final long MAGIC_NUMBER = 0x5041544853544F52L;

  static final int FORMAT_VERSION = 1;

  /// Magic (8) + version (4) + flags (4) + directory pointer (8) + directory length (4) +
  /// directory crc (4), padded to 64 bytes.
  static final int FILE_HEADER_LENGTH = 64;

  // this is an unsigned 32 int
  static final int CRC32_LENGTH = Integer.BYTES;

  private static final int FLAG_PAYLOAD_CRC32 = 1;

  /// Lifecycle of the table. Any failed I/O moves the table to UNKNOWN after which it refuses
  /// further use.
  enum TableState {
    NEW,
    OPEN,
    CLOSED,
    UNKNOWN
  }

  ///  FileOperations abstracts over the backing file so tests can count and intercept I/O.
  /*default*/ FileOperations fileOperations;

  @Getter private final Path filePath;

  @Getter private final boolean readOnly;

  /// Whether every row carries a CRC32 of its payload. Fixed at file creation.
  @Getter private final boolean payloadCrc32;

  private final int defaultChunkRows;

  private final Map<String, Long> dimensions = new LinkedHashMap<>();
  private final Map<String, Column> columns = new LinkedHashMap<>();
  private final Map<String, String> attributes = new LinkedHashMap<>();

  /// File offset where the next chunk or directory goes: one past the last chunk or the last
  /// directory written, whichever is later.
  private long dataEndPtr = FILE_HEADER_LENGTH;

  /// Set when the directory held in memory differs from the one in the file.
  private boolean dirty;

  private volatile TableState state = TableState.NEW;

  /// Opens a table over the given file operations, creating the header when the file is empty.
  ///
  /// @param filePath the path of the backing file, for diagnostics
  /// @param fileOperations positional access to the backing file
  /// @param readOnly whether the table rejects writes
  /// @param payloadCrc32 whether a new file should checksum row payloads; ignored for an
  /// existing file which records its own choice
  /// @param defaultChunkRows rows per chunk for columns created by this instance
  VariableTable(
      Path filePath,
      FileOperations fileOperations,
      boolean readOnly,
      boolean payloadCrc32,
      int defaultChunkRows)
      throws IOException {
    if (defaultChunkRows < 1) {
      throw new IllegalArgumentException("chunkRows must be positive, got " + defaultChunkRows);
    }
    this.filePath = filePath;
    this.fileOperations = fileOperations;
    this.readOnly = readOnly;
    this.defaultChunkRows = defaultChunkRows;
    try {
      final long length = fileOperations.length();
      if (length == 0) {
        if (readOnly) {
          throw new IOException("Cannot open empty file " + filePath + " in read only mode");
        }
        this.payloadCrc32 = payloadCrc32;
        writeHeader(0, 0, 0);
        logger.log(
            Level.FINE,
            () -> String.format("created table file=%s payloadCrc32=%b", filePath, payloadCrc32));
      } else {
        if (length < FILE_HEADER_LENGTH) {
          throw new IOException(
              String.format(
                  "File %s too short for a table header (%d < %d)",
                  filePath, length, FILE_HEADER_LENGTH));
        }
        final var header = ByteBuffer.wrap(read(0, FILE_HEADER_LENGTH));
        final long magic = header.getLong();
        if (magic != MAGIC_NUMBER) {
          throw new IOException(
              String.format(
                  "Invalid file format: %s does not start with magic number 0x%016X",
                  filePath, MAGIC_NUMBER));
        }
        final int version = header.getInt();
        if (version != FORMAT_VERSION) {
          throw new IOException(
              String.format("Unsupported table format version %d in %s", version, filePath));
        }
        this.payloadCrc32 = (header.getInt() & FLAG_PAYLOAD_CRC32) != 0;
        final long directoryPtr = header.getLong();
        final int directoryLength = header.getInt();
        final long directoryCrc = header.getInt() & 0xffffffffL;
        if (directoryLength > 0) {
          loadDirectory(directoryPtr, directoryLength, directoryCrc);
        }
        logger.log(
            Level.FINE,
            () ->
                String.format(
                    "opened table file=%s dimensions=%s columns=%d readOnly=%b",
                    filePath, dimensions, columns.size(), readOnly));
      }
      state = TableState.OPEN;
    } catch (Exception e) {
      state = TableState.UNKNOWN;
      throw e;
    }
  }

  /// Creates an unlimited dimension of length zero. Creating an existing dimension is a no-op.
  @Synchronized
  public void createDimension(String name) {
    ensureOpen();
    if (dimensions.containsKey(name)) {
      return;
    }
    ensureWritable();
    dimensions.put(name, 0L);
    dirty = true;
    logger.log(Level.FINE, () -> String.format("createDimension %s", name));
  }

  /// Returns the number of rows allocated along the dimension.
  ///
  /// @throws IllegalArgumentException if the dimension does not exist
  @Synchronized
  public long dimensionLength(String name) {
    ensureOpen();
    final Long length = dimensions.get(name);
    if (length == null) {
      throw new IllegalArgumentException("Unknown dimension " + name);
    }
    return length;
  }

  @Synchronized
  public boolean hasDimension(String name) {
    return dimensions.containsKey(name);
  }

  /// Creates a column, or returns the existing column of the same name when its layout
  /// matches. This lets a schema be declared again against a file that already holds it.
  ///
  /// @throws SchemaConflictException if a column of the same name has a different layout
  /// @throws IllegalArgumentException if the dimension does not exist
  @Synchronized
  public Column createColumn(ColumnDefinition definition) {
    ensureOpen();
    final Column existing = columns.get(definition.name());
    if (existing != null) {
      if (!existing.getDefinition().equals(definition)) {
        throw new SchemaConflictException(
            String.format(
                "Column %s already exists as %s, cannot redefine as %s",
                definition.name(), existing.getDefinition(), definition));
      }
      return existing;
    }
    ensureWritable();
    if (!dimensions.containsKey(definition.dimension())) {
      throw new IllegalArgumentException(
          String.format(
              "Column %s refers to unknown dimension %s",
              definition.name(), definition.dimension()));
    }
    final var column = new Column(this, definition, defaultChunkRows, List.of());
    columns.put(definition.name(), column);
    dirty = true;
    logger.log(Level.FINE, () -> String.format("createColumn %s", column));
    return column;
  }

  @Synchronized
  public Optional<Column> findColumn(String name) {
    ensureOpen();
    return Optional.ofNullable(columns.get(name));
  }

  /// @throws IllegalArgumentException if no such column exists
  public Column column(String name) {
    return findColumn(name)
        .orElseThrow(() -> new IllegalArgumentException("Unknown column " + name));
  }

  @Synchronized
  public List<String> columnNames() {
    return Collections.unmodifiableList(new ArrayList<>(columns.keySet()));
  }

  /// Sets a string attribute persisted with the directory. Setting the current value is a no-op
  /// so that read only tables accept it.
  @Synchronized
  public void setAttribute(String key, String value) {
    ensureOpen();
    if (value.equals(attributes.get(key))) {
      return;
    }
    ensureWritable();
    attributes.put(key, value);
    dirty = true;
  }

  @Synchronized
  public Optional<String> getAttribute(String key) {
    ensureOpen();
    return Optional.ofNullable(attributes.get(key));
  }

  @Synchronized
  byte[] readRow(Column column, long row) throws IOException {
    ensureOpen();
    final var definition = column.getDefinition();
    final long length = dimensions.get(definition.dimension());
    if (row < 0 || row >= length) {
      throw new IllegalArgumentException(
          String.format(
              "Row %d outside dimension %s of length %d", row, definition.dimension(), length));
    }
    final int chunk = (int) (row / column.getChunkRows());
    if (chunk >= column.chunkOffsets.size()) {
      return definition.fillRow();
    }
    final int stride = column.stride(payloadCrc32);
    final long position = rowPosition(column, row, stride);
    try {
      final byte[] buffer = read(position, stride);
      logger.log(
          Level.FINEST,
          () -> String.format("<r %s row:%d fp:%d len:%d", definition.name(), row, position, stride));
      if (!payloadCrc32) {
        return buffer;
      }
      final var wrapped = ByteBuffer.wrap(buffer);
      final byte[] payload = new byte[definition.rowBytes()];
      wrapped.get(payload);
      final long expectedCrc = wrapped.getInt() & 0xffffffffL;
      final long actualCrc = crc32(payload);
      if (actualCrc != expectedCrc) {
        throw new IllegalStateException(
            String.format(
                "CRC32 check failed for column %s row %d expected %d got %d",
                definition.name(), row, expectedCrc, actualCrc));
      }
      return payload;
    } catch (IOException e) {
      state = TableState.UNKNOWN;
      throw e;
    }
  }

  @Synchronized
  void writeRow(Column column, long row, byte[] payload) throws IOException {
    ensureOpen();
    ensureWritable();
    final var definition = column.getDefinition();
    if (payload.length != definition.rowBytes()) {
      throw new IllegalArgumentException(
          String.format(
              "Column %s expects rows of %d bytes, got %d",
              definition.name(), definition.rowBytes(), payload.length));
    }
    if (row < 0) {
      throw new IllegalArgumentException("Negative row " + row);
    }
    final int stride = column.stride(payloadCrc32);
    try {
      final int chunk = (int) (row / column.getChunkRows());
      while (column.chunkOffsets.size() <= chunk) {
        allocateChunk(column, stride);
      }
      final long position = rowPosition(column, row, stride);
      final byte[] buffer;
      if (payloadCrc32) {
        buffer =
            ByteBuffer.allocate(stride).put(payload).putInt((int) crc32(payload)).array();
      } else {
        buffer = payload;
      }
      fileOperations.write(position, buffer);
      logger.log(
          Level.FINEST,
          () -> String.format(">w %s row:%d fp:%d len:%d", definition.name(), row, position, stride));
      final String dimension = definition.dimension();
      if (row >= dimensions.get(dimension)) {
        dimensions.put(dimension, row + 1);
        dirty = true;
      }
    } catch (IOException e) {
      state = TableState.UNKNOWN;
      throw e;
    }
  }

  /// Persists the directory and forces the file to the storage device.
  @Synchronized
  public void sync() throws IOException {
    ensureOpen();
    try {
      if (!readOnly && dirty) {
        writeDirectory();
      }
      fileOperations.sync();
      logger.log(Level.FINE, () -> String.format("sync called on %s", filePath));
    } catch (IOException e) {
      state = TableState.UNKNOWN;
      throw e;
    }
  }

  /// Closes the table, writing the directory first when it has changed.
  @Synchronized
  public void close() throws IOException {
    logger.log(Level.FINE, () -> String.format("close called on %s", filePath));
    if (state == TableState.CLOSED) {
      return;
    }
    try {
      try {
        if (state == TableState.OPEN && !readOnly && dirty) {
          writeDirectory();
          fileOperations.sync();
        }
      } finally {
        fileOperations.close();
      }
    } catch (IOException e) {
      state = TableState.UNKNOWN;
      throw e;
    } finally {
      columns.clear();
      dimensions.clear();
      attributes.clear();
      state = TableState.CLOSED;
    }
  }

  public boolean isClosed() {
    return state == TableState.CLOSED;
  }

  TableState getState() {
    return state;
  }

  private void ensureOpen() {
    if (state != TableState.OPEN) {
      throw new IllegalStateException("Table is in state " + state + ", expected OPEN");
    }
  }

  private void ensureWritable() {
    if (readOnly) {
      throw new UnsupportedOperationException("Cannot modify read-only table " + filePath);
    }
  }

  private long rowPosition(Column column, long row, int stride) {
    final int chunk = (int) (row / column.getChunkRows());
    final long rowInChunk = row % column.getChunkRows();
    return column.chunkOffsets.get(chunk) + rowInChunk * stride;
  }

  /// Appends a chunk of fill rows, each with a valid CRC32 when payload checksums are on.
  private void allocateChunk(Column column, int stride) throws IOException {
    final long offset = dataEndPtr;
    final int chunkBytes = Math.multiplyExact(stride, column.getChunkRows());
    final byte[] fill = column.getDefinition().fillRow();
    final var chunk = ByteBuffer.allocate(chunkBytes);
    while (chunk.hasRemaining()) {
      chunk.put(fill);
      if (payloadCrc32) {
        chunk.putInt((int) crc32(fill));
      }
    }
    fileOperations.write(offset, chunk.array());
    dataEndPtr = offset + chunkBytes;
    column.chunkOffsets.add(offset);
    dirty = true;
    logger.log(
        Level.FINER,
        () ->
            String.format(
                "allocated chunk %d of %s at fp:%d len:%d",
                column.chunkOffsets.size() - 1, column.getName(), offset, chunkBytes));
  }

  private void writeHeader(long directoryPtr, int directoryLength, long directoryCrc)
      throws IOException {
    final var header = ByteBuffer.allocate(FILE_HEADER_LENGTH);
    header.putLong(MAGIC_NUMBER);
    header.putInt(FORMAT_VERSION);
    header.putInt(payloadCrc32 ? FLAG_PAYLOAD_CRC32 : 0);
    header.putLong(directoryPtr);
    header.putInt(directoryLength);
    header.putInt((int) directoryCrc);
    fileOperations.write(0, header.array());
  }

  private void writeDirectory() throws IOException {
    final var bout = new ByteArrayOutputStream();
    try (var out = new DataOutputStream(bout)) {
      out.writeInt(dimensions.size());
      for (var entry : dimensions.entrySet()) {
        out.writeUTF(entry.getKey());
        out.writeLong(entry.getValue());
      }
      out.writeInt(columns.size());
      for (Column column : columns.values()) {
        final var definition = column.getDefinition();
        out.writeUTF(definition.name());
        out.writeUTF(definition.dimension());
        out.writeByte(definition.type().code);
        final int[] shape = definition.shape();
        out.writeInt(shape.length);
        for (int extent : shape) {
          out.writeInt(extent);
        }
        out.writeUTF(definition.description());
        out.writeInt(column.getChunkRows());
        out.writeInt(column.chunkOffsets.size());
        for (long offset : column.chunkOffsets) {
          out.writeLong(offset);
        }
      }
      out.writeInt(attributes.size());
      for (var entry : attributes.entrySet()) {
        out.writeUTF(entry.getKey());
        out.writeUTF(entry.getValue());
      }
    }
    final byte[] directory = bout.toByteArray();
    final long crc = crc32(directory);
    final long directoryPtr = dataEndPtr;
    fileOperations.write(directoryPtr, directory);
    writeHeader(directoryPtr, directory.length, crc);
    dataEndPtr = directoryPtr + directory.length;
    dirty = false;
    logger.log(
        Level.FINER,
        () ->
            String.format(
                "wrote directory fp:%d len:%d crc:%d columns=%d",
                directoryPtr, directory.length, crc, columns.size()));
  }

  private void loadDirectory(long directoryPtr, int directoryLength, long expectedCrc)
      throws IOException {
    final byte[] directory = read(directoryPtr, directoryLength);
    final long actualCrc = crc32(directory);
    if (actualCrc != expectedCrc) {
      throw new IOException(
          String.format(
              "Directory CRC32 check failed for %s expected %d got %d",
              filePath, expectedCrc, actualCrc));
    }
    dataEndPtr = directoryPtr + directoryLength;
    try (var in = new DataInputStream(new ByteArrayInputStream(directory))) {
      final int dimensionCount = in.readInt();
      for (int i = 0; i < dimensionCount; i++) {
        dimensions.put(in.readUTF(), in.readLong());
      }
      final int columnCount = in.readInt();
      for (int i = 0; i < columnCount; i++) {
        final String name = in.readUTF();
        final String dimension = in.readUTF();
        final VariableType type = VariableType.fromCode(in.readByte());
        final int[] shape = new int[in.readInt()];
        for (int d = 0; d < shape.length; d++) {
          shape[d] = in.readInt();
        }
        final String description = in.readUTF();
        final int chunkRows = in.readInt();
        final int chunkCount = in.readInt();
        final List<Long> offsets = new ArrayList<>(chunkCount);
        for (int c = 0; c < chunkCount; c++) {
          offsets.add(in.readLong());
        }
        final var definition = new ColumnDefinition(name, dimension, type, shape, description);
        columns.put(name, new Column(this, definition, chunkRows, offsets));
      }
      final int attributeCount = in.readInt();
      for (int i = 0; i < attributeCount; i++) {
        attributes.put(in.readUTF(), in.readUTF());
      }
    }
  }

  private byte[] read(long position, int length) throws IOException {
    final byte[] buffer = new byte[length];
    fileOperations.readFully(position, buffer);
    return buffer;
  }

  private static long crc32(byte[] bytes) {
    final var crc = new CRC32();
    crc.update(bytes, 0, bytes.length);
    return crc.getValue();
  }

  @Override
  public String toString() {
    return String.format("VariableTable[%s state=%s columns=%d]", filePath, state, columns.size());
  }
}
