package com.github.simbo1905.pathstore;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jetbrains.annotations.TestOnly;

/// Builder for opening a {@link StoreRegistry} over a file with a fluent API.
///
/// Example usage:
/// <pre>
/// StoreRegistry registry = new StoreRegistryBuilder()
///     .path("/path/to/paths.db")
///     .chunkRows(256)
///     .cacheSize(50_000)
///     .open();
/// </pre>
///
/// The defaults for `cacheSize` and `chunkRows` can be set with the system properties
/// {@link StoreRegistry#CACHE_SIZE_PROPERTY} and {@link StoreRegistry#CHUNK_ROWS_PROPERTY}.
public class StoreRegistryBuilder {

  private static final Logger logger = Logger.getLogger(StoreRegistryBuilder.class.getName());

  /// Access mode for the backing file.
  @SuppressWarnings("LombokGetterMayBeUsed")
  public enum AccessMode {
    READ_ONLY("r"),
    READ_WRITE("rw");

    final String mode;

    AccessMode(String mode) {
      this.mode = mode;
    }

    public String getMode() {
      return mode;
    }
  }

  private Path path;
  private String tempFilePrefix;
  private String tempFileSuffix;
  private AccessMode accessMode = AccessMode.READ_WRITE;
  private int chunkRows =
      Integer.getInteger(StoreRegistry.CHUNK_ROWS_PROPERTY, StoreRegistry.DEFAULT_CHUNK_ROWS);
  private int cacheSize =
      Integer.getInteger(StoreRegistry.CACHE_SIZE_PROPERTY, StoreRegistry.DEFAULT_CACHE_SIZE);
  private boolean disablePayloadCrc32 = false;
  private UnaryOperator<FileOperations> fileOperationsDecorator = UnaryOperator.identity();

  /// Sets the path of the file.
  ///
  /// @param path the path to the file
  /// @return this builder for chaining
  public StoreRegistryBuilder path(Path path) {
    this.path = path;
    return this;
  }

  /// Sets the path of the file using a string, which is normalized.
  ///
  /// @param path the path string to the file
  /// @return this builder for chaining
  public StoreRegistryBuilder path(String path) {
    this.path = Paths.get(path).normalize();
    return this;
  }

  /// Creates a new temporary file that is deleted on JVM exit.
  ///
  /// @param prefix the prefix for the temporary file
  /// @param suffix the suffix for the temporary file
  /// @return this builder for chaining
  public StoreRegistryBuilder tempFile(String prefix, String suffix) {
    this.tempFilePrefix = prefix;
    this.tempFileSuffix = suffix;
    return this;
  }

  /// Opens the file in read-only mode. Saves fail with {@link UnsupportedOperationException}.
  ///
  /// @param readOnly true for read-only access
  /// @return this builder for chaining
  public StoreRegistryBuilder readOnly(boolean readOnly) {
    this.accessMode = readOnly ? AccessMode.READ_ONLY : AccessMode.READ_WRITE;
    return this;
  }

  public StoreRegistryBuilder accessMode(AccessMode accessMode) {
    this.accessMode = Objects.requireNonNull(accessMode, "accessMode");
    return this;
  }

  /// Sets the number of rows per chunk for columns created through the registry. Existing
  /// columns keep the chunk size they were created with.
  ///
  /// @param chunkRows rows per chunk, at least 1
  /// @return this builder for chaining
  public StoreRegistryBuilder chunkRows(int chunkRows) {
    if (chunkRows < 1) {
      throw new IllegalArgumentException("chunkRows must be positive, got " + chunkRows);
    }
    this.chunkRows = chunkRows;
    return this;
  }

  /// Sets the maximum number of records each store keeps in its cache.
  ///
  /// @param cacheSize records per store, at least 1
  /// @return this builder for chaining
  public StoreRegistryBuilder cacheSize(int cacheSize) {
    if (cacheSize < 1) {
      throw new IllegalArgumentException("cacheSize must be positive, got " + cacheSize);
    }
    this.cacheSize = cacheSize;
    return this;
  }

  /// Disables the CRC32 stored after every row. Only honoured when a new file is created.
  ///
  /// @param disable true to disable CRC32, false to enable (default)
  /// @return this builder for chaining
  public StoreRegistryBuilder disablePayloadCrc32(boolean disable) {
    this.disablePayloadCrc32 = disable;
    return this;
  }

  /// Wraps the file operations, for tests that count or fail I/O.
  @TestOnly
  public StoreRegistryBuilder fileOperationsDecorator(UnaryOperator<FileOperations> decorator) {
    this.fileOperationsDecorator = Objects.requireNonNull(decorator, "decorator");
    return this;
  }

  /// Opens the file, creating a new table when it is empty or does not exist.
  ///
  /// @return a registry with no stores registered
  /// @throws IOException if the file cannot be opened or is not a valid table
  public StoreRegistry open() throws IOException {
    final Path target;
    if (tempFilePrefix != null && tempFileSuffix != null) {
      target = Files.createTempFile(tempFilePrefix, tempFileSuffix);
      target.toFile().deleteOnExit();
    } else if (path != null) {
      target = path;
    } else {
      throw new IllegalStateException("Either path or tempFile must be specified");
    }
    if (accessMode == AccessMode.READ_ONLY && !Files.exists(target)) {
      throw new NoSuchFileException(target.toString());
    }
    logger.log(
        Level.FINE,
        () ->
            String.format(
                "open path=%s accessMode=%s chunkRows=%d cacheSize=%d disablePayloadCrc32=%b",
                target, accessMode, chunkRows, cacheSize, disablePayloadCrc32));

    final var file = new RandomAccessFile(target.toFile(), accessMode.getMode());
    try {
      final FileOperations fileOperations =
          fileOperationsDecorator.apply(new DirectFileOperations(file));
      final var table =
          new VariableTable(
              target,
              fileOperations,
              accessMode == AccessMode.READ_ONLY,
              !disablePayloadCrc32,
              chunkRows);
      return new StoreRegistry(table, cacheSize);
    } catch (IOException | RuntimeException e) {
      try {
        file.close();
      } catch (IOException closeFailure) {
        logger.log(Level.WARNING, "Failed to close " + target + " after a failed open", closeFailure);
        e.addSuppressed(closeFailure);
      }
      throw e;
    }
  }
}
