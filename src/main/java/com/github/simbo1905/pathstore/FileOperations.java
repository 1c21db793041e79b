package com.github.simbo1905.pathstore;

import java.io.IOException;

/// Positional file access used by the variable table. Every call is one physical
/// operation against the backing file so that a delegating implementation can count
/// or intercept I/O.
public interface FileOperations {

  /// Forces all buffered modifications to be written to the storage device.
  void sync() throws IOException;

  /// Reads exactly `b.length` bytes starting at `position`.
  void readFully(long position, byte[] b) throws IOException;

  /// Writes all of `b` starting at `position`, growing the file if needed.
  void write(long position, byte[] b) throws IOException;

  long length() throws IOException;

  void close() throws IOException;
}
