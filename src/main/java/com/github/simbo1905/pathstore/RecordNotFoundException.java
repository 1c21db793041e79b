package com.github.simbo1905.pathstore;

import lombok.Getter;

/// Thrown when an index has never been committed to a store.
public class RecordNotFoundException extends IllegalArgumentException {

  @Getter private final String storeName;

  @Getter private final long index;

  public RecordNotFoundException(String storeName, long index, long size) {
    super(String.format("Index %d not found in store %s of size %d", index, storeName, size));
    this.storeName = storeName;
    this.index = index;
  }

  /// Reports an earlier failure again, keeping the original as the cause.
  public RecordNotFoundException(RecordNotFoundException first) {
    super(first.getMessage(), first);
    this.storeName = first.storeName;
    this.index = first.index;
  }
}
