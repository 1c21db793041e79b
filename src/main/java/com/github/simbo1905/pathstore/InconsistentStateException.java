package com.github.simbo1905.pathstore;

/// Thrown when an object does not belong to the store it is given to, or when a write or read
/// would break the pairing of a snapshot with its time reversed twin.
public class InconsistentStateException extends IllegalStateException {

  public InconsistentStateException(String message) {
    super(message);
  }
}
