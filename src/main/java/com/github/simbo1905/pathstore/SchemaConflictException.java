package com.github.simbo1905.pathstore;

/// Thrown when a schema or its sizing metadata is declared twice with incompatible values, or
/// when two features of one store declare the same variable name. Never retried.
public class SchemaConflictException extends IllegalStateException {

  public SchemaConflictException(String message) {
    super(message);
  }
}
