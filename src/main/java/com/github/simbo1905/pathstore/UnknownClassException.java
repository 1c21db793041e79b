package com.github.simbo1905.pathstore;

/// Thrown when a registry is asked for a store it does not hold.
public class UnknownClassException extends IllegalArgumentException {

  public UnknownClassException(Object key) {
    super("No store registered for " + key);
  }
}
