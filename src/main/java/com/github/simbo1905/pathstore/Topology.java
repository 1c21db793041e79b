package com.github.simbo1905.pathstore;

/// What a store needs to know about the simulated system. The dynamics engine supplies an
/// implementation; the store keeps only the counts and the description.
public interface Topology {

  int getAtomCount();

  int getSpatialDimensions();

  /// A human readable description persisted with the file, for example a residue summary.
  default String describe() {
    return "";
  }
}
