package com.github.simbo1905.pathstore;

import java.util.Objects;
import java.util.Optional;

/// One time schema parameters that fix the shapes of feature variables.
///
/// @param atomCount number of atoms per configuration
/// @param spatialDimensions number of spatial coordinates per atom
/// @param topology opaque description of the system, empty when none was supplied
public record SizingMetadata(int atomCount, int spatialDimensions, String topology) {

  static final String ATOMS_ATTRIBUTE = "sizing.atoms";
  static final String SPATIAL_ATTRIBUTE = "sizing.spatial";
  static final String TOPOLOGY_ATTRIBUTE = "topology";

  public SizingMetadata {
    if (atomCount < 1) {
      throw new IllegalArgumentException("atomCount must be positive, got " + atomCount);
    }
    if (spatialDimensions < 1) {
      throw new IllegalArgumentException(
          "spatialDimensions must be positive, got " + spatialDimensions);
    }
    topology = topology == null ? "" : topology;
  }

  public static SizingMetadata of(int atomCount, int spatialDimensions) {
    return new SizingMetadata(atomCount, spatialDimensions, "");
  }

  public static SizingMetadata of(Topology topology) {
    Objects.requireNonNull(topology, "topology");
    return new SizingMetadata(
        topology.getAtomCount(), topology.getSpatialDimensions(), topology.describe());
  }

  /// The shape part of the metadata in the form persisted per store.
  String encodeShape() {
    return String.format("atoms=%d;spatial=%d", atomCount, spatialDimensions);
  }

  void persist(VariableTable table) {
    table.setAttribute(ATOMS_ATTRIBUTE, Integer.toString(atomCount));
    table.setAttribute(SPATIAL_ATTRIBUTE, Integer.toString(spatialDimensions));
    table.setAttribute(TOPOLOGY_ATTRIBUTE, topology);
  }

  /// Reads back metadata written by {@link #persist(VariableTable)}.
  static Optional<SizingMetadata> restore(VariableTable table) {
    final var atoms = table.getAttribute(ATOMS_ATTRIBUTE);
    final var spatial = table.getAttribute(SPATIAL_ATTRIBUTE);
    if (atoms.isEmpty() || spatial.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(
        new SizingMetadata(
            Integer.parseInt(atoms.get()),
            Integer.parseInt(spatial.get()),
            table.getAttribute(TOPOLOGY_ATTRIBUTE).orElse("")));
  }
}
