package com.github.simbo1905.pathstore;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

/// A reusable bundle of persisted fields. A store's schema is the union of the variables of
/// the features it declares; the order of the features changes only the physical layout.
///
/// Implementations hold no state. Everything they need at runtime arrives in the
/// {@link StoreContext}.
public interface Feature {

  /// Name used when a snapshot kind lists its features.
  String getName();

  /// The table variables this feature needs. Names must be unique within one store.
  List<Variable<?>> getVariables();

  /// The fields a record must carry for this feature. Defaults to one field per variable.
  default List<FieldKey<?>> getFieldKeys() {
    return getVariables().stream().<FieldKey<?>>map(Variable::getKey).collect(Collectors.toList());
  }

  /// Stores this feature reads and writes through. A registry registers and initializes them
  /// before the store declaring this feature. Called once per registration so implementations
  /// return fresh instances.
  default List<ObjectStore<?>> createChildStores() {
    return List.of();
  }

  /// Allocates the variables in the table.
  default void initialize(StoreContext context) throws IOException {
    for (Variable<?> variable : getVariables()) {
      context.createColumn(variable);
    }
  }

  /// Rejects field values that must never reach the table. Called when a record is built.
  default void validate(Fields fields) {}

  default void write(StoreContext context, long row, Fields fields) throws IOException {
    for (Variable<?> variable : getVariables()) {
      writeVariable(context, variable, row, fields);
    }
  }

  default void read(StoreContext context, long row, Fields.Builder fields) throws IOException {
    for (Variable<?> variable : getVariables()) {
      readVariable(context, variable, row, fields);
    }
  }

  /// Maps a field value to its meaning in the time reversed twin of a snapshot. The stored
  /// payload is shared by both halves of a pair so the transform is applied on access.
  default <V> V reverse(FieldKey<V> key, V value) {
    return value;
  }

  /// An independent copy of a field value. Features with mutable values such as arrays must
  /// override this so a snapshot never shares state with its callers.
  default <V> V copy(FieldKey<V> key, V value) {
    return value;
  }

  private static <V> void writeVariable(
      StoreContext context, Variable<V> variable, long row, Fields fields) throws IOException {
    context.write(variable, row, fields.get(variable.getKey()));
  }

  private static <V> void readVariable(
      StoreContext context, Variable<V> variable, long row, Fields.Builder fields)
      throws IOException {
    fields.put(variable.getKey(), context.read(variable, row));
  }
}
