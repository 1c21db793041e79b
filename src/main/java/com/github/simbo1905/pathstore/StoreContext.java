package com.github.simbo1905.pathstore;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import lombok.Getter;

/// Everything a {@link Feature} may touch while it allocates, reads or writes on behalf of one
/// store: the sizing metadata, the registry holding sibling stores, and the columns of the
/// store. Columns are named `store.variable` so features of different stores never collide.
public final class StoreContext {

  @Getter private final StoreRegistry registry;

  @Getter private final SizingMetadata metadata;

  /// The name of the store whose columns this context addresses.
  @Getter private final String storeName;

  private final String indexDimension;

  private final String payloadDimension;

  private final Map<String, Column> columns = new HashMap<>();

  StoreContext(
      StoreRegistry registry,
      SizingMetadata metadata,
      String storeName,
      String indexDimension,
      String payloadDimension) {
    this.registry = registry;
    this.metadata = metadata;
    this.storeName = storeName;
    this.indexDimension = indexDimension;
    this.payloadDimension = payloadDimension;
  }

  /// Creates the column for a feature variable along the store's payload dimension, or
  /// validates the column already present in the file.
  public Column createColumn(Variable<?> variable) {
    return createColumn(variable, payloadDimension);
  }

  /// Creates a column with one row per store index, as opposed to one row per payload.
  Column createIndexColumn(Variable<?> variable) {
    return createColumn(variable, indexDimension);
  }

  private Column createColumn(Variable<?> variable, String dimension) {
    final var definition =
        new ColumnDefinition(
            columnName(variable),
            dimension,
            variable.getType(),
            variable.shape(metadata),
            variable.getDescription());
    final Column column = registry.getTable().createColumn(definition);
    columns.put(variable.getName(), column);
    return column;
  }

  public <V> void write(Variable<V> variable, long row, V value) throws IOException {
    final Column column = column(variable);
    column.write(row, variable.encode(value, metadata, column.getDefinition().rowBytes()));
  }

  public <V> V read(Variable<V> variable, long row) throws IOException {
    return variable.decode(column(variable).read(row), metadata);
  }

  public Column column(Variable<?> variable) {
    final Column column = columns.get(variable.getName());
    if (column == null) {
      throw new IllegalStateException(
          String.format("Variable %s was not initialized in store %s", variable.getName(), storeName));
    }
    return column;
  }

  String columnName(Variable<?> variable) {
    return storeName + "." + variable.getName();
  }
}
