package com.github.simbo1905.pathstore;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;

/// A handle on one column of a {@link VariableTable}. Rows live in fixed size chunks that
/// are appended to the file on first write, so a column never needs to be contiguous.
public final class Column {

  @Getter private final ColumnDefinition definition;

  /// Rows per chunk. Fixed when the column is created.
  @Getter private final int chunkRows;

  /// File offsets of the allocated chunks in chunk order.
  final List<Long> chunkOffsets;

  private final VariableTable table;

  Column(VariableTable table, ColumnDefinition definition, int chunkRows, List<Long> chunkOffsets) {
    if (chunkRows < 1) {
      throw new IllegalArgumentException("chunkRows must be positive, got " + chunkRows);
    }
    this.table = table;
    this.definition = definition;
    this.chunkRows = chunkRows;
    this.chunkOffsets = new ArrayList<>(chunkOffsets);
  }

  public String getName() {
    return definition.name();
  }

  /// Reads the payload of one row. A row that was never written reads as
  /// {@link ColumnDefinition#fillRow()}, without I/O when its chunk was never allocated.
  public byte[] read(long row) throws IOException {
    return table.readRow(this, row);
  }

  /// Writes the payload of one row, which must be exactly {@link ColumnDefinition#rowBytes()}
  /// long. Writing past the end of the dimension extends it.
  public void write(long row, byte[] payload) throws IOException {
    table.writeRow(this, row, payload);
  }

  /// Current length of the dimension this column grows along.
  public long length() {
    return table.dimensionLength(definition.dimension());
  }

  int stride(boolean payloadCrc32) {
    return definition.rowBytes() + (payloadCrc32 ? VariableTable.CRC32_LENGTH : 0);
  }

  @Override
  public String toString() {
    return String.format(
        "Column[%s chunkRows=%d chunks=%d]", definition, chunkRows, chunkOffsets.size());
  }
}
