package com.github.simbo1905.pathstore;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

public class VariableTableTest extends JulLoggingConfig {

  private static final ColumnDefinition SPEED =
      new ColumnDefinition("runs.speed", "runs", VariableType.INT64, new int[0], "speed of run");

  private Path file;

  private VariableTable table;

  @Before
  public void createFile() throws IOException {
    file = Files.createTempFile("variable-table", ".db");
  }

  @After
  public void deleteFile() throws IOException {
    if (table != null && !table.isClosed()) {
      table.close();
    }
    Files.deleteIfExists(file);
  }

  private VariableTable open(boolean readOnly, FileOperations fileOperations) throws IOException {
    return new VariableTable(file, fileOperations, readOnly, true, 4);
  }

  private FileOperations direct(boolean readOnly) throws IOException {
    return new DirectFileOperations(new RandomAccessFile(file.toFile(), readOnly ? "r" : "rw"));
  }

  private static byte[] longBytes(long value) {
    return ByteBuffer.allocate(Long.BYTES).putLong(value).array();
  }

  @Test
  public void testWriteReadAndReopen() throws Exception {
    table = open(false, direct(false));
    table.createDimension("runs");
    final Column column = table.createColumn(SPEED);
    for (long row = 0; row < 10; row++) {
      column.write(row, longBytes(row * 7));
    }
    table.setAttribute("units", "m/s");
    Assert.assertEquals(10, table.dimensionLength("runs"));
    table.close();

    table = open(true, direct(true));
    Assert.assertEquals(10, table.dimensionLength("runs"));
    assertThat(table.columnNames(), contains("runs.speed"));
    assertThat(table.getAttribute("units"), is(Optional.of("m/s")));
    final Column reopened = table.column("runs.speed");
    Assert.assertEquals(4, reopened.getChunkRows());
    for (long row = 0; row < 10; row++) {
      Assert.assertArrayEquals(longBytes(row * 7), reopened.read(row));
    }
  }

  @Test
  public void testUnallocatedChunkReadsZerosWithoutIo() throws Exception {
    final var counting = new CountingFileOperations(direct(false));
    table = open(false, counting);
    table.createDimension("runs");
    final Column speed = table.createColumn(SPEED);
    final Column laps =
        table.createColumn(new ColumnDefinition("runs.laps", "runs", VariableType.INT32, null, ""));
    speed.write(9, longBytes(99));
    counting.resetCounts();

    Assert.assertArrayEquals(new byte[Integer.BYTES], laps.read(5));
    Assert.assertEquals(0, counting.getReads());
    Assert.assertArrayEquals(longBytes(99), speed.read(9));
    Assert.assertEquals(1, counting.getReads());
  }

  @Test
  public void testRowOutsideDimensionIsRejected() throws Exception {
    table = open(false, direct(false));
    table.createDimension("runs");
    final Column column = table.createColumn(SPEED);
    column.write(0, longBytes(1));
    Assert.assertThrows(IllegalArgumentException.class, () -> column.read(1));
  }

  @Test
  public void testRedefiningColumnIsSchemaConflict() throws Exception {
    table = open(false, direct(false));
    table.createDimension("runs");
    table.createColumn(SPEED);
    Assert.assertSame(
        table.column("runs.speed"),
        table.createColumn(new ColumnDefinition("runs.speed", "runs", VariableType.INT64, null, "other text")));
    Assert.assertThrows(
        SchemaConflictException.class,
        () -> table.createColumn(new ColumnDefinition("runs.speed", "runs", VariableType.FLOAT64, null, "")));
    Assert.assertThrows(
        IllegalArgumentException.class,
        () -> table.createColumn(new ColumnDefinition("laps.speed", "laps", VariableType.INT64, null, "")));
  }

  @Test
  public void testWrongRowLengthIsRejected() throws Exception {
    table = open(false, direct(false));
    table.createDimension("runs");
    final Column column = table.createColumn(SPEED);
    Assert.assertThrows(IllegalArgumentException.class, () -> column.write(0, new byte[3]));
  }

  @Test
  public void testCorruptRowFailsCrc() throws Exception {
    table = open(false, direct(false));
    table.createDimension("runs");
    final Column column = table.createColumn(SPEED);
    column.write(0, longBytes(42));
    final long offset = column.chunkOffsets.get(0);
    table.close();

    try (var raf = new RandomAccessFile(file.toFile(), "rw")) {
      raf.seek(offset + 3);
      raf.write(0x7f);
    }

    table = open(true, direct(true));
    final var thrown =
        Assert.assertThrows(IllegalStateException.class, () -> table.column("runs.speed").read(0));
    assertThat(thrown.getMessage(), containsString("CRC32"));
  }

  @Test
  public void testBadMagicNumberIsRejected() throws Exception {
    Files.write(file, new byte[VariableTable.FILE_HEADER_LENGTH]);
    final var thrown = Assert.assertThrows(IOException.class, () -> open(true, direct(true)));
    assertThat(thrown.getMessage(), containsString("magic number"));
  }

  @Test
  public void testCorruptDirectoryIsRejected() throws Exception {
    table = open(false, direct(false));
    table.createDimension("runs");
    table.createColumn(SPEED).write(0, longBytes(1));
    table.close();

    // the directory is the last thing in the file
    try (var raf = new RandomAccessFile(file.toFile(), "rw")) {
      raf.seek(raf.length() - 1);
      final int last = raf.read();
      raf.seek(raf.length() - 1);
      raf.write(last ^ 0xff);
    }
    final var thrown = Assert.assertThrows(IOException.class, () -> open(true, direct(true)));
    assertThat(thrown.getMessage(), containsString("Directory CRC32"));
  }

  @Test
  public void testEmptyFileCannotBeOpenedReadOnly() {
    Assert.assertThrows(IOException.class, () -> open(true, direct(true)));
  }

  @Test
  public void testReadOnlyAcceptsExistingSchemaButNotNewSchema() throws Exception {
    table = open(false, direct(false));
    table.createDimension("runs");
    table.createColumn(SPEED);
    table.setAttribute("units", "m/s");
    table.close();

    table = open(true, direct(true));
    table.createDimension("runs");
    table.createColumn(SPEED);
    table.setAttribute("units", "m/s");
    Assert.assertThrows(UnsupportedOperationException.class, () -> table.createDimension("laps"));
    Assert.assertThrows(UnsupportedOperationException.class, () -> table.setAttribute("units", "km/h"));
    Assert.assertThrows(
        UnsupportedOperationException.class, () -> table.column("runs.speed").write(0, longBytes(1)));
  }

  @Test
  public void testFailedWriteMovesTableToUnknownState() throws Exception {
    final var failing = new CountingFileOperations(direct(false));
    table = open(false, failing);
    table.createDimension("runs");
    final Column column = table.createColumn(SPEED);
    failing.failAfter(1);

    Assert.assertThrows(IOException.class, () -> column.write(0, longBytes(1)));
    Assert.assertTrue(failing.isThrown());
    Assert.assertEquals(VariableTable.TableState.UNKNOWN, table.getState());
    Assert.assertThrows(IllegalStateException.class, () -> table.createDimension("laps"));
  }

  @Test
  public void testUnpaddedRowsWithoutCrc() throws Exception {
    table = new VariableTable(file, direct(false), false, false, 2);
    table.createDimension("runs");
    table.createColumn(SPEED).write(3, longBytes(5));
    table.close();
    // header + two chunks of two 8 byte rows, then the directory
    final long chunkEnd = VariableTable.FILE_HEADER_LENGTH + 2L * 2 * Long.BYTES;
    Assert.assertTrue(Files.size(file) > chunkEnd);

    table = open(true, direct(true));
    Assert.assertFalse(table.isPayloadCrc32());
    Assert.assertArrayEquals(longBytes(5), table.column("runs.speed").read(3));
  }

  @Test
  public void testSyncedDirectorySurvivesChunksAllocatedAfterIt() throws Exception {
    table = open(false, direct(false));
    table.createDimension("runs");
    final Column column = table.createColumn(SPEED);
    column.write(0, longBytes(10));
    table.sync();
    column.write(9, longBytes(90));

    // a copy taken now is what a crash before the next sync leaves behind
    final Path crashed = Files.createTempFile("variable-table-crash", ".db");
    try {
      Files.copy(file, crashed, StandardCopyOption.REPLACE_EXISTING);
      try (var recovered =
          new VariableTable(
              crashed, new DirectFileOperations(new RandomAccessFile(crashed.toFile(), "rw")), false, true, 4)) {
        Assert.assertEquals(1, recovered.dimensionLength("runs"));
        Assert.assertArrayEquals(longBytes(10), recovered.column("runs.speed").read(0));
        recovered.column("runs.speed").write(5, longBytes(55));
      }
      try (var reopened =
          new VariableTable(
              crashed, new DirectFileOperations(new RandomAccessFile(crashed.toFile(), "r")), true, true, 4)) {
        final Column speed = reopened.column("runs.speed");
        Assert.assertEquals(6, reopened.dimensionLength("runs"));
        Assert.assertArrayEquals(longBytes(10), speed.read(0));
        Assert.assertArrayEquals(longBytes(0), speed.read(3));
        Assert.assertArrayEquals(longBytes(55), speed.read(5));
      }
    } finally {
      Files.deleteIfExists(crashed);
    }
  }

  @Test
  public void testUnwrittenFloatRowsReadAsNaNFill() throws Exception {
    final var counting = new CountingFileOperations(direct(false));
    table = open(false, counting);
    table.createDimension("frames");
    final var box =
        new ColumnDefinition("frames.box", "frames", VariableType.FLOAT32, new int[] {3, 3}, "");
    final Column boxes = table.createColumn(box);
    final Column steps =
        table.createColumn(new ColumnDefinition("frames.step", "frames", VariableType.INT64, new int[0], ""));
    final float[][] cube = {{2, 0, 0}, {0, 2, 0}, {0, 0, 2}};
    final var row = ByteBuffer.allocate(box.rowBytes());
    VariableCodec.float32Matrix().encode(cube, box.shape(), row);
    boxes.write(0, row.array());
    steps.write(9, longBytes(9));
    counting.resetCounts();

    // chunk 1 of the box column was never allocated
    final byte[] unallocated = boxes.read(6);
    Assert.assertEquals(0, counting.getReads());
    Assert.assertNull(VariableCodec.float32Matrix().decode(box.shape(), ByteBuffer.wrap(unallocated)));

    // row 2 sits in the allocated chunk 0 but was never written
    final byte[] unwritten = boxes.read(2);
    Assert.assertEquals(1, counting.getReads());
    Assert.assertNull(VariableCodec.float32Matrix().decode(box.shape(), ByteBuffer.wrap(unwritten)));

    Assert.assertArrayEquals(
        cube[1], VariableCodec.float32Matrix().decode(box.shape(), ByteBuffer.wrap(boxes.read(0)))[1], 0f);
  }
}
