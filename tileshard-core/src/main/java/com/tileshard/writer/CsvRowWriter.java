package com.tileshard.writer;

import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.google.common.base.Preconditions;
import com.tileshard.dataset.PointRecord;
import com.tileshard.util.StorageException;
import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes rows of text values to a CSV file that starts with a header row.
 * <p>
 * The header is written as soon as the file is created, so a file with no rows still lists its columns.
 */
public class CsvRowWriter implements Closeable {

  private static final CsvMapper MAPPER = CsvMapper.builder()
    .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
    .build();

  private final Path path;
  private final int width;
  private final SequenceWriter output;
  private long rows = 0;

  private CsvRowWriter(Path path, List<String> columns, Writer out) throws IOException {
    this.path = path;
    this.width = columns.size();
    CsvSchema schema = CsvSchema.builder()
      .addColumns(columns, CsvSchema.ColumnType.STRING)
      .build()
      .withoutHeader()
      .withLineSeparator("\n");
    ObjectWriter writer = MAPPER.writerFor(List.class).with(schema);
    this.output = writer.writeValues(out);
    output.write(columns);
  }

  /**
   * Creates or truncates {@code path} and writes the {@code columns} header row.
   *
   * @throws StorageException if the file cannot be written
   */
  public static CsvRowWriter create(Path path, List<String> columns) {
    try {
      return create(path, columns, Files.newBufferedWriter(path));
    } catch (IOException e) {
      throw new StorageException("Unable to create", path, e);
    }
  }

  /** Writes the header to {@code out}, closing it if that fails. */
  static CsvRowWriter create(Path path, List<String> columns, Writer out) throws IOException {
    try {
      return new CsvRowWriter(path, columns, out);
    } catch (IOException | RuntimeException e) {
      try {
        out.close();
      } catch (IOException suppressed) {
        e.addSuppressed(suppressed);
      }
      throw e;
    }
  }

  /** Writes one row, which must have one value per column. */
  public void write(List<String> values) {
    Preconditions.checkArgument(values.size() == width, "Expected %s values but got %s", width, values);
    try {
      output.write(values);
      rows++;
    } catch (IOException e) {
      throw new StorageException("Unable to write row " + rows + " to", path, e);
    }
  }

  public void write(PointRecord record) {
    write(record.values());
  }

  /** Returns the number of rows written so far, not counting the header. */
  public long rows() {
    return rows;
  }

  public Path path() {
    return path;
  }

  @Override
  public void close() {
    try {
      output.close();
    } catch (IOException e) {
      throw new StorageException("Unable to close", path, e);
    }
  }
}
