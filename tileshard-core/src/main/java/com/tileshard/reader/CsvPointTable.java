package com.tileshard.reader;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.tileshard.dataset.PointRecord;
import com.tileshard.dataset.PointTable;
import com.tileshard.geo.CoordinateTransform;
import com.tileshard.util.CloseableIterator;
import com.tileshard.util.FileUtils;
import com.tileshard.util.StorageException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link PointTable} that streams rows from one or more CSV partition files every time it is scanned.
 * <p>
 * Every partition must start with the same header row, which must include {@code x} and {@code y} columns. Only one
 * partition is open at a time, so tables larger than memory can be scanned.
 */
public class CsvPointTable implements PointTable {

  private static final Logger LOGGER = LoggerFactory.getLogger(CsvPointTable.class);
  private static final CsvMapper MAPPER = new CsvMapper();
  private static final ObjectReader READER = MAPPER
    .readerFor(String[].class)
    .with(CsvParser.Feature.WRAP_AS_ARRAY)
    .with(CsvParser.Feature.SKIP_EMPTY_LINES);

  private final List<Path> partitions;
  private final List<String> columns;
  private final int xIndex;
  private final int yIndex;
  private final CoordinateTransform transform;

  private CsvPointTable(List<Path> partitions, CoordinateTransform transform) {
    if (partitions.isEmpty()) {
      throw new IllegalArgumentException("No CSV partitions to read");
    }
    this.partitions = List.copyOf(partitions);
    this.transform = Objects.requireNonNull(transform, "transform");
    this.columns = readHeader(this.partitions.get(0));
    this.xIndex = columns.indexOf(X);
    this.yIndex = columns.indexOf(Y);
    if (xIndex < 0 || yIndex < 0) {
      throw new FileFormatException(partitions.get(0) + " must have x and y columns, got " + columns);
    }
    LOGGER.debug("Opened {} partition(s) with columns {} ({} bytes)", this.partitions.size(), columns,
      this.partitions.stream().mapToLong(FileUtils::fileSize).sum());
  }

  /**
   * Opens a table over {@code path}, which is either a single CSV file or a directory whose {@code *.csv} files are
   * read as partitions in file name order.
   */
  public static CsvPointTable open(Path path, CoordinateTransform transform) {
    if (Files.isDirectory(path)) {
      try (Stream<Path> files = Files.list(path)) {
        List<Path> partitions = files
          .filter(file -> file.getFileName().toString().endsWith(".csv"))
          .sorted()
          .toList();
        return new CsvPointTable(partitions, transform);
      } catch (IOException e) {
        throw new StorageException("Unable to list partitions", path, e);
      }
    }
    return new CsvPointTable(List.of(path), transform);
  }

  public static CsvPointTable open(Path path) {
    return open(path, CoordinateTransform.identity());
  }

  /** Opens a table that reads {@code partitions} in order. */
  public static CsvPointTable of(List<Path> partitions, CoordinateTransform transform) {
    return new CsvPointTable(partitions, transform);
  }

  public List<Path> partitions() {
    return partitions;
  }

  @Override
  public List<String> columns() {
    return columns;
  }

  @Override
  public CoordinateTransform transform() {
    return transform;
  }

  @Override
  public CloseableIterator<PointRecord> iterator() {
    return CloseableIterator.concat(partitions, this::openPartition);
  }

  private static List<String> readHeader(Path path) {
    try (MappingIterator<String[]> rows = READER.readValues(path.toFile())) {
      if (!rows.hasNext()) {
        throw new FileFormatException(path + " is empty, expected a header row");
      }
      return List.of(rows.next());
    } catch (IOException e) {
      throw new StorageException("Unable to read header", path, e);
    } catch (RuntimeJsonMappingException e) {
      throw new FileFormatException("Invalid header in " + path, e);
    }
  }

  private CloseableIterator<PointRecord> openPartition(Path path) {
    MappingIterator<String[]> rows;
    try {
      rows = READER.readValues(path.toFile());
    } catch (IOException e) {
      throw new StorageException("Unable to open partition", path, e);
    }
    return new CloseableIterator<>() {
      private long row = 1;

      {
        List<String> header = rows.hasNext() ? List.of(rows.next()) : List.of();
        if (!header.equals(columns)) {
          close();
          throw new FileFormatException(path + " has header " + header + " but expected " + columns);
        }
      }

      @Override
      public boolean hasNext() {
        try {
          return rows.hasNext();
        } catch (RuntimeJsonMappingException e) {
          throw new FileFormatException("Unable to read " + path + " after row " + row, e);
        }
      }

      @Override
      public PointRecord next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        String[] values = rows.next();
        row++;
        if (values.length != columns.size()) {
          throw new FileFormatException(
            path + " row " + row + ": expected " + columns.size() + " values but got " + values.length);
        }
        try {
          return PointRecord.parse(Arrays.asList(values), xIndex, yIndex);
        } catch (NumberFormatException e) {
          throw new FileFormatException(path + " row " + row + ": invalid coordinates", e);
        }
      }

      @Override
      public void close() {
        try {
          rows.close();
        } catch (IOException e) {
          throw new UncheckedIOException(e);
        }
      }
    };
  }

  @Override
  public String toString() {
    return "CsvPointTable{partitions=" + partitions + "}";
  }
}
