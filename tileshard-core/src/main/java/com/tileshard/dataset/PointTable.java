package com.tileshard.dataset;

import com.tileshard.util.CloseableIterator;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import org.locationtech.jts.geom.Envelope;

/**
 * A table of points that may be too large to hold in memory.
 * <p>
 * Every call to {@link #iterator()} starts a new scan over the underlying rows. {@link #filter(Envelope)},
 * {@link #replaceValue(String, String, String)} and {@link #withColumn(String, Function)} return lazy views that are
 * applied while scanning, so the full table is never materialized; only {@link #materialize()} loads rows into memory
 * and callers should only use it once a view is small enough.
 */
public interface PointTable extends SpatialElement {

  String X = "x";
  String Y = "y";

  /** Returns the column names, in the order values appear in each {@link PointRecord}. */
  List<String> columns();

  /** Starts a new scan over every row of this table. */
  CloseableIterator<PointRecord> iterator();

  /**
   * Returns the position of {@code column} in {@link #columns()}.
   *
   * @throws IllegalArgumentException if there is no such column
   */
  default int columnIndex(String column) {
    int index = columns().indexOf(column);
    if (index < 0) {
      throw new IllegalArgumentException("No column '" + column + "' in " + columns());
    }
    return index;
  }

  /** Returns the min/max of the {@code x} and {@code y} columns, or a null envelope if the table is empty. */
  default Envelope extent() {
    Envelope result = new Envelope();
    try (var rows = iterator()) {
      while (rows.hasNext()) {
        PointRecord row = rows.next();
        result.expandToInclude(row.x(), row.y());
      }
    }
    return result;
  }

  /** Returns the number of rows, which requires a full scan. */
  default long count() {
    long result = 0;
    try (var rows = iterator()) {
      while (rows.hasNext()) {
        rows.next();
        result++;
      }
    }
    return result;
  }

  /** Returns all rows of this table in memory. */
  default List<PointRecord> materialize() {
    List<PointRecord> result = new ArrayList<>();
    try (var rows = iterator()) {
      rows.forEachRemaining(result::add);
    }
    return result;
  }

  /** Returns a lazy view of the rows where {@code minX <= x <= maxX} and {@code minY <= y <= maxY}. */
  default PointTable filter(Envelope bounds) {
    Envelope copy = new Envelope(bounds);
    return new DerivedPointTable(this, columns(),
      rows -> rows.filter(row -> copy.covers(row.x(), row.y())));
  }

  /** Returns a lazy view where every {@code value} in {@code column} is replaced with {@code replacement}. */
  default PointTable replaceValue(String column, String value, String replacement) {
    int index = columnIndex(column);
    return new DerivedPointTable(this, columns(),
      rows -> rows.map(row -> Objects.equals(row.value(index), value) ? row.withValue(index, replacement) : row));
  }

  /** Returns a lazy view with an extra last column {@code name} computed from each row by {@code value}. */
  default PointTable withColumn(String name, Function<PointRecord, String> value) {
    if (columns().contains(name)) {
      throw new IllegalArgumentException("Column '" + name + "' already exists in " + columns());
    }
    List<String> columns = new ArrayList<>(columns());
    columns.add(name);
    return new DerivedPointTable(this, columns, rows -> rows.map(row -> row.withAppended(value.apply(row))));
  }
}
