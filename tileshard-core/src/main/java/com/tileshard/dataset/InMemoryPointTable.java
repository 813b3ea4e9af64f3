package com.tileshard.dataset;

import com.tileshard.geo.CoordinateTransform;
import com.tileshard.util.CloseableIterator;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A {@link PointTable} whose rows are all held in memory.
 */
public class InMemoryPointTable implements PointTable {

  private final List<String> columns;
  private final List<PointRecord> rows;
  private final CoordinateTransform transform;

  public InMemoryPointTable(List<String> columns, List<PointRecord> rows, CoordinateTransform transform) {
    this.columns = List.copyOf(columns);
    this.rows = List.copyOf(rows);
    this.transform = Objects.requireNonNull(transform, "transform");
    for (PointRecord row : this.rows) {
      if (row.values().size() != this.columns.size()) {
        throw new IllegalArgumentException("Expected " + this.columns.size() + " values but got " + row.values());
      }
    }
  }

  /** Returns a builder for a table with {@code columns}, which must include {@code x} and {@code y}. */
  public static Builder builder(String... columns) {
    return new Builder(Arrays.asList(columns));
  }

  @Override
  public List<String> columns() {
    return columns;
  }

  @Override
  public CloseableIterator<PointRecord> iterator() {
    return CloseableIterator.of(rows.iterator());
  }

  @Override
  public List<PointRecord> materialize() {
    return rows;
  }

  @Override
  public long count() {
    return rows.size();
  }

  @Override
  public CoordinateTransform transform() {
    return transform;
  }

  @Override
  public String toString() {
    return "InMemoryPointTable{columns=" + columns + ", rows=" + rows.size() + "}";
  }

  /** Accumulates rows of raw values for a new {@link InMemoryPointTable}. */
  public static class Builder {

    private final List<String> columns;
    private final int xIndex;
    private final int yIndex;
    private final List<PointRecord> rows = new ArrayList<>();
    private CoordinateTransform transform = CoordinateTransform.identity();

    private Builder(List<String> columns) {
      this.columns = List.copyOf(columns);
      this.xIndex = this.columns.indexOf(X);
      this.yIndex = this.columns.indexOf(Y);
      if (xIndex < 0 || yIndex < 0) {
        throw new IllegalArgumentException("Point tables need x and y columns, got " + columns);
      }
    }

    /** Adds a row where each value is converted to text with {@link String#valueOf(Object)}. */
    public Builder add(Object... values) {
      rows.add(PointRecord.parse(Arrays.stream(values).map(String::valueOf).toList(), xIndex, yIndex));
      return this;
    }

    public Builder transform(CoordinateTransform transform) {
      this.transform = transform;
      return this;
    }

    public InMemoryPointTable build() {
      return new InMemoryPointTable(columns, rows, transform);
    }
  }
}
