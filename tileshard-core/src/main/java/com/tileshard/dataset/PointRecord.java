package com.tileshard.dataset;

import java.util.ArrayList;
import java.util.List;

/**
 * One row of a {@link PointTable}: its parsed coordinates plus the raw value of every column, in column order.
 * <p>
 * Raw values are kept as text so that a row written back out is identical to the row that was read.
 */
public record PointRecord(double x, double y, List<String> values) {

  public PointRecord {
    values = List.copyOf(values);
  }

  /**
   * Parses {@code values} into a record, reading coordinates from the {@code xIndex} and {@code yIndex} columns.
   *
   * @throws NumberFormatException if either coordinate is not a number
   */
  public static PointRecord parse(List<String> values, int xIndex, int yIndex) {
    return new PointRecord(Double.parseDouble(values.get(xIndex)), Double.parseDouble(values.get(yIndex)), values);
  }

  public String value(int column) {
    return values.get(column);
  }

  /** Returns a copy of this record with {@code value} appended as a new last column. */
  public PointRecord withAppended(String value) {
    List<String> updated = new ArrayList<>(values.size() + 1);
    updated.addAll(values);
    updated.add(value);
    return new PointRecord(x, y, updated);
  }

  /** Returns a copy of this record with the value of {@code column} replaced by {@code value}. */
  public PointRecord withValue(int column, String value) {
    List<String> updated = new ArrayList<>(values);
    updated.set(column, value);
    return new PointRecord(x, y, updated);
  }
}
