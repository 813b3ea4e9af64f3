package com.tileshard.dataset;

import com.tileshard.geo.CoordinateTransform;
import com.tileshard.util.CloseableIterator;
import java.util.List;
import java.util.function.UnaryOperator;

/** A lazy view over a parent {@link PointTable} that rewrites each scan of the parent. */
class DerivedPointTable implements PointTable {

  private final PointTable parent;
  private final List<String> columns;
  private final UnaryOperator<CloseableIterator<PointRecord>> view;

  DerivedPointTable(PointTable parent, List<String> columns, UnaryOperator<CloseableIterator<PointRecord>> view) {
    this.parent = parent;
    this.columns = List.copyOf(columns);
    this.view = view;
  }

  @Override
  public List<String> columns() {
    return columns;
  }

  @Override
  public CloseableIterator<PointRecord> iterator() {
    return view.apply(parent.iterator());
  }

  @Override
  public CoordinateTransform transform() {
    return parent.transform();
  }

  @Override
  public String toString() {
    return "DerivedPointTable{parent=" + parent + ", columns=" + columns + "}";
  }
}
