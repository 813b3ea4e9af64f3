package com.tileshard.geo;

import java.util.List;
import javax.annotation.concurrent.ThreadSafe;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.locationtech.jts.index.strtree.STRtree;

/**
 * Looks up which cell boundary a point falls in.
 * <p>
 * Cells are numbered from 1 in the order they are given. Multipolygon boundaries are split into their parts before
 * indexing so each part gets a tight envelope. The tree is built in {@link #of(List)} and never changes after.
 */
@ThreadSafe
public final class CellBoundaryIndex {

  private record Part(int cell, PreparedGeometry shape) {}

  private final STRtree tree = new STRtree();
  private final int cells;

  private CellBoundaryIndex(List<? extends Geometry> boundaries) {
    cells = boundaries.size();
    for (int i = 0; i < boundaries.size(); i++) {
      addParts(i + 1, boundaries.get(i));
    }
    tree.build();
  }

  public static CellBoundaryIndex of(List<? extends Geometry> boundaries) {
    return new CellBoundaryIndex(boundaries);
  }

  private void addParts(int cell, Geometry boundary) {
    for (int i = 0; i < boundary.getNumGeometries(); i++) {
      Geometry part = boundary.getGeometryN(i);
      if (part instanceof Polygon && !part.isEmpty()) {
        tree.insert(part.getEnvelopeInternal(), new Part(cell, PreparedGeometryFactory.prepare(part)));
      } else if (part != boundary) {
        addParts(cell, part);
      }
    }
  }

  /** Returns the number of boundaries this index was built from, including ones with no polygon parts. */
  public int cellCount() {
    return cells;
  }

  /**
   * Returns the highest numbered cell whose boundary touches or contains {@code (x, y)}, or {@code 0} if the point is
   * outside every cell.
   */
  public int cellAt(double x, double y) {
    Point point = GeoUtils.point(x, y);
    int result = 0;
    for (Object item : tree.query(new Envelope(x, x, y, y))) {
      Part part = (Part) item;
      if (part.cell > result && part.shape.intersects(point)) {
        result = part.cell;
      }
    }
    return result;
  }
}
