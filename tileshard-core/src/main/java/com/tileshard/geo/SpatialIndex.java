package com.tileshard.geo;

import java.util.List;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;

/**
 * Builds a queryable index over a list of points so that callers can find which points intersect a polygon without
 * testing every point.
 * <p>
 * Implementations are swappable: the sharding code only depends on this interface.
 */
@FunctionalInterface
public interface SpatialIndex {

  /** Returns the default index implementation, backed by a JTS {@link org.locationtech.jts.index.strtree.STRtree}. */
  static SpatialIndex strTree() {
    return StrTreeSpatialIndex::new;
  }

  /** Indexes {@code points}, where the position of each point in the list is its row index. */
  Indexed build(List<Coordinate> points);

  /** Points that have been indexed, queryable by geometry. */
  interface Indexed {

    /** Returns the number of indexed points. */
    int size();

    /** Returns the point at row {@code index}. */
    Coordinate get(int index);

    /** Returns the row indices of all points that intersect {@code geometry}, in ascending order. */
    int[] query(Geometry geometry);
  }
}
