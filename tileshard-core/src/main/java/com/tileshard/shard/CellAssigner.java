package com.tileshard.shard;

import com.tileshard.geo.SpatialIndex;
import java.util.List;
import org.locationtech.jts.geom.Geometry;

/**
 * Assigns each indexed point the id of the cell boundary that contains it.
 */
@FunctionalInterface
public interface CellAssigner {

  /**
   * Returns an assigner where the id of the point at row {@code r} is {@code i + 1} for the last boundary {@code i}
   * that intersects it, or {@code 0} when no boundary does.
   */
  static CellAssigner lastIntersecting() {
    return (points, boundaries) -> {
      int[] result = new int[points.size()];
      for (int i = 0; i < boundaries.size(); i++) {
        for (int row : points.query(boundaries.get(i))) {
          result[row] = i + 1;
        }
      }
      return result;
    };
  }

  /** Returns one cell id per row of {@code points}, where {@code 0} means no cell. */
  int[] boundariesToCellId(SpatialIndex.Indexed points, List<Geometry> boundaries);
}
