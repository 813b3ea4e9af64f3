package com.tileshard.shard;

import com.tileshard.dataset.PointTable;
import com.tileshard.geo.CellBoundaryIndex;
import java.util.List;
import org.locationtech.jts.geom.Geometry;

/**
 * Adds a cell id column to a point table without loading it into memory.
 */
@FunctionalInterface
public interface CellMapper {

  /**
   * Returns a mapper that indexes {@code boundaries} and gives each point the 1-based position of the last boundary
   * that intersects it, or {@code 0} when none does.
   */
  static CellMapper fromBoundaries(List<Geometry> boundaries) {
    CellBoundaryIndex index = CellBoundaryIndex.of(boundaries);
    return (table, column) -> table.withColumn(column, row -> Integer.toString(index.cellAt(row.x(), row.y())));
  }

  /** Returns a lazy view of {@code table} with an extra {@code column} holding the cell id of each point. */
  PointTable mapPointsToCells(PointTable table, String column);
}
