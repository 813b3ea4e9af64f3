package com.tileshard.tiling;

import com.google.common.base.Suppliers;
import com.tileshard.geo.GeoUtils;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.IntStream;
import org.locationtech.jts.geom.Geometry;

/**
 * The shapes of the tiles of a {@link GridTiler}: each tile rectangle clipped to the region of interest.
 */
public class TileGeometry {

  private final GridTiler grid;
  private final Supplier<List<Geometry>> polygons = Suppliers.memoize(this::computePolygons);

  public TileGeometry(GridTiler grid) {
    this.grid = grid;
  }

  /**
   * Returns the rectangle of tile {@code i}, intersected with the region of interest when there is one.
   * <p>
   * The intersection of a rectangle and a polygon may be a multipolygon, or a lower-dimension geometry if they only
   * touch.
   */
  public Geometry polygon(int i) {
    Geometry box = GeoUtils.box(grid.bounds(i));
    return grid.roi().map(box::intersection).orElse(box);
  }

  /** Returns the shape of every tile in tile order, computed on first use. */
  public List<Geometry> polygons() {
    return polygons.get();
  }

  public GridTiler grid() {
    return grid;
  }

  private List<Geometry> computePolygons() {
    return IntStream.range(0, grid.size()).mapToObj(this::polygon).toList();
  }
}
