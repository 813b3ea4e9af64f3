package com.tileshard.tiling;

import com.tileshard.config.TilingConfig;
import com.tileshard.dataset.Footprint;
import com.tileshard.dataset.MultiscaleRaster;
import com.tileshard.dataset.ShapesLayer;
import com.tileshard.dataset.SpatialDataset;
import com.tileshard.dataset.SpatialElement;
import com.tileshard.geo.GeoUtils;
import com.tileshard.util.Format;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Covers the footprint of one dataset element with a grid of square, overlapping tiles.
 * <p>
 * Images are tiled on integer pixel bounds starting at {@code (0, 0)}. Point tables are tiled from the min/max of their
 * coordinates and the tile width is then shrunk to the smallest width that still needs the same number of tiles, so
 * the grid ends exactly at the data. When the dataset has a {@value SpatialDataset#REGION_OF_INTEREST} shape, tiles
 * that do not intersect it are dropped.
 * <p>
 * Tiles are numbered in row-major order over the tiles that are kept, so tile {@code i} is the same tile for every
 * consumer of this grid.
 */
public class GridTiler {

  private static final Logger LOGGER = LoggerFactory.getLogger(GridTiler.class);

  private final SpatialElement element;
  private final AxisTiler xAxis;
  private final AxisTiler yAxis;
  private final double tileWidth;
  private final double tileOverlap;
  private final boolean tight;
  private final boolean integerCoords;
  private final Geometry roi;
  private final List<TileIndex> tiles;

  /**
   * Computes the tiles of {@code elementName}.
   *
   * @throws InvalidTilingException if {@code tileWidth <= tileOverlap}, or if rounding a point cloud's tile width up
   *                                 to a whole number would change the number of tiles
   * @throws com.tileshard.dataset.UnsupportedElementException if the element is not an image or point table
   * @throws IllegalArgumentException if there is no element named {@code elementName}
   */
  public GridTiler(SpatialDataset dataset, String elementName, double tileWidth, double tileOverlap) {
    if (!(tileWidth > tileOverlap)) {
      throw new InvalidTilingException(
        "Tile width must be greater than tile overlap, got width=" + tileWidth + " overlap=" + tileOverlap);
    }
    SpatialElement source = dataset.element(elementName);
    this.element = source instanceof MultiscaleRaster multiscale ? multiscale.fullResolution() : source;
    Footprint footprint = Footprint.of(element);

    this.xAxis = new AxisTiler(footprint.x(), tileWidth, tileOverlap, footprint.kind().integerCoords());
    this.yAxis = new AxisTiler(footprint.y(), tileWidth, tileOverlap, footprint.kind().integerCoords());
    this.tileOverlap = tileOverlap;
    this.tight = footprint.kind().tight();
    this.integerCoords = footprint.kind().integerCoords();
    this.roi = dataset.shapes(SpatialDataset.REGION_OF_INTEREST)
      .filter(layer -> !layer.isEmpty())
      .map(layer -> element.transform().toIntrinsic(layer.transform().toGlobal(layer.geometries().get(0))))
      .orElse(null);

    if (tight) {
      double width = Math.max(xAxis.tightWidth(), yAxis.tightWidth());
      if (!xAxis.keepsCount(width) || !yAxis.keepsCount(width)) {
        throw new InvalidTilingException("Tile width " + tileWidth + " and overlap " + tileOverlap +
          " are too small for " + elementName + ", whole tile width " + width + " would change the tile count");
      }
      xAxis.update(width);
      yAxis.update(width);
      this.tileWidth = width;
    } else {
      this.tileWidth = tileWidth;
    }

    int total = xAxis.count() * yAxis.count();
    List<TileIndex> kept = new ArrayList<>(total);
    for (int i = 0; i < total; i++) {
      TileIndex index = new TileIndex(i % xAxis.count(), i / xAxis.count());
      if (roi == null || roi.intersects(box(index))) {
        kept.add(index);
      }
    }
    this.tiles = List.copyOf(kept);

    LOGGER.info("{} tiles of width {} over {} ({}x{} grid{})", Format.defaultInstance().numeric(tiles.size()),
      Format.defaultInstance().decimal(this.tileWidth), elementName, xAxis.count(), yAxis.count(),
      roi == null ? "" : ", " + (total - tiles.size()) + " outside region of interest");
  }

  public GridTiler(SpatialDataset dataset, String elementName, TilingConfig config) {
    this(dataset, elementName, config.tileWidth(), config.tileOverlap());
  }

  /** Returns the number of tiles kept. */
  public int size() {
    return tiles.size();
  }

  public List<TileIndex> tiles() {
    return tiles;
  }

  /**
   * Returns the grid position of tile {@code i}.
   *
   * @throws IndexOutOfBoundsException if {@code i} is not in {@code [0, size())}
   */
  public TileIndex tileIndex(int i) {
    return tiles.get(i);
  }

  /**
   * Returns {@code [xmin, ymin, xmax, ymax]} of tile {@code i}, not clipped to the region of interest.
   *
   * @throws IndexOutOfBoundsException if {@code i} is not in {@code [0, size())}
   */
  public double[] bounds(int i) {
    return bounds(tiles.get(i));
  }

  private double[] bounds(TileIndex index) {
    double[] x = xAxis.bounds(index.ix());
    double[] y = yAxis.bounds(index.iy());
    return new double[]{x[0], y[0], x[1], y[1]};
  }

  private Polygon box(TileIndex index) {
    return GeoUtils.box(bounds(index));
  }

  /** Returns the region of interest in the intrinsic coordinates of the element, if the dataset has one. */
  public Optional<Geometry> roi() {
    return Optional.ofNullable(roi);
  }

  /** Returns the tiled element, resolved to its full-resolution image for a multiscale raster. */
  public SpatialElement element() {
    return element;
  }

  public AxisTiler xAxis() {
    return xAxis;
  }

  public AxisTiler yAxis() {
    return yAxis;
  }

  /** Returns the width of each tile after any tight adjustment. */
  public double tileWidth() {
    return tileWidth;
  }

  public double tileOverlap() {
    return tileOverlap;
  }

  public boolean isTight() {
    return tight;
  }

  public boolean isIntegerCoords() {
    return integerCoords;
  }

  @Override
  public String toString() {
    return "GridTiler{x=" + xAxis + ", y=" + yAxis + ", tiles=" + tiles.size() + ", roi=" + (roi != null) + '}';
  }
}
