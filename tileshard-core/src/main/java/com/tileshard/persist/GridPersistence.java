package com.tileshard.persist;

import com.tileshard.dataset.ShapeFeature;
import com.tileshard.dataset.ShapesLayer;
import com.tileshard.dataset.SpatialDataset;
import com.tileshard.geo.GeoUtils;
import com.tileshard.tiling.GridTiler;
import com.tileshard.tiling.TileGeometry;
import com.tileshard.util.FileUtils;
import com.tileshard.writer.CsvRowWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Saves the tiles of a {@link GridTiler} so that later steps can reuse them without recomputing the grid.
 */
public class GridPersistence {

  /** Attribute of each tile feature holding its unclipped {@code [xmin, ymin, xmax, ymax]}. */
  public static final String BOUNDS_ATTRIBUTE = "bboxes";
  public static final List<String> CSV_COLUMNS = List.of("index", BOUNDS_ATTRIBUTE, "geometry");

  private static final Logger LOGGER = LoggerFactory.getLogger(GridPersistence.class);
  private final SpatialDataset dataset;
  private final TileGeometry tiles;

  public GridPersistence(SpatialDataset dataset, TileGeometry tiles) {
    this.dataset = dataset;
    this.tiles = tiles;
  }

  /** Returns one feature per tile, in tile order, in the intrinsic coordinates of the tiled element. */
  public ShapesLayer toLayer() {
    GridTiler grid = tiles.grid();
    List<Geometry> polygons = tiles.polygons();
    List<ShapeFeature> features = new ArrayList<>(polygons.size());
    for (int i = 0; i < polygons.size(); i++) {
      features.add(new ShapeFeature(polygons.get(i), Map.of(BOUNDS_ATTRIBUTE, boundsList(grid.bounds(i)))));
    }
    return new ShapesLayer(features, grid.element().transform());
  }

  /**
   * Stores the tiles as the {@value SpatialDataset#TILES} shapes layer of the dataset, tagged with the transform of
   * the tiled element.
   *
   * @throws IllegalArgumentException if the layer already exists and {@code overwrite} is false
   */
  public ShapesLayer write(boolean overwrite) {
    ShapesLayer layer = toLayer();
    dataset.addShapes(SpatialDataset.TILES, layer, overwrite);
    LOGGER.info("Saved {} tiles to shapes '{}'", layer.size(), SpatialDataset.TILES);
    return layer;
  }

  /**
   * Writes one {@code index,bboxes,geometry} row per tile to {@code path}, with the geometry as well-known text.
   * <p>
   * Rows go to a temporary file next to {@code path} that then replaces it, so readers never see a partial file.
   *
   * @throws com.tileshard.util.StorageException if the file cannot be written
   */
  public void exportCsv(Path path) {
    GridTiler grid = tiles.grid();
    FileUtils.createParentDirectories(path);
    Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
    try (CsvRowWriter writer = CsvRowWriter.create(tmp, CSV_COLUMNS)) {
      List<Geometry> polygons = tiles.polygons();
      for (int i = 0; i < polygons.size(); i++) {
        writer.write(List.of(
          Integer.toString(i),
          boundsList(grid.bounds(i)).toString(),
          GeoUtils.toWkt(polygons.get(i))
        ));
      }
    } catch (RuntimeException e) {
      FileUtils.deleteFile(tmp);
      throw e;
    }
    FileUtils.replace(tmp, path);
    LOGGER.info("Exported {} tiles to {}", grid.size(), path);
  }

  private static List<Double> boundsList(double[] bounds) {
    return Arrays.stream(bounds).boxed().toList();
  }
}
