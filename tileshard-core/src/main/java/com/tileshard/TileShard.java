package com.tileshard;

import com.tileshard.config.Arguments;
import com.tileshard.config.TilingConfig;
import com.tileshard.dataset.InMemorySpatialDataset;
import com.tileshard.dataset.ShapesLayer;
import com.tileshard.dataset.SpatialDataset;
import com.tileshard.geo.CoordinateTransform;
import com.tileshard.geo.GeoUtils;
import com.tileshard.persist.GridPersistence;
import com.tileshard.reader.CsvPointTable;
import com.tileshard.shard.ShardResult;
import com.tileshard.shard.TranscriptSharder;
import com.tileshard.stats.Stats;
import com.tileshard.stats.Timers;
import com.tileshard.tiling.GridTiler;
import com.tileshard.tiling.TileGeometry;
import com.tileshard.util.StorageException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point: tiles a point CSV and writes one shard per tile.
 * <p>
 * Usage: {@code java -jar tileshard.jar input=points.csv output=shards [roi=roi.wkt] [prior=cells.wkt]} plus any
 * {@link TilingConfig} argument. Arguments can also come from {@code tileshard.*} JVM properties, {@code TILESHARD_*}
 * environment variables, or a {@code config} properties file.
 */
public class TileShard {

  public static final String ELEMENT = "transcripts";
  public static final String TILES_FILE = "tiles.csv";

  private static final Logger LOGGER = LoggerFactory.getLogger(TileShard.class);

  private TileShard() {}

  public static void main(String[] args) {
    run(Arguments.fromArgsOrConfigFile(args));
  }

  /** Reads inputs named by {@code arguments}, writes the tiles and shards, and returns the shards in tile order. */
  public static List<ShardResult> run(Arguments arguments) {
    Path input = arguments.inputFile("input", "point CSV file or directory of CSV partitions");
    Path output = arguments.file("output", "directory to write tiles and shards to");
    Path roiFile = arguments.file("roi", "file with a region of interest as well-known text", null);
    Envelope roiBounds = arguments.envelope("roi_bounds", "rectangular region of interest, used without roi");
    Path priorFile = arguments.file("prior", "file with one prior cell boundary per line as well-known text", null);
    TilingConfig config = TilingConfig.from(arguments);
    Stats stats = arguments.getStats();

    InMemorySpatialDataset dataset = new InMemorySpatialDataset();
    dataset.put(ELEMENT, CsvPointTable.open(input));
    if (roiFile != null) {
      dataset.addShapes(SpatialDataset.REGION_OF_INTEREST, ShapesLayer.of(readWkt(roiFile).get(0)), true);
    } else if (roiBounds != null) {
      dataset.addShapes(SpatialDataset.REGION_OF_INTEREST, ShapesLayer.of(GeoUtils.box(roiBounds)), true);
    }
    if (priorFile != null) {
      dataset.addShapes(SpatialDataset.PRIOR_BOUNDARIES,
        ShapesLayer.of(CoordinateTransform.identity(), readWkt(priorFile)), true);
    }

    Timers.Finishable tiling = stats.startStage("tiling");
    TileGeometry tiles = new TileGeometry(new GridTiler(dataset, ELEMENT, config));
    GridPersistence persistence = new GridPersistence(dataset, tiles);
    persistence.write(config.overwrite());
    persistence.exportCsv(output.resolve(TILES_FILE));
    tiling.stop();

    List<ShardResult> results = new TranscriptSharder(dataset, tiles, config, stats)
      .shard(output);
    stats.printSummary();
    LOGGER.info("Finished {} shards", results.size());
    return results;
  }

  private static List<Geometry> readWkt(Path path) {
    try {
      List<Geometry> result = Files.readAllLines(path).stream()
        .filter(line -> !line.isBlank())
        .map(GeoUtils::parseWkt)
        .toList();
      if (result.isEmpty()) {
        throw new IllegalArgumentException(path + " has no geometries");
      }
      return result;
    } catch (IOException e) {
      throw new StorageException("Unable to read", path, e);
    }
  }
}
