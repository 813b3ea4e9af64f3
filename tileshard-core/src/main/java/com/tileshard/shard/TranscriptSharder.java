package com.tileshard.shard;

import com.tileshard.config.TilingConfig;
import com.tileshard.dataset.PointRecord;
import com.tileshard.dataset.PointTable;
import com.tileshard.dataset.ShapesLayer;
import com.tileshard.dataset.SpatialDataset;
import com.tileshard.dataset.SpatialElement;
import com.tileshard.dataset.UnsupportedElementException;
import com.tileshard.geo.GeoUtils;
import com.tileshard.geo.SpatialIndex;
import com.tileshard.stats.Counter;
import com.tileshard.stats.ProgressLoggers;
import com.tileshard.stats.Stats;
import com.tileshard.stats.Timers;
import com.tileshard.tiling.TileGeometry;
import com.tileshard.util.CloseableIterator;
import com.tileshard.util.FileUtils;
import com.tileshard.util.LogUtil;
import com.tileshard.worker.Worker;
import com.tileshard.writer.CsvRowWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.stream.IntStream;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateXY;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits a point table into one CSV file per tile so that each tile can be processed on its own.
 * <p>
 * Tile {@code i} is written to {@code <root>/<i>/transcripts.csv} with every source column, plus a {@code cell}
 * column when prior boundaries are used. Points on a shared edge or in an overlap go to every tile that covers them.
 * Tiles clipped by the region of interest only keep the points inside the clipped shape.
 * <p>
 * Tiles run in parallel and the first tile to fail fails the whole run.
 */
public class TranscriptSharder {

  public static final String SHARD_FILE = "transcripts.csv";
  public static final String CELL_COLUMN = "cell";
  public static final String UNASSIGNED_CELL = "0";

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptSharder.class);

  private final SpatialDataset dataset;
  private final TileGeometry tiles;
  private final TilingConfig config;
  private final Stats stats;
  private SpatialIndex spatialIndex = SpatialIndex.strTree();
  private CellAssigner cellAssigner = CellAssigner.lastIntersecting();

  public TranscriptSharder(SpatialDataset dataset, TileGeometry tiles, TilingConfig config, Stats stats) {
    this.dataset = dataset;
    this.tiles = tiles;
    this.config = config;
    this.stats = stats;
  }

  /** Replaces the index used to find the points inside clipped tiles. */
  public TranscriptSharder setSpatialIndex(SpatialIndex spatialIndex) {
    this.spatialIndex = spatialIndex;
    return this;
  }

  /** Replaces how points inside clipped tiles are assigned to prior boundaries. */
  public TranscriptSharder setCellAssigner(CellAssigner cellAssigner) {
    this.cellAssigner = cellAssigner;
    return this;
  }

  /**
   * Writes every tile under {@code root} and returns one result per tile in tile order.
   *
   * @throws UnsupportedElementException         if the tiled element is not a point table
   * @throws IllegalArgumentException            if prior boundaries are requested but missing, or the cell column
   *                                             does not exist
   * @throws com.tileshard.util.StorageException if a directory or file cannot be written
   */
  public List<ShardResult> shard(Path root) {
    SpatialElement element = tiles.grid().element();
    if (!(element instanceof PointTable points)) {
      throw new UnsupportedElementException("Only point tables can be sharded, got " +
        element.getClass().getSimpleName());
    }
    PointTable source = points;
    if (config.cellKey() != null && config.unassignedValue() != null) {
      source = source.replaceValue(config.cellKey(), config.unassignedValue(), UNASSIGNED_CELL);
    }
    List<Geometry> prior = config.usePrior() ? priorBoundaries(element) : null;
    CellMapper mapper = prior == null ? null : CellMapper.fromBoundaries(prior);

    int count = tiles.grid().size();
    List<Geometry> polygons = tiles.polygons();
    ShardResult[] results = new ShardResult[count];
    Queue<Integer> queue = new ConcurrentLinkedQueue<>();
    IntStream.range(0, count).forEach(queue::add);
    Counter tilesDone = stats.longCounter("shard_tiles");
    Counter rowsWritten = stats.longCounter("shard_rows");

    LOGGER.info("Making {} point shards in {}", count, root);
    FileUtils.createDirectory(root);
    stats.monitorFile("shards", root);
    Timers.Finishable timer = stats.startStage("shard");
    PointTable table = source;
    Worker worker = new Worker("shard", stats, Math.max(1, Math.min(config.threads(), count)), () -> {
      Integer i;
      while ((i = queue.poll()) != null) {
        int tile = i;
        ShardResult result = LogUtil.withStageDetail("tile " + tile,
          () -> shardTile(tile, polygons.get(tile), table, root, prior, mapper));
        results[i] = result;
        rowsWritten.incBy(result.rows());
        tilesDone.inc();
      }
    });
    ProgressLoggers loggers = ProgressLoggers.create()
      .addRatePercentCounter("tiles", count, tilesDone)
      .addRateCounter("rows", rowsWritten);
    try {
      worker.awaitAndLog(loggers, config.logInterval());
    } finally {
      timer.stop();
    }
    LOGGER.info("Point shards saved in {}", root);
    return List.of(results);
  }

  private List<Geometry> priorBoundaries(SpatialElement element) {
    ShapesLayer layer = dataset.shapes(SpatialDataset.PRIOR_BOUNDARIES)
      .orElseThrow(() -> new IllegalArgumentException(
        "Prior boundaries requested but the dataset has no '" + SpatialDataset.PRIOR_BOUNDARIES + "' shapes"));
    return layer.geometries().stream()
      .map(geometry -> element.transform().toIntrinsic(layer.transform().toGlobal(geometry)))
      .toList();
  }

  private ShardResult shardTile(int i, Geometry polygon, PointTable source, Path root, List<Geometry> prior,
    CellMapper mapper) {
    Path dir = root.resolve(Integer.toString(i));
    FileUtils.createDirectory(dir);
    Path path = dir.resolve(SHARD_FILE);

    Envelope envelope = polygon.getEnvelopeInternal();
    PointTable subset = source.filter(envelope);
    List<String> columns = new ArrayList<>(source.columns());
    if (prior != null) {
      columns.add(CELL_COLUMN);
    }

    try (CsvRowWriter writer = CsvRowWriter.create(path, columns)) {
      // an empty shape has a null envelope that matches no point
      boolean clipped = !polygon.isEmpty() && polygon.getArea() < GeoUtils.box(envelope).getArea();
      if (clipped) {
        List<PointRecord> rows = subset.materialize();
        List<Coordinate> coordinates = rows.stream()
          .<Coordinate>map(row -> new CoordinateXY(row.x(), row.y()))
          .toList();
        SpatialIndex.Indexed index = spatialIndex.build(coordinates);
        int[] inside = index.query(polygon);
        int[] cells = prior == null ? null : cellAssigner.boundariesToCellId(index, prior);
        for (int row : inside) {
          PointRecord record = rows.get(row);
          writer.write(cells == null ? record : record.withAppended(Integer.toString(cells[row])));
        }
      } else {
        PointTable output = mapper == null ? subset : mapper.mapPointsToCells(subset, CELL_COLUMN);
        try (CloseableIterator<PointRecord> rows = output.iterator()) {
          rows.forEachRemaining(writer::write);
        }
      }
      LOGGER.debug("Tile {} bounds {}: {} points", i, Arrays.toString(tiles.grid().bounds(i)), writer.rows());
      return new ShardResult(i, path, writer.rows());
    }
  }
}
