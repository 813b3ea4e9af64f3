package com.tileshard.shard;

import static com.tileshard.TestUtils.POINTS;
import static com.tileshard.TestUtils.assertLines;
import static com.tileshard.TestUtils.config;
import static com.tileshard.TestUtils.datasetWith;
import static com.tileshard.TestUtils.points;
import static com.tileshard.TestUtils.readLines;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.tileshard.config.TilingConfig;
import com.tileshard.dataset.InMemoryPointTable;
import com.tileshard.dataset.InMemorySpatialDataset;
import com.tileshard.dataset.PointTable;
import com.tileshard.dataset.RasterImage;
import com.tileshard.dataset.ShapesLayer;
import com.tileshard.dataset.SpatialDataset;
import com.tileshard.dataset.UnsupportedElementException;
import com.tileshard.geo.GeoUtils;
import com.tileshard.stats.Stats;
import com.tileshard.tiling.GridTiler;
import com.tileshard.tiling.TileGeometry;
import com.tileshard.util.StorageException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

@Timeout(30)
class TranscriptSharderTest {

  private static final String TRIANGLE = "POLYGON ((0 0, 10 0, 0 10, 0 0))";

  @TempDir
  Path tmpDir;

  private List<ShardResult> shard(SpatialDataset dataset, TilingConfig config) {
    var tiles = new TileGeometry(new GridTiler(dataset, POINTS, config));
    return new TranscriptSharder(dataset, tiles, config, Stats.inMemory()).shard(tmpDir);
  }

  private static InMemorySpatialDataset square() {
    return datasetWith(points(
      new double[]{0, 0},
      new double[]{10, 0},
      new double[]{0, 10},
      new double[]{10, 10},
      new double[]{2, 2},
      new double[]{8, 8}
    ));
  }

  private static void addPriorCells(SpatialDataset dataset) {
    dataset.addShapes(SpatialDataset.PRIOR_BOUNDARIES, ShapesLayer.of(
      GeoUtils.box(-1, -1, 3, 3),
      GeoUtils.box(1, 1, 5, 5)
    ), false);
  }

  private static TilingConfig withPrior(TilingConfig config) {
    return new TilingConfig(config.tileWidth(), config.tileOverlap(), config.threads(), config.logInterval(),
      null, null, true, true);
  }

  @Test
  void testSingleTileKeepsEveryPointOnce() {
    var results = shard(square(), config(100, 10));
    assertEquals(1, results.size());
    assertEquals(new ShardResult(0, tmpDir.resolve("0").resolve("transcripts.csv"), 6), results.get(0));
    assertLines(results.get(0).path(),
      "x,y,gene",
      "0,0,gene0",
      "10,0,gene1",
      "0,10,gene2",
      "10,10,gene3",
      "2,2,gene4",
      "8,8,gene5"
    );
  }

  @Test
  void testPointAtTheEdgeOfTightGridIsSharded() {
    var dataset = datasetWith(points(
      new double[]{521.87, 0},
      new double[]{12565.87, 10}
    ));
    var results = shard(dataset, config(5622, 4286));
    assertEquals(6, results.size());
    assertTrue(results.get(0).rows() >= 1);
    assertEquals(1, results.get(5).rows());
    assertLines(results.get(5).path(),
      "x,y,gene",
      "12565.87,10,gene1"
    );
  }

  @Test
  void testPointsInOverlapGoToBothTiles() {
    var dataset = datasetWith(points(
      new double[]{0, 0},
      new double[]{45, 0},
      new double[]{55, 0},
      new double[]{100, 0}
    ));
    var results = shard(dataset, config(60, 20));
    assertEquals(2, results.size());
    assertLines(results.get(0).path(), "x,y,gene", "0,0,gene0", "45,0,gene1", "55,0,gene2");
    assertLines(results.get(1).path(), "x,y,gene", "45,0,gene1", "55,0,gene2", "100,0,gene3");
  }

  @Test
  void testEmptyTileWritesHeaderOnly() {
    var dataset = datasetWith(points(new double[]{0, 0}, new double[]{100, 100}));
    var results = shard(dataset, config(60, 20));
    assertEquals(4, results.size());
    assertEquals(List.of(1L, 0L, 0L, 1L), results.stream().map(ShardResult::rows).toList());
    assertLines(results.get(1).path(), "x,y,gene");
    assertLines(results.get(3).path(), "x,y,gene", "100,100,gene1");
  }

  @Test
  void testClippedTileOnlyKeepsPointsInsideRoi() {
    var dataset = square();
    dataset.addShapes(SpatialDataset.REGION_OF_INTEREST, ShapesLayer.of(GeoUtils.parseWkt(TRIANGLE)), false);
    var results = shard(dataset, config(100, 10));
    assertLines(results.get(0).path(),
      "x,y,gene",
      "0,0,gene0",
      "10,0,gene1",
      "0,10,gene2",
      "2,2,gene4"
    );
    assertEquals(4, results.get(0).rows());
  }

  @Test
  void testPriorCellsOnClippedTile() {
    var dataset = square();
    dataset.addShapes(SpatialDataset.REGION_OF_INTEREST, ShapesLayer.of(GeoUtils.parseWkt(TRIANGLE)), false);
    addPriorCells(dataset);
    var results = shard(dataset, withPrior(config(100, 10)));
    assertLines(results.get(0).path(),
      "x,y,gene,cell",
      "0,0,gene0,1",
      "10,0,gene1,0",
      "0,10,gene2,0",
      "2,2,gene4,2"
    );
  }

  @Test
  void testPriorCellsOnRectangularTile() {
    var dataset = square();
    addPriorCells(dataset);
    var results = shard(dataset, withPrior(config(100, 10)));
    assertLines(results.get(0).path(),
      "x,y,gene,cell",
      "0,0,gene0,1",
      "10,0,gene1,0",
      "0,10,gene2,0",
      "10,10,gene3,0",
      "2,2,gene4,2",
      "8,8,gene5,0"
    );
  }

  @Test
  void testMissingPriorCells() {
    var config = withPrior(config(100, 10));
    var dataset = square();
    assertThrows(IllegalArgumentException.class, () -> shard(dataset, config));
  }

  @Test
  void testUnassignedValueIsReplacedWithZero() {
    var table = InMemoryPointTable.builder(PointTable.X, PointTable.Y, "cell_id")
      .add(0, 0, "UNASSIGNED")
      .add(5, 5, "7")
      .build();
    var config = new TilingConfig(100, 10, 2, Duration.ofSeconds(10), "cell_id", "UNASSIGNED", false, true);
    var results = shard(datasetWith(table), config);
    assertLines(results.get(0).path(), "x,y,cell_id", "0,0,0", "5,5,7");
  }

  @Test
  void testOnlyPointTablesCanBeSharded() {
    var dataset = new InMemorySpatialDataset().put("image", new RasterImage(100, 100));
    var config = config(30, 10);
    var tiles = new TileGeometry(new GridTiler(dataset, "image", config));
    var sharder = new TranscriptSharder(dataset, tiles, config, Stats.inMemory());
    assertThrows(UnsupportedElementException.class, () -> sharder.shard(tmpDir));
  }

  @Test
  void testOutputDirectoryIsAFile() throws IOException {
    var config = config(100, 10);
    var dataset = square();
    var tiles = new TileGeometry(new GridTiler(dataset, POINTS, config));
    Path root = tmpDir.resolve("root");
    Files.writeString(root, "not a directory");
    var sharder = new TranscriptSharder(dataset, tiles, config, Stats.inMemory());
    var exception = assertThrows(StorageException.class, () -> sharder.shard(root));
    assertEquals(root, exception.path());
  }

  @Test
  void testFirstFailingTileFailsTheRun() {
    var dataset = square();
    dataset.addShapes(SpatialDataset.REGION_OF_INTEREST, ShapesLayer.of(GeoUtils.parseWkt(TRIANGLE)), false);
    var config = config(100, 10);
    var tiles = new TileGeometry(new GridTiler(dataset, POINTS, config));
    var sharder = new TranscriptSharder(dataset, tiles, config, Stats.inMemory())
      .setSpatialIndex(points -> {
        throw new IllegalStateException("index failed");
      });
    var exception = assertThrows(IllegalStateException.class, () -> sharder.shard(tmpDir));
    assertEquals("index failed", exception.getMessage());
  }

  @Test
  void testCustomCellAssigner() {
    var dataset = square();
    dataset.addShapes(SpatialDataset.REGION_OF_INTEREST, ShapesLayer.of(GeoUtils.parseWkt(TRIANGLE)), false);
    addPriorCells(dataset);
    var config = withPrior(config(100, 10));
    var tiles = new TileGeometry(new GridTiler(dataset, POINTS, config));
    var results = new TranscriptSharder(dataset, tiles, config, Stats.inMemory())
      .setCellAssigner((points, boundaries) -> new int[points.size()])
      .shard(tmpDir);
    for (String line : readLines(results.get(0).path()).subList(1, 5)) {
      assertTrue(line.endsWith(",0"), line);
    }
  }

  @Test
  void testManyTilesOnSeveralThreads() {
    var builder = InMemoryPointTable.builder(PointTable.X, PointTable.Y, "gene");
    for (int x = 0; x <= 100; x += 5) {
      for (int y = 0; y <= 100; y += 5) {
        builder.add(x, y, "g");
      }
    }
    var config = new TilingConfig(20, 5, 4, Duration.ofSeconds(10), null, null, false, true);
    var results = shard(datasetWith(builder.build()), config);
    assertEquals(49, results.size());
    for (int i = 0; i < results.size(); i++) {
      assertEquals(i, results.get(i).index());
      assertEquals(results.get(i).rows() + 1, readLines(results.get(i).path()).size());
      assertFalse(results.get(i).rows() == 0);
    }
  }
}
