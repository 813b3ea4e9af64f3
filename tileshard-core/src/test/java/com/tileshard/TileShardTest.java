package com.tileshard;

import static com.tileshard.TestUtils.assertLines;
import static com.tileshard.TestUtils.readLines;
import static com.tileshard.TestUtils.writeLines;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.tileshard.config.Arguments;
import com.tileshard.tiling.InvalidTilingException;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

@Timeout(30)
class TileShardTest {

  @TempDir
  Path tmpDir;

  @Test
  void testTilesAndShardsCsv() {
    Path input = tmpDir.resolve("points.csv");
    writeLines(input, "x,y,gene", "0,0,a", "45,0,b", "55,0,c", "100,0,d");
    Path output = tmpDir.resolve("out");
    var results = TileShard.run(Arguments.of(
      "input", input,
      "output", output,
      "tile_width", 60,
      "tile_overlap", 20,
      "threads", 2
    ));
    assertEquals(2, results.size());
    assertLines(output.resolve("0").resolve("transcripts.csv"), "x,y,gene", "0,0,a", "45,0,b", "55,0,c");
    assertLines(output.resolve("1").resolve("transcripts.csv"), "x,y,gene", "45,0,b", "55,0,c", "100,0,d");
    var tiles = readLines(output.resolve(TileShard.TILES_FILE));
    assertEquals(3, tiles.size());
    assertEquals("index,bboxes,geometry", tiles.get(0));
    assertTrue(tiles.get(2).startsWith("1,\"[40.0, 0.0, 100.0, 60.0]\""), tiles.get(2));
  }

  @Test
  void testRoiAndPriorFiles() {
    Path input = tmpDir.resolve("points.csv");
    writeLines(input, "x,y,gene", "0,0,a", "10,0,b", "0,10,c", "10,10,d", "2,2,e");
    Path roi = tmpDir.resolve("roi.wkt");
    writeLines(roi, "POLYGON ((0 0, 10 0, 0 10, 0 0))");
    Path prior = tmpDir.resolve("cells.wkt");
    writeLines(prior, "POLYGON ((-1 -1, 3 -1, 3 3, -1 3, -1 -1))", "", "POLYGON ((9 -1, 11 -1, 11 1, 9 1, 9 -1))");
    Path output = tmpDir.resolve("out");
    var results = TileShard.run(Arguments.of(
      "input", input,
      "output", output,
      "roi", roi,
      "prior", prior,
      "use_prior", true
    ));
    assertEquals(1, results.size());
    assertLines(results.get(0).path(), "x,y,gene,cell", "0,0,a,1", "10,0,b,2", "0,10,c,0", "2,2,e,1");
  }

  @Test
  void testRoiBounds() {
    Path input = tmpDir.resolve("points.csv");
    writeLines(input, "x,y", "0,0", "100,100");
    var results = TileShard.run(Arguments.of(
      "input", input,
      "output", tmpDir.resolve("out"),
      "tile_width", 60,
      "tile_overlap", 20,
      "roi_bounds", "0,0,30,30"
    ));
    assertEquals(1, results.size());
    assertEquals(1, results.get(0).rows());
  }

  @Test
  void testInvalidTileSize() {
    Path input = tmpDir.resolve("points.csv");
    writeLines(input, "x,y", "0,0", "100,100");
    var args = Arguments.of("input", input, "output", tmpDir.resolve("out"), "tile_width", 50, "tile_overlap", 50);
    assertThrows(InvalidTilingException.class, () -> TileShard.run(args));
  }

  @Test
  void testMissingInput() {
    var args = Arguments.of("input", tmpDir.resolve("missing.csv"), "output", tmpDir.resolve("out"));
    assertThrows(IllegalArgumentException.class, () -> TileShard.run(args));
  }
}
