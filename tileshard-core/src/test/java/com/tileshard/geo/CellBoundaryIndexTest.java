package com.tileshard.geo;

import static com.tileshard.geo.GeoUtils.box;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class CellBoundaryIndexTest {

  @Test
  void testNoCells() {
    CellBoundaryIndex index = CellBoundaryIndex.of(List.of());
    assertEquals(0, index.cellCount());
    assertEquals(0, index.cellAt(0.5, 0.5));
  }

  @ParameterizedTest
  @CsvSource({
    "0.5, 0.5, 1",
    "1, 1, 1",
    "0, 0.5, 1",
    "1.5, 1.5, 0",
    "-0.1, 0.5, 0",
  })
  void testSingleCell(double x, double y, int expected) {
    assertEquals(expected, CellBoundaryIndex.of(List.of(box(0, 0, 1, 1))).cellAt(x, y));
  }

  @Test
  void testOverlappingCellsUseLastOne() {
    CellBoundaryIndex index = CellBoundaryIndex.of(List.of(
      box(0, 0, 1, 1),
      box(0.5, 0.5, 2, 2),
      box(10, 10, 11, 11)
    ));
    assertEquals(3, index.cellCount());
    assertEquals(1, index.cellAt(0.25, 0.25));
    assertEquals(2, index.cellAt(0.75, 0.75));
    assertEquals(2, index.cellAt(1.5, 1.5));
    assertEquals(3, index.cellAt(10.5, 10.5));
  }

  @Test
  void testCellWithHole() {
    CellBoundaryIndex index = CellBoundaryIndex.of(List.of(box(0, 0, 1, 1).difference(box(0.25, 0.25, 0.75, 0.75))));
    assertEquals(1, index.cellAt(0.1, 0.1));
    assertEquals(0, index.cellAt(0.5, 0.5));
  }

  @Test
  void testMultiPolygonCell() {
    CellBoundaryIndex index = CellBoundaryIndex.of(List.of(
      box(5, 5, 6, 6),
      box(0, 0, 1, 1).union(box(2, 2, 3, 3))
    ));
    assertEquals(2, index.cellAt(0.5, 0.5));
    assertEquals(2, index.cellAt(2.5, 2.5));
    assertEquals(0, index.cellAt(1.5, 1.5));
    assertEquals(1, index.cellAt(5.5, 5.5));
  }

  @Test
  void testCellsWithoutAreaKeepTheirNumber() {
    CellBoundaryIndex index = CellBoundaryIndex.of(List.of(
      GeoUtils.point(0.5, 0.5),
      box(0, 0, 1, 1)
    ));
    assertEquals(2, index.cellCount());
    assertEquals(2, index.cellAt(0.5, 0.5));
  }
}
