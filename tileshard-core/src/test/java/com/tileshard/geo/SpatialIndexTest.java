package com.tileshard.geo;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateXY;

class SpatialIndexTest {

  private final SpatialIndex.Indexed index = SpatialIndex.strTree().build(List.of(
    new CoordinateXY(5, 5),
    new CoordinateXY(0, 0),
    new CoordinateXY(9, 1),
    new CoordinateXY(1, 9),
    new CoordinateXY(2, 2)
  ));

  @Test
  void testQueryReturnsSortedRows() {
    assertEquals(5, index.size());
    assertEquals(new Coordinate(9, 1), index.get(2));
    assertArrayEquals(new int[]{0, 1, 2, 3, 4}, index.query(GeoUtils.box(0, 0, 10, 10)));
  }

  @Test
  void testQueryUsesGeometryNotEnvelope() {
    var triangle = GeoUtils.parseWkt("POLYGON ((0 0, 10 0, 0 10, 0 0))");
    // (5, 5) and (9, 1) and (1, 9) lie on the hypotenuse
    assertArrayEquals(new int[]{0, 1, 2, 3, 4}, index.query(triangle));
    var smaller = GeoUtils.parseWkt("POLYGON ((0 0, 6 0, 0 6, 0 0))");
    assertArrayEquals(new int[]{1, 4}, index.query(smaller));
  }

  @Test
  void testEmpty() {
    assertArrayEquals(new int[0], index.query(GeoUtils.JTS_FACTORY.createPolygon()));
    assertArrayEquals(new int[0], SpatialIndex.strTree().build(List.of()).query(GeoUtils.box(0, 0, 1, 1)));
  }
}
