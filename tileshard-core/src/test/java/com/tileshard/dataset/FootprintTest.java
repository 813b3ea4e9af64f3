package com.tileshard.dataset;

import static com.tileshard.TestUtils.points;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.tileshard.geo.GeoUtils;
import java.util.List;
import org.junit.jupiter.api.Test;

class FootprintTest {

  @Test
  void testRaster() {
    assertEquals(new Footprint(ElementKind.RASTER, new Span(0, 40), new Span(0, 30)),
      Footprint.of(new RasterImage(40, 30)));
  }

  @Test
  void testMultiscaleRaster() {
    var multiscale = new MultiscaleRaster(List.of(new RasterImage(40, 30), new RasterImage(20, 15)));
    assertEquals(Footprint.of(new RasterImage(40, 30)), Footprint.of(multiscale));
  }

  @Test
  void testPoints() {
    var footprint = Footprint.of(points(new double[]{-1, 2}, new double[]{3, 4}));
    assertEquals(new Footprint(ElementKind.POINT_CLOUD, new Span(-1, 3), new Span(2, 4)), footprint);
    assertEquals(4, footprint.x().delta());
  }

  @Test
  void testUnsupported() {
    var exception = assertThrows(UnsupportedElementException.class,
      () -> Footprint.of(ShapesLayer.of(GeoUtils.box(0, 0, 1, 1))));
    assertEquals("Invalid element type: ShapesLayer", exception.getMessage());
  }

  @Test
  void testInvalidSpan() {
    assertThrows(IllegalArgumentException.class, () -> new Span(2, 1));
    assertThrows(IllegalArgumentException.class, () -> new RasterImage(-1, 1));
    assertThrows(IllegalArgumentException.class, () -> new MultiscaleRaster(List.of()));
  }
}
