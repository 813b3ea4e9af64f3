package com.tileshard.dataset;

import org.locationtech.jts.geom.Envelope;

/**
 * The extent of an element along both axes in its intrinsic coordinates, along with its {@link ElementKind}.
 */
public record Footprint(ElementKind kind, Span x, Span y) {

  /**
   * Resolves the footprint of {@code element}.
   * <p>
   * A {@link MultiscaleRaster} is resolved to its full-resolution image, an image spans {@code [0, width]} x
   * {@code [0, height]}, and a point table spans the min/max of its {@code x} and {@code y} columns which requires a
   * full pass over the table.
   *
   * @throws UnsupportedElementException if {@code element} is neither an image nor a point table
   * @throws IllegalArgumentException    if {@code element} is an empty point table
   */
  public static Footprint of(SpatialElement element) {
    if (element instanceof MultiscaleRaster multiscale) {
      element = multiscale.fullResolution();
    }
    if (element instanceof RasterImage image) {
      return new Footprint(ElementKind.RASTER, new Span(0, image.width()), new Span(0, image.height()));
    } else if (element instanceof PointTable table) {
      Envelope extent = table.extent();
      if (extent.isNull()) {
        throw new IllegalArgumentException("Cannot compute the footprint of an empty point table");
      }
      return new Footprint(ElementKind.POINT_CLOUD,
        new Span(extent.getMinX(), extent.getMaxX()),
        new Span(extent.getMinY(), extent.getMaxY()));
    }
    throw new UnsupportedElementException("Invalid element type: " +
      (element == null ? "null" : element.getClass().getSimpleName()));
  }

  public Envelope envelope() {
    return new Envelope(x.min(), x.max(), y.min(), y.max());
  }
}
