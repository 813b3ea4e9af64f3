package com.tileshard.dataset;

import com.tileshard.geo.CoordinateTransform;
import java.util.Objects;

/**
 * A 2D image where only the pixel extents matter for tiling.
 *
 * @param width     number of pixels along the {@code x} axis
 * @param height    number of pixels along the {@code y} axis
 * @param transform maps pixel coordinates to global coordinates
 */
public record RasterImage(int width, int height, CoordinateTransform transform) implements SpatialElement {

  public RasterImage {
    if (width < 0 || height < 0) {
      throw new IllegalArgumentException("Image extents must be >= 0, got " + width + "x" + height);
    }
    Objects.requireNonNull(transform, "transform");
  }

  public RasterImage(int width, int height) {
    this(width, height, CoordinateTransform.identity());
  }
}
