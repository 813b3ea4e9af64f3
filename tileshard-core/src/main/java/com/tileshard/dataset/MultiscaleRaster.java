package com.tileshard.dataset;

import com.tileshard.geo.CoordinateTransform;
import java.util.List;

/**
 * An image pyramid where scale {@code 0} is the full-resolution image and every following scale is a downsampled copy.
 */
public record MultiscaleRaster(List<RasterImage> scales) implements SpatialElement {

  public MultiscaleRaster {
    if (scales.isEmpty()) {
      throw new IllegalArgumentException("A multiscale image needs at least one scale");
    }
    scales = List.copyOf(scales);
  }

  /** Returns the full-resolution image, which is the one that gets tiled. */
  public RasterImage fullResolution() {
    return scales.get(0);
  }

  @Override
  public CoordinateTransform transform() {
    return fullResolution().transform();
  }
}
