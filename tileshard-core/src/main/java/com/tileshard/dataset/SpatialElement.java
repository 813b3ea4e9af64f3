package com.tileshard.dataset;

import com.tileshard.geo.CoordinateTransform;

/**
 * One named element of a {@link SpatialDataset}: an image, a point table, or a layer of shapes.
 */
public interface SpatialElement {

  /** Returns the transform between this element's intrinsic coordinates and the dataset's global coordinates. */
  CoordinateTransform transform();
}
