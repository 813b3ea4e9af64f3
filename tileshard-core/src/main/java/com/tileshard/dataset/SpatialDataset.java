package com.tileshard.dataset;

import java.util.Optional;
import java.util.Set;

/**
 * A container of named images, point tables and shape layers that share a global coordinate space.
 */
public interface SpatialDataset {

  /** Reserved shapes key of the region of interest polygon. */
  String REGION_OF_INTEREST = "region_of_interest";
  /** Reserved shapes key of the tile layer written by {@link com.tileshard.tiling.GridPersistence}. */
  String TILES = "sopa_patches";
  /** Reserved shapes key of the prior segmentation boundaries used to assign points to cells. */
  String PRIOR_BOUNDARIES = "cellpose_boundaries";

  /**
   * Returns the element named {@code name}.
   *
   * @throws IllegalArgumentException if there is no such element
   */
  SpatialElement element(String name);

  /** Returns the names of every element in this dataset. */
  Set<String> elementNames();

  /** Returns the shapes layer stored under {@code key}, if any. */
  Optional<ShapesLayer> shapes(String key);

  /**
   * Stores {@code layer} under {@code key}.
   *
   * @throws IllegalArgumentException if a layer named {@code key} exists and {@code overwrite} is false
   */
  void addShapes(String key, ShapesLayer layer, boolean overwrite);
}
