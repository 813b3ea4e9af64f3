package com.tileshard.dataset;

/**
 * The kinds of elements that can be tiled, and how their coordinates behave.
 */
public enum ElementKind {
  /** Pixel grid: integral coordinates, and tiles may extend past the last pixel. */
  RASTER(false, true),
  /** Continuous coordinates, and tiles must exactly cover the extent so every point falls into at least one tile. */
  POINT_CLOUD(true, false);

  private final boolean tight;
  private final boolean integerCoords;

  ElementKind(boolean tight, boolean integerCoords) {
    this.tight = tight;
    this.integerCoords = integerCoords;
  }

  public boolean tight() {
    return tight;
  }

  public boolean integerCoords() {
    return integerCoords;
  }
}
