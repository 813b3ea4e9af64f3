package com.tileshard.config;

import java.time.Duration;

/**
 * Holder for the parameters shared by tiling and sharding.
 *
 * @param tileWidth       width and height of each tile, in the intrinsic units of the tiled element
 * @param tileOverlap     width shared by two adjacent tiles
 * @param threads         number of shard worker threads
 * @param logInterval     how often to log sharding progress
 * @param cellKey         name of an existing cell assignment column in the point table, or {@code null}
 * @param unassignedValue value of {@code cellKey} that means "not assigned to a cell", remapped to {@code 0}, or
 *                        {@code null}
 * @param usePrior        whether to assign each sharded point the id of the prior boundary containing it
 * @param overwrite       whether to replace an existing tile layer
 */
public record TilingConfig(
  double tileWidth,
  double tileOverlap,
  int threads,
  Duration logInterval,
  String cellKey,
  String unassignedValue,
  boolean usePrior,
  boolean overwrite
) {

  public static final double DEFAULT_TILE_WIDTH = 5_000;
  public static final double DEFAULT_TILE_OVERLAP = 50;

  public TilingConfig {
    if (threads < 1) {
      throw new IllegalArgumentException("threads must be >= 1, was " + threads);
    }
    if (tileWidth <= 0) {
      throw new IllegalArgumentException("tile_width must be > 0, was " + tileWidth);
    }
    if (tileOverlap < 0) {
      throw new IllegalArgumentException("tile_overlap must be >= 0, was " + tileOverlap);
    }
  }

  public static TilingConfig defaults() {
    return from(Arguments.of());
  }

  public static TilingConfig from(Arguments arguments) {
    return new TilingConfig(
      arguments.getDouble("tile_width|patch_width", "width of each tile", DEFAULT_TILE_WIDTH),
      arguments.getDouble("tile_overlap|patch_overlap", "overlap between adjacent tiles", DEFAULT_TILE_OVERLAP),
      arguments.threads(),
      arguments.getDuration("loginterval", "time between logs", "10s"),
      arguments.getString("cell_key", "existing cell assignment column of the points", null),
      arguments.getString("unassigned_value", "value of cell_key for points without a cell", null),
      arguments.getBoolean("use_prior", "assign points to prior segmentation boundaries", false),
      arguments.getBoolean("overwrite|force", "replace an existing tile layer", true)
    );
  }

  /** Returns a copy of this config with a different tile width and overlap. */
  public TilingConfig withTileSize(double width, double overlap) {
    return new TilingConfig(width, overlap, threads, logInterval, cellKey, unassignedValue, usePrior, overwrite);
  }
}
