package com.tileshard.tiling;

/**
 * Tile width and overlap that cannot produce a tiling, for example an overlap as wide as the tiles.
 */
public class InvalidTilingException extends IllegalArgumentException {

  public InvalidTilingException(String message) {
    super(message);
  }
}
