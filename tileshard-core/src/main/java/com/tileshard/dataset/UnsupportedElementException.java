package com.tileshard.dataset;

/**
 * Thrown when an element of a {@link SpatialDataset} can't be used for the requested operation, for example when
 * tiling is requested on a layer of shapes instead of an image or a point table.
 */
public class UnsupportedElementException extends RuntimeException {

  public UnsupportedElementException(String message) {
    super(message);
  }
}
