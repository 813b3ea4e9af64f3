package com.tileshard.dataset;

/**
 * A closed interval {@code [min, max]} along one axis.
 */
public record Span(double min, double max) {

  public Span {
    if (!(min <= max)) {
      throw new IllegalArgumentException("Invalid span [" + min + ", " + max + "]");
    }
  }

  public double delta() {
    return max - min;
  }
}
