package com.tileshard.tiling;

import static com.tileshard.util.Exceptions.checkInvariant;

import com.tileshard.dataset.Span;
import java.util.Objects;

/**
 * Splits one axis {@code [min, max]} into a fixed number of intervals of {@code tileWidth} that overlap their
 * neighbors by {@code tileOverlap}.
 * <p>
 * The number of intervals is computed once at construction. {@link #update(double)} can widen the intervals after
 * that, but only to a width that keeps the same count.
 */
public class AxisTiler {

  private final Span span;
  private final double tileOverlap;
  private final boolean integerCoords;
  private final int count;
  private double tileWidth;

  /**
   * @param integerCoords whether {@link #bounds(int)} truncates each bound toward zero, for pixel grids
   */
  public AxisTiler(double min, double max, double tileWidth, double tileOverlap, boolean integerCoords) {
    this(new Span(min, max), tileWidth, tileOverlap, integerCoords);
  }

  public AxisTiler(Span span, double tileWidth, double tileOverlap, boolean integerCoords) {
    this.span = Objects.requireNonNull(span, "span");
    this.tileWidth = tileWidth;
    this.tileOverlap = tileOverlap;
    this.integerCoords = integerCoords;
    this.count = countFor(tileWidth);
  }

  private int countFor(double width) {
    double delta = span.delta();
    if (width >= delta) {
      return 1;
    }
    return (int) Math.ceil((delta - tileOverlap) / (width - tileOverlap));
  }

  /** Returns true if intervals of {@code newWidth} would split this axis into the same {@link #count()}. */
  public boolean keepsCount(double newWidth) {
    return countFor(newWidth) == count;
  }

  /** Returns the number of intervals along this axis, always at least 1. */
  public int count() {
    return count;
  }

  /**
   * Returns the smallest whole width that covers the axis with the same {@link #count()} and overlap, so that the last
   * interval ends at {@code max} instead of past it.
   */
  public double tightWidth() {
    return Math.ceil((span.delta() + (count - 1) * tileOverlap) / count);
  }

  /**
   * Replaces the interval width.
   *
   * @throws com.tileshard.util.Exceptions.InvariantViolation if {@code newWidth} would change {@link #count()}
   */
  public void update(double newWidth) {
    this.tileWidth = newWidth;
    int recomputed = countFor(newWidth);
    checkInvariant(recomputed == count, "Width %s changes the tile count from %d to %d", newWidth, count, recomputed);
  }

  /**
   * Returns {@code [x0, x1]} of interval {@code i}, where {@code x0 = min + i * (tileWidth - tileOverlap)} and
   * {@code x1 = x0 + tileWidth}. The last interval always reaches {@code max}.
   *
   * @throws IndexOutOfBoundsException if {@code i} is not in {@code [0, count)}
   */
  public double[] bounds(int i) {
    Objects.checkIndex(i, count);
    double x0 = span.min() + i * (tileWidth - tileOverlap);
    double x1 = x0 + tileWidth;
    if (i == count - 1 && x1 < span.max()) {
      // rounding can leave the last interval an ulp short of max
      x1 = span.max();
    }
    if (integerCoords) {
      // casting truncates toward zero, also for negative origins
      return new double[]{(long) x0, (long) x1};
    }
    return new double[]{x0, x1};
  }

  public Span span() {
    return span;
  }

  public double tileWidth() {
    return tileWidth;
  }

  public double tileOverlap() {
    return tileOverlap;
  }

  public boolean isIntegerCoords() {
    return integerCoords;
  }

  @Override
  public String toString() {
    return "AxisTiler{span=" + span + ", tileWidth=" + tileWidth + ", tileOverlap=" + tileOverlap + ", count=" +
      count + '}';
  }
}
