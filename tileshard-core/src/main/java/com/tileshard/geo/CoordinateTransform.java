package com.tileshard.geo;

import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.util.AffineTransformation;
import org.locationtech.jts.geom.util.NoninvertibleTransformationException;

/**
 * Maps geometries between the intrinsic coordinate space of one dataset element (pixels for an image, native units
 * for a point table) and the global coordinate space shared by every element in the dataset.
 */
public interface CoordinateTransform {

  CoordinateTransform IDENTITY = new CoordinateTransform() {
    @Override
    public Geometry toGlobal(Geometry geometry) {
      return geometry;
    }

    @Override
    public Geometry toIntrinsic(Geometry geometry) {
      return geometry;
    }

    @Override
    public String toString() {
      return "Identity";
    }
  };

  /** Returns {@code geometry}, given in intrinsic coordinates, in global coordinates. */
  Geometry toGlobal(Geometry geometry);

  /** Returns {@code geometry}, given in global coordinates, in intrinsic coordinates. */
  Geometry toIntrinsic(Geometry geometry);

  static CoordinateTransform identity() {
    return IDENTITY;
  }

  /**
   * Returns a transform where {@code intrinsicToGlobal} maps intrinsic coordinates to global coordinates.
   *
   * @throws IllegalArgumentException if {@code intrinsicToGlobal} can't be inverted
   */
  static CoordinateTransform affine(AffineTransformation intrinsicToGlobal) {
    return new Affine(intrinsicToGlobal);
  }

  /** Returns a transform that scales intrinsic coordinates by {@code sx, sy} to get global coordinates. */
  static CoordinateTransform scale(double sx, double sy) {
    return affine(AffineTransformation.scaleInstance(sx, sy));
  }

  /** Returns a transform that shifts intrinsic coordinates by {@code dx, dy} to get global coordinates. */
  static CoordinateTransform translation(double dx, double dy) {
    return affine(AffineTransformation.translationInstance(dx, dy));
  }

  /** Returns a transform that applies {@code this} then {@code next} when going from intrinsic to global. */
  default CoordinateTransform andThen(CoordinateTransform next) {
    var first = this;
    return new CoordinateTransform() {
      @Override
      public Geometry toGlobal(Geometry geometry) {
        return next.toGlobal(first.toGlobal(geometry));
      }

      @Override
      public Geometry toIntrinsic(Geometry geometry) {
        return first.toIntrinsic(next.toIntrinsic(geometry));
      }

      @Override
      public String toString() {
        return first + " -> " + next;
      }
    };
  }

  /** An affine transform and its precomputed inverse. */
  final class Affine implements CoordinateTransform {

    private final AffineTransformation forward;
    private final AffineTransformation inverse;

    private Affine(AffineTransformation forward) {
      this.forward = forward;
      try {
        this.inverse = forward.getInverse();
      } catch (NoninvertibleTransformationException e) {
        throw new IllegalArgumentException("Transform is not invertible: " + forward, e);
      }
    }

    @Override
    public Geometry toGlobal(Geometry geometry) {
      return forward.transform(geometry);
    }

    @Override
    public Geometry toIntrinsic(Geometry geometry) {
      return inverse.transform(geometry);
    }

    @Override
    public String toString() {
      return "Affine" + forward;
    }
  }
}
