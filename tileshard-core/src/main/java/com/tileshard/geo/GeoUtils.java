package com.tileshard.geo;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateXY;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.impl.PackedCoordinateSequenceFactory;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;
import org.locationtech.jts.io.WKTWriter;

/**
 * A collection of utilities for working with JTS data structures and planar geometry.
 */
public class GeoUtils {

  /** Shared geometry factory that stores coordinates in packed double arrays. */
  public static final GeometryFactory JTS_FACTORY = new GeometryFactory(PackedCoordinateSequenceFactory.DOUBLE_FACTORY);

  // should not instantiate
  private GeoUtils() {}

  public static Point point(double x, double y) {
    return JTS_FACTORY.createPoint(new CoordinateXY(x, y));
  }

  public static Point point(Coordinate coord) {
    return JTS_FACTORY.createPoint(coord);
  }

  /** Returns an axis-aligned rectangle polygon from {@code minX,minY} to {@code maxX,maxY}. */
  public static Polygon box(double minX, double minY, double maxX, double maxY) {
    return JTS_FACTORY.createPolygon(new Coordinate[]{
      new CoordinateXY(minX, minY),
      new CoordinateXY(maxX, minY),
      new CoordinateXY(maxX, maxY),
      new CoordinateXY(minX, maxY),
      new CoordinateXY(minX, minY)
    });
  }

  /** Returns an axis-aligned rectangle polygon from {@code [minX, minY, maxX, maxY]}. */
  public static Polygon box(double[] bounds) {
    if (bounds.length != 4) {
      throw new IllegalArgumentException("Expected [minX, minY, maxX, maxY] but got " + bounds.length + " values");
    }
    return box(bounds[0], bounds[1], bounds[2], bounds[3]);
  }

  /** Returns the rectangle polygon covering {@code envelope}. */
  public static Polygon box(Envelope envelope) {
    return box(envelope.getMinX(), envelope.getMinY(), envelope.getMaxX(), envelope.getMaxY());
  }

  /**
   * Parses a geometry from well-known text.
   *
   * @throws IllegalArgumentException if {@code wkt} is not valid well-known text
   */
  public static Geometry parseWkt(String wkt) {
    try {
      return new WKTReader(JTS_FACTORY).read(wkt);
    } catch (ParseException e) {
      throw new IllegalArgumentException("Invalid WKT: " + wkt, e);
    }
  }

  /** Returns {@code geometry} as well-known text. */
  public static String toWkt(Geometry geometry) {
    return new WKTWriter().write(geometry);
  }
}
