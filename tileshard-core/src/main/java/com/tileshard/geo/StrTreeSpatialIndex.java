package com.tileshard.geo;

import java.util.List;
import javax.annotation.concurrent.ThreadSafe;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.locationtech.jts.index.strtree.STRtree;

/**
 * A {@link SpatialIndex.Indexed} over points stored in a JTS {@link STRtree}.
 * <p>
 * The tree is built eagerly in the constructor, so reads are thread-safe.
 */
@ThreadSafe
class StrTreeSpatialIndex implements SpatialIndex.Indexed {

  private final STRtree index = new STRtree();
  private final Coordinate[] points;

  StrTreeSpatialIndex(List<Coordinate> points) {
    this.points = points.toArray(Coordinate[]::new);
    for (int i = 0; i < this.points.length; i++) {
      index.insert(new Envelope(this.points[i]), i);
    }
    index.build();
  }

  @Override
  public int size() {
    return points.length;
  }

  @Override
  public Coordinate get(int index) {
    return points[index];
  }

  @Override
  public int[] query(Geometry geometry) {
    if (geometry.isEmpty() || points.length == 0) {
      return new int[0];
    }
    // first pre-filter points with the envelope of the query geometry
    List<?> items = index.query(geometry.getEnvelopeInternal());
    // then post-filter to only points that actually intersect it
    PreparedGeometry prepared = PreparedGeometryFactory.prepare(geometry);
    return items.stream()
      .mapToInt(item -> (Integer) item)
      .filter(i -> prepared.intersects(GeoUtils.point(points[i])))
      .sorted()
      .toArray();
  }
}
