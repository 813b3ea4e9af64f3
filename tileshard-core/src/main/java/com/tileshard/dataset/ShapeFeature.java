package com.tileshard.dataset;

import java.util.Map;
import java.util.Objects;
import org.locationtech.jts.geom.Geometry;

/**
 * One geometry in a {@link ShapesLayer} along with its attribute values.
 */
public record ShapeFeature(Geometry geometry, Map<String, Object> attributes) {

  public ShapeFeature {
    Objects.requireNonNull(geometry, "geometry");
    attributes = Map.copyOf(attributes);
  }

  public ShapeFeature(Geometry geometry) {
    this(geometry, Map.of());
  }

  public Object getAttribute(String key) {
    return attributes.get(key);
  }
}
