package com.tileshard.dataset;

import com.tileshard.geo.CoordinateTransform;
import java.util.List;
import java.util.Objects;
import org.locationtech.jts.geom.Geometry;

/**
 * An ordered list of geometries in the intrinsic coordinate space of {@code transform}, such as a region of interest,
 * cell boundaries, or the tiles computed by {@link com.tileshard.tiling.GridTiler}.
 */
public record ShapesLayer(List<ShapeFeature> features, CoordinateTransform transform) implements SpatialElement {

  public ShapesLayer {
    features = List.copyOf(features);
    Objects.requireNonNull(transform, "transform");
  }

  /** Returns a layer with one attribute-less feature for each geometry in {@code geometries}. */
  public static ShapesLayer of(CoordinateTransform transform, List<? extends Geometry> geometries) {
    return new ShapesLayer(geometries.stream().map(ShapeFeature::new).toList(), transform);
  }

  /** Returns a layer in global coordinates with one attribute-less feature for each geometry. */
  public static ShapesLayer of(Geometry... geometries) {
    return of(CoordinateTransform.identity(), List.of(geometries));
  }

  public List<Geometry> geometries() {
    return features.stream().map(ShapeFeature::geometry).toList();
  }

  public int size() {
    return features.size();
  }

  public boolean isEmpty() {
    return features.isEmpty();
  }
}
