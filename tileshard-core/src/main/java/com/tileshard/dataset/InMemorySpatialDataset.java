package com.tileshard.dataset;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import javax.annotation.concurrent.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link SpatialDataset} that holds references to its elements in memory.
 * <p>
 * Shape layers are elements too, so they can be looked up with {@link #element(String)}. Replacing a layer swaps the
 * reference atomically, so concurrent readers see either the old or the new layer.
 */
@ThreadSafe
public class InMemorySpatialDataset implements SpatialDataset {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemorySpatialDataset.class);
  private final ConcurrentMap<String, SpatialElement> elements = new ConcurrentHashMap<>();

  /** Adds or replaces the image or point table named {@code name} and returns this dataset. */
  public InMemorySpatialDataset put(String name, SpatialElement element) {
    elements.put(name, element);
    return this;
  }

  @Override
  public SpatialElement element(String name) {
    SpatialElement element = elements.get(name);
    if (element == null) {
      throw new IllegalArgumentException("No element named '" + name + "', available: " + elements.keySet());
    }
    return element;
  }

  @Override
  public Set<String> elementNames() {
    return Set.copyOf(elements.keySet());
  }

  @Override
  public Optional<ShapesLayer> shapes(String key) {
    return elements.get(key) instanceof ShapesLayer layer ? Optional.of(layer) : Optional.empty();
  }

  @Override
  public void addShapes(String key, ShapesLayer layer, boolean overwrite) {
    if (overwrite) {
      if (elements.put(key, layer) != null) {
        LOGGER.debug("Replaced existing shapes '{}'", key);
      }
    } else if (elements.putIfAbsent(key, layer) != null) {
      throw new IllegalArgumentException("Shapes '" + key + "' already exist, use overwrite to replace them");
    }
  }
}
