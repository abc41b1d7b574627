package com.onthegomap.mapkit.symbology;

import com.onthegomap.mapkit.config.MapkitConfig;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The {@link Scheme} of a {@link PointLayer}.
 * <p>
 * A new scheme starts with a single category that draws every feature with the default symbolizer from
 * {@link MapkitConfig}. Categories can be edited in place, but layers replace their scheme as a whole.
 * <p>
 * Equality and hash code follow the current categories, so they change when the scheme is edited. Do not edit a
 * scheme while it is a key in a hash-based collection.
 */
public class PointScheme implements Scheme<PointCategory> {

  public static final String DEFAULT_LEGEND_TEXT = "All features";

  private final List<PointCategory> categories = new ArrayList<>();

  public PointScheme(MapkitConfig config) {
    categories.add(new PointCategory(DEFAULT_LEGEND_TEXT,
      new PointSymbolizer(config.pointColor(), config.pointSize(), PointShape.ELLIPSE)));
  }

  public PointScheme() {
    this(MapkitConfig.defaults());
  }

  @Override
  public List<PointCategory> categories() {
    return Collections.unmodifiableList(categories);
  }

  public PointScheme addCategory(PointCategory category) {
    categories.add(category);
    return this;
  }

  public boolean removeCategory(PointCategory category) {
    return categories.remove(category);
  }

  public void clearCategories() {
    categories.clear();
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof PointScheme other && categories.equals(other.categories));
  }

  @Override
  public int hashCode() {
    return Objects.hash(categories);
  }

  @Override
  public String toString() {
    return "PointScheme" + categories;
  }
}
