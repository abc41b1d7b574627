package com.onthegomap.mapkit.symbology;

import com.google.common.base.Preconditions;
import com.onthegomap.mapkit.config.MapkitConfig;

/**
 * How to draw a single point feature.
 *
 * @param color hex color like {@code #4682B4}
 * @param size  marker width and height in pixels
 * @param shape marker shape
 */
public record PointSymbolizer(String color, double size, PointShape shape) {

  public PointSymbolizer {
    Preconditions.checkArgument(MapkitConfig.isHexColor(color), "Invalid color: %s", color);
    Preconditions.checkArgument(size > 0, "Point size must be positive, got %s", size);
    Preconditions.checkNotNull(shape, "shape");
  }

  public PointSymbolizer withColor(String newColor) {
    return new PointSymbolizer(newColor, size, shape);
  }

  public PointSymbolizer withSize(double newSize) {
    return new PointSymbolizer(color, newSize, shape);
  }
}
