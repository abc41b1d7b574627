package com.onthegomap.mapkit.config;

import com.google.common.base.Preconditions;
import java.util.regex.Pattern;

/**
 * Holder for parameters used when building layers.
 *
 * @param singlePointPadding distance added on each side of the extent of a layer with exactly one point
 * @param pointSize          marker size of the default point symbolizer, in pixels
 * @param pointColor         hex color of the default point symbolizer
 */
public record MapkitConfig(
  double singlePointPadding,
  double pointSize,
  String pointColor
) {

  public static final double DEFAULT_SINGLE_POINT_PADDING = 10;
  public static final double DEFAULT_POINT_SIZE = 4;
  public static final String DEFAULT_POINT_COLOR = "#4682B4";

  private static final Pattern HEX_COLOR = Pattern.compile("^#[0-9a-fA-F]{6}$");

  private static final MapkitConfig DEFAULTS =
    new MapkitConfig(DEFAULT_SINGLE_POINT_PADDING, DEFAULT_POINT_SIZE, DEFAULT_POINT_COLOR);

  public MapkitConfig {
    Preconditions.checkArgument(singlePointPadding >= 0, "single point padding must be >= 0, got %s",
      singlePointPadding);
    Preconditions.checkArgument(pointSize > 0, "point size must be > 0, got %s", pointSize);
    Preconditions.checkArgument(isHexColor(pointColor), "point color must look like #RRGGBB, got %s", pointColor);
  }

  /** Returns true if {@code color} is a {@code #RRGGBB} hex color. */
  public static boolean isHexColor(String color) {
    return color != null && HEX_COLOR.matcher(color).matches();
  }

  public static MapkitConfig defaults() {
    return DEFAULTS;
  }

  public static MapkitConfig from(Arguments arguments) {
    return new MapkitConfig(
      arguments.getDouble("single_point_padding",
        "distance to expand the extent of a layer with a single point by on each side",
        DEFAULT_SINGLE_POINT_PADDING),
      arguments.getDouble("point_size", "size of the default point marker in pixels", DEFAULT_POINT_SIZE),
      arguments.getString("point_color", "hex color of the default point marker", DEFAULT_POINT_COLOR)
    );
  }
}
