package com.onthegomap.mapkit.measure;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Well-known reference latitudes offered to editors as suggested values.
 * <p>
 * Declaration order is the order editors present them in.
 */
public enum ReferenceLatitude {
  EQUATOR("Equator", 0),
  NORTH_POLE("NorthPole", 90),
  SOUTH_POLE("SouthPole", -90),
  TROPIC_OF_CAPRICORN("TropicOfCapricorn", -23.5),
  TROPIC_OF_CANCER("TropicOfCancer", 23.5);

  private static final Pattern SEPARATORS = Pattern.compile("[\\s_-]+");

  private final String displayName;
  private final double degrees;

  ReferenceLatitude(String displayName, double degrees) {
    this.displayName = displayName;
    this.degrees = degrees;
  }

  public String displayName() {
    return displayName;
  }

  public double degrees() {
    return degrees;
  }

  /**
   * Returns the preset matching {@code name} ignoring case, whitespace, underscores and dashes, so {@code "north pole"}
   * and {@code "NORTH_POLE"} both match {@link #NORTH_POLE}.
   */
  public static Optional<ReferenceLatitude> fromName(String name) {
    if (name == null) {
      return Optional.empty();
    }
    String normalized = normalize(name);
    for (var value : values()) {
      if (normalize(value.displayName).equals(normalized)) {
        return Optional.of(value);
      }
    }
    return Optional.empty();
  }

  private static String normalize(String name) {
    return SEPARATORS.matcher(name.strip()).replaceAll("").toLowerCase(Locale.ROOT);
  }
}
