package com.onthegomap.mapkit.measure;

import java.util.Locale;

/**
 * An angle north (positive) or south (negative) of the equator, in decimal degrees.
 * <p>
 * Values outside of [-90, 90] are kept as given until {@link #normalize()} folds them back over the poles.
 */
public final class Latitude implements Measurement, Comparable<Latitude> {

  public static final Latitude EMPTY = new Latitude(0);
  public static final Latitude EQUATOR = new Latitude(ReferenceLatitude.EQUATOR.degrees());
  public static final Latitude NORTH_POLE = new Latitude(ReferenceLatitude.NORTH_POLE.degrees());
  public static final Latitude SOUTH_POLE = new Latitude(ReferenceLatitude.SOUTH_POLE.degrees());
  public static final Latitude TROPIC_OF_CANCER = new Latitude(ReferenceLatitude.TROPIC_OF_CANCER.degrees());
  public static final Latitude TROPIC_OF_CAPRICORN = new Latitude(ReferenceLatitude.TROPIC_OF_CAPRICORN.degrees());

  private final double decimalDegrees;

  public Latitude(double decimalDegrees) {
    this.decimalDegrees = decimalDegrees;
  }

  /**
   * Parses {@code text} like {@code "23.5°N"} or {@code "-12,5"} using the number conventions of {@code locale}.
   *
   * @throws ValueFormatException if {@code text} is not a valid latitude
   */
  public static Latitude parse(String text, Locale locale) {
    return new Latitude(DegreeFormat.forLocale(locale).parseLatitude(text));
  }

  @Override
  public double decimalDegrees() {
    return decimalDegrees;
  }

  public boolean isNorthern() {
    return decimalDegrees > 0;
  }

  public boolean isSouthern() {
    return decimalDegrees < 0;
  }

  public boolean isEmpty() {
    return decimalDegrees == 0;
  }

  public boolean isInvalid() {
    return Double.isNaN(decimalDegrees);
  }

  /**
   * Returns this latitude folded into [-90, 90] the way a path continues over a pole, so {@code 100} becomes
   * {@code 80} and {@code -190} becomes {@code 10}.
   */
  public Latitude normalize() {
    if (Double.isNaN(decimalDegrees) || Double.isInfinite(decimalDegrees)) {
      return this;
    }
    double wrapped = ((decimalDegrees + 180) % 360 + 360) % 360 - 180;
    if (wrapped > 90) {
      wrapped = 180 - wrapped;
    } else if (wrapped < -90) {
      wrapped = -180 - wrapped;
    }
    return wrapped == decimalDegrees ? this : new Latitude(wrapped);
  }

  public double toRadians() {
    return Math.toRadians(decimalDegrees);
  }

  @Override
  public String format(Locale locale) {
    return DegreeFormat.forLocale(locale).formatLatitude(decimalDegrees);
  }

  @Override
  public int compareTo(Latitude o) {
    return Double.compare(decimalDegrees, o.decimalDegrees);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof Latitude other && (decimalDegrees == other.decimalDegrees ||
      (Double.isNaN(decimalDegrees) && Double.isNaN(other.decimalDegrees)));
  }

  @Override
  public int hashCode() {
    return Double.hashCode(decimalDegrees == 0 ? 0d : decimalDegrees);
  }

  /** Returns the canonical text for this latitude, like {@code "23.5°N"}. */
  @Override
  public String toString() {
    return format(Locale.ROOT);
  }
}
