package com.onthegomap.mapkit.measure;

import java.util.Locale;

/**
 * An angle measured upward from the horizon, in decimal degrees.
 * <p>
 * Instances are immutable and compare equal when their {@link #decimalDegrees()} are equal.
 */
public final class Elevation implements Measurement, Comparable<Elevation> {

  /** An elevation of zero, used as the value of unset properties. */
  public static final Elevation EMPTY = new Elevation(0);
  public static final Elevation HORIZON = new Elevation(0);
  /** Directly overhead. */
  public static final Elevation ZENITH = new Elevation(90);

  private final double decimalDegrees;

  public Elevation(double decimalDegrees) {
    this.decimalDegrees = decimalDegrees;
  }

  /** Returns an elevation from whole degrees, minutes and seconds, where the sign of {@code hours} applies to all. */
  public Elevation(int hours, int minutes, double seconds) {
    this(toDecimalDegrees(hours, minutes, seconds));
  }

  /**
   * Parses {@code text} using the number conventions of {@code locale}.
   *
   * @throws ValueFormatException if {@code text} is not a valid angle
   * @see DegreeFormat
   */
  public static Elevation parse(String text, Locale locale) {
    return new Elevation(DegreeFormat.forLocale(locale).parse(text));
  }

  public static Elevation fromRadians(double radians) {
    return new Elevation(Math.toDegrees(radians));
  }

  static double toDecimalDegrees(int hours, int minutes, double seconds) {
    double abs = Math.abs(hours) + minutes / 60d + seconds / 3600d;
    return hours < 0 ? -abs : abs;
  }

  @Override
  public double decimalDegrees() {
    return decimalDegrees;
  }

  /** Whole degrees, truncated toward zero. */
  public int hours() {
    return (int) decimalDegrees;
  }

  /** Whole minutes of the fractional degree, always positive. */
  public int minutes() {
    return (int) ((Math.abs(decimalDegrees) - Math.abs(hours())) * 60);
  }

  /** Remaining seconds after {@link #hours()} and {@link #minutes()}, rounded to 9 decimals. */
  public double seconds() {
    double remaining = (Math.abs(decimalDegrees) - Math.abs(hours())) * 3600 - minutes() * 60d;
    return Math.round(remaining * 1e9) / 1e9;
  }

  public double toRadians() {
    return Math.toRadians(decimalDegrees);
  }

  public boolean isEmpty() {
    return decimalDegrees == 0;
  }

  public boolean isInvalid() {
    return Double.isNaN(decimalDegrees);
  }

  public boolean isInfinity() {
    return Double.isInfinite(decimalDegrees);
  }

  public Elevation add(Elevation other) {
    return new Elevation(decimalDegrees + other.decimalDegrees);
  }

  public Elevation subtract(Elevation other) {
    return new Elevation(decimalDegrees - other.decimalDegrees);
  }

  public Elevation multiply(double factor) {
    return new Elevation(decimalDegrees * factor);
  }

  public Elevation divide(double divisor) {
    return new Elevation(decimalDegrees / divisor);
  }

  @Override
  public String format(Locale locale) {
    return DegreeFormat.forLocale(locale).format(decimalDegrees);
  }

  /** Returns this elevation like {@code 12°30'36"}. */
  public String toDmsString(Locale locale) {
    return DegreeFormat.forLocale(locale).formatDms(decimalDegrees);
  }

  @Override
  public int compareTo(Elevation o) {
    return Double.compare(decimalDegrees, o.decimalDegrees);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof Elevation other && (decimalDegrees == other.decimalDegrees ||
      (Double.isNaN(decimalDegrees) && Double.isNaN(other.decimalDegrees)));
  }

  @Override
  public int hashCode() {
    // +0.0 and -0.0 are equal so must hash the same
    return Double.hashCode(decimalDegrees == 0 ? 0d : decimalDegrees);
  }

  /** Returns the canonical text for this elevation, like {@code "45.5°"}. */
  @Override
  public String toString() {
    return format(Locale.ROOT);
  }
}
