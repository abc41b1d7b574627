package com.onthegomap.mapkit.measure;

import java.util.Locale;

/**
 * An immutable angular measurement that is fully described by one scalar in decimal degrees.
 * <p>
 * Implementations must provide a public constructor taking that scalar, so that
 * {@code new Impl(value.decimalDegrees())} is equal to {@code value}.
 */
public interface Measurement {

  /** The scalar this measurement was constructed from. */
  double decimalDegrees();

  /** Returns the canonical text for this measurement using number conventions of {@code locale}. */
  String format(Locale locale);
}
