package com.onthegomap.mapkit.convert;

import java.util.Optional;

/**
 * The closed set of representations a measurement can be converted to and from.
 */
public enum RepresentationKind {
  /** Locale-dependent text, as a {@link String}. */
  TEXT,
  /** The scalar in decimal degrees, as a {@link Double}. */
  NUMBER,
  /** A recipe to rebuild the value later, as an {@link InstanceDescriptor}. */
  DESCRIPTOR,
  /** The measurement type itself. */
  SAME_TYPE;

  /**
   * Returns the kind that {@code type} corresponds to for a converter of {@code valueType}, or empty if unsupported.
   */
  public static Optional<RepresentationKind> of(Class<?> type, Class<?> valueType) {
    if (type == null) {
      return Optional.empty();
    } else if (type.equals(valueType)) {
      return Optional.of(SAME_TYPE);
    } else if (type.equals(String.class)) {
      return Optional.of(TEXT);
    } else if (type.equals(Double.class) || type.equals(double.class)) {
      return Optional.of(NUMBER);
    } else if (InstanceDescriptor.class.isAssignableFrom(type)) {
      return Optional.of(DESCRIPTOR);
    }
    return Optional.empty();
  }

  /** Returns the kind of the runtime value {@code value} for a converter of {@code valueType}. */
  public static Optional<RepresentationKind> ofValue(Object value, Class<?> valueType) {
    return value == null ? Optional.empty() : of(value.getClass(), valueType);
  }
}
