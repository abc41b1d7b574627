package com.onthegomap.mapkit.convert;

import com.onthegomap.mapkit.measure.DegreeFormat;
import com.onthegomap.mapkit.measure.Measurement;
import com.onthegomap.mapkit.measure.ReferenceLatitude;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Converts measurements of one {@link ValueType} to and from text, numbers and {@link InstanceDescriptor descriptors}
 * for hosts like property editors that only know the value type at runtime.
 * <p>
 * Converters hold no mutable state and can be shared between threads. A {@code null} locale means
 * {@link DegreeFormat#defaultLocale()}.
 *
 * @param <T> the measurement class
 */
public class MeasurementConverter<T extends Measurement> {

  private static final List<String> STANDARD_VALUES = Stream.of(ReferenceLatitude.values())
    .map(ReferenceLatitude::displayName)
    .toList();

  private final ValueType<T> valueType;

  public MeasurementConverter(ValueType<T> valueType) {
    this.valueType = valueType;
  }

  public ValueType<T> valueType() {
    return valueType;
  }

  public boolean canConvertFrom(Class<?> sourceType) {
    return RepresentationKind.of(sourceType, valueType.type()).isPresent();
  }

  public boolean canConvertFrom(RepresentationKind kind) {
    return kind != null;
  }

  public boolean canConvertTo(Class<?> destinationType) {
    return RepresentationKind.of(destinationType, valueType.type()).isPresent();
  }

  public boolean canConvertTo(RepresentationKind kind) {
    return kind != null;
  }

  /**
   * Returns a measurement built from {@code value} depending on its runtime type: text is parsed with
   * {@code locale}, a {@link Double} is used as decimal degrees, a descriptor is replayed, and a measurement of this
   * type is returned as-is.
   *
   * @throws com.onthegomap.mapkit.measure.ValueFormatException if {@code value} is text that cannot be parsed
   * @throws UnsupportedConversionException                     for any other type of value, including {@code null}
   */
  public T convertFrom(Object value, Locale locale) {
    var kind = RepresentationKind.ofValue(value, valueType.type())
      .orElseThrow(() -> unsupported("from", value == null ? "null" : value.getClass().getName()));
    return switch (kind) {
      case TEXT -> fromText((String) value, locale);
      case NUMBER -> fromNumber((Double) value);
      case DESCRIPTOR -> fromDescriptor((InstanceDescriptor) value);
      case SAME_TYPE -> valueType.type().cast(value);
    };
  }

  /** Alias for {@link #convertFrom(Object, Locale)} using the default locale. */
  public T convertFrom(Object value) {
    return convertFrom(value, null);
  }

  /**
   * Returns {@code value} converted to {@code destinationType}.
   * <p>
   * A {@code null} value becomes {@code "0°"} as text, {@code 0.0} as a number and a reference to the empty constant
   * as a descriptor.
   *
   * @throws UnsupportedConversionException if {@code destinationType} is not supported or {@code value} is not a
   *                                        measurement of this type
   */
  public Object convertTo(Object value, Class<?> destinationType, Locale locale) {
    if (value != null && value.getClass().equals(destinationType)) {
      return value;
    }
    var kind = RepresentationKind.of(destinationType, valueType.type())
      .orElseThrow(() -> unsupported("to", destinationType == null ? "null" : destinationType.getName()));
    T measurement = value == null ? null : valueType.cast(value);
    return switch (kind) {
      case TEXT -> toText(measurement, locale);
      case NUMBER -> toNumber(measurement);
      case DESCRIPTOR -> toDescriptor(measurement);
      case SAME_TYPE -> measurement;
    };
  }

  /** Alias for {@link #convertTo(Object, Class, Locale)} using the default locale. */
  public Object convertTo(Object value, Class<?> destinationType) {
    return convertTo(value, destinationType, null);
  }

  public T fromText(String text, Locale locale) {
    return valueType.parse(text, locale == null ? DegreeFormat.defaultLocale() : locale);
  }

  public T fromNumber(double decimalDegrees) {
    return valueType.create(decimalDegrees);
  }

  public T fromDescriptor(InstanceDescriptor descriptor) {
    return valueType.materialize(descriptor);
  }

  public String toText(T value, Locale locale) {
    if (value == null) {
      return valueType.zeroText();
    }
    return value.format(locale == null ? DegreeFormat.defaultLocale() : locale);
  }

  public double toNumber(T value) {
    return (value == null ? valueType.empty() : value).decimalDegrees();
  }

  public InstanceDescriptor toDescriptor(T value) {
    return valueType.describe(value);
  }

  public boolean standardValuesSupported() {
    return true;
  }

  /** Suggested inputs for editors, in display order. Any other valid text is accepted too. */
  public List<String> standardValues() {
    return STANDARD_VALUES;
  }

  public boolean standardValuesExclusive() {
    return false;
  }

  private UnsupportedConversionException unsupported(String direction, String type) {
    return new UnsupportedConversionException(
      "Cannot convert " + valueType.tag() + " " + direction + " " + type);
  }
}
