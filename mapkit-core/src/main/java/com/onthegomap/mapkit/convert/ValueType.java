package com.onthegomap.mapkit.convert;

import com.onthegomap.mapkit.measure.DegreeFormat;
import com.onthegomap.mapkit.measure.Elevation;
import com.onthegomap.mapkit.measure.Latitude;
import com.onthegomap.mapkit.measure.Measurement;
import java.util.Locale;
import java.util.function.BiFunction;
import java.util.function.DoubleFunction;

/**
 * Everything a converter needs to know about one measurement type: how to build it from its scalar, how to parse it,
 * and its empty constant.
 *
 * @param tag         stable name used in {@link InstanceDescriptor descriptors}
 * @param type        the measurement class
 * @param constructor the single-scalar constructor
 * @param parser      parses locale-dependent text
 * @param empty       the immutable constant referenced by {@link InstanceDescriptor.EmptyConstant}
 * @param <T>         the measurement class
 */
public record ValueType<T extends Measurement>(
  String tag,
  Class<T> type,
  DoubleFunction<T> constructor,
  BiFunction<String, Locale, T> parser,
  T empty
) {

  public static final ValueType<Elevation> ELEVATION =
    new ValueType<>("Elevation", Elevation.class, Elevation::new, Elevation::parse, Elevation.EMPTY);
  public static final ValueType<Latitude> LATITUDE =
    new ValueType<>("Latitude", Latitude.class, Latitude::new, Latitude::parse, Latitude.EMPTY);

  /** Text returned in place of a missing value. */
  public String zeroText() {
    return DegreeFormat.ZERO_TEXT;
  }

  public T create(double decimalDegrees) {
    return constructor.apply(decimalDegrees);
  }

  public T parse(String text, Locale locale) {
    return parser.apply(text, locale);
  }

  /** Returns {@code value} cast to this type, or throws if it belongs to another type. */
  public T cast(Object value) {
    if (!type.isInstance(value)) {
      throw new UnsupportedConversionException(
        "Expected " + tag + " but got " + (value == null ? "null" : value.getClass().getSimpleName()));
    }
    return type.cast(value);
  }

  /** Returns a descriptor that rebuilds {@code value}, or references {@link #empty()} when {@code value} is null. */
  public InstanceDescriptor describe(T value) {
    return value == null ? InstanceDescriptor.emptyConstant(tag) :
      InstanceDescriptor.constructorCall(tag, value.decimalDegrees());
  }

  /** Replays {@code descriptor} to produce an instance of this type. */
  public T materialize(InstanceDescriptor descriptor) {
    if (!tag.equals(descriptor.typeTag())) {
      throw new UnsupportedConversionException(
        "Descriptor for " + descriptor.typeTag() + " cannot produce " + tag);
    }
    if (descriptor instanceof InstanceDescriptor.ConstructorCall call) {
      return create(call.argument());
    }
    return empty;
  }
}
