package com.onthegomap.mapkit.convert;

import com.google.common.collect.ImmutableMap;
import com.onthegomap.mapkit.measure.Measurement;
import java.util.Collection;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable lookup from {@link ValueType#tag()} to value type, used to replay {@link InstanceDescriptor descriptors}
 * whose type is only known at runtime.
 */
public class ValueTypeRegistry {

  private static final Logger LOGGER = LoggerFactory.getLogger(ValueTypeRegistry.class);
  private static final ValueTypeRegistry DEFAULT = of(ValueType.ELEVATION, ValueType.LATITUDE);

  private final ImmutableMap<String, ValueType<?>> byTag;
  private final ImmutableMap<Class<?>, ValueType<?>> byClass;

  private ValueTypeRegistry(ImmutableMap<String, ValueType<?>> byTag, ImmutableMap<Class<?>, ValueType<?>> byClass) {
    this.byTag = byTag;
    this.byClass = byClass;
  }

  /**
   * Returns a registry containing {@code types}.
   *
   * @throws IllegalArgumentException if two types share a tag or a class
   */
  public static ValueTypeRegistry of(ValueType<?>... types) {
    var tags = ImmutableMap.<String, ValueType<?>>builder();
    var classes = ImmutableMap.<Class<?>, ValueType<?>>builder();
    for (var type : types) {
      tags.put(type.tag(), type);
      classes.put(type.type(), type);
    }
    var result = new ValueTypeRegistry(tags.buildOrThrow(), classes.buildOrThrow());
    LOGGER.debug("Registered value types {}", result.byTag.keySet());
    return result;
  }

  /** Returns the registry of all measurement types in this library. */
  public static ValueTypeRegistry defaultRegistry() {
    return DEFAULT;
  }

  public Optional<ValueType<?>> get(String tag) {
    return Optional.ofNullable(byTag.get(tag));
  }

  public Optional<ValueType<?>> get(Class<?> type) {
    return Optional.ofNullable(byClass.get(type));
  }

  public Collection<ValueType<?>> types() {
    return byTag.values();
  }

  /** Returns a converter for measurements of class {@code type}, if registered. */
  public Optional<MeasurementConverter<?>> converterFor(Class<?> type) {
    return get(type).map(ValueTypeRegistry::converter);
  }

  private static <T extends Measurement> MeasurementConverter<?> converter(ValueType<T> type) {
    return new MeasurementConverter<>(type);
  }

  /**
   * Rebuilds the measurement {@code descriptor} stands for.
   *
   * @throws UnsupportedConversionException if no type is registered under the descriptor's tag
   */
  public Measurement materialize(InstanceDescriptor descriptor) {
    ValueType<?> type = byTag.get(descriptor.typeTag());
    if (type == null) {
      throw new UnsupportedConversionException("Unknown value type '" + descriptor.typeTag() + "'");
    }
    return type.materialize(descriptor);
  }
}
