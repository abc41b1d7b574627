package com.onthegomap.mapkit.convert;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.List;

/**
 * A recipe that a design-time host can persist and replay later through a {@link ValueTypeRegistry} to rebuild a
 * measurement.
 * <p>
 * Either a call to the single-scalar constructor of a value type, or a reference to its immutable {@code EMPTY}
 * constant.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
  @JsonSubTypes.Type(value = InstanceDescriptor.ConstructorCall.class, name = "constructor"),
  @JsonSubTypes.Type(value = InstanceDescriptor.EmptyConstant.class, name = "empty")
})
public sealed interface InstanceDescriptor {

  /** The {@link ValueType#tag()} of the type this descriptor rebuilds. */
  String typeTag();

  /** The constructor arguments, empty for a constant reference. */
  List<Double> arguments();

  /** Returns the Java expression this descriptor stands for, like {@code new Elevation(45.5)}. */
  String toSourceCode();

  static ConstructorCall constructorCall(String typeTag, double argument) {
    return new ConstructorCall(typeTag, argument);
  }

  static EmptyConstant emptyConstant(String typeTag) {
    return new EmptyConstant(typeTag);
  }

  /** Invoke the one-argument constructor of {@code typeTag} with {@code argument}. */
  record ConstructorCall(
    @JsonProperty(value = "type", required = true) String typeTag,
    @JsonProperty(value = "argument", required = true) double argument
  ) implements InstanceDescriptor {

    @Override
    public List<Double> arguments() {
      return List.of(argument);
    }

    @Override
    public String toSourceCode() {
      return "new " + typeTag + "(" + javaLiteral(argument) + ")";
    }

    private static String javaLiteral(double value) {
      if (Double.isNaN(value)) {
        return "Double.NaN";
      } else if (Double.isInfinite(value)) {
        return value > 0 ? "Double.POSITIVE_INFINITY" : "Double.NEGATIVE_INFINITY";
      }
      return Double.toString(value);
    }
  }

  /** Reference the shared {@code EMPTY} constant of {@code typeTag}. */
  record EmptyConstant(
    @JsonProperty(value = "type", required = true) String typeTag
  ) implements InstanceDescriptor {

    @Override
    public List<Double> arguments() {
      return List.of();
    }

    @Override
    public String toSourceCode() {
      return typeTag + ".EMPTY";
    }
  }
}
