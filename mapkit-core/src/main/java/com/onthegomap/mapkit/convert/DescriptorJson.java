package com.onthegomap.mapkit.convert;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;

/**
 * Reads and writes {@link InstanceDescriptor descriptors} as JSON, like
 * {@code {"kind":"constructor","type":"Elevation","argument":45.5}}, so hosts can persist them between sessions.
 */
public class DescriptorJson {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
    .registerModules(new Jdk8Module())
    .enable(DeserializationFeature.FAIL_ON_NULL_CREATOR_PROPERTIES)
    .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
  private static final ObjectWriter PRETTY_WRITER = OBJECT_MAPPER.writerWithDefaultPrettyPrinter();

  private DescriptorJson() {}

  public static String toJson(InstanceDescriptor descriptor) {
    try {
      return OBJECT_MAPPER.writeValueAsString(descriptor);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to write descriptor " + descriptor, e);
    }
  }

  public static String toPrettyJson(InstanceDescriptor descriptor) {
    try {
      return PRETTY_WRITER.writeValueAsString(descriptor);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to write descriptor " + descriptor, e);
    }
  }

  /**
   * Parses a descriptor written by {@link #toJson(InstanceDescriptor)}.
   *
   * @throws IllegalArgumentException if {@code json} is not a valid descriptor
   */
  public static InstanceDescriptor fromJson(String json) {
    try {
      return OBJECT_MAPPER.readValue(json, InstanceDescriptor.class);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid descriptor: " + json, e);
    }
  }
}
