package com.gentoro.mcsguide.utility;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.gentoro.mcsguide.exception.SerializationException;

/**
 * Shared Jackson mappers. Both protocol surfaces serialize records through {@link #toJson(Object)}
 * so a record reads the same over REST and MCP.
 */
public class JacksonUtility {

  private static final ObjectMapper JSON_MAPPER =
      new ObjectMapper()
          // Dataset files may carry editorial fields the model does not declare
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
          .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
          .setSerializationInclusion(JsonInclude.Include.NON_NULL);

  private static final ObjectMapper PRETTY_MAPPER =
      JSON_MAPPER.copy().enable(SerializationFeature.INDENT_OUTPUT);

  public static ObjectMapper getJsonMapper() {
    return JSON_MAPPER;
  }

  public static String toJson(Object object) {
    try {
      return JSON_MAPPER.writeValueAsString(object);
    } catch (Exception e) {
      throw new SerializationException("Failed to serialize object to JSON", e);
    }
  }

  /** Indented rendition, used for text payloads meant to be read by an agent. */
  public static String toPrettyJson(Object object) {
    try {
      return PRETTY_MAPPER.writeValueAsString(object);
    } catch (Exception e) {
      throw new SerializationException("Failed to serialize object to JSON", e);
    }
  }

  public static JsonNode toTree(Object object) {
    return JSON_MAPPER.valueToTree(object);
  }
}
