package com.gentoro.wordhint.utility;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/** Shared Jackson mapper. {@link ObjectMapper} is thread-safe once configured. */
public final class JacksonUtility {
  private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

  private JacksonUtility() {}

  public static ObjectMapper getJsonMapper() {
    return JSON_MAPPER;
  }

  public static String toJson(Object value) {
    try {
      return JSON_MAPPER.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to serialize value to JSON", e);
    }
  }
}
