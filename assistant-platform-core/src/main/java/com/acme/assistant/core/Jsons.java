package com.acme.assistant.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.io.UncheckedIOException;

public final class Jsons {
  private static final ObjectMapper M =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

  private Jsons() {}

  public static String toJson(Object o) {
    try {
      return M.writeValueAsString(o);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public static byte[] toBytes(Object o) {
    try {
      return M.writeValueAsBytes(o);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public static <T> T fromJson(String json, Class<T> clazz) {
    try {
      return M.readValue(json, clazz);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /**
   * Parse raw bytes into a tree. Malformed input surfaces as {@link IllegalArgumentException} so
   * that callers inside a pipeline stage report it like any other bad input.
   */
  public static JsonNode readTree(byte[] bytes) {
    try {
      return M.readTree(bytes);
    } catch (IOException e) {
      throw new IllegalArgumentException("Payload is not valid JSON: " + e.getMessage(), e);
    }
  }

  public static <T> T treeToValue(JsonNode node, Class<T> clazz) {
    try {
      return M.treeToValue(node, clazz);
    } catch (IOException e) {
      throw new IllegalArgumentException("Cannot map payload to " + clazz.getSimpleName(), e);
    }
  }
}
