package com.github.spud.sample.ai.finance.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.util.List;
import java.util.Map;
import org.springframework.boot.json.AbstractJsonParser;
import org.springframework.boot.json.JsonParseException;

/**
 * Shared Jackson helper for tool payloads. Payloads exchanged with the completion service use
 * snake_case property names.
 */
public class JsonUtils extends AbstractJsonParser {

  private static final ObjectMapper objectMapper = JsonMapper.builder()
    .findAndAddModules()
    .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
    .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
    .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
    .build();

  private static final JsonUtils INSTANCE = new JsonUtils();

  public static JsonNode readTree(String json) {
    return INSTANCE.tryParse(() -> objectMapper.readTree(json), Exception.class);
  }

  public static String toJson(Object obj) {
    return INSTANCE.tryParse(() -> objectMapper.writeValueAsString(obj), Exception.class);
  }

  public static <T> T fromJson(String json, Class<T> clazz) {
    return INSTANCE.tryParse(() -> objectMapper.readValue(json, clazz), Exception.class);
  }

  /**
   * Structured error payload fed back to the completion service: {@code {"error": "..."}}
   */
  public static String errorPayload(String message) {
    return toJson(Map.of("error", message != null ? message : "Unknown error"));
  }

  @Override
  public Map<String, Object> parseMap(String json) throws JsonParseException {
    return tryParse(() -> objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {
    }), Exception.class);
  }

  @Override
  public List<Object> parseList(String json) throws JsonParseException {
    return tryParse(() -> objectMapper.readValue(json, new TypeReference<List<Object>>() {
    }), Exception.class);
  }
}
