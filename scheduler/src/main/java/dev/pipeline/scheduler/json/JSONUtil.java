package dev.pipeline.scheduler.json;

import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/** JSON encoding of the map and policy columns, and of notification payloads. */
public class JSONUtil {

  private static final ObjectMapper mapper = new ObjectMapper();

  private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};
  private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {};

  public static class JsonRuntimeException extends RuntimeException {
    public JsonRuntimeException(JsonProcessingException cause) {
      super(cause.getMessage(), cause);
      setStackTrace(cause.getStackTrace());
      for (Throwable suppressed : cause.getSuppressed()) {
        addSuppressed(suppressed);
      }
    }
  }

  static {
    mapper.registerModule(new JavaTimeModule());
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  public static ObjectMapper mapper() {
    return mapper;
  }

  public static String toJson(Object value) {
    if (value == null) {
      return null;
    }
    try {
      return mapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new JsonRuntimeException(e);
    }
  }

  public static <T> T fromJson(String json, Class<T> type) {
    if (json == null || json.isEmpty()) {
      return null;
    }
    try {
      return mapper.readValue(json, type);
    } catch (JsonProcessingException e) {
      throw new JsonRuntimeException(e);
    }
  }

  public static Map<String, Object> toObjectMap(String json) {
    if (json == null || json.isEmpty()) {
      return Map.of();
    }
    try {
      return mapper.readValue(json, OBJECT_MAP);
    } catch (JsonProcessingException e) {
      throw new JsonRuntimeException(e);
    }
  }

  public static Map<String, String> toStringMap(String json) {
    if (json == null || json.isEmpty()) {
      return Map.of();
    }
    try {
      return mapper.readValue(json, STRING_MAP);
    } catch (JsonProcessingException e) {
      throw new JsonRuntimeException(e);
    }
  }
}
