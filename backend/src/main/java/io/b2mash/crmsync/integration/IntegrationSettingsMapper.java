package io.b2mash.crmsync.integration;

import io.b2mash.crmsync.exception.InvalidStateException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/** Converts {@link IntegrationSettings} to and from the JSON stored on each integration. */
@Component
public class IntegrationSettingsMapper {

  private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  public IntegrationSettingsMapper(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public IntegrationSettings fromJson(String json) {
    if (json == null || json.isBlank()) {
      return IntegrationSettings.defaults();
    }
    try {
      return objectMapper.readValue(json, IntegrationSettings.class);
    } catch (JacksonException e) {
      throw new IllegalStateException("Stored integration settings are not valid JSON", e);
    }
  }

  public String toJson(IntegrationSettings settings) {
    return objectMapper.writeValueAsString(settings);
  }

  public Map<String, Object> toMap(IntegrationSettings settings) {
    return objectMapper.convertValue(settings, JSON_OBJECT);
  }

  /**
   * Applies a partial update: keys present in {@code patch} replace the current values, everything
   * else is kept.
   *
   * @throws InvalidStateException if a known key has the wrong JSON type
   */
  public IntegrationSettings merge(IntegrationSettings current, Map<String, Object> patch) {
    if (patch == null || patch.isEmpty()) {
      return current;
    }
    var merged = new LinkedHashMap<>(toMap(current));
    merged.putAll(patch);
    try {
      return objectMapper.convertValue(merged, IntegrationSettings.class);
    } catch (JacksonException | IllegalArgumentException e) {
      throw new InvalidStateException(
          "Invalid settings", "Integration settings could not be applied: " + e.getMessage());
    }
  }
}
