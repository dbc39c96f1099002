package io.b2mash.crmsync.canonical;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * CRM-neutral behavioral event. A missing timestamp defaults to the time of construction.
 *
 * @param name event name, at most 100 characters
 * @param properties free-form event attributes
 * @param timestamp when the event happened
 * @param value optional monetary or numeric value
 */
public record CanonicalEvent(
    @NotBlank @Size(max = 100) String name,
    Map<String, Object> properties,
    Instant timestamp,
    Double value) {

  public CanonicalEvent {
    properties =
        properties == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    if (timestamp == null) {
      timestamp = Instant.now();
    }
  }

  public static CanonicalEvent named(String name, Map<String, Object> properties) {
    return new CanonicalEvent(name, properties, null, null);
  }

  /** Properties rendered one {@code key: value} pair per line, for CRMs that store free text. */
  public String describeProperties() {
    var description = new StringBuilder();
    properties.forEach(
        (key, value) -> {
          if (description.length() > 0) {
            description.append('\n');
          }
          description.append(key).append(": ").append(value);
        });
    return description.toString();
  }
}
