package io.b2mash.crmsync.integration;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-integration settings stored as JSON. Known keys are typed; unknown keys are kept verbatim so
 * newer clients can round-trip them. The legacy {@code field_mapping} key is discarded with a
 * warning, and {@code sync_frequency} is always {@value #REAL_TIME}.
 */
public class IntegrationSettings {

  private static final Logger log = LoggerFactory.getLogger(IntegrationSettings.class);

  public static final String REAL_TIME = "real-time";
  static final Set<String> DISCARDED_KEYS = Set.of("field_mapping");

  private List<String> enabledEvents = List.of();
  private List<String> selectedFields = List.of();
  private String leadQuality;
  private final Map<String, Object> additional = new LinkedHashMap<>();

  public static IntegrationSettings defaults() {
    return new IntegrationSettings();
  }

  /** Empty means every event is forwarded. */
  @JsonProperty("enabled_events")
  public List<String> getEnabledEvents() {
    return enabledEvents;
  }

  @JsonProperty("enabled_events")
  public void setEnabledEvents(List<String> enabledEvents) {
    this.enabledEvents = enabledEvents == null ? List.of() : List.copyOf(enabledEvents);
  }

  /** Canonical field names to send; empty means all of them. */
  @JsonProperty("selected_fields")
  public List<String> getSelectedFields() {
    return selectedFields;
  }

  @JsonProperty("selected_fields")
  public void setSelectedFields(List<String> selectedFields) {
    this.selectedFields = selectedFields == null ? List.of() : List.copyOf(selectedFields);
  }

  @JsonProperty("lead_quality")
  public String getLeadQuality() {
    return leadQuality;
  }

  @JsonProperty("lead_quality")
  public void setLeadQuality(String leadQuality) {
    this.leadQuality = leadQuality;
  }

  @JsonProperty("sync_frequency")
  public String getSyncFrequency() {
    return REAL_TIME;
  }

  @JsonProperty("sync_frequency")
  public void setSyncFrequency(String syncFrequency) {
    if (syncFrequency != null && !REAL_TIME.equals(syncFrequency)) {
      log.warn("Ignoring sync_frequency '{}'; only {} is supported", syncFrequency, REAL_TIME);
    }
  }

  @JsonAnyGetter
  public Map<String, Object> getAdditional() {
    return additional;
  }

  @JsonAnySetter
  public void putAdditional(String key, Object value) {
    if (DISCARDED_KEYS.contains(key)) {
      log.warn("Discarding deprecated settings key '{}'", key);
      return;
    }
    additional.put(key, value);
  }

  public boolean allowsEvent(String eventName) {
    return enabledEvents.isEmpty() || enabledEvents.contains(eventName);
  }
}
