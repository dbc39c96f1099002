package io.b2mash.crmsync.integration.provider;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decrypted, CRM-specific credential map (api_key, access_token, username, ...). Never logged:
 * {@link #toString()} prints key names only.
 */
public record CrmCredentials(Map<String, Object> values) {

  private static final List<String> PRIMARY_SECRET_KEYS =
      List.of("api_key", "access_token", "client_secret", "password");

  public CrmCredentials {
    values =
        values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  public static CrmCredentials of(Map<String, Object> values) {
    return new CrmCredentials(values);
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  /** Trimmed string value, or null when absent or blank. */
  public String get(String key) {
    var value = values.get(key);
    if (value == null) {
      return null;
    }
    var text = value.toString().trim();
    return text.isEmpty() ? null : text;
  }

  public boolean has(String key) {
    return get(key) != null;
  }

  /** Masked suffix of the primary secret, e.g. {@code ****a1b2}; null when there is none. */
  public String hint() {
    for (String key : PRIMARY_SECRET_KEYS) {
      var secret = get(key);
      if (secret != null) {
        return secret.length() > 4 ? "****" + secret.substring(secret.length() - 4) : "****";
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return "CrmCredentials" + values.keySet();
  }
}
