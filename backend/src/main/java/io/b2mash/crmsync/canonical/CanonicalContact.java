package io.b2mash.crmsync.canonical;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * CRM-neutral contact record. Field names in {@link #namedFields()} are the canonical names used by
 * the field mapping registry. The email is lowercased and trimmed on construction; custom
 * properties are copied and never shared with the caller.
 */
public record CanonicalContact(
    @NotBlank @Email String email,
    @Size(max = 100) String firstName,
    @Size(max = 100) String lastName,
    @Size(max = 20) String phone,
    @Size(max = 200) String company,
    @Size(max = 100) String jobTitle,
    @Size(max = 100) String department,
    @Size(max = 255) String streetAddress,
    @Size(max = 255) String streetAddress2,
    @Size(max = 100) String city,
    @Size(max = 100) String state,
    @Size(max = 20) String postalCode,
    @Size(max = 100) String country,
    @Size(max = 255) String website,
    @Size(max = 50) String timezone,
    @Size(max = 10) String language,
    Map<String, Object> customProperties) {

  public static final String EMAIL = "email";

  /** Canonical field names, in the order mapping output is produced. */
  public static final List<String> FIELD_NAMES =
      List.of(
          EMAIL,
          "first_name",
          "last_name",
          "phone",
          "company",
          "job_title",
          "department",
          "street_address",
          "street_address_2",
          "city",
          "state",
          "postal_code",
          "country",
          "website",
          "timezone",
          "language");

  public CanonicalContact {
    email = email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    customProperties =
        customProperties == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(customProperties));
  }

  /** Standard fields keyed by canonical name, in {@link #FIELD_NAMES} order. Values may be null. */
  public Map<String, String> namedFields() {
    var fields = new LinkedHashMap<String, String>();
    fields.put(EMAIL, email);
    fields.put("first_name", firstName);
    fields.put("last_name", lastName);
    fields.put("phone", phone);
    fields.put("company", company);
    fields.put("job_title", jobTitle);
    fields.put("department", department);
    fields.put("street_address", streetAddress);
    fields.put("street_address_2", streetAddress2);
    fields.put("city", city);
    fields.put("state", state);
    fields.put("postal_code", postalCode);
    fields.put("country", country);
    fields.put("website", website);
    fields.put("timezone", timezone);
    fields.put("language", language);
    return fields;
  }

  public String fieldValue(String canonicalName) {
    return namedFields().get(canonicalName);
  }

  /**
   * Returns a copy restricted to the given canonical fields. Email and custom properties always
   * survive; an empty selection keeps every field.
   */
  public CanonicalContact selectFields(Collection<String> selected) {
    if (selected == null || selected.isEmpty()) {
      return this;
    }
    Set<String> keep = Set.copyOf(selected);
    var fields = namedFields();
    fields.replaceAll((name, value) -> EMAIL.equals(name) || keep.contains(name) ? value : null);
    return fromNamedFields(fields, customProperties);
  }

  static CanonicalContact fromNamedFields(Map<String, String> f, Map<String, Object> custom) {
    return new CanonicalContact(
        f.get(EMAIL),
        f.get("first_name"),
        f.get("last_name"),
        f.get("phone"),
        f.get("company"),
        f.get("job_title"),
        f.get("department"),
        f.get("street_address"),
        f.get("street_address_2"),
        f.get("city"),
        f.get("state"),
        f.get("postal_code"),
        f.get("country"),
        f.get("website"),
        f.get("timezone"),
        f.get("language"),
        custom);
  }

  public static Builder builder(String email) {
    return new Builder(email);
  }

  /** Fluent construction keyed by canonical field names. */
  public static class Builder {

    private final Map<String, String> fields = new LinkedHashMap<>();
    private final Map<String, Object> customProperties = new LinkedHashMap<>();

    private Builder(String email) {
      fields.put(EMAIL, email);
    }

    public Builder field(String canonicalName, String value) {
      if (!FIELD_NAMES.contains(canonicalName)) {
        throw new IllegalArgumentException("Unknown canonical field: " + canonicalName);
      }
      fields.put(canonicalName, value);
      return this;
    }

    public Builder firstName(String value) {
      return field("first_name", value);
    }

    public Builder lastName(String value) {
      return field("last_name", value);
    }

    public Builder phone(String value) {
      return field("phone", value);
    }

    public Builder company(String value) {
      return field("company", value);
    }

    public Builder country(String value) {
      return field("country", value);
    }

    public Builder customProperty(String key, Object value) {
      customProperties.put(key, value);
      return this;
    }

    public CanonicalContact build() {
      return fromNamedFields(fields, customProperties);
    }
  }
}
