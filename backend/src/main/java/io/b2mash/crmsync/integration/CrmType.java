package io.b2mash.crmsync.integration;

import com.fasterxml.jackson.annotation.JsonValue;
import io.b2mash.crmsync.integration.provider.UnsupportedCrmTypeException;
import java.util.Arrays;
import java.util.Optional;

/** Closed set of CRM services a contact or event can be synchronized into. */
public enum CrmType {
  KLAVIYO("klaviyo"),
  SALESFORCE("salesforce"),
  CREATIO("creatio"),
  HUBSPOT("hubspot"),
  MAILCHIMP("mailchimp"),
  ACTIVECAMPAIGN("activecampaign"),
  SENDINBLUE("sendinblue"),
  ZOHO("zoho"),
  PIPEDRIVE("pipedrive"),
  INTERCOM("intercom"),
  CUSTOMERIO("customerio");

  private final String slug;

  CrmType(String slug) {
    this.slug = slug;
  }

  /** Lowercase identifier used in URLs, request bodies and sync results. */
  @JsonValue
  public String slug() {
    return slug;
  }

  public static Optional<CrmType> find(String value) {
    if (value == null) {
      return Optional.empty();
    }
    var normalized = value.trim();
    return Arrays.stream(values()).filter(t -> t.slug.equalsIgnoreCase(normalized)).findFirst();
  }

  /**
   * Resolves a CRM type from its slug (case-insensitive).
   *
   * @throws UnsupportedCrmTypeException if the value names no known CRM type
   */
  public static CrmType fromSlug(String value) {
    return find(value).orElseThrow(() -> new UnsupportedCrmTypeException(value));
  }
}
