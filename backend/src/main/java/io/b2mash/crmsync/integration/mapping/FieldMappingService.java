package io.b2mash.crmsync.integration.mapping;

import io.b2mash.crmsync.canonical.CanonicalContact;
import io.b2mash.crmsync.integration.CrmType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns a {@link CanonicalContact} into the payload shape a given CRM expects. Pure and
 * deterministic: the same contact and CRM type always produce an equal payload, and the input is
 * never mutated.
 */
@Service
public class FieldMappingService {

  private static final Logger log = LoggerFactory.getLogger(FieldMappingService.class);

  private static final Pattern PHONE_FORMATTING = Pattern.compile("[\\s()\\-]");

  private final FieldMappingRegistry registry;

  public FieldMappingService(FieldMappingRegistry registry) {
    this.registry = registry;
  }

  /**
   * Variant for callers holding a raw CRM type string.
   *
   * @throws FieldMappingException if the type is not recognized or the contact is invalid
   */
  public Map<String, Object> transformContact(CanonicalContact contact, String crmType) {
    var type =
        CrmType.find(crmType)
            .orElseThrow(
                () ->
                    new FieldMappingException(
                        null, null, "CRM type '" + crmType + "' is not supported"));
    return transformContact(contact, type);
  }

  /**
   * Validates the contact against the CRM's required fields, maps and normalizes each non-blank
   * field, then arranges the result with the CRM's structural transformer.
   *
   * @throws FieldMappingException if a required field is missing or the email is malformed
   */
  public Map<String, Object> transformContact(CanonicalContact contact, CrmType crmType) {
    var mapping = requireMapping(crmType);
    validate(contact, mapping);

    var mapped = new LinkedHashMap<String, Object>();
    contact
        .namedFields()
        .forEach(
            (field, value) -> {
              if (value == null || value.isBlank()) {
                return;
              }
              var target = mapping.fields().get(field);
              if (target == null) {
                log.warn(
                    "Field '{}' has no {} mapping and will not be synced", field, crmType.slug());
                return;
              }
              mapped.put(target, normalize(field, value, mapping));
            });

    return restructure(mapped, contact.customProperties(), mapping.transformer());
  }

  public FieldMappingDto describe(CrmType crmType) {
    return FieldMappingDto.from(requireMapping(crmType));
  }

  public List<CrmType> supportedTypes() {
    return registry.supportedTypes();
  }

  private CrmFieldMapping requireMapping(CrmType crmType) {
    return registry
        .find(crmType)
        .orElseThrow(
            () ->
                new FieldMappingException(
                    crmType, null, "CRM type '" + crmType.slug() + "' has no field mapping"));
  }

  private static void validate(CanonicalContact contact, CrmFieldMapping mapping) {
    var crmType = mapping.crmType();
    for (String required : mapping.requiredFields()) {
      var value = contact.fieldValue(required);
      if (value == null || value.isBlank()) {
        throw new FieldMappingException(
            crmType,
            required,
            "Required field '" + required + "' is missing or empty for " + crmType.slug());
      }
    }
    var email = contact.email();
    if (email == null || !email.contains("@")) {
      throw new FieldMappingException(
          crmType, CanonicalContact.EMAIL, "Email must be a valid email address");
    }
  }

  private static String normalize(String field, String value, CrmFieldMapping mapping) {
    switch (field) {
      case "email":
        return value.trim().toLowerCase(Locale.ROOT);
      case "country":
        return value.trim().toUpperCase(Locale.ROOT);
      case "phone":
        return mapping.stripPhoneFormatting()
            ? PHONE_FORMATTING.matcher(value).replaceAll("")
            : value;
      default:
        return value;
    }
  }

  private static Map<String, Object> restructure(
      Map<String, Object> mapped, Map<String, Object> custom, StructuralTransformer transformer) {
    var payload = new LinkedHashMap<String, Object>();
    switch (transformer.kind()) {
      case ATTRIBUTES_PROPERTIES -> {
        payload.put("attributes", mapped);
        if (!custom.isEmpty()) {
          payload.put(transformer.containerKey(), new LinkedHashMap<>(custom));
        }
      }
      case VALUE_WRAPPED -> {
        var properties = new LinkedHashMap<String, Object>();
        mapped.forEach((name, value) -> properties.put(name, wrapValue(value)));
        custom.forEach((name, value) -> properties.put(name, wrapValue(value)));
        payload.put(transformer.containerKey(), properties);
      }
      case MERGE_FIELDS -> {
        var identifierField = transformer.containerKey();
        var remaining = new LinkedHashMap<>(mapped);
        var identifier = remaining.remove(identifierField);
        payload.put(identifierField, identifier != null ? identifier : "");
        // Custom properties are not sent: merge tags must already exist on the audience
        payload.put(
            "merge_fields", transformer.nestDottedFields() ? nestDotted(remaining) : remaining);
      }
      case FLAT_SUFFIXED -> {
        payload.putAll(mapped);
        custom.forEach((name, value) -> payload.put(name + transformer.customFieldSuffix(), value));
      }
      case FLAT_ARRAY -> {
        payload.putAll(mapped);
        if (!custom.isEmpty()) {
          var entries = new ArrayList<Map<String, Object>>();
          custom.forEach(
              (name, value) -> {
                var entry = new LinkedHashMap<String, Object>();
                entry.put("field", name);
                entry.put("value", value);
                entries.add(entry);
              });
          payload.put(transformer.containerKey(), entries);
        }
      }
      case FLAT_NESTED -> {
        payload.putAll(transformer.nestDottedFields() ? nestDotted(mapped) : mapped);
        if (!custom.isEmpty()) {
          childObject(payload, transformer.containerKey()).putAll(custom);
        }
      }
      case FLAT -> {
        payload.putAll(mapped);
        payload.putAll(custom);
      }
    }
    return payload;
  }

  private static Map<String, Object> wrapValue(Object value) {
    var wrapped = new LinkedHashMap<String, Object>();
    wrapped.put("value", value);
    return wrapped;
  }

  /** Turns {@code {"ADDRESS.city": "x"}} into {@code {"ADDRESS": {"city": "x"}}}. */
  private static Map<String, Object> nestDotted(Map<String, Object> fields) {
    var nested = new LinkedHashMap<String, Object>();
    fields.forEach(
        (name, value) -> {
          int dot = name.indexOf('.');
          if (dot <= 0 || dot == name.length() - 1) {
            nested.put(name, value);
          } else {
            childObject(nested, name.substring(0, dot)).put(name.substring(dot + 1), value);
          }
        });
    return nested;
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> childObject(Map<String, Object> parent, String key) {
    var existing = parent.get(key);
    if (existing instanceof Map<?, ?> map) {
      var copy = new LinkedHashMap<String, Object>((Map<String, Object>) map);
      parent.put(key, copy);
      return copy;
    }
    var child = new LinkedHashMap<String, Object>();
    parent.put(key, child);
    return child;
  }
}
