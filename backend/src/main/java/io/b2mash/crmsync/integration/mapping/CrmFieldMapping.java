package io.b2mash.crmsync.integration.mapping;

import io.b2mash.crmsync.integration.CrmType;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static mapping descriptor for one CRM.
 *
 * @param crmType the CRM this descriptor applies to
 * @param fields canonical field name to CRM field name, in output order
 * @param requiredFields canonical fields that must be present and non-blank
 * @param transformer payload structure
 * @param stripPhoneFormatting whether spaces, dashes and parentheses are removed from phone numbers
 */
public record CrmFieldMapping(
    CrmType crmType,
    Map<String, String> fields,
    List<String> requiredFields,
    StructuralTransformer transformer,
    boolean stripPhoneFormatting) {

  public CrmFieldMapping {
    fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    requiredFields = List.copyOf(requiredFields);
  }
}
