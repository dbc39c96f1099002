package io.b2mash.crmsync.integration.mapping;

import java.util.List;
import java.util.Map;

public record FieldMappingDto(
    String crmType,
    List<String> supportedFields,
    List<String> requiredFields,
    Map<String, String> fieldMapping,
    String structure) {

  public static FieldMappingDto from(CrmFieldMapping mapping) {
    return new FieldMappingDto(
        mapping.crmType().slug(),
        List.copyOf(mapping.fields().keySet()),
        mapping.requiredFields(),
        mapping.fields(),
        mapping.transformer().kind().name().toLowerCase());
  }
}
