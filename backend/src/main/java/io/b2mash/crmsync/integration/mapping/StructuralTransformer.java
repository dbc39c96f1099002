package io.b2mash.crmsync.integration.mapping;

/**
 * Describes the payload structure of one CRM.
 *
 * @param kind overall layout
 * @param containerKey name of the object or array holding custom properties (or the identifier
 *     field for {@link TransformerKind#MERGE_FIELDS}); null when unused
 * @param customFieldSuffix suffix appended to custom property names; null when unused
 * @param nestDottedFields when true, mapped names like {@code ADDRESS.city} become nested objects
 */
public record StructuralTransformer(
    TransformerKind kind, String containerKey, String customFieldSuffix, boolean nestDottedFields) {

  public static StructuralTransformer attributesProperties() {
    return new StructuralTransformer(
        TransformerKind.ATTRIBUTES_PROPERTIES, "properties", null, false);
  }

  public static StructuralTransformer valueWrapped() {
    return new StructuralTransformer(TransformerKind.VALUE_WRAPPED, "properties", null, false);
  }

  public static StructuralTransformer mergeFields(String identifierField) {
    return new StructuralTransformer(TransformerKind.MERGE_FIELDS, identifierField, null, true);
  }

  public static StructuralTransformer suffixed(String suffix) {
    return new StructuralTransformer(TransformerKind.FLAT_SUFFIXED, null, suffix, false);
  }

  public static StructuralTransformer array(String arrayKey) {
    return new StructuralTransformer(TransformerKind.FLAT_ARRAY, arrayKey, null, false);
  }

  public static StructuralTransformer nested(String objectKey) {
    return new StructuralTransformer(TransformerKind.FLAT_NESTED, objectKey, null, true);
  }

  public static StructuralTransformer flat() {
    return new StructuralTransformer(TransformerKind.FLAT, null, null, false);
  }
}
