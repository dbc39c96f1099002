package io.b2mash.crmsync.integration.mapping;

/** How mapped fields and custom properties are arranged into the outbound payload. */
public enum TransformerKind {
  /** Mapped fields under {@code attributes}, custom properties (if any) in {@code properties}. */
  ATTRIBUTES_PROPERTIES,
  /** {@code {properties: {field: {value: v}}}}, custom properties wrapped the same way. */
  VALUE_WRAPPED,
  /** Identifier field lifted to the root, everything else under {@code merge_fields}. */
  MERGE_FIELDS,
  /** Flat mapped fields; custom properties at the root with a name suffix. */
  FLAT_SUFFIXED,
  /** Flat mapped fields; custom properties as an array of {@code {field, value}} entries. */
  FLAT_ARRAY,
  /** Flat mapped fields; custom properties merged into a nested object. */
  FLAT_NESTED,
  /** Flat mapped fields with custom properties merged at the root. */
  FLAT
}
