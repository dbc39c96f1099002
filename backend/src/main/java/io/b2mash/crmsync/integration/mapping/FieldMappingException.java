package io.b2mash.crmsync.integration.mapping;

import io.b2mash.crmsync.integration.CrmType;

/**
 * A canonical record could not be turned into a CRM payload: a required field is missing, the email
 * is malformed or the target CRM has no mapping. Raised before any remote call is made.
 */
public class FieldMappingException extends RuntimeException {

  private final CrmType crmType;
  private final String field;

  public FieldMappingException(CrmType crmType, String field, String message) {
    super(message);
    this.crmType = crmType;
    this.field = field;
  }

  /** Null when the requested CRM type itself was not recognized. */
  public CrmType getCrmType() {
    return crmType;
  }

  public String getField() {
    return field;
  }

  public String errorType() {
    return "mapping";
  }
}
