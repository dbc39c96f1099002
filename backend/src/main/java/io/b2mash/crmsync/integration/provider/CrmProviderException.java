package io.b2mash.crmsync.integration.provider;

import io.b2mash.crmsync.integration.CrmType;

/** Base type for failures raised by a CRM adapter while talking to its remote service. */
public abstract class CrmProviderException extends RuntimeException {

  private final CrmType crmType;

  protected CrmProviderException(CrmType crmType, String message, Throwable cause) {
    super(message, cause);
    this.crmType = crmType;
  }

  public CrmType getCrmType() {
    return crmType;
  }

  /** Stable error category reported in per-target sync results and sync log rows. */
  public abstract String errorType();
}
