package io.b2mash.crmsync.integration.provider;

import io.b2mash.crmsync.integration.CrmType;

/**
 * The remote CRM answered with an error, timed out, was unreachable or returned a body that could
 * not be read. {@link #getStatusCode()} is null when no HTTP response was received.
 */
public class CrmApiException extends CrmProviderException {

  private final Integer statusCode;

  public CrmApiException(CrmType crmType, String message) {
    this(crmType, message, null, null);
  }

  public CrmApiException(CrmType crmType, String message, Integer statusCode) {
    this(crmType, message, statusCode, null);
  }

  public CrmApiException(CrmType crmType, String message, Integer statusCode, Throwable cause) {
    super(crmType, message, cause);
    this.statusCode = statusCode;
  }

  public Integer getStatusCode() {
    return statusCode;
  }

  @Override
  public String errorType() {
    return "remote_api";
  }
}
