package io.b2mash.crmsync.integration.provider;

import io.b2mash.crmsync.integration.CrmType;

/** Credentials were missing, malformed or rejected by the remote CRM. */
public class CrmAuthenticationException extends CrmProviderException {

  public CrmAuthenticationException(CrmType crmType, String message) {
    super(crmType, message, null);
  }

  @Override
  public String errorType() {
    return "authentication";
  }
}
