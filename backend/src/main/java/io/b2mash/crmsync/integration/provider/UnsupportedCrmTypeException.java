package io.b2mash.crmsync.integration.provider;

/** Thrown when a request names a CRM type that is unknown or has no bound adapter. */
public class UnsupportedCrmTypeException extends RuntimeException {

  private final String requestedType;

  public UnsupportedCrmTypeException(String requestedType) {
    super("Unsupported CRM type: " + requestedType);
    this.requestedType = requestedType;
  }

  public String getRequestedType() {
    return requestedType;
  }
}
