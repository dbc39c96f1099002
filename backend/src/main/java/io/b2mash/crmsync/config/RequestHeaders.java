package io.b2mash.crmsync.config;

public final class RequestHeaders {

  /** Identifies the owning user or account; supplied by the authenticating gateway. */
  public static final String OWNER_ID = "X-Owner-Id";

  public static final String REQUEST_ID = "X-Request-Id";

  private RequestHeaders() {}
}
