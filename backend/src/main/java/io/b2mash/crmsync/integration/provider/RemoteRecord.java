package io.b2mash.crmsync.integration.provider;

import java.util.Map;

/** A successful CRM response: HTTP status plus the parsed (or synthesized) record. */
public record RemoteRecord(int statusCode, Map<String, Object> body) {

  public RemoteRecord {
    body = body == null ? Map.of() : body;
  }
}
