package io.b2mash.crmsync.integration;

import java.util.Locale;

public enum SyncStatus {
  CONNECTED,
  DISCONNECTED,
  ERROR;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
