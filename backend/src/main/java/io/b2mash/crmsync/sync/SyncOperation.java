package io.b2mash.crmsync.sync;

public enum SyncOperation {
  CONTACT_UPSERT,
  EVENT_SEND
}
