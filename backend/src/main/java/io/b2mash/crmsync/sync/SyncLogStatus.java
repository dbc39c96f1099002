package io.b2mash.crmsync.sync;

public enum SyncLogStatus {
  PENDING,
  SUCCESS,
  FAILED
}
