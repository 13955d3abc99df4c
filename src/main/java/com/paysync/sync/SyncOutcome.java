package com.paysync.sync;

public enum SyncOutcome {
  STOPPED_AT_CHECKPOINT,
  STOPPED_NO_MORE_DATA,
  STOPPED_BY_CANCELLATION,
  STOPPED_BY_ERROR
}
