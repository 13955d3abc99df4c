package com.paysync.sync;

public enum SyncPhase {
  IDLE,
  RESOLVING_CHECKPOINT,
  RESOLVING_TOKEN,
  LISTING_PAGE,
  PROCESSING_ITEM,
  ADVANCING_PAGE,
  STOPPED
}
