package com.paysync.sync;

public enum FailureKind {
  SETUP_ERROR,
  PAGE_ERROR,
  ITEM_UNAVAILABLE,
  PERSIST_ERROR
}
