package com.paysync.sync;

public record SyncProgress(
    int total,
    int current,
    int success,
    int failed,
    int page,
    SyncPhase phase
) {
  public static SyncProgress idle() {
    return new SyncProgress(0, 0, 0, 0, 0, SyncPhase.IDLE);
  }
}
