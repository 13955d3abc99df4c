package com.paysync.sync;

/** Receives what a run publishes for observers. Called from the run's thread only. */
public interface ProgressSink {
  void onEvent(ProgressEvent event);

  void onProgress(SyncProgress progress);
}
