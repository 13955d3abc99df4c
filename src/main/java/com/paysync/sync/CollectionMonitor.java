package com.paysync.sync;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Observer-facing view of one account's collection: running flag, counter
 * snapshot, capped newest-first log and the stop control.
 */
public class CollectionMonitor implements ProgressSink {
  private final ProgressLog log;
  private final Clock clock;
  private final AtomicBoolean collecting = new AtomicBoolean();

  private volatile SyncProgress progress = SyncProgress.idle();
  private volatile SyncMode mode;
  private volatile CancellationToken cancellation;
  private volatile SyncReport lastReport;

  public CollectionMonitor(int logCapacity, Clock clock) {
    this.log = new ProgressLog(logCapacity);
    this.clock = clock;
  }

  /** Marks the account as collecting; returns null when a run is already active. */
  public CancellationToken begin(SyncMode mode) {
    if (!collecting.compareAndSet(false, true)) {
      return null;
    }
    CancellationToken token = new CancellationToken();
    this.cancellation = token;
    this.mode = mode;
    this.progress = SyncProgress.idle();
    log.clear();
    return token;
  }

  public void finish(SyncReport report) {
    this.lastReport = report;
    if (report != null) {
      this.progress = report.progress();
    }
    collecting.set(false);
  }

  public boolean requestStop() {
    CancellationToken token = cancellation;
    if (!collecting.get() || token == null) {
      return false;
    }
    token.cancel();
    log.push(ProgressEvent.info(clock.instant(), progress.page(), null, "Stop requested"));
    return true;
  }

  public boolean isCollecting() {
    return collecting.get();
  }

  @Override
  public void onEvent(ProgressEvent event) {
    log.push(event);
  }

  @Override
  public void onProgress(SyncProgress progress) {
    this.progress = progress;
  }

  public CollectionStatus snapshot() {
    return new CollectionStatus(collecting.get(), mode, progress, log.snapshot(), lastReport);
  }
}
