package com.paysync.sync;

import com.paysync.model.ProviderType;
import java.util.Map;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

/**
 * Mutable state of one collection run. Owned by the run's thread; observers
 * only see {@link SyncProgress} snapshots.
 */
@Getter
public class SyncSession {
  private final UUID accountId;
  private final ProviderType providerType;
  private final SyncMode mode;
  private final CancellationToken cancellation;

  @Setter
  private Map<String, String> headers = Map.of();
  @Setter
  private String buildToken;
  @Setter
  private String stopAtExternalId;
  @Setter
  private boolean truncatePending;
  @Setter
  private PageCursor cursor;
  @Setter
  private SyncPhase phase = SyncPhase.IDLE;
  @Setter
  private boolean totalPagesLogged;

  private int total;
  private int current;
  private int success;
  private int failed;
  private int pagesVisited;

  public SyncSession(UUID accountId, ProviderType providerType, SyncMode mode, CancellationToken cancellation) {
    this.accountId = accountId;
    this.providerType = providerType;
    this.mode = mode;
    this.cancellation = cancellation;
  }

  public boolean isCancellationRequested() {
    return cancellation.isCancellationRequested() || Thread.currentThread().isInterrupted();
  }

  public int nextPageSequence() {
    return ++pagesVisited;
  }

  public void addListed(int count) {
    total += count;
  }

  public void recordSuccess() {
    success++;
    current++;
  }

  public void recordFailure() {
    failed++;
    current++;
  }

  public int currentPage() {
    return cursor == null ? 0 : cursor.sequence();
  }

  public SyncProgress progress() {
    return new SyncProgress(total, current, success, failed, currentPage(), phase);
  }
}
