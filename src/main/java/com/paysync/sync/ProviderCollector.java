package com.paysync.sync;

import com.paysync.ledger.TransactionRecord;
import com.paysync.model.ProviderType;
import java.util.Optional;

/**
 * Leaf operations a provider supplies to {@link SyncOrchestrator}. Calls are
 * made sequentially from the run's thread.
 */
public interface ProviderCollector {
  ProviderType getProviderType();

  Pagination pagination();

  /**
   * Derives the session-scoped build token. Called at most once per run.
   *
   * @throws SetupException when the token cannot be derived
   */
  String resolveToken(SyncSession session);

  /**
   * Fetches one listing page.
   *
   * @throws PageFetchException on a non-2xx status or an unreadable body
   */
  PageListing listPage(SyncSession session, PageCursor cursor);

  /** Fetches and normalizes one record; empty when the record is unavailable. Never throws. */
  Optional<TransactionRecord> fetchDetail(SyncSession session, ListingStub stub);

  /** Key compared with the checkpoint's external id. */
  default String buildStopKey(ListingStub stub) {
    return stub.externalId();
  }
}
