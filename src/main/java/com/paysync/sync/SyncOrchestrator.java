package com.paysync.sync;

import com.paysync.config.SyncProperties;
import com.paysync.credential.HeaderSupplier;
import com.paysync.ledger.Checkpoint;
import com.paysync.ledger.LedgerGateway;
import com.paysync.ledger.TransactionRecord;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Drives one collection run for any {@link ProviderCollector}: checkpoint and
 * token setup, page walk, per-item fetch and persist, and the stop rules.
 * Faults are converted to progress events here; nothing escapes {@link #run}.
 */
@Component
public class SyncOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(SyncOrchestrator.class);

  private final HeaderSupplier headerSupplier;
  private final CheckpointResolver checkpointResolver;
  private final BuildTokenResolver buildTokenResolver;
  private final LedgerGateway ledgerGateway;
  private final RequestPacer pacer;
  private final SyncProperties properties;
  private final Clock clock;

  public SyncOrchestrator(HeaderSupplier headerSupplier,
                          CheckpointResolver checkpointResolver,
                          BuildTokenResolver buildTokenResolver,
                          LedgerGateway ledgerGateway,
                          RequestPacer pacer,
                          SyncProperties properties,
                          Clock clock) {
    this.headerSupplier = headerSupplier;
    this.checkpointResolver = checkpointResolver;
    this.buildTokenResolver = buildTokenResolver;
    this.ledgerGateway = ledgerGateway;
    this.pacer = pacer;
    this.properties = properties;
    this.clock = clock;
  }

  public SyncReport run(ProviderCollector collector, SyncSession session, ProgressSink sink) {
    return new Run(collector, session, sink).execute();
  }

  private enum PartitionResult {
    HAD_DATA,
    EMPTY,
    STOPPED
  }

  private final class Run {
    private final ProviderCollector collector;
    private final SyncSession session;
    private final ProgressSink sink;
    private SyncOutcome outcome;
    private String errorMessage;

    private Run(ProviderCollector collector, SyncSession session, ProgressSink sink) {
      this.collector = collector;
      this.session = session;
      this.sink = sink;
    }

    SyncReport execute() {
      Instant startedAt = clock.instant();
      info(null, "Collection started (" + session.getMode().name().toLowerCase() + ")");
      try {
        prepare();
        walk();
      } catch (SetupException ex) {
        outcome = SyncOutcome.STOPPED_BY_ERROR;
        errorMessage = ex.getMessage();
        error(null, FailureKind.SETUP_ERROR, ex.getMessage());
      } catch (RuntimeException ex) {
        log.error("Collection for account {} failed unexpectedly", session.getAccountId(), ex);
        outcome = SyncOutcome.STOPPED_BY_ERROR;
        errorMessage = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
        error(null, FailureKind.SETUP_ERROR, "Unexpected failure: " + errorMessage);
      }
      session.setPhase(SyncPhase.STOPPED);
      publishProgress();
      info(null, "Collection finished: " + describe(outcome) + " (success " + session.getSuccess()
          + ", failed " + session.getFailed() + ")");
      return new SyncReport(outcome, session.progress(), session.getPagesVisited(), startedAt, clock.instant(),
          errorMessage);
    }

    private void prepare() {
      Map<String, String> headers;
      try {
        headers = headerSupplier.getHeaders(session.getAccountId());
      } catch (RuntimeException ex) {
        throw new SetupException("Request headers unavailable: " + ex.getMessage(), ex);
      }
      session.setHeaders(headers == null ? Map.of() : headers);

      if (session.getMode() == SyncMode.INCREMENTAL) {
        setPhase(SyncPhase.RESOLVING_CHECKPOINT);
        Optional<Checkpoint> checkpoint = checkpointResolver.currentCheckpoint(
            session.getAccountId(), collector.getProviderType());
        checkpoint.ifPresentOrElse(
            value -> {
              session.setStopAtExternalId(value.lastExternalId());
              info(null, "Resuming until " + value.lastExternalId());
            },
            () -> info(null, "No checkpoint, collecting full history"));
      } else {
        session.setTruncatePending(true);
      }

      setPhase(SyncPhase.RESOLVING_TOKEN);
      buildTokenResolver.resolve(session, collector);
    }

    private void walk() {
      Pagination pagination = collector.pagination();
      if (!pagination.yearPartitioned()) {
        PartitionResult result = walkPartition(null, pagination.firstPageIndex());
        if (result != PartitionResult.STOPPED) {
          outcome = SyncOutcome.STOPPED_NO_MORE_DATA;
        }
        return;
      }
      int emptyYears = 0;
      for (int year : years()) {
        PartitionResult result = walkPartition(year, pagination.firstPageIndex());
        if (result == PartitionResult.STOPPED) {
          return;
        }
        if (result == PartitionResult.EMPTY) {
          emptyYears++;
          if (emptyYears >= properties.maxEmptyYears()) {
            info(null, emptyYears + " consecutive years without data, stopping");
            break;
          }
        } else {
          emptyYears = 0;
        }
      }
      outcome = SyncOutcome.STOPPED_NO_MORE_DATA;
    }

    private List<Integer> years() {
      int current = LocalDate.now(clock.withZone(ZoneId.of(properties.zone()))).getYear();
      List<Integer> years = new ArrayList<>();
      for (int year = current; year >= properties.yearFloor(); year--) {
        years.add(year);
      }
      return Collections.unmodifiableList(years);
    }

    private PartitionResult walkPartition(Integer year, int firstPageIndex) {
      int pageIndex = firstPageIndex;
      int consecutiveFailures = 0;
      boolean hadData = false;
      while (true) {
        if (session.isCancellationRequested()) {
          stopByCancellation();
          return PartitionResult.STOPPED;
        }
        PageCursor cursor = new PageCursor(year, pageIndex, session.nextPageSequence());
        session.setCursor(cursor);
        setPhase(SyncPhase.LISTING_PAGE);

        PageListing listing;
        try {
          listing = collector.listPage(session, cursor);
        } catch (SetupException ex) {
          throw ex;
        } catch (RuntimeException ex) {
          consecutiveFailures++;
          error(null, FailureKind.PAGE_ERROR, "Page " + cursor.describe() + " failed: " + ex.getMessage());
          pacer.pause(properties.pageDelayMinMs(), properties.pageDelayMaxMs());
          if (consecutiveFailures >= properties.maxConsecutivePageFailures()) {
            warn("Giving up on " + (year == null ? "listing" : year) + " after "
                + consecutiveFailures + " failed pages");
            return hadData ? PartitionResult.HAD_DATA : PartitionResult.EMPTY;
          }
          pageIndex++;
          continue;
        }
        consecutiveFailures = 0;

        if (listing.reportedTotalPages() != null && !session.isTotalPagesLogged()) {
          session.setTotalPagesLogged(true);
          info(null, "Provider reports " + listing.reportedTotalPages() + " pages");
        }
        if (listing.isEmpty()) {
          if (year != null) {
            info(null, hadData ? "No more orders in " + year : "No orders in " + year);
          }
          return hadData ? PartitionResult.HAD_DATA : PartitionResult.EMPTY;
        }
        hadData = true;
        session.addListed(listing.stubs().size());
        publishProgress();

        for (ListingStub stub : listing.stubs()) {
          if (!processStub(stub)) {
            return PartitionResult.STOPPED;
          }
        }

        setPhase(SyncPhase.ADVANCING_PAGE);
        pacer.pause(properties.pageDelayMinMs(), properties.pageDelayMaxMs());
        pageIndex++;
      }
    }

    /** Returns false when the run has reached a terminal outcome. */
    private boolean processStub(ListingStub stub) {
      if (session.getStopAtExternalId() != null
          && session.getStopAtExternalId().equals(collector.buildStopKey(stub))) {
        outcome = SyncOutcome.STOPPED_AT_CHECKPOINT;
        info(stub.externalId(), "Reached last collected record, stopping");
        return false;
      }
      if (session.isCancellationRequested()) {
        stopByCancellation();
        return false;
      }
      setPhase(SyncPhase.PROCESSING_ITEM);

      Optional<TransactionRecord> fetched;
      try {
        fetched = collector.fetchDetail(session, stub);
      } catch (RuntimeException ex) {
        log.warn("Detail fetch for {} threw: {}", stub.externalId(), ex.getMessage());
        fetched = Optional.empty();
      }
      if (fetched.isEmpty()) {
        session.recordFailure();
        error(stub.externalId(), FailureKind.ITEM_UNAVAILABLE, "Detail unavailable for " + stub.externalId());
      } else {
        TransactionRecord record = mergeListFields(fetched.get(), stub);
        if (session.isTruncatePending()) {
          truncateLedger();
        }
        persist(stub, record);
      }
      publishProgress();
      pacer.pause(properties.itemDelayMinMs(), properties.itemDelayMaxMs());
      return true;
    }

    private void truncateLedger() {
      try {
        long removed = ledgerGateway.truncate(session.getAccountId(), collector.getProviderType());
        session.setTruncatePending(false);
        info(null, "Cleared " + removed + " stored records before full collection");
      } catch (RuntimeException ex) {
        throw new SetupException("Ledger reset failed: " + ex.getMessage(), ex);
      }
    }

    private void persist(ListingStub stub, TransactionRecord record) {
      try {
        ledgerGateway.save(session.getAccountId(), record);
      } catch (RuntimeException ex) {
        session.recordFailure();
        error(stub.externalId(), FailureKind.PERSIST_ERROR, "Saving " + stub.externalId() + " failed: " + ex.getMessage());
        return;
      }
      session.recordSuccess();
      ProgressEvent event = new ProgressEvent(clock.instant(), session.currentPage(), record.externalId(),
          record.displayName(), ProgressEvent.Severity.SUCCESS, null, record.totalAmount(), record.paidAt(),
          record.thumbnailUrl());
      log.info("[{} {}] saved {} {} ({})", collector.getProviderType(), session.getAccountId(),
          record.externalId(), record.displayName(), record.totalAmount());
      sink.onEvent(event);
    }

    private TransactionRecord mergeListFields(TransactionRecord record, ListingStub stub) {
      TransactionRecord.TransactionRecordBuilder builder = record.toBuilder()
          .externalId(stub.externalId())
          .providerType(collector.getProviderType());
      if (stub.statusCode() != null) {
        builder.statusCode(stub.statusCode());
      }
      if (stub.statusText() != null) {
        builder.statusText(stub.statusText());
      }
      if (stub.statusColor() != null) {
        builder.statusColor(stub.statusColor());
      }
      if (stub.productDetailUrl() != null) {
        builder.productDetailUrl(stub.productDetailUrl());
      }
      if (stub.orderDetailUrl() != null) {
        builder.orderDetailUrl(stub.orderDetailUrl());
      }
      return builder.build();
    }

    private void stopByCancellation() {
      outcome = SyncOutcome.STOPPED_BY_CANCELLATION;
      info(null, "Collection stopped on request");
    }

    private void setPhase(SyncPhase phase) {
      session.setPhase(phase);
      publishProgress();
    }

    private void publishProgress() {
      sink.onProgress(session.progress());
    }

    private void info(String externalId, String message) {
      log.info("[{} {}] {}", collector.getProviderType(), session.getAccountId(), message);
      sink.onEvent(ProgressEvent.info(clock.instant(), session.currentPage(), externalId, message));
    }

    private void warn(String message) {
      log.warn("[{} {}] {}", collector.getProviderType(), session.getAccountId(), message);
      sink.onEvent(ProgressEvent.info(clock.instant(), session.currentPage(), null, message));
    }

    private void error(String externalId, FailureKind kind, String message) {
      log.warn("[{} {}] {}: {}", collector.getProviderType(), session.getAccountId(), kind, message);
      sink.onEvent(ProgressEvent.error(clock.instant(), session.currentPage(), externalId, kind, message));
    }

    private String describe(SyncOutcome value) {
      return switch (value) {
        case STOPPED_AT_CHECKPOINT -> "caught up with last collected record";
        case STOPPED_NO_MORE_DATA -> "no more data";
        case STOPPED_BY_CANCELLATION -> "cancelled";
        case STOPPED_BY_ERROR -> "error";
      };
    }
  }
}
