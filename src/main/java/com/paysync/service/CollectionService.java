package com.paysync.service;

import com.paysync.config.SyncProperties;
import com.paysync.model.Account;
import com.paysync.provider.ProviderRegistry;
import com.paysync.repository.AccountRepository;
import com.paysync.sync.CancellationToken;
import com.paysync.sync.CollectionMonitor;
import com.paysync.sync.CollectionStatus;
import com.paysync.sync.ProviderCollector;
import com.paysync.sync.SyncMode;
import com.paysync.sync.SyncOrchestrator;
import com.paysync.sync.SyncReport;
import com.paysync.sync.SyncSession;
import java.time.Clock;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

/** Starts, stops and reports collection runs, at most one active run per account. */
@Service
public class CollectionService {
  private static final Logger log = LoggerFactory.getLogger(CollectionService.class);

  private final AccountRepository accountRepository;
  private final ProviderRegistry providerRegistry;
  private final SyncOrchestrator orchestrator;
  private final TaskExecutor executor;
  private final SyncProperties properties;
  private final Clock clock;
  private final Map<UUID, CollectionMonitor> monitors = new ConcurrentHashMap<>();

  public CollectionService(AccountRepository accountRepository,
                           ProviderRegistry providerRegistry,
                           SyncOrchestrator orchestrator,
                           @Qualifier("collectionExecutor") TaskExecutor executor,
                           SyncProperties properties,
                           Clock clock) {
    this.accountRepository = accountRepository;
    this.providerRegistry = providerRegistry;
    this.orchestrator = orchestrator;
    this.executor = executor;
    this.properties = properties;
    this.clock = clock;
  }

  public CollectionStatus start(UUID accountId, SyncMode mode) {
    Account account = accountRepository.findById(accountId)
        .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Account not found"));
    ProviderCollector collector = providerRegistry.require(account.getProvider());
    CollectionMonitor monitor = monitorFor(accountId);
    CancellationToken cancellation = monitor.begin(mode);
    if (cancellation == null) {
      throw new ResponseStatusException(HttpStatus.CONFLICT, "Collection already running");
    }
    SyncSession session = new SyncSession(accountId, account.getProvider(), mode, cancellation);
    try {
      executor.execute(() -> runCollection(collector, session, monitor));
    } catch (TaskRejectedException ex) {
      monitor.finish(null);
      throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Too many collections running", ex);
    }
    log.info("Started {} collection for account {} ({})", mode, accountId, account.getProvider());
    return monitor.snapshot();
  }

  public CollectionStatus requestStop(UUID accountId) {
    requireAccount(accountId);
    CollectionMonitor monitor = monitorFor(accountId);
    if (monitor.requestStop()) {
      log.info("Stop requested for account {}", accountId);
    }
    return monitor.snapshot();
  }

  public CollectionStatus status(UUID accountId) {
    requireAccount(accountId);
    return monitorFor(accountId).snapshot();
  }

  public boolean isCollecting(UUID accountId) {
    CollectionMonitor monitor = monitors.get(accountId);
    return monitor != null && monitor.isCollecting();
  }

  private void runCollection(ProviderCollector collector, SyncSession session, CollectionMonitor monitor) {
    SyncReport report = null;
    try {
      report = orchestrator.run(collector, session, monitor);
      log.info("Collection for account {} ended with {} in {} pages", session.getAccountId(), report.outcome(),
          report.pagesVisited());
      markCollected(session.getAccountId());
    } finally {
      monitor.finish(report);
    }
  }

  private void markCollected(UUID accountId) {
    try {
      accountRepository.findById(accountId).ifPresent(account -> {
        account.setLastCollectedAt(clock.instant());
        accountRepository.save(account);
      });
    } catch (RuntimeException ex) {
      log.warn("Could not record collection time for account {}: {}", accountId, ex.getMessage());
    }
  }

  private CollectionMonitor monitorFor(UUID accountId) {
    return monitors.computeIfAbsent(accountId, id -> new CollectionMonitor(properties.logCapacity(), clock));
  }

  private void requireAccount(UUID accountId) {
    if (!accountRepository.existsById(accountId)) {
      throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Account not found");
    }
  }
}
