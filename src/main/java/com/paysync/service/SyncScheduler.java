package com.paysync.service;

import com.paysync.config.SyncProperties;
import com.paysync.model.Account;
import com.paysync.repository.AccountRepository;
import com.paysync.sync.SyncMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;

@Component
public class SyncScheduler {
  private static final Logger log = LoggerFactory.getLogger(SyncScheduler.class);

  private final AccountRepository accountRepository;
  private final CollectionService collectionService;
  private final SyncProperties properties;
  private final Clock clock;

  public SyncScheduler(AccountRepository accountRepository,
                       CollectionService collectionService,
                       SyncProperties properties,
                       Clock clock) {
    this.accountRepository = accountRepository;
    this.collectionService = collectionService;
    this.properties = properties;
    this.clock = clock;
  }

  @Scheduled(fixedDelayString = "${paysync.sync.poll-ms:60000}")
  public void run() {
    if (!properties.schedulerEnabled()) {
      return;
    }
    Instant now = clock.instant();
    accountRepository.findByAutoSyncEnabledTrue()
        .stream()
        .filter(account -> shouldSync(account, now))
        .forEach(this::startIncremental);
  }

  private boolean shouldSync(Account account, Instant now) {
    if (collectionService.isCollecting(account.getId())) {
      return false;
    }
    long intervalMs = properties.autoSyncIntervalMs();
    if (intervalMs <= 0 || account.getLastCollectedAt() == null) {
      return true;
    }
    return Duration.between(account.getLastCollectedAt(), now).toMillis() >= intervalMs;
  }

  private void startIncremental(Account account) {
    try {
      collectionService.start(account.getId(), SyncMode.INCREMENTAL);
    } catch (ResponseStatusException ex) {
      log.info("Scheduled collection for account {} skipped: {}", account.getId(), ex.getReason());
    }
  }
}
