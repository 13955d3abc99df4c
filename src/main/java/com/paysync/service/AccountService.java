package com.paysync.service;

import com.paysync.dto.AccountResponse;
import com.paysync.dto.CreateAccountRequest;
import com.paysync.dto.UpdateAccountRequest;
import com.paysync.ledger.Checkpoint;
import com.paysync.ledger.LedgerGateway;
import com.paysync.model.Account;
import com.paysync.repository.AccountRepository;
import com.paysync.repository.LedgerEntryRepository;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@Service
public class AccountService {
  private final AccountRepository accountRepository;
  private final LedgerEntryRepository ledgerEntryRepository;
  private final LedgerGateway ledgerGateway;
  private final CollectionService collectionService;

  public AccountService(AccountRepository accountRepository,
                        LedgerEntryRepository ledgerEntryRepository,
                        LedgerGateway ledgerGateway,
                        CollectionService collectionService) {
    this.accountRepository = accountRepository;
    this.ledgerEntryRepository = ledgerEntryRepository;
    this.ledgerGateway = ledgerGateway;
    this.collectionService = collectionService;
  }

  @Transactional
  public AccountResponse createAccount(CreateAccountRequest request) {
    Account account = new Account();
    account.setProvider(request.getProvider());
    account.setAlias(request.getAlias() == null || request.getAlias().isBlank()
        ? request.getProvider().name().toLowerCase()
        : request.getAlias().trim());
    account.setAutoSyncEnabled(Boolean.TRUE.equals(request.getAutoSyncEnabled()));
    return toResponse(accountRepository.save(account));
  }

  @Transactional(readOnly = true)
  public List<AccountResponse> listAccounts() {
    return accountRepository.findAll().stream()
        .sorted(Comparator.comparing(Account::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())))
        .map(this::toResponse)
        .toList();
  }

  @Transactional
  public AccountResponse updateAccount(UUID accountId, UpdateAccountRequest request) {
    Account account = require(accountId);
    if (request.getAlias() != null && !request.getAlias().isBlank()) {
      account.setAlias(request.getAlias().trim());
    }
    if (request.getAutoSyncEnabled() != null) {
      account.setAutoSyncEnabled(request.getAutoSyncEnabled());
    }
    return toResponse(accountRepository.save(account));
  }

  @Transactional(readOnly = true)
  public Optional<Checkpoint> checkpoint(UUID accountId) {
    Account account = require(accountId);
    return ledgerGateway.getCheckpoint(account.getId(), account.getProvider());
  }

  private Account require(UUID accountId) {
    return accountRepository.findById(accountId)
        .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Account not found"));
  }

  private AccountResponse toResponse(Account account) {
    return new AccountResponse(
        account.getId(),
        account.getProvider(),
        account.getAlias(),
        account.isAutoSyncEnabled(),
        account.getLastCollectedAt(),
        collectionService.isCollecting(account.getId()),
        ledgerEntryRepository.countByAccountIdAndProvider(account.getId(), account.getProvider()),
        account.getCreatedAt());
  }
}
