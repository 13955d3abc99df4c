package com.paysync.ledger;

import com.paysync.model.ProviderType;
import java.util.Optional;
import java.util.UUID;

public interface LedgerGateway {
  Optional<Checkpoint> getCheckpoint(UUID accountId, ProviderType provider);

  /** Upserts by (account, provider, externalId). Failures surface as runtime exceptions. */
  void save(UUID accountId, TransactionRecord record);

  /** Removes every stored record of the provider for the account; returns the number removed. */
  long truncate(UUID accountId, ProviderType provider);
}
