package com.paysync.sync;

import com.paysync.ledger.Checkpoint;
import com.paysync.ledger.LedgerGateway;
import com.paysync.model.ProviderType;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Component;

@Component
public class CheckpointResolver {
  private final LedgerGateway ledgerGateway;

  public CheckpointResolver(LedgerGateway ledgerGateway) {
    this.ledgerGateway = ledgerGateway;
  }

  public Optional<Checkpoint> currentCheckpoint(UUID accountId, ProviderType provider) {
    try {
      return ledgerGateway.getCheckpoint(accountId, provider);
    } catch (RuntimeException ex) {
      throw new SetupException("Checkpoint lookup failed: " + ex.getMessage(), ex);
    }
  }
}
