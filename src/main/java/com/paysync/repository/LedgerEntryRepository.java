package com.paysync.repository;

import com.paysync.model.LedgerEntry;
import com.paysync.model.ProviderType;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface LedgerEntryRepository extends JpaRepository<LedgerEntry, UUID> {
  Optional<LedgerEntry> findFirstByAccountIdAndProviderOrderByPaidAtDesc(UUID accountId, ProviderType provider);

  Optional<LedgerEntry> findByAccountIdAndProviderAndExternalId(UUID accountId, ProviderType provider, String externalId);

  long countByAccountIdAndProvider(UUID accountId, ProviderType provider);

  long deleteByAccountIdAndProvider(UUID accountId, ProviderType provider);
}
