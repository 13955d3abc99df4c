package com.paysync.dto;

import com.paysync.model.ProviderType;
import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class AccountResponse {
  private UUID id;
  private ProviderType provider;
  private String alias;
  private boolean autoSyncEnabled;
  private Instant lastCollectedAt;
  private boolean collecting;
  private long storedRecords;
  private Instant createdAt;
}
