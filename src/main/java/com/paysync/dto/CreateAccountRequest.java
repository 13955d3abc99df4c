package com.paysync.dto;

import com.paysync.model.ProviderType;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class CreateAccountRequest {
  @NotNull
  private ProviderType provider;

  private String alias;

  private Boolean autoSyncEnabled;
}
