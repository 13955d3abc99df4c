package com.paysync.dto;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class UpdateAccountRequest {
  private String alias;
  private Boolean autoSyncEnabled;
}
