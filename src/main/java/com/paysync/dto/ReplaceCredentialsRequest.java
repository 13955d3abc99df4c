package com.paysync.dto;

import jakarta.validation.constraints.NotNull;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;

/** Request headers captured from an authenticated browser session. */
@Getter
@Setter
public class ReplaceCredentialsRequest {
  @NotNull
  private Map<String, String> headers;
}
