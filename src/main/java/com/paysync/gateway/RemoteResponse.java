package com.paysync.gateway;

public record RemoteResponse(int status, String body) {
  public boolean isSuccessful() {
    return status >= 200 && status < 300;
  }
}
