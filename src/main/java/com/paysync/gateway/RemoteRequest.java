package com.paysync.gateway;

import java.util.Map;

public record RemoteRequest(String url, String method, Map<String, String> headers, String body) {
  public static RemoteRequest get(String url, Map<String, String> headers) {
    return new RemoteRequest(url, "GET", headers == null ? Map.of() : headers, null);
  }
}
