package com.paysync.gateway;

/**
 * Executes a single HTTP request against a third-party host. Any status code
 * is returned as-is; only transport failures raise.
 */
public interface RemoteRequestGateway {
  RemoteResponse execute(RemoteRequest request);
}
