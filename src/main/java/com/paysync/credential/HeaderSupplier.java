package com.paysync.credential;

import java.util.Map;
import java.util.UUID;

/**
 * Supplies the pre-authenticated request headers (cookies, user agent, ...)
 * captured for an account.
 */
public interface HeaderSupplier {
  Map<String, String> getHeaders(UUID accountId);
}
