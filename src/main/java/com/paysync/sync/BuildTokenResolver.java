package com.paysync.sync;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves the provider build token once per run and caches it on the
 * session. Tokens rotate with provider deployments, so nothing is cached
 * across runs.
 */
@Component
public class BuildTokenResolver {
  private static final Logger log = LoggerFactory.getLogger(BuildTokenResolver.class);

  public static final Pattern NEXT_BUILD_MANIFEST = Pattern.compile("_next/static/([^/]+)/_buildManifest\\.js");

  public String resolve(SyncSession session, ProviderCollector collector) {
    if (session.getBuildToken() != null) {
      return session.getBuildToken();
    }
    String token;
    try {
      token = collector.resolveToken(session);
    } catch (SetupException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      throw new SetupException("Build token bootstrap failed: " + ex.getMessage(), ex);
    }
    if (token == null || token.isBlank()) {
      throw new SetupException("Build token bootstrap returned no token");
    }
    log.info("Resolved {} build token {} for account {}", collector.getProviderType(), token, session.getAccountId());
    session.setBuildToken(token);
    return token;
  }

  /** Returns group 1 of the first pattern that matches the document. */
  public static Optional<String> extract(String document, Pattern... patterns) {
    if (document == null || document.isEmpty()) {
      return Optional.empty();
    }
    for (Pattern pattern : patterns) {
      Matcher matcher = pattern.matcher(document);
      if (matcher.find() && matcher.group(1) != null && !matcher.group(1).isBlank()) {
        return Optional.of(matcher.group(1));
      }
    }
    return Optional.empty();
  }
}
