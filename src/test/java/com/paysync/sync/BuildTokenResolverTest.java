package com.paysync.sync;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.paysync.model.ProviderType;
import java.util.UUID;
import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;

class BuildTokenResolverTest {
  private final BuildTokenResolver resolver = new BuildTokenResolver();

  private static SyncSession session() {
    return new SyncSession(UUID.randomUUID(), ProviderType.COUPANG, SyncMode.INCREMENTAL, new CancellationToken());
  }

  @Test
  void cachesTokenOnSession() {
    ProviderCollector collector = mock(ProviderCollector.class);
    SyncSession session = session();
    when(collector.resolveToken(session)).thenReturn("abc123");

    assertThat(resolver.resolve(session, collector)).isEqualTo("abc123");
    assertThat(resolver.resolve(session, collector)).isEqualTo("abc123");
    assertThat(session.getBuildToken()).isEqualTo("abc123");
    verify(collector).resolveToken(session);
  }

  @Test
  void usesTokenAlreadyOnSession() {
    ProviderCollector collector = mock(ProviderCollector.class);
    SyncSession session = session();
    session.setBuildToken("cached");

    assertThat(resolver.resolve(session, collector)).isEqualTo("cached");
    verify(collector, never()).resolveToken(session);
  }

  @Test
  void wrapsTransportFailures() {
    ProviderCollector collector = mock(ProviderCollector.class);
    SyncSession session = session();
    when(collector.resolveToken(session)).thenThrow(new IllegalStateException("connection reset"));

    assertThatThrownBy(() -> resolver.resolve(session, collector))
        .isInstanceOf(SetupException.class)
        .hasMessageContaining("connection reset");
  }

  @Test
  void blankTokenIsASetupFailure() {
    ProviderCollector collector = mock(ProviderCollector.class);
    SyncSession session = session();
    when(collector.resolveToken(session)).thenReturn(" ");

    assertThatThrownBy(() -> resolver.resolve(session, collector)).isInstanceOf(SetupException.class);
    assertThat(session.getBuildToken()).isNull();
  }

  @Test
  void extractTriesPatternsInOrder() {
    String html = "<script src=\"/_next/static/generic/_buildManifest.js\"></script>"
        + "<script src=\"https://financial.pstatic.net/naverpay-web/v2/_next/static/cdn-token/_buildManifest.js\">";
    Pattern cdn = Pattern.compile("financial\\.pstatic\\.net/naverpay-web/[^/]+/_next/static/([^/]+)/_buildManifest\\.js");

    assertThat(BuildTokenResolver.extract(html, cdn, BuildTokenResolver.NEXT_BUILD_MANIFEST)).contains("cdn-token");
    assertThat(BuildTokenResolver.extract(html, BuildTokenResolver.NEXT_BUILD_MANIFEST)).contains("generic");
    assertThat(BuildTokenResolver.extract("<html></html>", cdn, BuildTokenResolver.NEXT_BUILD_MANIFEST)).isEmpty();
  }
}
