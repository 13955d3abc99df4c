package com.paysync.credential;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.paysync.config.CryptoProperties;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class HeaderCipherTest {
  private static final String SECRET = "MDEyMzQ1Njc4OWFiY2RlZjAxMjM0NTY3ODlhYmNkZWY=";
  private static final UUID ACCOUNT = UUID.fromString("3f6c1d2e-8b4a-4e0f-9a7d-5c2b1e0f4a93");

  private final HeaderCipher cipher = new HeaderCipher(new CryptoProperties(SECRET));

  @Test
  void sealsWithFreshIvAndOpensForSameHeader() {
    String first = cipher.seal(ACCOUNT, "Cookie", "NID_SES=abc");
    String second = cipher.seal(ACCOUNT, "Cookie", "NID_SES=abc");

    assertThat(first).startsWith("v1:").doesNotContain("NID_SES");
    assertThat(first).isNotEqualTo(second);
    assertThat(cipher.open(ACCOUNT, "Cookie", first)).isEqualTo("NID_SES=abc");
  }

  @Test
  void headerNameBindingIgnoresCase() {
    String sealed = cipher.seal(ACCOUNT, "User-Agent", "Mozilla/5.0");

    assertThat(cipher.open(ACCOUNT, "user-agent", sealed)).isEqualTo("Mozilla/5.0");
  }

  @Test
  void valueMovedToAnotherHeaderOrAccountDoesNotOpen() {
    String sealed = cipher.seal(ACCOUNT, "Cookie", "NID_SES=abc");

    assertThatThrownBy(() -> cipher.open(ACCOUNT, "Authorization", sealed))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Authorization");
    assertThatThrownBy(() -> cipher.open(UUID.randomUUID(), "Cookie", sealed))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void rejectsTamperedOrUnversionedValues() {
    String sealed = cipher.seal(ACCOUNT, "Cookie", "PCID=1");
    String tampered = sealed.substring(0, sealed.length() - 4) + "AAAA";

    assertThatThrownBy(() -> cipher.open(ACCOUNT, "Cookie", tampered)).isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(() -> cipher.open(ACCOUNT, "Cookie", "aXY=:Ym9keQ=="))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("v1");
  }

  @Test
  void requiresUsableSecret() {
    assertThatThrownBy(() -> new HeaderCipher(new CryptoProperties(" ")))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("paysync.crypto.secret");
    assertThatThrownBy(() -> new HeaderCipher(new CryptoProperties("c2hvcnQ=")))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("bit key");
  }
}
