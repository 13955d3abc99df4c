package com.paysync.credential;

import com.paysync.config.CryptoProperties;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Locale;
import java.util.UUID;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.stereotype.Component;

/**
 * Seals captured session header values with AES-GCM. The owning account and
 * the lower-cased header name are bound in as associated data, so a value
 * copied onto another account or header does not open.
 *
 * <p>Sealed form: {@code v1:base64(iv):base64(ciphertext)}.
 */
@Component
public class HeaderCipher {
  private static final String VERSION = "v1";
  private static final String TRANSFORMATION = "AES/GCM/NoPadding";
  private static final int TAG_BITS = 128;
  private static final int IV_BYTES = 12;

  private final SecretKey key;
  private final SecureRandom random = new SecureRandom();

  public HeaderCipher(CryptoProperties properties) {
    String secret = properties.secret();
    if (secret == null || secret.isBlank()) {
      throw new IllegalStateException("paysync.crypto.secret is required to store session headers");
    }
    byte[] keyBytes;
    try {
      keyBytes = Base64.getDecoder().decode(secret.trim());
    } catch (IllegalArgumentException ex) {
      throw new IllegalStateException("paysync.crypto.secret is not valid base64", ex);
    }
    if (keyBytes.length != 16 && keyBytes.length != 24 && keyBytes.length != 32) {
      throw new IllegalStateException("paysync.crypto.secret must decode to a 128, 192 or 256 bit key");
    }
    this.key = new SecretKeySpec(keyBytes, "AES");
  }

  public String seal(UUID accountId, String headerName, String value) {
    byte[] iv = new byte[IV_BYTES];
    random.nextBytes(iv);
    try {
      Cipher cipher = cipher(Cipher.ENCRYPT_MODE, iv, accountId, headerName);
      byte[] sealed = cipher.doFinal(value.getBytes(StandardCharsets.UTF_8));
      Base64.Encoder encoder = Base64.getEncoder();
      return VERSION + ":" + encoder.encodeToString(iv) + ":" + encoder.encodeToString(sealed);
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException("Could not seal header " + headerName, ex);
    }
  }

  public String open(UUID accountId, String headerName, String sealed) {
    String[] parts = sealed == null ? new String[0] : sealed.split(":", 3);
    if (parts.length != 3 || !VERSION.equals(parts[0])) {
      throw new IllegalStateException("Stored header " + headerName + " is not in " + VERSION + " sealed form");
    }
    try {
      Base64.Decoder decoder = Base64.getDecoder();
      Cipher cipher = cipher(Cipher.DECRYPT_MODE, decoder.decode(parts[1]), accountId, headerName);
      return new String(cipher.doFinal(decoder.decode(parts[2])), StandardCharsets.UTF_8);
    } catch (GeneralSecurityException | IllegalArgumentException ex) {
      throw new IllegalStateException("Stored header " + headerName + " does not open for account " + accountId, ex);
    }
  }

  private Cipher cipher(int mode, byte[] iv, UUID accountId, String headerName) throws GeneralSecurityException {
    Cipher cipher = Cipher.getInstance(TRANSFORMATION);
    cipher.init(mode, key, new GCMParameterSpec(TAG_BITS, iv));
    cipher.updateAAD((accountId + "\n" + headerName.toLowerCase(Locale.ROOT)).getBytes(StandardCharsets.UTF_8));
    return cipher;
  }
}
