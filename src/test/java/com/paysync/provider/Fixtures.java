package com.paysync.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

public final class Fixtures {
  public static final ObjectMapper MAPPER = new ObjectMapper();

  private Fixtures() {
  }

  public static String text(String path) {
    try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + path)) {
      if (in == null) {
        throw new IllegalArgumentException("Missing fixture " + path);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
  }

  public static JsonNode json(String path) {
    try {
      return MAPPER.readTree(text(path));
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
  }
}
