package com.paysync.provider;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;

/** Lenient readers for provider JSON, where fields drift between string and number. */
public final class ProviderJson {
  private ProviderJson() {
  }

  public static JsonNode at(JsonNode node, String path) {
    JsonNode current = node;
    for (String part : path.split("\\.")) {
      if (current == null || current.isMissingNode() || current.isNull()) {
        return null;
      }
      current = current.isArray() && isIndex(part) ? current.path(Integer.parseInt(part)) : current.path(part);
    }
    if (current == null || current.isMissingNode() || current.isNull()) {
      return null;
    }
    return current;
  }

  /** First non-blank text among the paths; numbers are rendered as text. */
  public static String text(JsonNode node, String... paths) {
    for (String path : paths) {
      JsonNode candidate = at(node, path);
      if (candidate == null) {
        continue;
      }
      if (candidate.isTextual()) {
        String value = candidate.asText();
        if (!value.isBlank()) {
          return value;
        }
      } else if (candidate.isNumber() || candidate.isBoolean()) {
        return candidate.asText();
      }
    }
    return null;
  }

  /** First numeric value among the paths; numeric strings are accepted. */
  public static Long longValue(JsonNode node, String... paths) {
    for (String path : paths) {
      Long parsed = parseLong(at(node, path));
      if (parsed != null) {
        return parsed;
      }
    }
    return null;
  }

  /** First value greater than zero; zero and missing fall through to the next path. */
  public static Long firstPositive(JsonNode node, String... paths) {
    for (String path : paths) {
      Long parsed = parseLong(at(node, path));
      if (parsed != null && parsed > 0) {
        return parsed;
      }
    }
    return null;
  }

  public static Instant instant(JsonNode node, ZoneId zone, String... paths) {
    for (String path : paths) {
      JsonNode candidate = at(node, path);
      if (candidate == null) {
        continue;
      }
      if (candidate.isNumber()) {
        return Instant.ofEpochMilli(candidate.asLong());
      }
      if (!candidate.isTextual() || candidate.asText().isBlank()) {
        continue;
      }
      Instant parsed = parseInstant(candidate.asText().trim(), zone);
      if (parsed != null) {
        return parsed;
      }
    }
    return null;
  }

  static Instant parseInstant(String value, ZoneId zone) {
    if (value.chars().allMatch(Character::isDigit)) {
      return Instant.ofEpochMilli(Long.parseLong(value));
    }
    try {
      return Instant.parse(value);
    } catch (DateTimeParseException ignored) {
      // not an ISO instant
    }
    try {
      return OffsetDateTime.parse(value).toInstant();
    } catch (DateTimeParseException ignored) {
      // no offset
    }
    try {
      return LocalDateTime.parse(value.replace(' ', 'T')).atZone(zone).toInstant();
    } catch (DateTimeParseException ignored) {
      // date only
    }
    try {
      return LocalDate.parse(value.length() >= 10 ? value.substring(0, 10) : value).atStartOfDay(zone).toInstant();
    } catch (DateTimeParseException ignored) {
      return null;
    }
  }

  public static int quantity(JsonNode node, String... paths) {
    Long value = longValue(node, paths);
    return value == null || value < 1 ? 1 : value.intValue();
  }

  public static boolean hasElements(JsonNode node) {
    return node != null && node.isArray() && node.size() > 0;
  }

  public static String abbreviate(String value) {
    if (value == null) {
      return "";
    }
    String compact = value.replaceAll("\\s+", " ").trim();
    return compact.length() <= 240 ? compact : compact.substring(0, 240) + "...";
  }

  private static Long parseLong(JsonNode candidate) {
    if (candidate == null) {
      return null;
    }
    if (candidate.isNumber()) {
      return candidate.asLong();
    }
    if (!candidate.isTextual()) {
      return null;
    }
    String value = candidate.asText().replace(",", "").trim();
    if (value.isEmpty()) {
      return null;
    }
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException ex) {
      try {
        return Math.round(Double.parseDouble(value));
      } catch (NumberFormatException ignored) {
        return null;
      }
    }
  }

  private static boolean isIndex(String part) {
    return !part.isEmpty() && part.chars().allMatch(Character::isDigit);
  }
}
