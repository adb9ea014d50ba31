package io.campaign.job;

import io.campaign.model.RecipientTarget;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Normalization and deduplication of raw email input.
 *
 * <p>Two addresses are the same recipient iff their normalized forms are equal:
 * {@code "A@Example.com"} and {@code " a@example.com "} both normalize to
 * {@code "a@example.com"}.
 */
public final class EmailAddresses {

  private EmailAddresses() {}

  /**
   * Trims surrounding whitespace and lower-cases.
   */
  public static String normalize(String raw) {
    return raw == null ? null : raw.trim().toLowerCase(Locale.ROOT);
  }

  /**
   * Minimal syntactic check on a normalized address: one {@code @} with a non-empty local
   * part and domain, and no whitespace.
   */
  public static boolean isValid(String normalized) {
    if (normalized == null || normalized.isEmpty()) {
      return false;
    }
    int at = normalized.indexOf('@');
    if (at <= 0 || at != normalized.lastIndexOf('@') || at == normalized.length() - 1) {
      return false;
    }
    for (int i = 0; i < normalized.length(); i++) {
      if (Character.isWhitespace(normalized.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  /**
   * Splits a comma-separated string into trimmed, non-empty entries, preserving order.
   * Entries are not normalized.
   */
  public static List<String> parseList(String commaSeparated) {
    if (commaSeparated == null || commaSeparated.isBlank()) {
      return List.of();
    }
    List<String> result = new ArrayList<>();
    for (String part : commaSeparated.split(",")) {
      String trimmed = part.trim();
      if (!trimmed.isEmpty()) {
        result.add(trimmed);
      }
    }
    return result;
  }

  /**
   * Normalizes and deduplicates raw entries. The first occurrence of an address decides
   * its position and display name; blank or malformed entries are collected separately.
   */
  public static Canonical canonicalize(List<RecipientTarget> raw) {
    Map<String, RecipientTarget> unique = new LinkedHashMap<>();
    List<String> rejected = new ArrayList<>();
    for (RecipientTarget target : raw) {
      String email = normalize(target.email());
      if (!isValid(email)) {
        rejected.add(target.email());
        continue;
      }
      unique.putIfAbsent(email, new RecipientTarget(email, blankToNull(target.name())));
    }
    return new Canonical(List.copyOf(unique.values()), List.copyOf(rejected));
  }

  private static String blankToNull(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }

  /**
   * Result of {@link #canonicalize}.
   *
   * @param targets  distinct normalized addresses in first-seen order
   * @param rejected raw entries that were blank or malformed
   */
  public record Canonical(List<RecipientTarget> targets, List<String> rejected) {}
}
