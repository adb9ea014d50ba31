package io.campaign.util;

import io.campaign.model.RecipientTarget;

import java.util.ArrayList;
import java.util.List;

/**
 * Lightweight JSON encoder/decoder for job address lists.
 *
 * <p>Only handles the exact shape it writes: an array of flat objects whose values are
 * strings or {@code null}. Unknown keys are ignored on parse.
 */
public final class DefaultTargetCodec implements TargetCodec {
  static final DefaultTargetCodec INSTANCE = new DefaultTargetCodec();

  DefaultTargetCodec() {
  }

  @Override
  public String toJson(List<RecipientTarget> targets) {
    if (targets == null || targets.isEmpty()) {
      return null;
    }
    StringBuilder sb = new StringBuilder();
    sb.append('[');
    for (int i = 0; i < targets.size(); i++) {
      RecipientTarget target = targets.get(i);
      if (i > 0) {
        sb.append(',');
      }
      sb.append("{\"email\":\"").append(escape(target.email())).append('"');
      if (target.name() != null) {
        sb.append(",\"name\":\"").append(escape(target.name())).append('"');
      }
      sb.append('}');
    }
    sb.append(']');
    return sb.toString();
  }

  @Override
  public List<RecipientTarget> parse(String json) {
    if (json == null) {
      return List.of();
    }
    String trimmed = json.trim();
    if (trimmed.isEmpty() || "null".equals(trimmed)) {
      return List.of();
    }
    int len = trimmed.length();
    if (trimmed.charAt(0) != '[') {
      throw new IllegalArgumentException("Expected JSON array");
    }
    List<RecipientTarget> result = new ArrayList<>();
    int idx = skipWhitespace(trimmed, 1);
    if (idx < len && trimmed.charAt(idx) == ']') {
      return result;
    }
    while (true) {
      idx = skipWhitespace(trimmed, idx);
      if (idx >= len || trimmed.charAt(idx) != '{') {
        throw new IllegalArgumentException("Expected address object");
      }
      idx = parseTarget(trimmed, idx + 1, result);
      idx = skipWhitespace(trimmed, idx);
      if (idx >= len) {
        throw new IllegalArgumentException("Unexpected end of JSON array");
      }
      char next = trimmed.charAt(idx);
      if (next == ',') {
        idx++;
        continue;
      }
      if (next == ']') {
        return result;
      }
      throw new IllegalArgumentException("Expected ',' or ']'");
    }
  }

  private static int parseTarget(String input, int start, List<RecipientTarget> out) {
    String email = null;
    String name = null;
    int len = input.length();
    int idx = skipWhitespace(input, start);
    if (idx < len && input.charAt(idx) == '}') {
      throw new IllegalArgumentException("Address object is missing \"email\"");
    }
    while (true) {
      idx = skipWhitespace(input, idx);
      if (idx >= len || input.charAt(idx) != '"') {
        throw new IllegalArgumentException("Expected string key");
      }
      ParseResult key = parseString(input, idx + 1);
      idx = skipWhitespace(input, key.nextIndex);
      if (idx >= len || input.charAt(idx) != ':') {
        throw new IllegalArgumentException("Expected ':' after key");
      }
      idx = skipWhitespace(input, idx + 1);
      String value;
      if (input.startsWith("null", idx)) {
        value = null;
        idx += 4;
      } else if (idx < len && input.charAt(idx) == '"') {
        ParseResult parsed = parseString(input, idx + 1);
        value = parsed.value;
        idx = parsed.nextIndex;
      } else {
        throw new IllegalArgumentException("Expected string value or null");
      }
      if ("email".equals(key.value)) {
        email = value;
      } else if ("name".equals(key.value)) {
        name = value;
      }
      idx = skipWhitespace(input, idx);
      if (idx >= len) {
        throw new IllegalArgumentException("Unexpected end of address object");
      }
      char next = input.charAt(idx);
      if (next == ',') {
        idx++;
        continue;
      }
      if (next == '}') {
        if (email == null) {
          throw new IllegalArgumentException("Address object is missing \"email\"");
        }
        out.add(new RecipientTarget(email, name));
        return idx + 1;
      }
      throw new IllegalArgumentException("Expected ',' or '}'");
    }
  }

  private static int skipWhitespace(String input, int index) {
    int i = index;
    while (i < input.length()) {
      char c = input.charAt(i);
      if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
        break;
      }
      i++;
    }
    return i;
  }

  private static ParseResult parseString(String input, int startIndex) {
    StringBuilder sb = new StringBuilder();
    int i = startIndex;
    while (i < input.length()) {
      char c = input.charAt(i);
      if (c == '"') {
        return new ParseResult(sb.toString(), i + 1);
      }
      if (c != '\\') {
        sb.append(c);
        i++;
        continue;
      }
      if (i + 1 >= input.length()) {
        throw new IllegalArgumentException("Invalid escape sequence");
      }
      char next = input.charAt(i + 1);
      switch (next) {
        case '"', '\\', '/' -> sb.append(next);
        case 'b' -> sb.append('\b');
        case 'f' -> sb.append('\f');
        case 'n' -> sb.append('\n');
        case 'r' -> sb.append('\r');
        case 't' -> sb.append('\t');
        case 'u' -> {
          if (i + 5 >= input.length()) {
            throw new IllegalArgumentException("Invalid unicode escape");
          }
          try {
            sb.append((char) Integer.parseInt(input.substring(i + 2, i + 6), 16));
          } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid unicode escape", ex);
          }
          i += 4;
        }
        default -> throw new IllegalArgumentException("Unsupported escape sequence: \\" + next);
      }
      i += 2;
    }
    throw new IllegalArgumentException("Unterminated string");
  }

  private static String escape(String value) {
    StringBuilder sb = new StringBuilder(value.length() + 8);
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\b' -> sb.append("\\b");
        case '\f' -> sb.append("\\f");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        default -> {
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
        }
      }
    }
    return sb.toString();
  }

  private record ParseResult(String value, int nextIndex) {}
}
