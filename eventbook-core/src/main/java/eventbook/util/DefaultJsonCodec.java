package eventbook.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Dependency-free {@link JsonCodec} for flat arrays of strings.
 *
 * <p>Accessible via {@link JsonCodec#getDefault()}.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  DefaultJsonCodec() {
  }

  @Override
  public String toJsonArray(List<String> values) {
    Objects.requireNonNull(values, "values");
    StringBuilder sb = new StringBuilder();
    sb.append('[');
    for (int i = 0; i < values.size(); i++) {
      String value = values.get(i);
      if (value == null) {
        throw new IllegalArgumentException("values cannot contain null");
      }
      if (i > 0) {
        sb.append(',');
      }
      sb.append('"');
      escape(value, sb);
      sb.append('"');
    }
    sb.append(']');
    return sb.toString();
  }

  @Override
  public List<String> parseArray(String json) {
    if (json == null || json.isBlank()) {
      return Collections.emptyList();
    }
    String input = json.trim();
    int len = input.length();
    if (input.charAt(0) != '[') {
      throw new IllegalArgumentException("Expected JSON array");
    }
    List<String> result = new ArrayList<>();
    int idx = skipWhitespace(input, 1);
    if (idx < len && input.charAt(idx) == ']') {
      return expectEnd(input, idx + 1, result);
    }
    while (true) {
      if (idx >= len || input.charAt(idx) != '"') {
        throw new IllegalArgumentException("Expected string element at index " + idx);
      }
      idx = parseString(input, idx + 1, result);
      idx = skipWhitespace(input, idx);
      if (idx >= len) {
        throw new IllegalArgumentException("Unexpected end of JSON array");
      }
      char next = input.charAt(idx);
      if (next == ']') {
        return expectEnd(input, idx + 1, result);
      }
      if (next != ',') {
        throw new IllegalArgumentException("Expected ',' or ']' at index " + idx);
      }
      idx = skipWhitespace(input, idx + 1);
    }
  }

  private static List<String> expectEnd(String input, int idx, List<String> result) {
    if (skipWhitespace(input, idx) != input.length()) {
      throw new IllegalArgumentException("Trailing characters after JSON array");
    }
    return Collections.unmodifiableList(result);
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

  /** Appends the string starting after the opening quote; returns the index after the closing quote. */
  private static int parseString(String input, int start, List<String> out) {
    StringBuilder sb = new StringBuilder();
    int i = start;
    while (i < input.length()) {
      char c = input.charAt(i);
      if (c == '"') {
        out.add(sb.toString());
        return i + 1;
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

  private static void escape(String value, StringBuilder sb) {
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
  }
}
