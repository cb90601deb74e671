package guardrail.util;

import java.util.Map;

/**
 * Deterministic JSON writer for flat objects.
 *
 * <p>Keys are written in the iteration order of the supplied map, so callers pass a
 * {@link java.util.LinkedHashMap} with a fixed field order. Values may be {@code null},
 * {@link Number}, {@link Boolean} or anything else (written via {@code toString()} as a string).
 * The output contains no insignificant whitespace, which makes it suitable as input to a
 * keyed hash.
 */
public final class CanonicalJson {

  private CanonicalJson() {
  }

  /**
   * Writes the map as a single-line JSON object.
   *
   * @param fields ordered fields; must not contain null keys
   * @return the JSON text, {@code "{}"} for an empty map
   * @throws IllegalArgumentException if a key is null
   */
  public static String write(Map<String, ?> fields) {
    StringBuilder sb = new StringBuilder(64 + fields.size() * 24);
    sb.append('{');
    boolean first = true;
    for (Map.Entry<String, ?> entry : fields.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("fields cannot contain null keys");
      }
      if (!first) {
        sb.append(',');
      }
      first = false;
      sb.append('"');
      escapeInto(sb, entry.getKey());
      sb.append("\":");
      appendValue(sb, entry.getValue());
    }
    return sb.append('}').toString();
  }

  private static void appendValue(StringBuilder sb, Object value) {
    if (value == null) {
      sb.append("null");
    } else if (value instanceof Number || value instanceof Boolean) {
      sb.append(value);
    } else {
      sb.append('"');
      escapeInto(sb, value.toString());
      sb.append('"');
    }
  }

  private static void escapeInto(StringBuilder sb, String value) {
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
