package infosquito.util;

import java.util.Map;

/**
 * Encoder for flat JSON objects with string values.
 *
 * <p>Output is compact: no whitespace between tokens, keys in map iteration order.
 * Only the characters JSON requires are escaped.
 */
public final class JsonCodec {

  private JsonCodec() {
  }

  /**
   * Encodes a string map as a JSON object.
   *
   * @param fields the fields to encode, in the order they should appear
   * @return the JSON text; {@code "{}"} for an empty map
   * @throws IllegalArgumentException if a key is {@code null}
   */
  public static String toJson(Map<String, String> fields) {
    StringBuilder sb = new StringBuilder();
    sb.append('{');
    boolean first = true;
    for (Map.Entry<String, String> entry : fields.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("fields cannot contain null keys");
      }
      if (!first) {
        sb.append(',');
      }
      first = false;
      appendString(sb, entry.getKey());
      sb.append(':');
      if (entry.getValue() == null) {
        sb.append("null");
      } else {
        appendString(sb, entry.getValue());
      }
    }
    return sb.append('}').toString();
  }

  private static void appendString(StringBuilder sb, String value) {
    sb.append('"');
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
    sb.append('"');
  }
}
