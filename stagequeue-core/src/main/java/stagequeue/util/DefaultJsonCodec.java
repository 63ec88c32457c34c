package stagequeue.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lightweight JSON encoder/decoder for scheduling-log detail maps.
 * Has no external dependencies; supports objects, arrays, strings, numbers,
 * booleans and {@code null}.
 *
 * <p>Integral numbers decode to {@link Long}, all others to {@link Double}.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  DefaultJsonCodec() {
  }

  @Override
  public String toJson(Map<String, ?> details) {
    if (details == null) {
      return null;
    }
    StringBuilder sb = new StringBuilder();
    writeValue(sb, details);
    return sb.toString();
  }

  @Override
  public Map<String, Object> parseObject(String json) {
    if (json == null) {
      return Collections.emptyMap();
    }
    String trimmed = json.trim();
    if (trimmed.isEmpty() || "null".equals(trimmed)) {
      return Collections.emptyMap();
    }
    Parser parser = new Parser(trimmed);
    parser.skipWhitespace();
    if (parser.peek() != '{') {
      throw new IllegalArgumentException("Expected JSON object");
    }
    Object value = parser.readValue();
    parser.skipWhitespace();
    if (!parser.atEnd()) {
      throw new IllegalArgumentException("Trailing content after JSON object");
    }
    @SuppressWarnings("unchecked")
    Map<String, Object> map = (Map<String, Object>) value;
    return map;
  }

  private static void writeValue(StringBuilder sb, Object value) {
    if (value == null) {
      sb.append("null");
    } else if (value instanceof String s) {
      sb.append('"').append(escape(s)).append('"');
    } else if (value instanceof Boolean b) {
      sb.append(b);
    } else if (value instanceof Double d) {
      writeFloating(sb, d);
    } else if (value instanceof Float f) {
      writeFloating(sb, f.doubleValue());
    } else if (value instanceof Number n) {
      sb.append(n);
    } else if (value instanceof Enum<?> e) {
      sb.append('"').append(escape(e.name())).append('"');
    } else if (value instanceof Map<?, ?> map) {
      sb.append('{');
      boolean first = true;
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        if (entry.getKey() == null) {
          throw new IllegalArgumentException("details cannot contain null keys");
        }
        if (!first) {
          sb.append(',');
        }
        first = false;
        sb.append('"').append(escape(entry.getKey().toString())).append('"').append(':');
        writeValue(sb, entry.getValue());
      }
      sb.append('}');
    } else if (value instanceof Collection<?> items) {
      sb.append('[');
      boolean first = true;
      for (Object item : items) {
        if (!first) {
          sb.append(',');
        }
        first = false;
        writeValue(sb, item);
      }
      sb.append(']');
    } else {
      throw new IllegalArgumentException("Unsupported JSON value type: " + value.getClass().getName());
    }
  }

  private static void writeFloating(StringBuilder sb, double d) {
    if (Double.isNaN(d) || Double.isInfinite(d)) {
      sb.append("null");
    } else {
      sb.append(d);
    }
  }

  private static String escape(String value) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\b':
          sb.append("\\b");
          break;
        case '\f':
          sb.append("\\f");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        default:
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
      }
    }
    return sb.toString();
  }

  private static final class Parser {
    private final String input;
    private int idx;

    private Parser(String input) {
      this.input = input;
    }

    boolean atEnd() {
      return idx >= input.length();
    }

    char peek() {
      if (atEnd()) {
        throw new IllegalArgumentException("Unexpected end of JSON");
      }
      return input.charAt(idx);
    }

    void skipWhitespace() {
      while (idx < input.length()) {
        char c = input.charAt(idx);
        if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
          break;
        }
        idx++;
      }
    }

    Object readValue() {
      skipWhitespace();
      char ch = peek();
      switch (ch) {
        case '{':
          return readObject();
        case '[':
          return readArray();
        case '"':
          idx++;
          return readString();
        case 't':
          return readLiteral("true", Boolean.TRUE);
        case 'f':
          return readLiteral("false", Boolean.FALSE);
        case 'n':
          return readLiteral("null", null);
        default:
          if (ch == '-' || Character.isDigit(ch)) {
            return readNumber();
          }
          throw new IllegalArgumentException("Unexpected character '" + ch + "' at " + idx);
      }
    }

    private Map<String, Object> readObject() {
      idx++;
      Map<String, Object> result = new LinkedHashMap<>();
      skipWhitespace();
      if (peek() == '}') {
        idx++;
        return result;
      }
      while (true) {
        skipWhitespace();
        if (peek() != '"') {
          throw new IllegalArgumentException("Expected string key");
        }
        idx++;
        String key = readString();
        skipWhitespace();
        if (peek() != ':') {
          throw new IllegalArgumentException("Expected ':' after key");
        }
        idx++;
        result.put(key, readValue());
        skipWhitespace();
        char next = peek();
        idx++;
        if (next == '}') {
          return result;
        }
        if (next != ',') {
          throw new IllegalArgumentException("Expected ',' or '}'");
        }
      }
    }

    private List<Object> readArray() {
      idx++;
      List<Object> result = new ArrayList<>();
      skipWhitespace();
      if (peek() == ']') {
        idx++;
        return result;
      }
      while (true) {
        result.add(readValue());
        skipWhitespace();
        char next = peek();
        idx++;
        if (next == ']') {
          return result;
        }
        if (next != ',') {
          throw new IllegalArgumentException("Expected ',' or ']'");
        }
      }
    }

    private Object readLiteral(String literal, Object value) {
      if (!input.startsWith(literal, idx)) {
        throw new IllegalArgumentException("Invalid literal at " + idx);
      }
      idx += literal.length();
      return value;
    }

    private Number readNumber() {
      int start = idx;
      boolean floating = false;
      while (idx < input.length()) {
        char c = input.charAt(idx);
        if (c == '.' || c == 'e' || c == 'E') {
          floating = true;
        } else if (!(Character.isDigit(c) || c == '-' || c == '+')) {
          break;
        }
        idx++;
      }
      String text = input.substring(start, idx);
      try {
        return floating ? (Number) Double.valueOf(text) : (Number) Long.valueOf(text);
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("Invalid number: " + text, ex);
      }
    }

    private String readString() {
      StringBuilder sb = new StringBuilder();
      while (idx < input.length()) {
        char c = input.charAt(idx);
        if (c == '"') {
          idx++;
          return sb.toString();
        }
        if (c != '\\') {
          sb.append(c);
          idx++;
          continue;
        }
        if (idx + 1 >= input.length()) {
          throw new IllegalArgumentException("Invalid escape sequence");
        }
        char next = input.charAt(idx + 1);
        switch (next) {
          case '"':
          case '\\':
          case '/':
            sb.append(next);
            break;
          case 'b':
            sb.append('\b');
            break;
          case 'f':
            sb.append('\f');
            break;
          case 'n':
            sb.append('\n');
            break;
          case 'r':
            sb.append('\r');
            break;
          case 't':
            sb.append('\t');
            break;
          case 'u':
            if (idx + 5 >= input.length()) {
              throw new IllegalArgumentException("Invalid unicode escape");
            }
            String hex = input.substring(idx + 2, idx + 6);
            try {
              sb.append((char) Integer.parseInt(hex, 16));
            } catch (NumberFormatException ex) {
              throw new IllegalArgumentException("Invalid unicode escape", ex);
            }
            idx += 4;
            break;
          default:
            throw new IllegalArgumentException("Unsupported escape sequence: \\" + next);
        }
        idx += 2;
      }
      throw new IllegalArgumentException("Unterminated string");
    }
  }
}
