package alertgate.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Dependency-free JSON encoder/decoder for command payloads.
 *
 * <p>Accessible via {@link JsonCodec#getDefault()}.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  DefaultJsonCodec() {
  }

  @Override
  public String toJson(Map<String, ?> object) {
    Objects.requireNonNull(object, "object");
    StringBuilder sb = new StringBuilder();
    writeObject(sb, object);
    return sb.toString();
  }

  @Override
  public Map<String, Object> parseObject(String json) {
    if (json == null) {
      throw new IllegalArgumentException("Expected JSON object, got null");
    }
    Parser parser = new Parser(json);
    parser.skipWhitespace();
    if (!parser.peek('{')) {
      throw new IllegalArgumentException("Expected JSON object");
    }
    Map<String, Object> result = parser.readObject();
    parser.skipWhitespace();
    if (!parser.atEnd()) {
      throw new IllegalArgumentException("Unexpected trailing content at index " + parser.index);
    }
    return result;
  }

  private static void writeValue(StringBuilder sb, Object value) {
    if (value == null) {
      sb.append("null");
    } else if (value instanceof CharSequence s) {
      sb.append('"').append(escape(s.toString())).append('"');
    } else if (value instanceof Boolean b) {
      sb.append(b.booleanValue());
    } else if (value instanceof Double d && (d.isNaN() || d.isInfinite())
        || value instanceof Float f && (f.isNaN() || f.isInfinite())) {
      throw new IllegalArgumentException("Non-finite number cannot be encoded: " + value);
    } else if (value instanceof Number n) {
      sb.append(n);
    } else if (value instanceof Map<?, ?> map) {
      writeObject(sb, map);
    } else if (value instanceof Iterable<?> iterable) {
      sb.append('[');
      boolean first = true;
      for (Object element : iterable) {
        if (!first) {
          sb.append(',');
        }
        first = false;
        writeValue(sb, element);
      }
      sb.append(']');
    } else {
      throw new IllegalArgumentException("Unsupported JSON value type: " + value.getClass().getName());
    }
  }

  private static void writeObject(StringBuilder sb, Map<?, ?> map) {
    sb.append('{');
    boolean first = true;
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("JSON objects cannot contain null keys");
      }
      if (!first) {
        sb.append(',');
      }
      first = false;
      sb.append('"').append(escape(entry.getKey().toString())).append('"').append(':');
      writeValue(sb, entry.getValue());
    }
    sb.append('}');
  }

  private static String escape(String value) {
    StringBuilder sb = new StringBuilder(value.length());
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
    private int index;

    private Parser(String input) {
      this.input = input;
    }

    boolean atEnd() {
      return index >= input.length();
    }

    boolean peek(char expected) {
      return index < input.length() && input.charAt(index) == expected;
    }

    void skipWhitespace() {
      while (index < input.length()) {
        char c = input.charAt(index);
        if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
          break;
        }
        index++;
      }
    }

    void expect(char expected) {
      if (!peek(expected)) {
        throw new IllegalArgumentException("Expected '" + expected + "' at index " + index);
      }
      index++;
    }

    Object readValue() {
      skipWhitespace();
      if (atEnd()) {
        throw new IllegalArgumentException("Unexpected end of JSON input");
      }
      char c = input.charAt(index);
      switch (c) {
        case '{':
          return readObject();
        case '[':
          return readArray();
        case '"':
          return readString();
        case 't':
          readLiteral("true");
          return Boolean.TRUE;
        case 'f':
          readLiteral("false");
          return Boolean.FALSE;
        case 'n':
          readLiteral("null");
          return null;
        default:
          if (c == '-' || (c >= '0' && c <= '9')) {
            return readNumber();
          }
          throw new IllegalArgumentException("Unexpected character '" + c + "' at index " + index);
      }
    }

    Map<String, Object> readObject() {
      expect('{');
      Map<String, Object> result = new LinkedHashMap<>();
      skipWhitespace();
      if (peek('}')) {
        index++;
        return result;
      }
      while (true) {
        skipWhitespace();
        if (!peek('"')) {
          throw new IllegalArgumentException("Expected string key at index " + index);
        }
        String key = readString();
        skipWhitespace();
        expect(':');
        result.put(key, readValue());
        skipWhitespace();
        if (peek(',')) {
          index++;
          continue;
        }
        expect('}');
        return result;
      }
    }

    List<Object> readArray() {
      expect('[');
      List<Object> result = new ArrayList<>();
      skipWhitespace();
      if (peek(']')) {
        index++;
        return Collections.unmodifiableList(result);
      }
      while (true) {
        result.add(readValue());
        skipWhitespace();
        if (peek(',')) {
          index++;
          continue;
        }
        expect(']');
        return Collections.unmodifiableList(result);
      }
    }

    String readString() {
      expect('"');
      StringBuilder sb = new StringBuilder();
      while (index < input.length()) {
        char c = input.charAt(index);
        if (c == '"') {
          index++;
          return sb.toString();
        }
        if (c != '\\') {
          sb.append(c);
          index++;
          continue;
        }
        if (index + 1 >= input.length()) {
          throw new IllegalArgumentException("Invalid escape sequence");
        }
        char next = input.charAt(index + 1);
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
            if (index + 5 >= input.length()) {
              throw new IllegalArgumentException("Invalid unicode escape");
            }
            try {
              sb.append((char) Integer.parseInt(input.substring(index + 2, index + 6), 16));
            } catch (NumberFormatException ex) {
              throw new IllegalArgumentException("Invalid unicode escape", ex);
            }
            index += 4;
            break;
          default:
            throw new IllegalArgumentException("Unsupported escape sequence: \\" + next);
        }
        index += 2;
      }
      throw new IllegalArgumentException("Unterminated string");
    }

    Number readNumber() {
      int start = index;
      boolean integral = true;
      while (index < input.length()) {
        char c = input.charAt(index);
        if (c == '.' || c == 'e' || c == 'E') {
          integral = false;
        } else if (c != '-' && c != '+' && (c < '0' || c > '9')) {
          break;
        }
        index++;
      }
      String text = input.substring(start, index);
      try {
        return integral ? (Number) Long.parseLong(text) : (Number) Double.parseDouble(text);
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("Invalid number: " + text, ex);
      }
    }

    void readLiteral(String literal) {
      if (!input.startsWith(literal, index)) {
        throw new IllegalArgumentException("Expected '" + literal + "' at index " + index);
      }
      index += literal.length();
    }
  }
}
