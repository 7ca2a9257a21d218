package ca.gc.cra.agentreplay.application.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Minimal JSON helper that maps between JSON text and {@link Map}/{@link List}/primitive object graphs.
 *
 * <p>Objects keep field order. Doubles are written as plain decimals with at least one fractional digit and no
 * exponent, so timestamps stay readable and reload as floating-point values;
 * other numbers are written as parsed. Values of unknown types are written as their {@code toString()}.</p>
 *
 * @since 0.1.0
 */
public final class JsonSupport {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Parses the supplied JSON text into a mutable object graph of maps, lists, and primitives.
   *
   * @param json JSON document; never {@code null}
   * @return parsed object graph; an empty document yields an empty map
   * @throws IllegalArgumentException when parsing fails or trailing content follows the document
   */
  public Object parse(String json) {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = factory.createParser(json)) {
      JsonToken token = parser.nextToken();
      if (token == null) {
        return Map.of();
      }
      Object value = readValue(parser, token);
      JsonToken trailing = parser.nextToken();
      if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
        throw new IllegalArgumentException("JSON document contains trailing content");
      }
      return value;
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("Invalid JSON: " + ex.getOriginalMessage(), ex);
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid JSON: " + ex.getMessage(), ex);
    }
  }

  /**
   * Renders a value on a single line.
   *
   * @param value maps, lists, strings, numbers, booleans, or {@code null}
   * @return compact JSON text
   */
  public String toJson(Object value) {
    StringWriter out = new StringWriter();
    try {
      write(out, value, false);
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
    return out.toString();
  }

  /**
   * Renders a value with indentation.
   *
   * @param value maps, lists, strings, numbers, booleans, or {@code null}
   * @return pretty-printed JSON text
   */
  public String toPrettyJson(Object value) {
    StringWriter out = new StringWriter();
    try {
      write(out, value, true);
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
    return out.toString();
  }

  /**
   * Streams a value to a writer. The writer is flushed but not closed.
   *
   * @param out destination
   * @param value value to render
   * @param pretty whether to indent
   * @throws IOException when writing fails
   */
  public void write(Writer out, Object value, boolean pretty) throws IOException {
    Objects.requireNonNull(out, "out");
    try (JsonGenerator gen = factory.createGenerator(out)) {
      gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
      if (pretty) {
        gen.useDefaultPrettyPrinter();
      }
      writeValue(gen, value);
      gen.flush();
    }
  }

  private void writeValue(JsonGenerator gen, Object value) throws IOException {
    if (value == null) {
      gen.writeNull();
    } else if (value instanceof String text) {
      gen.writeString(text);
    } else if (value instanceof Boolean flag) {
      gen.writeBoolean(flag);
    } else if (value instanceof Double || value instanceof Float) {
      writeFloating(gen, ((Number) value).doubleValue());
    } else if (value instanceof BigDecimal decimal) {
      gen.writeNumber(decimal);
    } else if (value instanceof BigInteger integer) {
      gen.writeNumber(integer);
    } else if (value instanceof Number number) {
      gen.writeNumber(number.longValue());
    } else if (value instanceof Map<?, ?> map) {
      gen.writeStartObject();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        gen.writeFieldName(String.valueOf(entry.getKey()));
        writeValue(gen, entry.getValue());
      }
      gen.writeEndObject();
    } else if (value instanceof Collection<?> items) {
      gen.writeStartArray();
      for (Object item : items) {
        writeValue(gen, item);
      }
      gen.writeEndArray();
    } else if (value instanceof Object[] items) {
      gen.writeStartArray();
      for (Object item : items) {
        writeValue(gen, item);
      }
      gen.writeEndArray();
    } else {
      gen.writeString(value.toString());
    }
  }

  private static void writeFloating(JsonGenerator gen, double value) throws IOException {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      gen.writeNumber(value);
      return;
    }
    BigDecimal decimal = BigDecimal.valueOf(value);
    if (decimal.scale() < 1) {
      decimal = decimal.setScale(1);
    }
    gen.writeNumber(decimal.toPlainString());
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IllegalArgumentException("Unsupported JSON token: " + token);
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        break;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new IllegalArgumentException("Expected field name but found " + token);
      }
      String fieldName = parser.getCurrentName();
      JsonToken valueToken = parser.nextToken();
      map.put(fieldName, readValue(parser, valueToken));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        break;
      }
      list.add(readValue(parser, token));
    }
    return list;
  }
}
