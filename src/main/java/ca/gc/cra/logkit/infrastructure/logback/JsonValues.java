package ca.gc.cra.logkit.infrastructure.logback;

import ca.gc.cra.logkit.domain.log.Field;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import org.slf4j.event.KeyValuePair;

/**
 * Writes field values with Jackson's streaming generator.
 *
 * <p>Strings, booleans and numbers keep their JSON type; maps become objects; iterables and arrays become arrays;
 * throwables render as their text; anything else uses {@link String#valueOf(Object)}.</p>
 */
final class JsonValues {
  private JsonValues() {}

  static void writeFields(JsonGenerator gen, List<KeyValuePair> pairs) throws IOException {
    if (pairs == null) {
      return;
    }
    for (KeyValuePair pair : pairs) {
      gen.writeFieldName(pair.key);
      writeValue(gen, pair.value);
    }
  }

  static void writeValue(JsonGenerator gen, Object value) throws IOException {
    if (value == null) {
      gen.writeNull();
    } else if (value instanceof String text) {
      gen.writeString(text);
    } else if (value instanceof Boolean flag) {
      gen.writeBoolean(flag);
    } else if (value instanceof Integer || value instanceof Long
        || value instanceof Short || value instanceof Byte) {
      gen.writeNumber(((Number) value).longValue());
    } else if (value instanceof Double || value instanceof Float) {
      double d = ((Number) value).doubleValue();
      if (Double.isFinite(d)) {
        gen.writeNumber(d);
      } else {
        gen.writeString(Double.toString(d));
      }
    } else if (value instanceof BigInteger big) {
      gen.writeNumber(big);
    } else if (value instanceof BigDecimal big) {
      gen.writeNumber(big);
    } else if (value instanceof Number number) {
      gen.writeNumber(number.toString());
    } else if (value instanceof Map<?, ?> map) {
      gen.writeStartObject();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        gen.writeFieldName(String.valueOf(entry.getKey()));
        writeValue(gen, entry.getValue());
      }
      gen.writeEndObject();
    } else if (value instanceof Iterable<?> items) {
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
    } else if (value instanceof Throwable error) {
      gen.writeString(Field.errorText(error));
    } else {
      gen.writeString(String.valueOf(value));
    }
  }
}
