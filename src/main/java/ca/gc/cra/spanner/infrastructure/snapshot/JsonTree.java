package ca.gc.cra.spanner.infrastructure.snapshot;

import ca.gc.cra.spanner.application.snapshot.SnapshotFormatException;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parses a JSON document into a tree of {@link Map}, {@link List}, {@link String}, {@link Number},
 * {@link Boolean} and {@code null} values.
 */
final class JsonTree {
  private final JsonFactory factory;

  JsonTree(JsonFactory factory) {
    this.factory = Objects.requireNonNull(factory, "factory");
  }

  /**
   * Parses a complete document.
   *
   * @param document UTF-8 JSON bytes
   * @return parsed value; never {@code null} for a well-formed snapshot
   * @throws SnapshotFormatException when the bytes are empty, malformed or carry trailing content
   */
  Object parse(byte[] document) throws SnapshotFormatException {
    try (JsonParser parser = factory.createParser(document)) {
      JsonToken token = parser.nextToken();
      if (token == null) {
        throw new SnapshotFormatException("Snapshot document is empty");
      }
      Object value = readValue(parser, token);
      JsonToken trailing = parser.nextToken();
      if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
        throw new SnapshotFormatException("Snapshot document contains trailing content");
      }
      return value;
    } catch (JsonProcessingException ex) {
      throw new SnapshotFormatException("Snapshot document is not valid JSON: " + ex.getOriginalMessage(), ex);
    } catch (IOException ex) {
      throw new SnapshotFormatException("Snapshot document could not be parsed", ex);
    }
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException, SnapshotFormatException {
    if (token == null) {
      throw new SnapshotFormatException("Snapshot document ended unexpectedly");
    }
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new SnapshotFormatException("Unsupported JSON token: " + token);
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException, SnapshotFormatException {
    Map<String, Object> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        break;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new SnapshotFormatException("Expected field name but found " + token);
      }
      String fieldName = parser.currentName();
      JsonToken valueToken = parser.nextToken();
      map.put(fieldName, readValue(parser, valueToken));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException, SnapshotFormatException {
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
