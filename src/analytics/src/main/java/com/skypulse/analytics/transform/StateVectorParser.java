package com.skypulse.analytics.transform;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skypulse.analytics.model.RawStateVector;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses the OpenSky {@code /states/all} JSON body into raw state vectors.
 *
 * <p>Rows are fixed-position arrays defined by OpenSky. Short rows are tolerated (missing
 * positions read as {@code null}); rows that are not arrays are dropped one by one.
 */
public class StateVectorParser {
  private static final Logger log = LoggerFactory.getLogger(StateVectorParser.class);

  static final int ICAO24 = 0;
  static final int CALLSIGN = 1;
  static final int ORIGIN_COUNTRY = 2;
  static final int TIME_POSITION = 3;
  static final int LAST_CONTACT = 4;
  static final int LONGITUDE = 5;
  static final int LATITUDE = 6;
  static final int BARO_ALTITUDE = 7;
  static final int ON_GROUND = 8;
  static final int VELOCITY = 9;
  static final int TRUE_TRACK = 10;
  static final int VERTICAL_RATE = 11;
  static final int GEO_ALTITUDE = 13;
  static final int SQUAWK = 14;
  static final int CATEGORY = 17;

  private final ObjectMapper objectMapper;

  public StateVectorParser(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Parses a raw payload.
   *
   * @param payload response body
   * @return parsed rows; an absent or {@code null} {@code states} field yields no rows
   * @throws MalformedPayloadException when the body is not a JSON object
   */
  public RawPayload parse(String payload) {
    if (payload == null || payload.isBlank()) {
      throw new MalformedPayloadException("empty payload", null);
    }
    JsonNode root;
    try {
      root = objectMapper.readTree(payload);
    } catch (JsonProcessingException ex) {
      throw new MalformedPayloadException("payload is not valid JSON", ex);
    }
    if (root == null || !root.isObject()) {
      throw new MalformedPayloadException("payload root is not a JSON object", null);
    }

    Long time = longNumber(root.get("time"));
    JsonNode states = root.path("states");
    if (!states.isArray()) {
      return new RawPayload(time, List.of(), 0);
    }

    List<RawStateVector> vectors = new ArrayList<>(states.size());
    int rejected = 0;
    int index = 0;
    for (JsonNode row : states) {
      try {
        vectors.add(parseRow(index, row));
      } catch (MalformedRecordException ex) {
        rejected++;
        log.debug("Dropping malformed state vector: {}", ex.getMessage());
      }
      index++;
    }
    return new RawPayload(time, vectors, rejected);
  }

  RawStateVector parseRow(int index, JsonNode row) {
    if (row == null || !row.isArray()) {
      throw new MalformedRecordException(index, "state vector is not an array");
    }
    Double category = number(row.get(CATEGORY));
    return new RawStateVector(
        text(row.get(ICAO24)),
        text(row.get(CALLSIGN)),
        text(row.get(ORIGIN_COUNTRY)),
        longNumber(row.get(TIME_POSITION)),
        longNumber(row.get(LAST_CONTACT)),
        number(row.get(LONGITUDE)),
        number(row.get(LATITUDE)),
        number(row.get(BARO_ALTITUDE)),
        bool(row.get(ON_GROUND)),
        number(row.get(VELOCITY)),
        number(row.get(TRUE_TRACK)),
        number(row.get(VERTICAL_RATE)),
        number(row.get(GEO_ALTITUDE)),
        text(row.get(SQUAWK)),
        category == null || !Double.isFinite(category) ? null : category.intValue());
  }

  private static String text(JsonNode node) {
    if (node == null || node.isNull() || node.isContainerNode()) {
      return null;
    }
    return node.asText();
  }

  private static Double number(JsonNode node) {
    if (node == null || node.isNull()) {
      return null;
    }
    if (node.isNumber()) {
      return node.asDouble();
    }
    if (node.isTextual()) {
      try {
        return Double.parseDouble(node.asText().trim());
      } catch (NumberFormatException ex) {
        return null;
      }
    }
    return null;
  }

  private static Long longNumber(JsonNode node) {
    Double value = number(node);
    return value == null || !Double.isFinite(value) ? null : value.longValue();
  }

  private static Boolean bool(JsonNode node) {
    if (node == null || node.isNull()) {
      return null;
    }
    if (node.isBoolean()) {
      return node.booleanValue();
    }
    if (node.isTextual()) {
      String value = node.asText().trim();
      if ("true".equalsIgnoreCase(value)) {
        return Boolean.TRUE;
      }
      if ("false".equalsIgnoreCase(value)) {
        return Boolean.FALSE;
      }
    }
    return null;
  }
}
