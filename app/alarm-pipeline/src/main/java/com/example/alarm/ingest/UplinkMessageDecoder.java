/*
 * Where: Alarm pipeline ingest
 * What: Parses uplink/{gatewayId}/{messageKind} topics and JSON bodies into DeviceEvent
 * Why: Downstream components only ever see validated, typed events
 */
package com.example.alarm.ingest;

import com.example.alarm.model.DeviceEvent;
import com.example.alarm.model.DeviceEventPayload;
import com.example.alarm.model.EventKind;
import com.example.alarm.model.GeoPoint;
import com.example.alarm.model.Severity;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.Instant;
import org.springframework.stereotype.Component;

/**
 * Stateless decoder for gateway uplink messages.
 *
 * <p>Numeric fields accept JSON numbers or numeric strings. Anything else, including NaN and
 * infinities, is rejected as {@link DecodeErrorKind#MALFORMED_PAYLOAD}; values are never
 * coerced to zero. A JSON {@code null} counts as absent.
 */
@Component
public class UplinkMessageDecoder {

  static final String TOPIC_ROOT = "uplink";
  private static final String TOPIC_SEPARATOR = "/";

  private final ObjectMapper objectMapper;

  public UplinkMessageDecoder(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public DeviceEvent decode(String topic, byte[] body, Instant receivedAt) {
    final String[] levels = splitTopic(topic);
    final String gatewayId = levels[1];
    final EventKind kind;
    try {
      kind = EventKind.fromTopicValue(levels[2]);
    } catch (IllegalArgumentException ex) {
      throw new UplinkDecodeException(DecodeErrorKind.UNKNOWN_KIND, topic, ex.getMessage(), ex);
    }
    final JsonNode root = parseBody(topic, body);
    final FieldReader fields = new FieldReader(topic, root);
    final DeviceEventPayload payload =
        switch (kind) {
          case POWER_ON -> new DeviceEventPayload(
              fields.optionalText("sensorId"),
              fields.optionalNumber("batteryVoltage"),
              fields.optionalNumber("signalStrength"),
              fields.requiredText("firmwareVersion"),
              fields.optionalText("hardwareVersion"),
              null,
              null,
              null,
              null,
              null);
          case HEARTBEAT -> new DeviceEventPayload(
              fields.optionalText("sensorId"),
              fields.requiredNumber("batteryVoltage"),
              fields.requiredNumber("signalStrength"),
              null,
              null,
              null,
              null,
              null,
              null,
              null);
          case SMOKE_ALARM -> new DeviceEventPayload(
              fields.requiredText("sensorId"),
              null,
              null,
              null,
              null,
              fields.optionalSeverity("severity"),
              null,
              null,
              null,
              null);
          case REGISTRATION -> new DeviceEventPayload(
              fields.requiredText("sensorId"),
              null,
              null,
              null,
              null,
              null,
              null,
              fields.optionalText("houseId"),
              fields.optionalText("tenantId"),
              fields.optionalLocation("latitude", "longitude"));
          case DELETION_ACK -> new DeviceEventPayload(
              fields.requiredText("sensorId"),
              null,
              null,
              null,
              null,
              null,
              null,
              null,
              null,
              null);
          case SELF_TEST -> new DeviceEventPayload(
              fields.requiredText("sensorId"),
              null,
              null,
              null,
              null,
              null,
              fields.optionalBoolean("passed"),
              null,
              null,
              null);
          case LOW_BATTERY -> new DeviceEventPayload(
              fields.optionalText("sensorId"),
              fields.requiredNumber("batteryVoltage"),
              null,
              null,
              null,
              null,
              null,
              null,
              null,
              null);
        };
    return new DeviceEvent(gatewayId, kind, payload, receivedAt);
  }

  private String[] splitTopic(String topic) {
    if (topic == null) {
      throw new UplinkDecodeException(DecodeErrorKind.MALFORMED_TOPIC, null, "topic is missing");
    }
    final String[] levels = topic.split(TOPIC_SEPARATOR, -1);
    if (levels.length != 3
        || !TOPIC_ROOT.equals(levels[0])
        || levels[1].isBlank()
        || levels[2].isBlank()) {
      throw new UplinkDecodeException(
          DecodeErrorKind.MALFORMED_TOPIC,
          topic,
          "topic must be uplink/{gatewayId}/{messageKind}: " + topic);
    }
    return levels;
  }

  private JsonNode parseBody(String topic, byte[] body) {
    if (body == null || body.length == 0) {
      throw new UplinkDecodeException(DecodeErrorKind.MALFORMED_PAYLOAD, topic, "body is empty");
    }
    final JsonNode root;
    try {
      root = objectMapper.readTree(body);
    } catch (IOException ex) {
      throw new UplinkDecodeException(
          DecodeErrorKind.MALFORMED_PAYLOAD, topic, "body is not valid JSON", ex);
    }
    if (root == null || !root.isObject()) {
      throw new UplinkDecodeException(
          DecodeErrorKind.MALFORMED_PAYLOAD, topic, "body must be a JSON object");
    }
    return root;
  }

  /** Typed accessors over one message body; every failure names the offending field. */
  private static final class FieldReader {

    private final String topic;
    private final JsonNode root;

    private FieldReader(String topic, JsonNode root) {
      this.topic = topic;
      this.root = root;
    }

    String requiredText(String field) {
      final String value = optionalText(field);
      if (value == null) {
        throw malformed(field + " is required");
      }
      return value;
    }

    String optionalText(String field) {
      final JsonNode node = present(field);
      if (node == null) {
        return null;
      }
      if (!node.isTextual()) {
        throw malformed(field + " must be a string");
      }
      final String value = node.textValue().trim();
      return value.isEmpty() ? null : value;
    }

    double requiredNumber(String field) {
      final Double value = optionalNumber(field);
      if (value == null) {
        throw malformed(field + " is required");
      }
      return value;
    }

    Double optionalNumber(String field) {
      final JsonNode node = present(field);
      if (node == null) {
        return null;
      }
      final double value;
      if (node.isNumber()) {
        value = node.doubleValue();
      } else if (node.isTextual()) {
        try {
          value = new BigDecimal(node.textValue().trim()).doubleValue();
        } catch (NumberFormatException ex) {
          throw malformed(field + " must be numeric");
        }
      } else {
        throw malformed(field + " must be numeric");
      }
      if (!Double.isFinite(value)) {
        throw malformed(field + " must be finite");
      }
      return value;
    }

    Boolean optionalBoolean(String field) {
      final JsonNode node = present(field);
      if (node == null) {
        return null;
      }
      if (node.isBoolean()) {
        return node.booleanValue();
      }
      if (node.isTextual()) {
        final String value = node.textValue().trim();
        if ("true".equalsIgnoreCase(value)) {
          return Boolean.TRUE;
        }
        if ("false".equalsIgnoreCase(value)) {
          return Boolean.FALSE;
        }
      }
      throw malformed(field + " must be a boolean");
    }

    Severity optionalSeverity(String field) {
      final String value = optionalText(field);
      if (value == null) {
        return null;
      }
      try {
        return Severity.fromValue(value);
      } catch (IllegalArgumentException ex) {
        throw malformed(ex.getMessage());
      }
    }

    GeoPoint optionalLocation(String latitudeField, String longitudeField) {
      final Double latitude = optionalNumber(latitudeField);
      final Double longitude = optionalNumber(longitudeField);
      if (latitude == null && longitude == null) {
        return null;
      }
      if (latitude == null || longitude == null) {
        throw malformed(latitudeField + " and " + longitudeField + " must be given together");
      }
      try {
        return new GeoPoint(latitude, longitude);
      } catch (IllegalArgumentException ex) {
        throw malformed(ex.getMessage());
      }
    }

    private JsonNode present(String field) {
      final JsonNode node = root.get(field);
      return node == null || node.isNull() ? null : node;
    }

    private UplinkDecodeException malformed(String message) {
      return new UplinkDecodeException(DecodeErrorKind.MALFORMED_PAYLOAD, topic, message);
    }
  }
}
