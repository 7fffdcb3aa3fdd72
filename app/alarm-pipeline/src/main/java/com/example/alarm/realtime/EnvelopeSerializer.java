/*
 * Where: Alarm pipeline realtime hub
 * What: Renders a BroadcastEnvelope as the JSON text frame sent to clients
 */
package com.example.alarm.realtime;

import com.example.alarm.model.BroadcastEnvelope;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class EnvelopeSerializer {

  private final ObjectMapper objectMapper;

  public EnvelopeSerializer(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public String serialize(BroadcastEnvelope envelope) {
    final Map<String, Object> frame = new LinkedHashMap<>();
    frame.put("eventType", envelope.eventType());
    frame.put("timestamp", envelope.timestamp() == null ? null : envelope.timestamp().toString());
    frame.put("payload", envelope.payload());
    try {
      return objectMapper.writeValueAsString(frame);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize envelope " + envelope.eventType(), ex);
    }
  }
}
