/*
 * Where: Alarm pipeline API response DTO
 * What: External view of one AlarmIncident
 */
package com.example.alarm.api.response;

import com.example.alarm.model.AlarmIncident;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.Locale;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record IncidentResponse(
    String incidentId,
    String sensorId,
    String gatewayId,
    String severity,
    String state,
    String triggeredAt,
    String updatedAt,
    String acknowledgedBy,
    String acknowledgedAt,
    String escalatedAt,
    String resolvedAt) {

  public static IncidentResponse from(AlarmIncident incident) {
    return new IncidentResponse(
        incident.id().toString(),
        incident.sensorId(),
        incident.gatewayId(),
        incident.severity().value(),
        incident.state().name().toLowerCase(Locale.ROOT),
        format(incident.triggeredAt()),
        format(incident.updatedAt()),
        incident.acknowledgedBy(),
        format(incident.acknowledgedAt()),
        format(incident.escalatedAt()),
        format(incident.resolvedAt()));
  }

  private static String format(Instant instant) {
    return instant == null ? null : instant.toString();
  }
}
