/*
 * Where: Alarm pipeline domain model
 * What: Snapshot of one fire-alarm incident
 * Why: The state machine swaps immutable snapshots under the per-incident lock
 */
package com.example.alarm.model;

import java.time.Instant;
import java.util.UUID;

public record AlarmIncident(
    UUID id,
    String sensorId,
    String gatewayId,
    Severity severity,
    IncidentState state,
    Instant triggeredAt,
    Instant updatedAt,
    String acknowledgedBy,
    Instant acknowledgedAt,
    Instant escalatedAt,
    Instant resolvedAt) {

  public static AlarmIncident open(
      UUID id, String sensorId, String gatewayId, Severity severity, Instant now) {
    return new AlarmIncident(
        id, sensorId, gatewayId, severity, IncidentState.ACTIVE, now, now, null, null, null, null);
  }

  public boolean isOpen() {
    return !state.isTerminal();
  }

  public AlarmIncident withSeverity(Severity raised, Instant now) {
    return new AlarmIncident(
        id,
        sensorId,
        gatewayId,
        raised,
        state,
        triggeredAt,
        now,
        acknowledgedBy,
        acknowledgedAt,
        escalatedAt,
        resolvedAt);
  }

  public AlarmIncident acknowledge(String userId, Instant now) {
    return new AlarmIncident(
        id,
        sensorId,
        gatewayId,
        severity,
        IncidentState.ACKNOWLEDGED,
        triggeredAt,
        now,
        userId,
        now,
        escalatedAt,
        resolvedAt);
  }

  public AlarmIncident escalate(Instant now) {
    return new AlarmIncident(
        id,
        sensorId,
        gatewayId,
        severity.raised(),
        IncidentState.ESCALATED,
        triggeredAt,
        now,
        acknowledgedBy,
        acknowledgedAt,
        now,
        resolvedAt);
  }

  public AlarmIncident resolve(Instant now) {
    return new AlarmIncident(
        id,
        sensorId,
        gatewayId,
        severity,
        IncidentState.RESOLVED,
        triggeredAt,
        now,
        acknowledgedBy,
        acknowledgedAt,
        escalatedAt,
        now);
  }
}
