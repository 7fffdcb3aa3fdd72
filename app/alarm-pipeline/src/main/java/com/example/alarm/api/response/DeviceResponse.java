/*
 * Where: Alarm pipeline API response DTO
 * What: External view of one tracked gateway or sensor
 */
package com.example.alarm.api.response;

import com.example.alarm.model.DeviceState;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Locale;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeviceResponse(
    String deviceId,
    String kind,
    String parentGatewayId,
    String status,
    Double batteryLevel,
    Double signalStrength,
    String firmwareVersion,
    String lastHeartbeatAt,
    String updatedAt) {

  public static DeviceResponse from(DeviceState state) {
    return new DeviceResponse(
        state.id(),
        state.kind().name().toLowerCase(Locale.ROOT),
        state.parentGatewayId(),
        state.status().name().toLowerCase(Locale.ROOT),
        state.batteryLevel(),
        state.signalStrength(),
        state.firmwareVersion(),
        state.lastHeartbeatAt() == null ? null : state.lastHeartbeatAt().toString(),
        state.updatedAt() == null ? null : state.updatedAt().toString());
  }
}
