/*
 * Where: Alarm pipeline domain model
 * What: Last-known state of one gateway or sensor
 * Why: The tracker replaces the snapshot under the per-id lock, so readers never see a torn record
 */
package com.example.alarm.model;

import java.time.Duration;
import java.time.Instant;

public record DeviceState(
    String id,
    DeviceKind kind,
    String parentGatewayId,
    DeviceStatus status,
    Double batteryLevel,
    Double signalStrength,
    String firmwareVersion,
    Instant lastHeartbeatAt,
    Instant updatedAt) {

  public static DeviceState register(
      String id, DeviceKind kind, String parentGatewayId, Instant now) {
    return new DeviceState(
        id, kind, parentGatewayId, DeviceStatus.UNKNOWN, null, null, null, null, now);
  }

  /** Marks the device as heard from: online with a refreshed heartbeat. */
  public DeviceState heardAt(Instant now) {
    return new DeviceState(
        id,
        kind,
        parentGatewayId,
        DeviceStatus.ONLINE,
        batteryLevel,
        signalStrength,
        firmwareVersion,
        now,
        now);
  }

  public DeviceState withTelemetry(Double battery, Double signal, Instant now) {
    return new DeviceState(
        id,
        kind,
        parentGatewayId,
        status,
        battery == null ? batteryLevel : battery,
        signal == null ? signalStrength : signal,
        firmwareVersion,
        lastHeartbeatAt,
        now);
  }

  public DeviceState withFirmware(String firmware, Instant now) {
    return new DeviceState(
        id,
        kind,
        parentGatewayId,
        status,
        batteryLevel,
        signalStrength,
        firmware == null ? firmwareVersion : firmware,
        lastHeartbeatAt,
        now);
  }

  public DeviceState withParent(String gatewayId, Instant now) {
    return new DeviceState(
        id,
        kind,
        gatewayId,
        status,
        batteryLevel,
        signalStrength,
        firmwareVersion,
        lastHeartbeatAt,
        now);
  }

  public DeviceState offline(Instant now) {
    return new DeviceState(
        id,
        kind,
        parentGatewayId,
        DeviceStatus.OFFLINE,
        batteryLevel,
        signalStrength,
        firmwareVersion,
        lastHeartbeatAt,
        now);
  }

  public boolean isStale(Instant now, Duration window) {
    return status == DeviceStatus.ONLINE
        && lastHeartbeatAt != null
        && lastHeartbeatAt.plus(window).isBefore(now);
  }
}
