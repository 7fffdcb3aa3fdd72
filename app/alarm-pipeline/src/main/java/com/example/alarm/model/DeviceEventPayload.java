/*
 * Where: Alarm pipeline domain model
 * What: Kind-specific fields decoded from an uplink body
 * Why: One immutable carrier keeps DeviceEvent flat; absent fields are null
 */
package com.example.alarm.model;

public record DeviceEventPayload(
    String sensorId,
    Double batteryVoltage,
    Double signalStrength,
    String firmwareVersion,
    String hardwareVersion,
    Severity severity,
    Boolean selfTestPassed,
    String houseId,
    String tenantId,
    GeoPoint location) {

  public static DeviceEventPayload empty() {
    return new DeviceEventPayload(null, null, null, null, null, null, null, null, null, null);
  }

  public boolean hasSensor() {
    return sensorId != null && !sensorId.isBlank();
  }
}
