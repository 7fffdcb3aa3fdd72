/*
 * Where: Alarm pipeline domain model
 * What: Where a sensor is installed: house, tenant and coordinates
 * Why: Routing needs the location; broadcasts need the tenant/house scope
 */
package com.example.alarm.model;

public record SensorPlacement(
    String sensorId, String gatewayId, String houseId, String tenantId, GeoPoint location) {

  public SubscriptionScope scope() {
    return SubscriptionScope.of(tenantId, houseId);
  }
}
