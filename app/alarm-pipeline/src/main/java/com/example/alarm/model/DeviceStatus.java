/*
 * Where: Alarm pipeline domain model
 * What: Liveness status of a gateway or sensor
 */
package com.example.alarm.model;

public enum DeviceStatus {
  ONLINE,
  OFFLINE,
  UNKNOWN
}
