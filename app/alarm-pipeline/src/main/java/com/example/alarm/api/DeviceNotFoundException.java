/*
 * Where: Alarm pipeline API
 * What: Raised when a device lookup finds no tracked gateway or sensor
 */
package com.example.alarm.api;

public class DeviceNotFoundException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public DeviceNotFoundException(String deviceId) {
    super("device not found: " + deviceId);
  }
}
