package com.example.alarm.model;

public enum DeviceKind {
  GATEWAY,
  SENSOR
}
