/*
 * Where: Alarm pipeline domain model
 * What: Terminal outcome of a notification task
 */
package com.example.alarm.model;

public enum DeliveryStatus {
  SENT,
  FAILED,
  CANCELLED
}
