/*
 * Where: Alarm pipeline domain model
 * What: Delivery channels; NONE marks a recipient without any reachable address
 */
package com.example.alarm.model;

public enum NotificationChannel {
  PUSH,
  SMS,
  EMAIL,
  NONE
}
