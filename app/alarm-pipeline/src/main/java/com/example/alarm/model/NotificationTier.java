/*
 * Where: Alarm pipeline domain model
 * What: Fan-out pass a notification task belongs to
 * Why: Resolving an incident cancels only escalation-tier tasks that have not started
 */
package com.example.alarm.model;

public enum NotificationTier {
  INITIAL,
  ESCALATION
}
