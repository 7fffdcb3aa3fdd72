/*
 * Where: Alarm pipeline domain model
 * What: Result of dispatching one notification task
 */
package com.example.alarm.model;

import java.time.Instant;

public record DeliveryOutcome(
    NotificationTask task,
    DeliveryStatus status,
    int attempts,
    String lastError,
    Instant completedAt) {

  public static DeliveryOutcome sent(NotificationTask task, Instant completedAt) {
    return new DeliveryOutcome(task, DeliveryStatus.SENT, task.attempt(), null, completedAt);
  }

  public static DeliveryOutcome failed(NotificationTask task, String error, Instant completedAt) {
    return new DeliveryOutcome(task, DeliveryStatus.FAILED, task.attempt(), error, completedAt);
  }

  public static DeliveryOutcome cancelled(NotificationTask task, Instant completedAt) {
    return new DeliveryOutcome(task, DeliveryStatus.CANCELLED, task.attempt(), null, completedAt);
  }
}
