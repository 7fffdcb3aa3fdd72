/*
 * Where: Alarm pipeline domain model
 * What: One row of the delivery audit trail, keyed by (recipientId, incidentId)
 * Why: Every attempt is kept for compliance review, including retries and NoChannel entries
 */
package com.example.alarm.model;

import java.time.Instant;
import java.util.UUID;

/**
 * {@code terminal} is true on the attempt that decided the task outcome (sent, permanent
 * failure, retry exhaustion, NoChannel or cancellation).
 */
public record DeliveryAttemptRecord(
    UUID attemptId,
    String recipientId,
    UUID incidentId,
    UUID taskId,
    NotificationChannel channel,
    NotificationTier tier,
    int attempt,
    AttemptResult result,
    boolean terminal,
    String error,
    Instant attemptedAt) {

  public static DeliveryAttemptRecord of(
      NotificationTask task,
      AttemptResult result,
      boolean terminal,
      String error,
      Instant attemptedAt) {
    return new DeliveryAttemptRecord(
        UUID.randomUUID(),
        task.recipientId(),
        task.incidentId(),
        task.taskId(),
        task.channel(),
        task.tier(),
        task.attempt(),
        result,
        terminal,
        error,
        attemptedAt);
  }
}
