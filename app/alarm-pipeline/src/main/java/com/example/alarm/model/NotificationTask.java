/*
 * Where: Alarm pipeline domain model
 * What: One recipient delivery produced by the router for an incident
 * Why: The dispatcher owns the task until it records sent or failed
 */
package com.example.alarm.model;

import java.util.UUID;

public record NotificationTask(
    UUID taskId,
    String recipientId,
    UUID incidentId,
    NotificationChannel channel,
    String address,
    NotificationTier tier,
    String message,
    int attempt) {

  public NotificationTask withAttempt(int nextAttempt) {
    return new NotificationTask(
        taskId, recipientId, incidentId, channel, address, tier, message, nextAttempt);
  }

  public boolean isReachable() {
    return channel != NotificationChannel.NONE;
  }
}
