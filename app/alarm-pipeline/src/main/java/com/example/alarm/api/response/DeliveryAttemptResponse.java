/*
 * Where: Alarm pipeline API response DTO
 * What: One audited delivery attempt
 */
package com.example.alarm.api.response;

import com.example.alarm.model.DeliveryAttemptRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Locale;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeliveryAttemptResponse(
    String attemptId,
    String recipientId,
    String incidentId,
    String taskId,
    String channel,
    String tier,
    int attempt,
    String result,
    boolean terminal,
    String error,
    String attemptedAt) {

  public static DeliveryAttemptResponse from(DeliveryAttemptRecord record) {
    return new DeliveryAttemptResponse(
        record.attemptId().toString(),
        record.recipientId(),
        record.incidentId().toString(),
        record.taskId().toString(),
        record.channel().name().toLowerCase(Locale.ROOT),
        record.tier().name().toLowerCase(Locale.ROOT),
        record.attempt(),
        record.result().name().toLowerCase(Locale.ROOT),
        record.terminal(),
        record.error(),
        record.attemptedAt().toString());
  }
}
