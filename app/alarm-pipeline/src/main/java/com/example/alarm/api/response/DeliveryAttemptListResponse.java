/*
 * Where: Alarm pipeline API response DTO
 * What: A page of audited delivery attempts
 */
package com.example.alarm.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeliveryAttemptListResponse(List<DeliveryAttemptResponse> attempts) {

  public DeliveryAttemptListResponse {
    attempts = attempts == null ? List.of() : List.copyOf(attempts);
  }
}
