/*
 * Where: Alarm pipeline API response DTO
 * What: Open incidents, oldest trigger first
 */
package com.example.alarm.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record IncidentListResponse(List<IncidentResponse> incidents) {

  public IncidentListResponse {
    incidents = incidents == null ? List.of() : List.copyOf(incidents);
  }
}
