/*
 * Where: Alarm pipeline debug API response DTO
 * What: What the pipeline did with one injected uplink message
 */
package com.example.alarm.api.response;

import com.example.alarm.ingest.IngestResult;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record IngestResponse(
    String eventKind, String deviceId, DeviceResponse device, IncidentResponse incident) {

  public static IngestResponse from(IngestResult result) {
    return new IngestResponse(
        result.event().eventKind().topicValue(),
        result.event().subjectId(),
        result.device() == null ? null : DeviceResponse.from(result.device()),
        result.incident() == null ? null : IncidentResponse.from(result.incident()));
  }
}
