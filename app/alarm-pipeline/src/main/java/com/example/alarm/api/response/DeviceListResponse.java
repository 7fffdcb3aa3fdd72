/*
 * Where: Alarm pipeline API response DTO
 * What: Every tracked device ordered by id
 */
package com.example.alarm.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeviceListResponse(List<DeviceResponse> devices) {

  public DeviceListResponse {
    devices = devices == null ? List.of() : List.copyOf(devices);
  }
}
