/*
 * Where: Alarm pipeline API request DTO
 * What: Where a sensor is installed
 */
package com.example.alarm.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

/** Latitude and longitude are both present or both absent. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SensorPlacementRequest(
    @NotBlank String gatewayId,
    @NotBlank String houseId,
    @NotBlank String tenantId,
    Double latitude,
    Double longitude) {}
