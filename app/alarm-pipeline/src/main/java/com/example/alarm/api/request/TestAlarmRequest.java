/*
 * Where: Alarm pipeline debug API request DTO
 * What: Triggers a test fire alarm for a sensor
 */
package com.example.alarm.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

/** {@code severity} is optional; the configured default applies when it is absent. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TestAlarmRequest(
    @NotBlank String sensorId, @NotBlank String gatewayId, String severity) {}
