/*
 * Where: Alarm pipeline debug API request DTO
 * What: A mock MQTT message: topic plus JSON body
 * Why: Lets operators drive the ingestion path without a broker
 */
package com.example.alarm.api.request;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "request DTO is read once by the controller and never shared")
public record UplinkDebugRequest(@NotBlank String topic, @NotNull JsonNode body) {}
