/*
 * Where: Alarm pipeline API request DTO
 * What: Registers or replaces a notification recipient
 */
package com.example.alarm.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RecipientRequest(
    @NotBlank String houseId,
    @NotBlank String role,
    String pushToken,
    String phoneNumber,
    String email,
    @NotNull Double latitude,
    @NotNull Double longitude) {}
