/*
 * Where: Alarm pipeline configuration binding
 * What: Notification radius policy
 * Why: Escalation widens the base radius by the multiplier
 */
package com.example.alarm.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "alarm.routing")
@Validated
public record RoutingProperties(
    @Positive double baseRadiusMeters, @DecimalMin("1.0") double escalationRadiusMultiplier) {}
