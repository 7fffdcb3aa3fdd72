/*
 * Where: Alarm pipeline configuration binding
 * What: Acknowledgement timeout before escalation and incident defaults
 */
package com.example.alarm.config;

import com.example.alarm.model.Severity;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "alarm.incident")
@Validated
public record IncidentProperties(
    @NotNull Duration ackTimeout,
    @NotNull Duration escalationCheckInterval,
    @NotNull Severity defaultSeverity,
    @Positive int lockStripes) {

  @AssertTrue(message = "alarm.incident.ack-timeout must be positive")
  public boolean isAckTimeoutPositive() {
    return ackTimeout != null && !ackTimeout.isZero() && !ackTimeout.isNegative();
  }
}
