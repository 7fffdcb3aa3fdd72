/*
 * Where: Alarm pipeline configuration binding
 * What: Worker pool size and retry/backoff policy of the delivery dispatcher
 */
package com.example.alarm.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "alarm.dispatch")
@Validated
public record DispatchProperties(
    @Positive int workers,
    @Positive int maxAttempts,
    @NotNull Duration backoffBase,
    @NotNull Duration backoffMax,
    double backoffExponentBase,
    double backoffJitterMin,
    double backoffJitterMax,
    @Positive int errorMessageMaxLength) {

  @AssertTrue(message = "alarm.dispatch.backoff-jitter-min must not exceed backoff-jitter-max")
  public boolean isJitterRangeValid() {
    return backoffJitterMin > 0.0d && backoffJitterMin <= backoffJitterMax;
  }
}
