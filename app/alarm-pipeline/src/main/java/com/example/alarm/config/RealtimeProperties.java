/*
 * Where: Alarm pipeline configuration binding
 * What: Realtime hub queue depth, drain pool, send limits and WebSocket endpoint
 */
package com.example.alarm.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * @param sendTimeout longest a single frame may take to reach a client before the connection is
 *     dropped
 * @param sendBufferSizeLimit bytes a WebSocket session may buffer while a send is in progress
 */
@ConfigurationProperties(prefix = "alarm.realtime")
@Validated
public record RealtimeProperties(
    @Positive int queueDepth,
    @Positive int drainThreads,
    @NotNull Duration sendTimeout,
    @Positive int sendBufferSizeLimit,
    @NotBlank String path,
    List<String> allowedOrigins) {

  public List<String> allowedOrigins() {
    return allowedOrigins == null ? List.of() : allowedOrigins;
  }

  @AssertTrue(message = "alarm.realtime.send-timeout must be positive")
  public boolean isSendTimeoutPositive() {
    // null is reported by @NotNull
    return sendTimeout == null || (!sendTimeout.isZero() && !sendTimeout.isNegative());
  }
}
