/*
 * Where: Alarm pipeline configuration binding
 * What: Heartbeat staleness window, sweep cadence and low-battery threshold of the device tracker
 */
package com.example.alarm.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "alarm.device")
@Validated
public record DeviceTrackerProperties(
    @NotNull Duration stalenessWindow,
    @NotNull Duration sweepInterval,
    @Positive double lowBatteryVoltage,
    @Positive int lockStripes) {

  @AssertTrue(message = "alarm.device.staleness-window must be positive")
  public boolean isStalenessWindowPositive() {
    return stalenessWindow != null && !stalenessWindow.isZero() && !stalenessWindow.isNegative();
  }
}
