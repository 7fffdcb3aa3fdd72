/*
 * Where: Alarm pipeline configuration binding
 * What: Retention of resolved incidents and delivery audit rows
 */
package com.example.alarm.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "alarm.retention")
public record RetentionProperties(
    boolean enabled, Duration retentionPeriod, Duration cleanupInterval) {}
