/*
 * Where: Alarm pipeline configuration binding
 * What: NATS connection settings
 * Why: The broker address differs per environment; tests run with nats.enabled=false
 */
package com.example.alarm.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "nats")
public record NatsProperties(
    boolean enabled, String url, Duration connectionTimeout, String connectionName) {}
