/*
 * Where: Alarm pipeline configuration binding tests
 * What: Duration and enum values of the alarm.* prefixes bind from their string forms
 */
package com.example.alarm.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.alarm.model.Severity;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class AlarmPropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withUserConfiguration(TestConfiguration.class)
          .withPropertyValues(
              "alarm.incident.ack-timeout=2m",
              "alarm.incident.escalation-check-interval=10s",
              "alarm.incident.default-severity=HIGH",
              "alarm.incident.lock-stripes=64",
              "alarm.retention.enabled=true",
              "alarm.retention.retention-period=30d",
              "alarm.retention.cleanup-interval=1h");

  @Test
  void contextStartsAndBindsDurationFields() {
    contextRunner.run(
        context -> {
          assertThat(context).hasNotFailed();
          final IncidentProperties incident = context.getBean(IncidentProperties.class);
          final RetentionProperties retention = context.getBean(RetentionProperties.class);

          assertThat(incident.ackTimeout()).isEqualTo(Duration.ofMinutes(2));
          assertThat(incident.escalationCheckInterval()).isEqualTo(Duration.ofSeconds(10));
          assertThat(incident.defaultSeverity()).isEqualTo(Severity.HIGH);
          assertThat(retention.retentionPeriod()).isEqualTo(Duration.ofDays(30));
          assertThat(retention.cleanupInterval()).isEqualTo(Duration.ofHours(1));
        });
  }

  @Configuration
  @EnableConfigurationProperties({IncidentProperties.class, RetentionProperties.class})
  static class TestConfiguration {}
}
