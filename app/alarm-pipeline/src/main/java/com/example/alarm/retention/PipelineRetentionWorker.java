/*
 * Where: Alarm pipeline retention
 * What: Triggers retention cleanup on a schedule
 */
package com.example.alarm.retention;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "alarm.retention.enabled", havingValue = "true")
public class PipelineRetentionWorker {

  private final PipelineRetentionService retentionService;

  @Scheduled(fixedDelayString = "${alarm.retention.cleanup-interval}")
  public void run() {
    retentionService.cleanup();
  }
}
