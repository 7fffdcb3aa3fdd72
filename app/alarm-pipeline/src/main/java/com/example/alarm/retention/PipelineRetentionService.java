/*
 * Where: Alarm pipeline retention
 * What: Evicts old resolved incidents from memory and deletes expired incident and audit rows
 * Why: Keeps memory and tables bounded while open incidents are never touched
 */
package com.example.alarm.retention;

import com.example.alarm.config.RetentionProperties;
import com.example.alarm.dispatch.NotificationLedger;
import com.example.alarm.incident.AlarmStateMachine;
import com.example.alarm.model.AlarmIncident;
import com.example.alarm.repository.AlarmIncidentRepository;
import com.example.alarm.repository.DeliveryAttemptRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class PipelineRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(PipelineRetentionService.class);

  private final AlarmStateMachine stateMachine;
  private final NotificationLedger ledger;
  private final AlarmIncidentRepository incidentRepository;
  private final DeliveryAttemptRepository deliveryAttemptRepository;
  private final RetentionProperties properties;
  private final Clock clock;

  public void cleanup() {
    final Instant now = Instant.now(clock);
    final Instant threshold = now.minus(properties.retentionPeriod());
    final long staleOpen =
        stateMachine.openIncidents().stream()
            .map(AlarmIncident::triggeredAt)
            .filter(triggeredAt -> triggeredAt.isBefore(threshold))
            .count();
    if (staleOpen > 0) {
      logger.error(
          "alarm retention found incidents open beyond the retention period count={} threshold={}",
          staleOpen,
          threshold);
    }
    final List<UUID> evicted = stateMachine.evictResolvedBefore(threshold);
    evicted.forEach(ledger::evict);
    final int deletedIncidents = incidentRepository.deleteResolvedBefore(threshold);
    final int deletedAttempts = deliveryAttemptRepository.deleteOlderThan(threshold);
    logger.info(
        "alarm retention cleanup evicted={} incidents={} deliveryAttempts={} threshold={}",
        evicted.size(),
        deletedIncidents,
        deletedAttempts,
        threshold);
  }
}
