/*
 * Where: Alarm pipeline delivery
 * What: Appends delivery attempts to the audit table and answers failure queries
 * Why: An unavailable store must not stop notifications from going out
 */
package com.example.alarm.dispatch;

import com.example.alarm.metrics.PipelineMetrics;
import com.example.alarm.model.DeliveryAttemptRecord;
import com.example.alarm.repository.DeliveryAttemptRepository;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DeliveryAuditTrail {

  private static final Logger logger = LoggerFactory.getLogger(DeliveryAuditTrail.class);
  private static final String STORE = "delivery_attempts";

  private final DeliveryAttemptRepository repository;
  private final PipelineMetrics metrics;

  public void record(DeliveryAttemptRecord attempt) {
    try {
      repository.insert(attempt);
    } catch (DataAccessException ex) {
      logger.warn(
          "failed to append delivery audit recipientId={} incidentId={} attempt={} result={}",
          attempt.recipientId(),
          attempt.incidentId(),
          attempt.attempt(),
          attempt.result(),
          ex);
      metrics.recordStoreError(STORE);
    }
  }

  public List<DeliveryAttemptRecord> findFailures(int limit) {
    return repository.findFailures(limit);
  }

  public List<DeliveryAttemptRecord> findByRecipientAndIncident(
      String recipientId, UUID incidentId) {
    return repository.findByRecipientAndIncident(recipientId, incidentId);
  }
}
