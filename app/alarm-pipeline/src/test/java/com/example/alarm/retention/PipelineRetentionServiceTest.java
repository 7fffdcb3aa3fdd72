package com.example.alarm.retention;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.alarm.config.RetentionProperties;
import com.example.alarm.dispatch.NotificationLedger;
import com.example.alarm.incident.AlarmStateMachine;
import com.example.alarm.repository.AlarmIncidentRepository;
import com.example.alarm.repository.DeliveryAttemptRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PipelineRetentionServiceTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-03-31T00:00:00Z");
  private static final Instant THRESHOLD = Instant.parse("2026-03-01T00:00:00Z");

  @Mock private AlarmStateMachine stateMachine;
  @Mock private NotificationLedger ledger;
  @Mock private AlarmIncidentRepository incidentRepository;
  @Mock private DeliveryAttemptRepository deliveryAttemptRepository;

  @Test
  void cleanupUsesRetentionThresholdForEveryStore() {
    final UUID evicted = UUID.randomUUID();
    final PipelineRetentionService service =
        new PipelineRetentionService(
            stateMachine,
            ledger,
            incidentRepository,
            deliveryAttemptRepository,
            new RetentionProperties(true, Duration.ofDays(30), Duration.ofHours(1)),
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
    when(stateMachine.openIncidents()).thenReturn(List.of());
    when(stateMachine.evictResolvedBefore(THRESHOLD)).thenReturn(List.of(evicted));
    when(incidentRepository.deleteResolvedBefore(THRESHOLD)).thenReturn(1);
    when(deliveryAttemptRepository.deleteOlderThan(THRESHOLD)).thenReturn(4);

    service.cleanup();

    verify(ledger).evict(evicted);
    verify(incidentRepository).deleteResolvedBefore(THRESHOLD);
    verify(deliveryAttemptRepository).deleteOlderThan(THRESHOLD);
  }
}
