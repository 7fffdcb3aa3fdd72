/*
 * Where: Alarm pipeline incident lifecycle tests
 * What: Transition broadcasts, routing-to-dispatch handoff and routing failure handling
 */
package com.example.alarm.incident;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.alarm.device.SensorDirectory;
import com.example.alarm.dispatch.DeliveryDispatcher;
import com.example.alarm.metrics.PipelineMetrics;
import com.example.alarm.model.AlarmIncident;
import com.example.alarm.model.BroadcastEnvelope;
import com.example.alarm.model.IncidentState;
import com.example.alarm.model.IncidentTransition;
import com.example.alarm.model.NotificationChannel;
import com.example.alarm.model.NotificationTask;
import com.example.alarm.model.NotificationTier;
import com.example.alarm.model.Severity;
import com.example.alarm.model.SubscriptionScope;
import com.example.alarm.model.TransitionType;
import com.example.alarm.realtime.RealtimeBroadcastHub;
import com.example.alarm.routing.RoutingException;
import com.example.alarm.routing.SpatialNotificationRouter;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class IncidentFanOutPublisherTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-03-01T10:00:00Z");
  private static final SubscriptionScope HOUSE = SubscriptionScope.of("tenant-1", "house-1");

  @Mock private RealtimeBroadcastHub hub;
  @Mock private SensorDirectory sensorDirectory;
  @Mock private SpatialNotificationRouter router;
  @Mock private DeliveryDispatcher dispatcher;
  @Mock private PipelineMetrics metrics;

  private IncidentFanOutPublisher publisher;
  private AlarmIncident incident;

  @BeforeEach
  void setUp() {
    publisher = new IncidentFanOutPublisher(hub, sensorDirectory, router, dispatcher, metrics);
    incident = AlarmIncident.open(UUID.randomUUID(), "s-1", "gw-1", Severity.HIGH, FIXED_NOW);
  }

  @Test
  void transitionIsBroadcastToTheSensorHouse() {
    when(sensorDirectory.scopeOf("s-1")).thenReturn(HOUSE);

    publisher.transitioned(
        new IncidentTransition(TransitionType.TRIGGERED, incident, null, FIXED_NOW));

    final ArgumentCaptor<BroadcastEnvelope> envelope =
        ArgumentCaptor.forClass(BroadcastEnvelope.class);
    verify(hub).broadcast(envelope.capture());
    assertThat(envelope.getValue().eventType()).isEqualTo("incident.triggered");
    assertThat(envelope.getValue().scope()).isEqualTo(HOUSE);
    assertThat(envelope.getValue().payload())
        .containsEntry("incidentId", incident.id().toString())
        .containsEntry("severity", "high")
        .containsEntry("state", "ACTIVE");
    verify(dispatcher, never()).cancelEscalation(any());
  }

  @Test
  void resolutionCancelsPendingEscalations() {
    final AlarmIncident resolved = incident.resolve(FIXED_NOW.plusSeconds(60));

    publisher.transitioned(
        new IncidentTransition(
            TransitionType.RESOLVED, resolved, IncidentState.ACTIVE, resolved.updatedAt()));

    verify(dispatcher).cancelEscalation(incident.id());
  }

  @Test
  void onlyReachableTasksAreDispatched() {
    final NotificationTask push = task("u1", NotificationChannel.PUSH);
    final NotificationTask none = task("u2", NotificationChannel.NONE);
    when(router.route(incident, NotificationTier.INITIAL)).thenReturn(List.of(push, none));

    publisher.fanOutRequested(incident, NotificationTier.INITIAL);

    verify(dispatcher).dispatchAll(List.of(push));
  }

  @Test
  void routingFailureIsCountedAndNothingIsDispatched() {
    when(router.route(incident, NotificationTier.INITIAL))
        .thenThrow(new RoutingException("no placement"));

    publisher.fanOutRequested(incident, NotificationTier.INITIAL);

    verify(metrics).recordRoutingError();
    verify(dispatcher, never()).dispatchAll(any());
  }

  private NotificationTask task(String recipientId, NotificationChannel channel) {
    return new NotificationTask(
        UUID.randomUUID(),
        recipientId,
        incident.id(),
        channel,
        "addr",
        NotificationTier.INITIAL,
        "Fire alarm",
        0);
  }
}
