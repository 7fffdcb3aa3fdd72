/*
 * Where: Alarm pipeline incident lifecycle
 * What: Broadcasts incident transitions and hands fan-out requests to routing and delivery
 * Why: Routing completes before any task of the incident is dispatched; dispatch is parallel
 */
package com.example.alarm.incident;

import com.example.alarm.device.SensorDirectory;
import com.example.alarm.dispatch.DeliveryDispatcher;
import com.example.alarm.metrics.PipelineMetrics;
import com.example.alarm.model.AlarmIncident;
import com.example.alarm.model.BroadcastEnvelope;
import com.example.alarm.model.IncidentTransition;
import com.example.alarm.model.NotificationTask;
import com.example.alarm.model.NotificationTier;
import com.example.alarm.model.TransitionType;
import com.example.alarm.realtime.RealtimeBroadcastHub;
import com.example.alarm.routing.RoutingException;
import com.example.alarm.routing.SpatialNotificationRouter;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class IncidentFanOutPublisher implements IncidentEventPublisher {

  private static final Logger logger = LoggerFactory.getLogger(IncidentFanOutPublisher.class);

  private final RealtimeBroadcastHub hub;
  private final SensorDirectory sensorDirectory;
  private final SpatialNotificationRouter router;
  private final DeliveryDispatcher dispatcher;
  private final PipelineMetrics metrics;

  @Override
  public void transitioned(IncidentTransition transition) {
    final AlarmIncident incident = transition.incident();
    hub.broadcast(
        new BroadcastEnvelope(
            transition.type().eventType(),
            sensorDirectory.scopeOf(incident.sensorId()),
            payload(transition),
            transition.occurredAt()));
    if (transition.type() == TransitionType.RESOLVED) {
      dispatcher.cancelEscalation(incident.id());
    }
  }

  @Override
  public void fanOutRequested(AlarmIncident incident, NotificationTier tier) {
    final List<NotificationTask> tasks;
    try {
      tasks = router.route(incident, tier);
    } catch (RoutingException | DataAccessException ex) {
      // the incident stays open and visible on dashboards; only the notification pass is lost
      logger.warn("notification routing failed incidentId={} tier={}", incident.id(), tier, ex);
      metrics.recordRoutingError();
      return;
    }
    final List<NotificationTask> reachable =
        tasks.stream().filter(NotificationTask::isReachable).toList();
    dispatcher.dispatchAll(reachable);
  }

  private Map<String, Object> payload(IncidentTransition transition) {
    final AlarmIncident incident = transition.incident();
    final Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("incidentId", incident.id().toString());
    payload.put("sensorId", incident.sensorId());
    payload.put("gatewayId", incident.gatewayId());
    payload.put("severity", incident.severity().value());
    payload.put("state", incident.state().name());
    payload.put(
        "previousState",
        transition.previousState() == null ? null : transition.previousState().name());
    payload.put("triggeredAt", text(incident.triggeredAt()));
    payload.put("acknowledgedBy", incident.acknowledgedBy());
    payload.put("resolvedAt", text(incident.resolvedAt()));
    return payload;
  }

  private static String text(Instant instant) {
    return instant == null ? null : instant.toString();
  }
}
