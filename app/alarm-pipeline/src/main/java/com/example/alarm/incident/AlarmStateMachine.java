/*
 * Where: Alarm pipeline incident lifecycle
 * What: Owns every AlarmIncident and applies trigger/acknowledge/escalate/resolve transitions
 * Why: One open incident per sensor; transitions for one incident are strictly serialized
 */
package com.example.alarm.incident;

import com.example.alarm.config.IncidentProperties;
import com.example.alarm.metrics.PipelineMetrics;
import com.example.alarm.model.AlarmIncident;
import com.example.alarm.model.IncidentState;
import com.example.alarm.model.IncidentTransition;
import com.example.alarm.model.NotificationTier;
import com.example.alarm.model.Severity;
import com.example.alarm.model.TransitionType;
import com.example.alarm.repository.AlarmIncidentRepository;
import com.example.common.concurrent.KeyedLocks;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Incident lifecycle: {@code active -> acknowledged -> resolved} or {@code active -> escalated ->
 * resolved}.
 *
 * <p>Two lock families are used and always taken in the same order: the sensor lock guards the
 * sensor-to-open-incident index (trigger and resolve), the incident lock guards one incident
 * record. Notification fan-out runs after both locks are released.
 */
@Component
public class AlarmStateMachine {

  private static final Logger logger = LoggerFactory.getLogger(AlarmStateMachine.class);
  private static final String STORE = "alarm_incidents";

  private final ConcurrentMap<UUID, AlarmIncident> incidents = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, UUID> openBySensor = new ConcurrentHashMap<>();
  private final KeyedLocks sensorLocks;
  private final KeyedLocks incidentLocks;
  private final Duration ackTimeout;
  private final Severity defaultSeverity;
  private final AlarmIncidentRepository repository;
  private final IncidentEventPublisher publisher;
  private final PipelineMetrics metrics;
  private final Clock clock;

  public AlarmStateMachine(
      IncidentProperties properties,
      AlarmIncidentRepository repository,
      IncidentEventPublisher publisher,
      PipelineMetrics metrics,
      Clock clock) {
    this.sensorLocks = new KeyedLocks(properties.lockStripes());
    this.incidentLocks = new KeyedLocks(properties.lockStripes());
    this.ackTimeout = properties.ackTimeout();
    this.defaultSeverity = properties.defaultSeverity();
    this.repository = repository;
    this.publisher = publisher;
    this.metrics = metrics;
    this.clock = clock;
  }

  /**
   * Opens an incident for the sensor, or coalesces into the sensor's open incident. Coalescing
   * raises severity only when the new value is strictly higher and never creates a second record.
   *
   * @param severity reported severity; null means the configured default
   */
  public AlarmIncident trigger(String sensorId, String gatewayId, Severity severity) {
    final Severity reported = severity == null ? defaultSeverity : severity;
    final TriggerResult result =
        sensorLocks.withLock(
            sensorId,
            () -> {
              final UUID openId = openBySensor.get(sensorId);
              if (openId != null) {
                final Optional<AlarmIncident> coalesced =
                    incidentLocks.withLock(openId, () -> coalesce(openId, reported));
                if (coalesced.isPresent()) {
                  return new TriggerResult(coalesced.get(), false);
                }
                openBySensor.remove(sensorId, openId);
              }
              final AlarmIncident created =
                  AlarmIncident.open(
                      UUID.randomUUID(), sensorId, gatewayId, reported, clock.instant());
              incidentLocks.withLock(
                  created.id(),
                  () -> {
                    incidents.put(created.id(), created);
                    openBySensor.put(sensorId, created.id());
                    persist(created);
                    emit(TransitionType.TRIGGERED, created, null);
                  });
              return new TriggerResult(created, true);
            });
    if (result.created()) {
      logger.info(
          "incident triggered incidentId={} sensorId={} gatewayId={} severity={}",
          result.incident().id(),
          sensorId,
          gatewayId,
          reported.value());
      publisher.fanOutRequested(result.incident(), NotificationTier.INITIAL);
    }
    return result.incident();
  }

  public AlarmIncident acknowledge(UUID incidentId, String userId) {
    return incidentLocks.withLock(
        incidentId,
        () -> {
          final AlarmIncident current = requireLive(incidentId);
          if (current.state() != IncidentState.ACTIVE) {
            throw new InvalidTransitionException(incidentId, current.state(), "acknowledge");
          }
          final AlarmIncident next = current.acknowledge(userId, clock.instant());
          store(next);
          emit(TransitionType.ACKNOWLEDGED, next, current.state());
          logger.info("incident acknowledged incidentId={} userId={}", incidentId, userId);
          return next;
        });
  }

  /** Escalates an active incident: severity goes up one tier and a wider fan-out follows. */
  public AlarmIncident escalate(UUID incidentId) {
    final AlarmIncident escalated =
        incidentLocks.withLock(
            incidentId,
            () -> {
              final AlarmIncident current = requireLive(incidentId);
              if (current.state() != IncidentState.ACTIVE) {
                throw new InvalidTransitionException(incidentId, current.state(), "escalate");
              }
              return applyEscalation(current);
            });
    publisher.fanOutRequested(escalated, NotificationTier.ESCALATION);
    return escalated;
  }

  /**
   * Escalates every active incident left unacknowledged for longer than the acknowledgement
   * timeout.
   *
   * @return incidents escalated by this pass
   */
  public List<AlarmIncident> escalateOverdue() {
    final Instant now = clock.instant();
    final List<AlarmIncident> escalated = new ArrayList<>();
    for (AlarmIncident candidate : incidents.values()) {
      if (!isOverdue(candidate, now)) {
        continue;
      }
      final Optional<AlarmIncident> result =
          incidentLocks.withLock(
              candidate.id(),
              () -> {
                // acknowledged or resolved since the unlocked check
                final AlarmIncident current = incidents.get(candidate.id());
                if (current == null || !isOverdue(current, now)) {
                  return Optional.<AlarmIncident>empty();
                }
                return Optional.of(applyEscalation(current));
              });
      result.ifPresent(
          incident -> {
            escalated.add(incident);
            publisher.fanOutRequested(incident, NotificationTier.ESCALATION);
          });
    }
    if (!escalated.isEmpty()) {
      logger.info("acknowledgement timeout escalated incidents count={}", escalated.size());
    }
    return escalated;
  }

  /**
   * Resolves the incident from any non-terminal state. Resolving a resolved incident returns it
   * unchanged.
   */
  public AlarmIncident resolve(UUID incidentId) {
    final AlarmIncident snapshot =
        find(incidentId).orElseThrow(() -> new IncidentNotFoundException(incidentId));
    if (snapshot.state() == IncidentState.RESOLVED && !incidents.containsKey(incidentId)) {
      return snapshot;
    }
    return sensorLocks.withLock(
        snapshot.sensorId(),
        () ->
            incidentLocks.withLock(
                incidentId,
                () -> {
                  final AlarmIncident current = requireLive(incidentId);
                  if (current.state() == IncidentState.RESOLVED) {
                    return current;
                  }
                  final AlarmIncident next = current.resolve(clock.instant());
                  store(next);
                  openBySensor.remove(next.sensorId(), incidentId);
                  emit(TransitionType.RESOLVED, next, current.state());
                  logger.info(
                      "incident resolved incidentId={} previousState={}",
                      incidentId,
                      current.state());
                  return next;
                }));
  }

  /** Looks up an incident in memory, falling back to the store for evicted ones. */
  public Optional<AlarmIncident> find(UUID incidentId) {
    final AlarmIncident live = incidents.get(incidentId);
    if (live != null) {
      return Optional.of(live);
    }
    try {
      return repository.findById(incidentId);
    } catch (DataAccessException ex) {
      logger.warn("failed to load incident incidentId={}", incidentId, ex);
      metrics.recordStoreError(STORE);
      return Optional.empty();
    }
  }

  public Optional<AlarmIncident> findOpenBySensor(String sensorId) {
    final UUID openId = openBySensor.get(sensorId);
    return openId == null ? Optional.empty() : Optional.ofNullable(incidents.get(openId));
  }

  public List<AlarmIncident> openIncidents() {
    return incidents.values().stream()
        .filter(AlarmIncident::isOpen)
        .sorted(Comparator.comparing(AlarmIncident::triggeredAt))
        .toList();
  }

  /** Re-registers open incidents loaded from the store after a restart. */
  public int restore(Collection<AlarmIncident> stored) {
    int restored = 0;
    for (AlarmIncident incident : stored) {
      if (!incident.isOpen()) {
        continue;
      }
      final boolean registered =
          sensorLocks.withLock(
              incident.sensorId(),
              () -> {
                final UUID current = openBySensor.putIfAbsent(incident.sensorId(), incident.id());
                if (current != null) {
                  if (!current.equals(incident.id())) {
                    logger.warn(
                        "stored incident not restored, sensor already has an open incident"
                            + " sensorId={} storedIncidentId={} openIncidentId={}",
                        incident.sensorId(),
                        incident.id(),
                        current);
                  }
                  return false;
                }
                incidents.put(incident.id(), incident);
                return true;
              });
      if (registered) {
        restored++;
      }
    }
    return restored;
  }

  /**
   * Drops resolved incidents whose resolution is older than the threshold from memory. They stay
   * readable through {@link #find} until the store deletes them.
   */
  public List<UUID> evictResolvedBefore(Instant threshold) {
    final List<UUID> evicted = new ArrayList<>();
    for (AlarmIncident incident : incidents.values()) {
      if (incident.state() == IncidentState.RESOLVED
          && incident.resolvedAt() != null
          && incident.resolvedAt().isBefore(threshold)
          && incidents.remove(incident.id(), incident)) {
        evicted.add(incident.id());
      }
    }
    return evicted;
  }

  private Optional<AlarmIncident> coalesce(UUID openId, Severity reported) {
    final AlarmIncident current = incidents.get(openId);
    if (current == null || !current.isOpen()) {
      return Optional.empty();
    }
    if (!reported.isHigherThan(current.severity())) {
      logger.debug(
          "smoke alarm coalesced incidentId={} severity={}", openId, current.severity().value());
      return Optional.of(current);
    }
    final AlarmIncident raised = current.withSeverity(reported, clock.instant());
    store(raised);
    emit(TransitionType.COALESCED, raised, current.state());
    logger.info(
        "incident severity raised incidentId={} from={} to={}",
        openId,
        current.severity().value(),
        reported.value());
    return Optional.of(raised);
  }

  private AlarmIncident applyEscalation(AlarmIncident current) {
    final AlarmIncident next = current.escalate(clock.instant());
    store(next);
    emit(TransitionType.ESCALATED, next, current.state());
    logger.info(
        "incident escalated incidentId={} severity={}", next.id(), next.severity().value());
    return next;
  }

  private boolean isOverdue(AlarmIncident incident, Instant now) {
    return incident.state() == IncidentState.ACTIVE
        && !incident.triggeredAt().plus(ackTimeout).isAfter(now);
  }

  private AlarmIncident requireLive(UUID incidentId) {
    final AlarmIncident current = incidents.get(incidentId);
    if (current == null) {
      throw new IncidentNotFoundException(incidentId);
    }
    return current;
  }

  private void store(AlarmIncident incident) {
    incidents.put(incident.id(), incident);
    persist(incident);
  }

  private void persist(AlarmIncident incident) {
    try {
      repository.upsert(incident);
    } catch (DataAccessException ex) {
      logger.warn("failed to persist incident incidentId={}", incident.id(), ex);
      metrics.recordStoreError(STORE);
    }
  }

  private void emit(TransitionType type, AlarmIncident incident, IncidentState previousState) {
    metrics.recordTransition(type.eventType());
    publisher.transitioned(
        new IncidentTransition(type, incident, previousState, incident.updatedAt()));
  }

  private record TriggerResult(AlarmIncident incident, boolean created) {}
}
