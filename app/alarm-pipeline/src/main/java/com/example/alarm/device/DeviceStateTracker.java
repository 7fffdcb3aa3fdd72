/*
 * Where: Alarm pipeline device layer
 * What: Authoritative in-memory state of every gateway and sensor, written through to PostgreSQL
 * Why: Liveness, telemetry and registration are updated per device in receipt order
 */
package com.example.alarm.device;

import com.example.alarm.config.DeviceTrackerProperties;
import com.example.alarm.metrics.PipelineMetrics;
import com.example.alarm.model.BroadcastEnvelope;
import com.example.alarm.model.DeviceEvent;
import com.example.alarm.model.DeviceEventPayload;
import com.example.alarm.model.DeviceKind;
import com.example.alarm.model.DeviceState;
import com.example.alarm.model.DeviceStatus;
import com.example.alarm.model.EventKind;
import com.example.alarm.model.SensorPlacement;
import com.example.alarm.realtime.RealtimeBroadcastHub;
import com.example.alarm.repository.DeviceStateRepository;
import com.example.common.concurrent.KeyedLocks;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Applies decoded uplink events to device state.
 *
 * <p>Every uplink marks its gateway as heard from; events that name a sensor also mark that
 * sensor. Updates for one device id run under that id's lock, so two events for the same device
 * are applied in the order they arrive while unrelated devices proceed in parallel. Unknown ids
 * are registered on first contact.
 */
@Component
public class DeviceStateTracker {

  static final String EVENT_STATUS = "device.status";
  static final String EVENT_LOW_BATTERY = "device.low_battery";
  static final String EVENT_SELF_TEST = "device.self_test";
  static final String EVENT_REMOVED = "device.removed";

  private static final Logger logger = LoggerFactory.getLogger(DeviceStateTracker.class);
  private static final String STORE = "device_states";

  private final ConcurrentMap<String, DeviceState> states = new ConcurrentHashMap<>();
  private final KeyedLocks locks;
  private final Duration stalenessWindow;
  private final double lowBatteryVoltage;
  private final SensorDirectory directory;
  private final DeviceStateRepository repository;
  private final RealtimeBroadcastHub hub;
  private final PipelineMetrics metrics;
  private final Clock clock;

  public DeviceStateTracker(
      DeviceTrackerProperties properties,
      SensorDirectory directory,
      DeviceStateRepository repository,
      RealtimeBroadcastHub hub,
      PipelineMetrics metrics,
      Clock clock) {
    this.locks = new KeyedLocks(properties.lockStripes());
    this.stalenessWindow = properties.stalenessWindow();
    this.lowBatteryVoltage = properties.lowBatteryVoltage();
    this.directory = directory;
    this.repository = repository;
    this.hub = hub;
    this.metrics = metrics;
    this.clock = clock;
  }

  /** Applies the event and returns the updated state of the device the event is about. */
  public DeviceState applyEvent(DeviceEvent event) {
    final Instant now = event.receivedAt() == null ? clock.instant() : event.receivedAt();
    final DeviceState gateway =
        locks.withLock(event.sourceId(), () -> updateGateway(event, now));
    if (!event.payload().hasSensor()) {
      return gateway;
    }
    final String sensorId = event.payload().sensorId();
    if (event.eventKind() == EventKind.DELETION_ACK) {
      return locks.withLock(sensorId, () -> removeSensor(sensorId, event.sourceId(), now));
    }
    return locks.withLock(sensorId, () -> updateSensor(event, now));
  }

  /**
   * Marks every device whose last heartbeat is older than the staleness window as offline.
   *
   * @return number of devices that changed to offline
   */
  public int sweep() {
    final Instant now = clock.instant();
    int changed = 0;
    for (String deviceId : states.keySet()) {
      final DeviceState candidate = states.get(deviceId);
      if (candidate == null || !candidate.isStale(now, stalenessWindow)) {
        continue;
      }
      final boolean marked =
          locks.withLock(
              deviceId,
              () -> {
                // re-read: a heartbeat may have arrived since the unlocked check
                final DeviceState current = states.get(deviceId);
                if (current == null || !current.isStale(now, stalenessWindow)) {
                  return false;
                }
                final DeviceState offline = current.offline(now);
                states.put(deviceId, offline);
                persist(offline);
                publishStatusChange(current, offline, now);
                return true;
              });
      if (marked) {
        changed++;
      }
    }
    metrics.updateOfflineDevices(countOffline());
    if (changed > 0) {
      logger.info("staleness sweep marked devices offline count={}", changed);
    }
    return changed;
  }

  public Optional<DeviceState> find(String deviceId) {
    return Optional.ofNullable(states.get(deviceId));
  }

  public List<DeviceState> snapshot() {
    return states.values().stream().sorted(Comparator.comparing(DeviceState::id)).toList();
  }

  /** Seeds state loaded from the store; live updates that already arrived win. */
  public void restore(Collection<DeviceState> stored) {
    stored.forEach(state -> states.putIfAbsent(state.id(), state));
    metrics.updateOfflineDevices(countOffline());
  }

  private DeviceState updateGateway(DeviceEvent event, Instant now) {
    final String gatewayId = event.sourceId();
    final DeviceState previous = states.get(gatewayId);
    final DeviceState base =
        previous == null
            ? DeviceState.register(gatewayId, DeviceKind.GATEWAY, null, now)
            : previous;
    DeviceState next = base.heardAt(now);
    if (!event.payload().hasSensor()) {
      next = applyTelemetry(next, event, now);
    }
    states.put(gatewayId, next);
    persist(next);
    publishDerived(event, previous, next, now);
    return next;
  }

  private DeviceState updateSensor(DeviceEvent event, Instant now) {
    final DeviceEventPayload payload = event.payload();
    final String sensorId = payload.sensorId();
    final DeviceState previous = states.get(sensorId);
    DeviceState next =
        (previous == null
                ? DeviceState.register(sensorId, DeviceKind.SENSOR, event.sourceId(), now)
                : previous)
            .heardAt(now);
    if (!Objects.equals(next.parentGatewayId(), event.sourceId())) {
      next = next.withParent(event.sourceId(), now);
    }
    next = applyTelemetry(next, event, now);
    if (event.eventKind() == EventKind.REGISTRATION) {
      directory.register(
          new SensorPlacement(
              sensorId,
              event.sourceId(),
              payload.houseId(),
              payload.tenantId(),
              payload.location()));
      logger.info(
          "sensor registered sensorId={} gatewayId={} houseId={}",
          sensorId,
          event.sourceId(),
          payload.houseId());
    }
    states.put(sensorId, next);
    persist(next);
    publishDerived(event, previous, next, now);
    return next;
  }

  private DeviceState removeSensor(String sensorId, String gatewayId, Instant now) {
    final DeviceState removed = states.remove(sensorId);
    final Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("deviceId", sensorId);
    payload.put("gatewayId", gatewayId);
    // scope must be resolved before the placement is dropped
    final BroadcastEnvelope envelope =
        new BroadcastEnvelope(EVENT_REMOVED, directory.scopeOf(sensorId), payload, now);
    directory.remove(sensorId);
    try {
      repository.delete(sensorId);
    } catch (DataAccessException ex) {
      logger.warn("failed to delete device state deviceId={}", sensorId, ex);
      metrics.recordStoreError(STORE);
    }
    hub.broadcast(envelope);
    logger.info("sensor removed sensorId={} gatewayId={}", sensorId, gatewayId);
    return removed == null
        ? DeviceState.register(sensorId, DeviceKind.SENSOR, gatewayId, now)
        : removed;
  }

  private DeviceState applyTelemetry(DeviceState state, DeviceEvent event, Instant now) {
    final DeviceEventPayload payload = event.payload();
    DeviceState next = state;
    if (payload.batteryVoltage() != null || payload.signalStrength() != null) {
      next = next.withTelemetry(payload.batteryVoltage(), payload.signalStrength(), now);
    }
    if (payload.firmwareVersion() != null) {
      next = next.withFirmware(payload.firmwareVersion(), now);
    }
    return next;
  }

  private void publishDerived(
      DeviceEvent event, DeviceState previous, DeviceState next, Instant now) {
    publishStatusChange(previous, next, now);
    final boolean subject = event.subjectId().equals(next.id());
    final boolean reportedLow = subject && event.eventKind() == EventKind.LOW_BATTERY;
    if (reportedLow || crossedLowBatteryThreshold(previous, next)) {
      final Map<String, Object> payload = devicePayload(next);
      payload.put("batteryVoltage", next.batteryLevel());
      payload.put("thresholdVoltage", lowBatteryVoltage);
      payload.put("reported", reportedLow);
      hub.broadcast(
          new BroadcastEnvelope(EVENT_LOW_BATTERY, directory.scopeOf(next.id()), payload, now));
      logger.info("low battery candidate deviceId={} battery={}", next.id(), next.batteryLevel());
    }
    if (subject && event.eventKind() == EventKind.SELF_TEST) {
      final Map<String, Object> payload = devicePayload(next);
      payload.put("passed", event.payload().selfTestPassed());
      hub.broadcast(
          new BroadcastEnvelope(EVENT_SELF_TEST, directory.scopeOf(next.id()), payload, now));
    }
  }

  private boolean crossedLowBatteryThreshold(DeviceState previous, DeviceState next) {
    final Double current = next.batteryLevel();
    if (current == null || current >= lowBatteryVoltage) {
      return false;
    }
    final Double before = previous == null ? null : previous.batteryLevel();
    return before == null || before >= lowBatteryVoltage;
  }

  private void publishStatusChange(DeviceState previous, DeviceState next, Instant now) {
    final DeviceStatus before = previous == null ? null : previous.status();
    if (before == next.status()) {
      return;
    }
    final Map<String, Object> payload = devicePayload(next);
    payload.put("previousStatus", before == null ? null : before.name());
    final Instant heartbeat = next.lastHeartbeatAt();
    payload.put("lastHeartbeatAt", heartbeat == null ? null : heartbeat.toString());
    hub.broadcast(new BroadcastEnvelope(EVENT_STATUS, directory.scopeOf(next.id()), payload, now));
  }

  private Map<String, Object> devicePayload(DeviceState state) {
    final Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("deviceId", state.id());
    payload.put("kind", state.kind().name());
    payload.put("parentGatewayId", state.parentGatewayId());
    payload.put("status", state.status().name());
    return payload;
  }

  private void persist(DeviceState state) {
    try {
      repository.upsert(state);
    } catch (DataAccessException ex) {
      logger.warn("failed to persist device state deviceId={}", state.id(), ex);
      metrics.recordStoreError(STORE);
    }
  }

  private int countOffline() {
    return (int) states.values().stream().filter(s -> s.status() == DeviceStatus.OFFLINE).count();
  }
}
