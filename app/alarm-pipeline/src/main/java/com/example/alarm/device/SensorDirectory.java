/*
 * Where: Alarm pipeline device layer
 * What: Cache of sensor placements backed by sensor_placements
 * Why: Routing needs a sensor's location and broadcasts need the house/tenant scope of a device
 */
package com.example.alarm.device;

import com.example.alarm.metrics.PipelineMetrics;
import com.example.alarm.model.SensorPlacement;
import com.example.alarm.model.SubscriptionScope;
import com.example.alarm.repository.SensorPlacementRepository;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
public class SensorDirectory {

  private static final Logger logger = LoggerFactory.getLogger(SensorDirectory.class);
  private static final String STORE = "sensor_placements";

  private final ConcurrentMap<String, SensorPlacement> placements = new ConcurrentHashMap<>();
  private final SensorPlacementRepository repository;
  private final PipelineMetrics metrics;
  private final Clock clock;

  public SensorDirectory(
      SensorPlacementRepository repository, PipelineMetrics metrics, Clock clock) {
    this.repository = repository;
    this.metrics = metrics;
    this.clock = clock;
  }

  public void register(SensorPlacement placement) {
    placements.put(placement.sensorId(), placement);
    try {
      repository.upsert(placement, clock.instant());
    } catch (DataAccessException ex) {
      logger.warn("failed to persist sensor placement sensorId={}", placement.sensorId(), ex);
      metrics.recordStoreError(STORE);
    }
  }

  public Optional<SensorPlacement> find(String sensorId) {
    final SensorPlacement cached = placements.get(sensorId);
    if (cached != null) {
      return Optional.of(cached);
    }
    try {
      final Optional<SensorPlacement> loaded = repository.findBySensorId(sensorId);
      loaded.ifPresent(placement -> placements.putIfAbsent(sensorId, placement));
      return loaded;
    } catch (DataAccessException ex) {
      logger.warn("failed to load sensor placement sensorId={}", sensorId, ex);
      metrics.recordStoreError(STORE);
      return Optional.empty();
    }
  }

  public void remove(String sensorId) {
    placements.remove(sensorId);
    try {
      repository.delete(sensorId);
    } catch (DataAccessException ex) {
      logger.warn("failed to delete sensor placement sensorId={}", sensorId, ex);
      metrics.recordStoreError(STORE);
    }
  }

  /**
   * Scope of the house a device belongs to. Gateways inherit the scope of any sensor registered
   * under them; devices with no known placement are visible to every subscriber.
   */
  public SubscriptionScope scopeOf(String deviceId) {
    final SensorPlacement own = placements.get(deviceId);
    if (own != null) {
      return own.scope();
    }
    for (SensorPlacement placement : placements.values()) {
      if (deviceId.equals(placement.gatewayId())) {
        return placement.scope();
      }
    }
    return SubscriptionScope.ALL;
  }

  /** Loads every stored placement into the cache. */
  public int reload() {
    final List<SensorPlacement> stored = repository.findAll();
    stored.forEach(placement -> placements.put(placement.sensorId(), placement));
    return stored.size();
  }
}
