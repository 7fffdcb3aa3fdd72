/*
 * Where: Alarm pipeline metrics
 * What: Counters, gauges and timers for ingest, incidents, delivery and realtime fan-out
 * Why: Decode failures, retry exhaustion and realtime backpressure must be visible in Prometheus
 */
package com.example.alarm.metrics;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class PipelineMetrics {

  static final String METRIC_INGEST_TOTAL = "alarm.ingest.total";
  static final String METRIC_DECODE_ERROR_TOTAL = "alarm.decode.error.total";
  static final String METRIC_TRANSITION_TOTAL = "alarm.incident.transition.total";
  static final String METRIC_DELIVERY_TOTAL = "alarm.delivery.total";
  static final String METRIC_DELIVERY_ATTEMPT_TOTAL = "alarm.delivery.attempt.total";
  static final String METRIC_DELIVERY_LATENCY = "alarm.delivery.latency";
  static final String METRIC_ROUTING_ERROR_TOTAL = "alarm.routing.error.total";
  static final String METRIC_BACKPRESSURE_TOTAL = "alarm.realtime.backpressure.total";
  static final String METRIC_REALTIME_EVICTED_TOTAL = "alarm.realtime.evicted.total";
  static final String METRIC_REALTIME_CONNECTIONS = "alarm.realtime.connections";
  static final String METRIC_DEVICES_OFFLINE = "alarm.device.offline.current";
  static final String METRIC_STORE_ERROR_TOTAL = "alarm.store.error.total";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger realtimeConnections = new AtomicInteger(0);
  private final AtomicInteger offlineDevices = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> taggedCounters = new ConcurrentHashMap<>();
  private final Counter routingErrorCounter;
  private final Counter backpressureCounter;
  private final Counter realtimeEvictedCounter;
  private final Timer deliveryLatencyTimer;

  public PipelineMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_REALTIME_CONNECTIONS, realtimeConnections, AtomicInteger::get)
        .description("Currently connected realtime subscribers")
        .register(meterRegistry);
    Gauge.builder(METRIC_DEVICES_OFFLINE, offlineDevices, AtomicInteger::get)
        .description("Devices currently considered offline")
        .register(meterRegistry);
    this.routingErrorCounter =
        Counter.builder(METRIC_ROUTING_ERROR_TOTAL)
            .description("Incidents whose notification fan-out could not be planned")
            .register(meterRegistry);
    this.backpressureCounter =
        Counter.builder(METRIC_BACKPRESSURE_TOTAL)
            .description("Realtime envelopes dropped because a subscriber queue was full")
            .register(meterRegistry);
    this.realtimeEvictedCounter =
        Counter.builder(METRIC_REALTIME_EVICTED_TOTAL)
            .description("Realtime subscribers dropped because a send exceeded the send timeout")
            .register(meterRegistry);
    this.deliveryLatencyTimer =
        Timer.builder(METRIC_DELIVERY_LATENCY)
            .description("Time from dispatch to successful delivery")
            .register(meterRegistry);
  }

  public void recordIngest(String kind) {
    increment(METRIC_INGEST_TOTAL, "kind", kind, "Decoded uplink events");
  }

  public void recordDecodeError(String kind) {
    increment(METRIC_DECODE_ERROR_TOTAL, "kind", kind, "Uplink messages rejected by the decoder");
  }

  public void recordTransition(String type) {
    increment(METRIC_TRANSITION_TOTAL, "type", type, "Incident state transitions");
  }

  public void recordDeliveryResult(String result) {
    increment(METRIC_DELIVERY_TOTAL, "result", result, "Final notification delivery outcomes");
  }

  public void recordDeliveryAttempt(String result) {
    increment(
        METRIC_DELIVERY_ATTEMPT_TOTAL, "result", result, "Individual notification send attempts");
  }

  public void recordStoreError(String store) {
    increment(METRIC_STORE_ERROR_TOTAL, "store", store, "Write-through failures per store");
  }

  public void recordRoutingError() {
    routingErrorCounter.increment();
  }

  public void recordBackpressure() {
    backpressureCounter.increment();
  }

  public void recordRealtimeEviction() {
    realtimeEvictedCounter.increment();
  }

  public void recordDeliveryLatency(Instant triggeredAt, Instant sentAt) {
    if (triggeredAt == null || sentAt == null || sentAt.isBefore(triggeredAt)) {
      return;
    }
    deliveryLatencyTimer.record(Duration.between(triggeredAt, sentAt));
  }

  public void updateRealtimeConnections(int count) {
    realtimeConnections.set(Math.max(count, 0));
  }

  public void updateOfflineDevices(int count) {
    offlineDevices.set(Math.max(count, 0));
  }

  private void increment(String name, String tagKey, String tagValue, String description) {
    taggedCounters
        .computeIfAbsent(
            name + '|' + tagValue,
            ignored ->
                Counter.builder(name)
                    .description(description)
                    .tags(Tags.of(tagKey, tagValue))
                    .register(meterRegistry))
        .increment();
  }
}
