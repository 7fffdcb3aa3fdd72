/*
 * Where: Alarm pipeline ingest tests
 * What: Verifies decode -> tracker -> state machine wiring and decode-error accounting
 */
package com.example.alarm.ingest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.alarm.device.DeviceStateTracker;
import com.example.alarm.incident.AlarmStateMachine;
import com.example.alarm.metrics.PipelineMetrics;
import com.example.alarm.model.AlarmIncident;
import com.example.alarm.model.DeviceEvent;
import com.example.alarm.model.DeviceKind;
import com.example.alarm.model.DeviceState;
import com.example.alarm.model.Severity;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

@ExtendWith(MockitoExtension.class)
class UplinkIngestServiceTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-03-01T10:00:00Z");

  @Mock private DeviceStateTracker tracker;
  @Mock private AlarmStateMachine stateMachine;
  @Mock private PipelineMetrics metrics;

  private UplinkIngestService service;

  @BeforeEach
  void setUp() {
    service =
        new UplinkIngestService(
            new UplinkMessageDecoder(new ObjectMapper()),
            tracker,
            stateMachine,
            metrics,
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void smokeAlarmUpdatesTrackerAndTriggersIncident() {
    final DeviceState sensor = DeviceState.register("s-1", DeviceKind.SENSOR, "gw-1", FIXED_NOW);
    final AlarmIncident incident =
        AlarmIncident.open(UUID.randomUUID(), "s-1", "gw-1", Severity.HIGH, FIXED_NOW);
    when(tracker.applyEvent(any(DeviceEvent.class))).thenReturn(sensor);
    when(stateMachine.trigger("s-1", "gw-1", Severity.HIGH)).thenReturn(incident);

    final IngestResult result =
        service.ingest(
            "uplink/gw-1/smoke_alarm", body("{\"sensorId\":\"s-1\",\"severity\":\"high\"}"));

    assertThat(result.device()).isEqualTo(sensor);
    assertThat(result.incident()).isEqualTo(incident);
    assertThat(result.event().receivedAt()).isEqualTo(FIXED_NOW);
    verify(metrics).recordIngest("smoke_alarm");
  }

  @Test
  void heartbeatDoesNotTouchStateMachine() {
    when(tracker.applyEvent(any(DeviceEvent.class)))
        .thenReturn(DeviceState.register("gw-1", DeviceKind.GATEWAY, null, FIXED_NOW));

    final IngestResult result =
        service.ingest(
            "uplink/gw-1/heartbeat", body("{\"batteryVoltage\":3.0,\"signalStrength\":-60}"));

    assertThat(result.incident()).isNull();
    verifyNoInteractions(stateMachine);
  }

  @Test
  void decodeFailureIsCountedAndNothingIsApplied() {
    assertThatThrownBy(() -> service.ingest("uplink/gw-1/bogus", body("{}")))
        .isInstanceOf(UplinkDecodeException.class);

    verify(metrics).recordDecodeError("unknown_kind");
    verify(metrics, never()).recordIngest(anyString());
    verifyNoInteractions(tracker, stateMachine);
  }

  @Test
  void traceIdBoundByCallerIsKeptAndOwnKeysAreCleared() {
    when(tracker.applyEvent(any(DeviceEvent.class)))
        .thenReturn(DeviceState.register("gw-1", DeviceKind.GATEWAY, null, FIXED_NOW));
    MDC.put(UplinkIngestService.MDC_TRACE_ID, "trace-from-broker");
    try {
      service.ingest(
          "uplink/gw-1/heartbeat", body("{\"batteryVoltage\":3.0,\"signalStrength\":-60}"));

      assertThat(MDC.get(UplinkIngestService.MDC_TRACE_ID)).isEqualTo("trace-from-broker");
      assertThat(MDC.get(UplinkIngestService.MDC_TOPIC)).isNull();
      assertThat(MDC.get(UplinkIngestService.MDC_GATEWAY_ID)).isNull();
    } finally {
      MDC.clear();
    }
  }

  private static byte[] body(String json) {
    return json.getBytes(StandardCharsets.UTF_8);
  }
}
