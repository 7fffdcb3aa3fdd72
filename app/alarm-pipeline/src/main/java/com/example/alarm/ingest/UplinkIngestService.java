/*
 * Where: Alarm pipeline ingest
 * What: Single entry point for one transport message: decode, track device state, raise incidents
 * Why: The NATS subscriber and the debug endpoint share exactly the same processing path
 */
package com.example.alarm.ingest;

import com.example.alarm.device.DeviceStateTracker;
import com.example.alarm.incident.AlarmStateMachine;
import com.example.alarm.metrics.PipelineMetrics;
import com.example.alarm.model.AlarmIncident;
import com.example.alarm.model.DeviceEvent;
import com.example.alarm.model.DeviceState;
import com.example.alarm.model.EventKind;
import com.example.common.TraceIds;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class UplinkIngestService {

  static final String MDC_TRACE_ID = "trace_id";
  static final String MDC_TOPIC = "topic";
  static final String MDC_GATEWAY_ID = "gateway_id";

  private static final Logger logger = LoggerFactory.getLogger(UplinkIngestService.class);

  private final UplinkMessageDecoder decoder;
  private final DeviceStateTracker tracker;
  private final AlarmStateMachine stateMachine;
  private final PipelineMetrics metrics;
  private final Clock clock;

  /**
   * Processes one uplink message.
   *
   * @throws UplinkDecodeException when the topic or body is invalid; nothing is applied
   */
  public IngestResult ingest(String topic, byte[] body) {
    // callers such as the NATS subscriber may already have bound a trace id
    final boolean ownsTrace = MDC.get(MDC_TRACE_ID) == null;
    if (ownsTrace) {
      MDC.put(MDC_TRACE_ID, TraceIds.newTraceId());
    }
    MDC.put(MDC_TOPIC, topic);
    try {
      return apply(topic, body);
    } finally {
      MDC.remove(MDC_TOPIC);
      MDC.remove(MDC_GATEWAY_ID);
      if (ownsTrace) {
        MDC.remove(MDC_TRACE_ID);
      }
    }
  }

  private IngestResult apply(String topic, byte[] body) {
    final DeviceEvent event;
    try {
      event = decoder.decode(topic, body, clock.instant());
    } catch (UplinkDecodeException ex) {
      metrics.recordDecodeError(ex.getKind().metricValue());
      logger.warn(
          "uplink message rejected kind={} topic={} reason={}",
          ex.getKind(),
          topic,
          ex.getMessage());
      throw ex;
    }
    MDC.put(MDC_GATEWAY_ID, event.sourceId());
    metrics.recordIngest(event.eventKind().topicValue());
    final DeviceState device = tracker.applyEvent(event);
    AlarmIncident incident = null;
    if (event.eventKind() == EventKind.SMOKE_ALARM) {
      incident =
          stateMachine.trigger(
              event.payload().sensorId(), event.sourceId(), event.payload().severity());
    }
    logger.debug(
        "uplink message applied kind={} gatewayId={} deviceId={}",
        event.eventKind().topicValue(),
        event.sourceId(),
        device.id());
    return new IngestResult(event, device, incident);
  }
}
