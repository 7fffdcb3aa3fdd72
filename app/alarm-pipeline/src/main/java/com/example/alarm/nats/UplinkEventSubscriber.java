/*
 * Where: Alarm pipeline NATS subscription
 * What: Consumes gateway uplink messages from JetStream and feeds the ingest service
 * Why: Bad messages are terminated, store outages are redelivered, the consumer never stops
 */
package com.example.alarm.nats;

import com.example.alarm.StateRecoveryRunner;
import com.example.alarm.config.UplinkNatsProperties;
import com.example.alarm.ingest.UplinkDecodeException;
import com.example.alarm.ingest.UplinkIngestService;
import com.example.common.TraceIds;
import com.google.common.annotations.VisibleForTesting;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.StreamConfiguration;
import io.nats.client.impl.Headers;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.DependsOn;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Durable push consumer of {@code alarm.uplink.subject}.
 *
 * <p>NATS subjects are translated back into MQTT topics before ingest, so a message published by
 * the MQTT bridge on {@code uplink/gw-1/heartbeat} arrives here as {@code uplink.gw-1.heartbeat}
 * and is decoded exactly like a debug injection of the original topic.
 *
 * <p>The subscription opens only after state recovery, so a backlog redelivered at startup lands
 * on restored incidents.
 */
@Component
@DependsOn(StateRecoveryRunner.BEAN_NAME)
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class UplinkEventSubscriber {

  private static final Logger logger = LoggerFactory.getLogger(UplinkEventSubscriber.class);
  private static final int STREAM_NOT_FOUND_ERROR = 404;
  private static final int STREAM_NOT_FOUND_API_ERROR = 10059;
  private static final String MSG_ID_HEADER = "Nats-Msg-Id";
  private static final String MDC_TRACE_ID = "trace_id";

  private final Connection connection;
  private final UplinkIngestService ingestService;
  private final UplinkNatsProperties properties;
  private final AtomicBoolean started = new AtomicBoolean(false);
  private Dispatcher dispatcher;
  private JetStreamSubscription subscription;

  public UplinkEventSubscriber(
      Connection connection, UplinkIngestService ingestService, UplinkNatsProperties properties) {
    this.connection = connection;
    this.ingestService = ingestService;
    this.properties = properties;
  }

  @PostConstruct
  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    try {
      ensureStream(connection.jetStreamManagement(), streamConfiguration(properties));
      dispatcher = connection.createDispatcher();
      subscription =
          connection
              .jetStream()
              .subscribe(
                  properties.subject(),
                  dispatcher,
                  this::handleMessage,
                  false,
                  subscribeOptions(properties));
      logger.info(
          "uplink consumer started subject={} stream={} durable={} maxDeliver={}",
          properties.subject(),
          properties.stream(),
          properties.durable(),
          properties.maxDeliver());
    } catch (IOException | JetStreamApiException ex) {
      started.set(false);
      throw new IllegalStateException(
          "failed to subscribe to uplink stream " + properties.stream(), ex);
    }
  }

  @PreDestroy
  public void stop() {
    if (subscription != null) {
      subscription.unsubscribe();
      subscription = null;
    }
    if (dispatcher != null) {
      connection.closeDispatcher(dispatcher);
      dispatcher = null;
    }
  }

  @VisibleForTesting
  void handleMessage(Message message) {
    MDC.put(MDC_TRACE_ID, TraceIds.resolve(messageId(message)));
    try {
      settle(message, process(message));
    } finally {
      MDC.remove(MDC_TRACE_ID);
    }
  }

  /** NATS subject tokens map one to one onto MQTT topic levels. */
  static String toTopic(String subject) {
    return subject == null ? null : subject.replace('.', '/');
  }

  static StreamConfiguration streamConfiguration(UplinkNatsProperties properties) {
    // duplicate window deduplicates gateway retries carrying the same Nats-Msg-Id
    return StreamConfiguration.builder()
        .name(properties.stream())
        .subjects(properties.subject())
        .duplicateWindow(properties.duplicateWindow())
        .build();
  }

  static PushSubscribeOptions subscribeOptions(UplinkNatsProperties properties) {
    return PushSubscribeOptions.builder()
        .stream(properties.stream())
        .durable(properties.durable())
        .configuration(
            ConsumerConfiguration.builder()
                .ackPolicy(AckPolicy.Explicit)
                .ackWait(properties.ackWait())
                .maxDeliver(properties.maxDeliver())
                .build())
        .build();
  }

  private Settlement process(Message message) {
    final String topic = toTopic(message.getSubject());
    try {
      ingestService.ingest(topic, message.getData());
      return Settlement.ACK;
    } catch (UplinkDecodeException ex) {
      // redelivery cannot repair a malformed message; the ingest service already logged it
      return Settlement.TERM;
    } catch (DataAccessException ex) {
      logger.warn("uplink store unavailable, message will be redelivered topic={}", topic, ex);
      return Settlement.NAK;
    } catch (RuntimeException ex) {
      logger.warn("uplink processing failed, message will be redelivered topic={}", topic, ex);
      return Settlement.NAK;
    }
  }

  private void settle(Message message, Settlement settlement) {
    if (settlement == Settlement.NAK && isLastDelivery(message)) {
      logger.error(
          "uplink message exhausted its deliveries and will be dropped subject={} maxDeliver={}",
          message.getSubject(),
          properties.maxDeliver());
    }
    try {
      switch (settlement) {
        case ACK -> message.ack();
        case NAK -> message.nak();
        case TERM -> message.term();
        default -> throw new IllegalArgumentException("unknown settlement " + settlement);
      }
    } catch (IllegalStateException ex) {
      logger.warn("failed to {} uplink message", settlement.name().toLowerCase(Locale.ROOT), ex);
    }
  }

  private boolean isLastDelivery(Message message) {
    return message.isJetStream()
        && message.metaData().deliveredCount() >= properties.maxDeliver();
  }

  private String messageId(Message message) {
    final Headers headers = message.getHeaders();
    return headers == null ? null : headers.getFirst(MSG_ID_HEADER);
  }

  private void ensureStream(
      JetStreamManagement jetStreamManagement, StreamConfiguration configuration)
      throws IOException, JetStreamApiException {
    try {
      jetStreamManagement.updateStream(configuration);
    } catch (JetStreamApiException ex) {
      if (ex.getApiErrorCode() != STREAM_NOT_FOUND_API_ERROR
          && ex.getErrorCode() != STREAM_NOT_FOUND_ERROR) {
        throw ex;
      }
      jetStreamManagement.addStream(configuration);
      logger.info("uplink stream created stream={}", configuration.getName());
    }
  }

  private enum Settlement {
    ACK,
    NAK,
    TERM
  }
}
