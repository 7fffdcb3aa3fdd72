/*
 * Where: Alarm pipeline realtime hub
 * What: Registry of live dashboard connections and scoped fan-out of BroadcastEnvelopes
 * Why: Broadcasters never wait on a client; a client stuck in a send is dropped after a deadline
 */
package com.example.alarm.realtime;

import com.example.alarm.config.RealtimeProperties;
import com.example.alarm.metrics.PipelineMetrics;
import com.example.alarm.model.BroadcastEnvelope;
import com.example.alarm.model.SubscriptionScope;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Connection registry with copy-on-write snapshots.
 *
 * <p>{@link #connect} and {@link #disconnect} serialize on the registry lock and publish a new
 * immutable map; {@link #broadcast} reads whichever snapshot is current and never takes the lock.
 * Each connection has at most one drain task in flight, so sends to one client never overlap.
 *
 * <p>The drain pool keeps {@code drain-threads} threads warm and grows past that while clients
 * block in a send, so a blocked client never holds the thread another client needs. A watchdog
 * disconnects any client whose current send has run longer than {@code send-timeout}.
 */
@Component
public class RealtimeBroadcastHub {

  private static final Logger logger = LoggerFactory.getLogger(RealtimeBroadcastHub.class);

  private final int queueDepth;
  private final long sendTimeoutNanos;
  private final PipelineMetrics metrics;
  private final EnvelopeSerializer serializer;
  private final ThreadPoolExecutor drainExecutor;
  private final ScheduledExecutorService watchdog;
  private final Object registryLock = new Object();
  private volatile ImmutableMap<String, ConnectionRecord> registry = ImmutableMap.of();

  public RealtimeBroadcastHub(
      RealtimeProperties properties, PipelineMetrics metrics, EnvelopeSerializer serializer) {
    this.queueDepth = properties.queueDepth();
    this.sendTimeoutNanos = properties.sendTimeout().toNanos();
    this.metrics = metrics;
    this.serializer = serializer;
    this.drainExecutor =
        new ThreadPoolExecutor(
            properties.drainThreads(),
            Integer.MAX_VALUE,
            60L,
            TimeUnit.SECONDS,
            new SynchronousQueue<>(),
            new ThreadFactoryBuilder().setNameFormat("realtime-drain-%d").setDaemon(true).build());
    this.watchdog =
        Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder()
                .setNameFormat("realtime-watchdog-%d")
                .setDaemon(true)
                .build());
    final long checkMillis = Math.max(10L, properties.sendTimeout().toMillis() / 4);
    watchdog.scheduleWithFixedDelay(
        this::evictStalledConnections, checkMillis, checkMillis, TimeUnit.MILLISECONDS);
  }

  public String connect(SubscriptionScope scope, RealtimeChannel channel) {
    final String connectionId = UUID.randomUUID().toString();
    final ConnectionRecord record =
        new ConnectionRecord(
            connectionId, scope == null ? SubscriptionScope.ALL : scope, channel, queueDepth);
    synchronized (registryLock) {
      registry =
          ImmutableMap.<String, ConnectionRecord>builder()
              .putAll(registry)
              .put(connectionId, record)
              .buildOrThrow();
      metrics.updateRealtimeConnections(registry.size());
    }
    logger.debug("realtime connection opened connectionId={} scope={}", connectionId, scope);
    return connectionId;
  }

  /** Removes and closes the connection. Unknown or already removed ids are ignored. */
  public void disconnect(String connectionId) {
    final ConnectionRecord removed;
    synchronized (registryLock) {
      removed = registry.get(connectionId);
      if (removed == null) {
        return;
      }
      final ImmutableMap.Builder<String, ConnectionRecord> builder = ImmutableMap.builder();
      for (Map.Entry<String, ConnectionRecord> entry : registry.entrySet()) {
        if (!entry.getKey().equals(connectionId)) {
          builder.put(entry);
        }
      }
      registry = builder.buildOrThrow();
      metrics.updateRealtimeConnections(registry.size());
    }
    if (removed.markClosed()) {
      removed.channel().close();
      logger.debug("realtime connection closed connectionId={}", connectionId);
    }
  }

  public void broadcast(BroadcastEnvelope envelope) {
    final ImmutableMap<String, ConnectionRecord> snapshot = registry;
    if (snapshot.isEmpty()) {
      return;
    }
    final String frame = serializer.serialize(envelope);
    for (ConnectionRecord record : snapshot.values()) {
      if (!record.scope().covers(envelope.scope())) {
        continue;
      }
      if (record.offer(frame)) {
        metrics.recordBackpressure();
      }
      scheduleDrain(record);
    }
  }

  public int connectionCount() {
    return registry.size();
  }

  public Optional<ConnectionRecord> find(String connectionId) {
    return Optional.ofNullable(registry.get(connectionId));
  }

  @PreDestroy
  public void shutdown() {
    final ImmutableMap<String, ConnectionRecord> closing;
    synchronized (registryLock) {
      closing = registry;
      registry = ImmutableMap.of();
      metrics.updateRealtimeConnections(0);
    }
    for (ConnectionRecord record : closing.values()) {
      if (record.markClosed()) {
        record.channel().close();
      }
    }
    watchdog.shutdownNow();
    drainExecutor.shutdownNow();
  }

  @VisibleForTesting
  int evictStalledConnections() {
    int evicted = 0;
    try {
      final long now = System.nanoTime();
      for (ConnectionRecord record : registry.values()) {
        if (record.isSendOverdue(now, sendTimeoutNanos) && record.markEvicting()) {
          logger.warn(
              "realtime send exceeded timeout, dropping connection connectionId={} timeoutMs={}",
              record.connectionId(),
              TimeUnit.NANOSECONDS.toMillis(sendTimeoutNanos));
          metrics.recordRealtimeEviction();
          closeAsync(record.connectionId());
          evicted++;
        }
      }
    } catch (RuntimeException ex) {
      // keeps the scheduled check alive
      logger.warn("realtime watchdog check failed", ex);
    }
    return evicted;
  }

  /** Closing a session that is stuck in a send may block too, so it runs off the caller. */
  private void closeAsync(String connectionId) {
    try {
      drainExecutor.execute(() -> disconnect(connectionId));
    } catch (RejectedExecutionException ex) {
      // executor is shutting down and closes every channel itself
      logger.debug("realtime close skipped during shutdown connectionId={}", connectionId);
    }
  }

  private void scheduleDrain(ConnectionRecord record) {
    if (!record.tryStartDrain()) {
      return;
    }
    try {
      drainExecutor.execute(() -> drain(record));
    } catch (RejectedExecutionException ex) {
      // executor is shutting down
      record.finishDrain();
    }
  }

  private void drain(ConnectionRecord record) {
    boolean failed = false;
    try {
      String frame;
      while (!record.isClosed() && (frame = record.poll()) != null) {
        record.beginSend(System.nanoTime());
        try {
          record.channel().send(frame);
        } finally {
          record.endSend();
        }
      }
    } catch (IOException | RuntimeException ex) {
      logger.warn("realtime send failed connectionId={}", record.connectionId(), ex);
      failed = true;
    } finally {
      record.finishDrain();
    }
    if (failed) {
      disconnect(record.connectionId());
      return;
    }
    // a frame offered between the last poll and finishDrain is picked up here
    if (record.hasPending() && !record.isClosed()) {
      scheduleDrain(record);
    }
  }
}
