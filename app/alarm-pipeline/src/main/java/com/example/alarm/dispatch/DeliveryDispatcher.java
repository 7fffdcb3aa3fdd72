/*
 * Where: Alarm pipeline delivery
 * What: Sends notification tasks through the push transport with bounded retries
 * Why: Transient failures back off exponentially with jitter; permanent ones fail at once
 */
package com.example.alarm.dispatch;

import com.example.alarm.config.DispatchProperties;
import com.example.alarm.metrics.PipelineMetrics;
import com.example.alarm.model.AttemptResult;
import com.example.alarm.model.DeliveryAttemptRecord;
import com.example.alarm.model.DeliveryOutcome;
import com.example.alarm.model.NotificationTask;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs delivery attempts on a fixed worker pool.
 *
 * <p>Each task has at most one attempt chain at a time: a second dispatch of a task that is still
 * in flight returns the running chain's future. Backoff waits happen on a scheduler, so waiting
 * retries never hold a worker thread. Every attempt is appended to the audit trail.
 */
@Component
public class DeliveryDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(DeliveryDispatcher.class);
  static final String NO_CHANNEL_ERROR = "NoChannel";

  private final DispatchProperties properties;
  private final PushTransport transport;
  private final NotificationLedger ledger;
  private final DeliveryAuditTrail auditTrail;
  private final PipelineMetrics metrics;
  private final Clock clock;
  private final ExecutorService workers;
  private final ScheduledExecutorService retryScheduler;
  private final ConcurrentMap<UUID, CompletableFuture<DeliveryOutcome>> inFlight =
      new ConcurrentHashMap<>();

  public DeliveryDispatcher(
      DispatchProperties properties,
      PushTransport transport,
      NotificationLedger ledger,
      DeliveryAuditTrail auditTrail,
      PipelineMetrics metrics,
      Clock clock) {
    this.properties = properties;
    this.transport = transport;
    this.ledger = ledger;
    this.auditTrail = auditTrail;
    this.metrics = metrics;
    this.clock = clock;
    this.workers =
        Executors.newFixedThreadPool(
            properties.workers(),
            new ThreadFactoryBuilder().setNameFormat("delivery-worker-%d").setDaemon(true).build());
    this.retryScheduler =
        Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder().setNameFormat("delivery-retry-%d").setDaemon(true).build());
  }

  /** Sends the task and blocks until it is sent, failed for good, or cancelled. */
  public DeliveryOutcome dispatch(NotificationTask task) {
    return dispatchAsync(task).join();
  }

  public List<CompletableFuture<DeliveryOutcome>> dispatchAll(Collection<NotificationTask> tasks) {
    return tasks.stream().map(this::dispatchAsync).toList();
  }

  public CompletableFuture<DeliveryOutcome> dispatchAsync(NotificationTask task) {
    final CompletableFuture<DeliveryOutcome> created = new CompletableFuture<>();
    final CompletableFuture<DeliveryOutcome> running =
        inFlight.putIfAbsent(task.taskId(), created);
    if (running != null) {
      return running;
    }
    created.whenComplete((outcome, error) -> inFlight.remove(task.taskId(), created));
    final Instant startedAt = clock.instant();
    if (!task.isReachable()) {
      final NotificationTask counted = task.withAttempt(0);
      audit(counted, AttemptResult.NO_CHANNEL, true, NO_CHANNEL_ERROR);
      finish(created, DeliveryOutcome.failed(counted, NO_CHANNEL_ERROR, startedAt), "no_channel");
      return created;
    }
    if (!ledger.begin(task)) {
      final NotificationTask counted = task.withAttempt(0);
      audit(counted, AttemptResult.CANCELLED, true, null);
      finish(created, DeliveryOutcome.cancelled(counted, startedAt), "cancelled");
      logger.info(
          "notification cancelled before dispatch incidentId={} recipientId={} tier={}",
          task.incidentId(),
          task.recipientId(),
          task.tier());
      return created;
    }
    submitAttempt(new AttemptChain(task.withAttempt(1), startedAt, created));
    return created;
  }

  /**
   * Cancels escalation-tier notifications of the incident that have not started yet. Attempts
   * already running finish normally.
   */
  public int cancelEscalation(UUID incidentId) {
    final int cancelled = ledger.cancelEscalation(incidentId);
    if (cancelled > 0) {
      logger.info(
          "pending escalation notifications cancelled incidentId={} count={}",
          incidentId,
          cancelled);
    }
    return cancelled;
  }

  @PreDestroy
  public void shutdown() {
    retryScheduler.shutdownNow();
    workers.shutdownNow();
    inFlight.values().forEach(future -> future.cancel(false));
  }

  @VisibleForTesting
  Duration computeBackoffDuration(int attempt) {
    final double baseMillis = properties.backoffBase().toMillis();
    final double exp = baseMillis * Math.pow(properties.backoffExponentBase(), (attempt - 1));
    final double capped = Math.min(exp, properties.backoffMax().toMillis());
    final double jitterMin = properties.backoffJitterMin();
    final double jitterMax = properties.backoffJitterMax();
    final double jitter =
        jitterMin + ThreadLocalRandom.current().nextDouble() * (jitterMax - jitterMin);
    return Duration.ofMillis((long) Math.ceil(capped * jitter));
  }

  private void submitAttempt(AttemptChain chain) {
    try {
      workers.execute(() -> attempt(chain));
    } catch (RejectedExecutionException ex) {
      fail(chain, AttemptResult.TRANSIENT_FAILURE, "dispatcher is shutting down");
    }
  }

  private void attempt(AttemptChain chain) {
    final NotificationTask task = chain.task();
    try {
      transport.send(
          task.recipientId(),
          new PushMessage(task.channel(), task.address(), task.incidentId(), task.message()));
    } catch (PermanentDeliveryException ex) {
      logger.warn(
          "notification rejected permanently incidentId={} recipientId={} attempt={}",
          task.incidentId(),
          task.recipientId(),
          task.attempt(),
          ex);
      fail(chain, AttemptResult.PERMANENT_FAILURE, ex.getMessage());
      return;
    } catch (TransientDeliveryException ex) {
      retryOrFail(chain, ex);
      return;
    } catch (RuntimeException ex) {
      // unclassified transport errors count as transient
      retryOrFail(chain, ex);
      return;
    }
    final Instant sentAt = clock.instant();
    audit(task, AttemptResult.SENT, true, null);
    metrics.recordDeliveryLatency(chain.startedAt(), sentAt);
    finish(chain.result(), DeliveryOutcome.sent(task, sentAt), "sent");
    logger.info(
        "notification sent incidentId={} recipientId={} channel={} attempt={}",
        task.incidentId(),
        task.recipientId(),
        task.channel(),
        task.attempt());
  }

  private void retryOrFail(AttemptChain chain, RuntimeException ex) {
    final NotificationTask task = chain.task();
    if (task.attempt() >= properties.maxAttempts()) {
      logger.warn(
          "notification retries exhausted incidentId={} recipientId={} attempts={}",
          task.incidentId(),
          task.recipientId(),
          task.attempt(),
          ex);
      fail(chain, AttemptResult.TRANSIENT_FAILURE, ex.getMessage());
      return;
    }
    audit(task, AttemptResult.TRANSIENT_FAILURE, false, ex.getMessage());
    final Duration backoff = computeBackoffDuration(task.attempt());
    final AttemptChain next = chain.next();
    logger.warn(
        "notification retry scheduled incidentId={} recipientId={} nextAttempt={} backoffMs={}",
        task.incidentId(),
        task.recipientId(),
        next.task().attempt(),
        backoff.toMillis(),
        ex);
    try {
      retryScheduler.schedule(
          () -> submitAttempt(next), backoff.toMillis(), TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException rejected) {
      fail(chain, AttemptResult.TRANSIENT_FAILURE, "dispatcher is shutting down");
    }
  }

  private void fail(AttemptChain chain, AttemptResult result, String error) {
    final String truncated = truncateError(error);
    audit(chain.task(), result, true, truncated);
    finish(
        chain.result(),
        DeliveryOutcome.failed(chain.task(), truncated, clock.instant()),
        result == AttemptResult.PERMANENT_FAILURE ? "permanent_failure" : "exhausted");
  }

  private void finish(
      CompletableFuture<DeliveryOutcome> result, DeliveryOutcome outcome, String metricResult) {
    ledger.complete(outcome.task(), outcome.status());
    metrics.recordDeliveryResult(metricResult);
    result.complete(outcome);
  }

  private void audit(NotificationTask task, AttemptResult result, boolean terminal, String error) {
    if (task.attempt() > 0) {
      metrics.recordDeliveryAttempt(result.name().toLowerCase(Locale.ROOT));
    }
    auditTrail.record(
        DeliveryAttemptRecord.of(task, result, terminal, truncateError(error), clock.instant()));
  }

  private String truncateError(String message) {
    if (message == null) {
      return null;
    }
    final int maxLength = properties.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }

  /** One task's sequence of attempts; only one attempt of a chain runs at a time. */
  private record AttemptChain(
      NotificationTask task, Instant startedAt, CompletableFuture<DeliveryOutcome> result) {

    AttemptChain next() {
      return new AttemptChain(task.withAttempt(task.attempt() + 1), startedAt, result);
    }
  }
}
