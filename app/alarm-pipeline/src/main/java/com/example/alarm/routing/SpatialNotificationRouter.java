/*
 * Where: Alarm pipeline notification routing
 * What: Turns an incident into notification tasks for the recipients around its sensor
 * Why: Recipients are chosen by house and radius; the same inputs always yield the same tasks
 */
package com.example.alarm.routing;

import com.example.alarm.config.RoutingProperties;
import com.example.alarm.device.SensorDirectory;
import com.example.alarm.dispatch.DeliveryAuditTrail;
import com.example.alarm.dispatch.NotificationLedger;
import com.example.alarm.metrics.PipelineMetrics;
import com.example.alarm.model.AlarmIncident;
import com.example.alarm.model.AttemptResult;
import com.example.alarm.model.DeliveryAttemptRecord;
import com.example.alarm.model.DeliveryStatus;
import com.example.alarm.model.NotificationChannel;
import com.example.alarm.model.NotificationTask;
import com.example.alarm.model.NotificationTier;
import com.example.alarm.model.Recipient;
import com.example.alarm.model.SensorPlacement;
import com.example.alarm.model.Severity;
import com.example.alarm.repository.RecipientRepository;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Spatial recipient selection.
 *
 * <p>Occupants of the sensor's house are always notified. From {@code high} severity on, and for
 * every escalation, all recipients within the radius are added as well: occupants of neighbouring
 * houses and emergency roles. The escalation tier multiplies the radius.
 *
 * <p>Tasks are ordered by recipient id and their ids derive from (incident, recipient, tier), so
 * {@link #plan} is a pure function of its inputs and the recipient directory.
 */
@Component
public class SpatialNotificationRouter {

  private static final Logger logger = LoggerFactory.getLogger(SpatialNotificationRouter.class);

  private final SensorDirectory sensorDirectory;
  private final RecipientRepository recipientRepository;
  private final NotificationLedger ledger;
  private final DeliveryAuditTrail auditTrail;
  private final RoutingProperties properties;
  private final PipelineMetrics metrics;
  private final Clock clock;

  public SpatialNotificationRouter(
      SensorDirectory sensorDirectory,
      RecipientRepository recipientRepository,
      NotificationLedger ledger,
      DeliveryAuditTrail auditTrail,
      RoutingProperties properties,
      PipelineMetrics metrics,
      Clock clock) {
    this.sensorDirectory = sensorDirectory;
    this.recipientRepository = recipientRepository;
    this.ledger = ledger;
    this.auditTrail = auditTrail;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
  }

  /**
   * Plans and claims tasks for the incident. Recipients that already have a pending, in-flight or
   * sent task for the incident are left out. Tasks without a reachable channel are returned with
   * channel {@code NONE} and are already recorded as failed.
   */
  public List<NotificationTask> route(AlarmIncident incident, NotificationTier tier) {
    final List<NotificationTask> planned = plan(incident, tier);
    final List<NotificationTask> claimed = new ArrayList<>(planned.size());
    int duplicates = 0;
    for (NotificationTask task : planned) {
      if (!ledger.register(task)) {
        duplicates++;
        continue;
      }
      if (!task.isReachable()) {
        recordNoChannel(task);
      }
      claimed.add(task);
    }
    logger.info(
        "notification routing completed incidentId={} tier={} planned={} claimed={} duplicates={}",
        incident.id(),
        tier,
        planned.size(),
        claimed.size(),
        duplicates);
    return claimed;
  }

  /** Candidate tasks without deduplication, sorted by recipient id. */
  public List<NotificationTask> plan(AlarmIncident incident, NotificationTier tier) {
    final SensorPlacement placement =
        sensorDirectory
            .find(incident.sensorId())
            .orElseThrow(
                () ->
                    new RoutingException(
                        "sensor has no registered placement sensorId=" + incident.sensorId()));
    final SortedMap<String, Recipient> recipients = new TreeMap<>();
    if (placement.houseId() != null) {
      for (Recipient occupant : recipientRepository.findByHouseId(placement.houseId())) {
        recipients.put(occupant.recipientId(), occupant);
      }
    }
    final boolean widened =
        incident.severity().isAtLeast(Severity.HIGH) || tier == NotificationTier.ESCALATION;
    if (widened && placement.location() != null) {
      for (Recipient nearby :
          recipientRepository.findWithinRadius(placement.location(), radiusFor(tier))) {
        recipients.put(nearby.recipientId(), nearby);
      }
    } else if (widened) {
      logger.warn(
          "sensor placement has no location, radius search skipped sensorId={}",
          incident.sensorId());
    }
    final String message = renderMessage(incident, placement, tier);
    final List<NotificationTask> tasks = new ArrayList<>(recipients.size());
    for (Recipient recipient : recipients.values()) {
      tasks.add(toTask(incident, recipient, tier, message));
    }
    return tasks;
  }

  double radiusFor(NotificationTier tier) {
    return tier == NotificationTier.ESCALATION
        ? properties.baseRadiusMeters() * properties.escalationRadiusMultiplier()
        : properties.baseRadiusMeters();
  }

  private NotificationTask toTask(
      AlarmIncident incident, Recipient recipient, NotificationTier tier, String message) {
    final NotificationChannel channel;
    final String address;
    if (hasText(recipient.pushToken())) {
      channel = NotificationChannel.PUSH;
      address = recipient.pushToken();
    } else if (hasText(recipient.phoneNumber())) {
      channel = NotificationChannel.SMS;
      address = recipient.phoneNumber();
    } else if (hasText(recipient.email())) {
      channel = NotificationChannel.EMAIL;
      address = recipient.email();
    } else {
      channel = NotificationChannel.NONE;
      address = null;
    }
    return new NotificationTask(
        taskId(incident.id(), recipient.recipientId(), tier),
        recipient.recipientId(),
        incident.id(),
        channel,
        address,
        tier,
        message,
        0);
  }

  static UUID taskId(UUID incidentId, String recipientId, NotificationTier tier) {
    final String key = incidentId + ":" + recipientId + ":" + tier.name();
    return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8));
  }

  private String renderMessage(
      AlarmIncident incident, SensorPlacement placement, NotificationTier tier) {
    final String prefix =
        tier == NotificationTier.ESCALATION ? "ESCALATED fire alarm" : "Fire alarm";
    final String where =
        placement.houseId() == null ? "unknown house" : "house " + placement.houseId();
    return prefix
        + " at "
        + where
        + ": sensor "
        + incident.sensorId()
        + " reports "
        + incident.severity().value()
        + " severity";
  }

  private void recordNoChannel(NotificationTask task) {
    ledger.complete(task, DeliveryStatus.FAILED);
    auditTrail.record(
        DeliveryAttemptRecord.of(
            task, AttemptResult.NO_CHANNEL, true, "NoChannel", clock.instant()));
    metrics.recordDeliveryResult("no_channel");
    logger.info(
        "recipient has no reachable channel incidentId={} recipientId={}",
        task.incidentId(),
        task.recipientId());
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
