/*
 * Where: Alarm pipeline delivery
 * What: Per-incident record of which recipients have a pending, in-flight or sent notification
 * Why: Escalation must not re-notify recipients already reached, and resolution cancels queued
 *      escalation tasks
 */
package com.example.alarm.dispatch;

import com.example.alarm.model.DeliveryStatus;
import com.example.alarm.model.NotificationTask;
import com.example.alarm.model.NotificationTier;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
public class NotificationLedger {

  private final ConcurrentMap<UUID, IncidentLedger> ledgers = new ConcurrentHashMap<>();

  /**
   * Claims the (recipient, incident) slot for a routed task.
   *
   * @return false when the recipient already has a pending, in-flight or sent task for the
   *     incident, or when the task is escalation tier and escalation was cancelled
   */
  public boolean register(NotificationTask task) {
    final IncidentLedger ledger = ledgerFor(task.incidentId());
    synchronized (ledger) {
      if (task.tier() == NotificationTier.ESCALATION && ledger.escalationCancelled) {
        return false;
      }
      final Entry existing = ledger.entries.get(task.recipientId());
      if (existing != null && existing.state.blocksDuplicate()) {
        return false;
      }
      ledger.entries.put(
          task.recipientId(), new Entry(task.taskId(), task.tier(), LedgerState.PENDING));
      return true;
    }
  }

  /**
   * Moves the task to in-flight before its first attempt.
   *
   * @return false when the task was cancelled and must not be sent
   */
  public boolean begin(NotificationTask task) {
    final IncidentLedger ledger = ledgerFor(task.incidentId());
    synchronized (ledger) {
      final Entry entry = ledger.entries.get(task.recipientId());
      if (entry != null && entry.state == LedgerState.CANCELLED) {
        return false;
      }
      if (task.tier() == NotificationTier.ESCALATION && ledger.escalationCancelled) {
        ledger.entries.put(
            task.recipientId(), new Entry(task.taskId(), task.tier(), LedgerState.CANCELLED));
        return false;
      }
      ledger.entries.put(
          task.recipientId(), new Entry(task.taskId(), task.tier(), LedgerState.IN_FLIGHT));
      return true;
    }
  }

  public void complete(NotificationTask task, DeliveryStatus status) {
    final IncidentLedger ledger = ledgerFor(task.incidentId());
    final LedgerState state =
        switch (status) {
          case SENT -> LedgerState.SENT;
          case FAILED -> LedgerState.FAILED;
          case CANCELLED -> LedgerState.CANCELLED;
        };
    synchronized (ledger) {
      ledger.entries.put(task.recipientId(), new Entry(task.taskId(), task.tier(), state));
    }
  }

  /**
   * Cancels escalation-tier tasks of the incident that have not started and refuses new ones.
   *
   * @return number of pending tasks cancelled
   */
  public int cancelEscalation(UUID incidentId) {
    final IncidentLedger ledger = ledgerFor(incidentId);
    synchronized (ledger) {
      ledger.escalationCancelled = true;
      int cancelled = 0;
      for (Map.Entry<String, Entry> slot : ledger.entries.entrySet()) {
        final Entry entry = slot.getValue();
        if (entry.tier == NotificationTier.ESCALATION && entry.state == LedgerState.PENDING) {
          slot.setValue(new Entry(entry.taskId, entry.tier, LedgerState.CANCELLED));
          cancelled++;
        }
      }
      return cancelled;
    }
  }

  public Optional<LedgerState> state(UUID incidentId, String recipientId) {
    final IncidentLedger ledger = ledgers.get(incidentId);
    if (ledger == null) {
      return Optional.empty();
    }
    synchronized (ledger) {
      final Entry entry = ledger.entries.get(recipientId);
      return entry == null ? Optional.empty() : Optional.of(entry.state);
    }
  }

  public void evict(UUID incidentId) {
    ledgers.remove(incidentId);
  }

  private IncidentLedger ledgerFor(UUID incidentId) {
    return ledgers.computeIfAbsent(incidentId, ignored -> new IncidentLedger());
  }

  private static final class IncidentLedger {
    private final Map<String, Entry> entries = new HashMap<>();
    private boolean escalationCancelled;
  }

  private record Entry(UUID taskId, NotificationTier tier, LedgerState state) {}
}
