package com.example.alarm.incident;

import com.example.alarm.model.AlarmIncident;
import com.example.alarm.model.IncidentTransition;
import com.example.alarm.model.NotificationTier;

/** Downstream side effects of incident transitions. */
public interface IncidentEventPublisher {

  /**
   * Called for every transition while the incident lock is held, so calls for one incident arrive
   * in transition order. Implementations must not block.
   */
  void transitioned(IncidentTransition transition);

  /** Called after the lock is released when a trigger or escalation needs notification fan-out. */
  void fanOutRequested(AlarmIncident incident, NotificationTier tier);
}
