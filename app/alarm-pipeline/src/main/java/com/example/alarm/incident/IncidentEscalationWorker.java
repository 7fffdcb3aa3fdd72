/*
 * Where: Alarm pipeline incident lifecycle
 * What: Periodically escalates incidents left unacknowledged past the timeout
 */
package com.example.alarm.incident;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class IncidentEscalationWorker {

  private final AlarmStateMachine stateMachine;

  @Scheduled(fixedDelayString = "${alarm.incident.escalation-check-interval}")
  public void run() {
    stateMachine.escalateOverdue();
  }
}
