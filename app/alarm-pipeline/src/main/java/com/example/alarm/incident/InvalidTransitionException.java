/*
 * Where: Alarm pipeline incident lifecycle
 * What: A transition was requested from a state that does not allow it
 * Why: Misuse is reported to the caller (HTTP 409) and never retried
 */
package com.example.alarm.incident;

import com.example.alarm.model.IncidentState;
import java.util.UUID;

public class InvalidTransitionException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final UUID incidentId;
  private final IncidentState currentState;

  public InvalidTransitionException(UUID incidentId, IncidentState currentState, String operation) {
    super(operation + " is not allowed for incident " + incidentId + " in state " + currentState);
    this.incidentId = incidentId;
    this.currentState = currentState;
  }

  public UUID getIncidentId() {
    return incidentId;
  }

  public IncidentState getCurrentState() {
    return currentState;
  }
}
