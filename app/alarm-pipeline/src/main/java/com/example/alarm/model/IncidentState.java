/*
 * Where: Alarm pipeline domain model
 * What: Lifecycle states of a fire-alarm incident
 * Why: resolved is the only terminal state
 */
package com.example.alarm.model;

public enum IncidentState {
  ACTIVE,
  ACKNOWLEDGED,
  ESCALATED,
  RESOLVED;

  public boolean isTerminal() {
    return this == RESOLVED;
  }
}
