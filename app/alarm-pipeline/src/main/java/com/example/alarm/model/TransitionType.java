/*
 * Where: Alarm pipeline domain model
 * What: Kinds of incident transitions and their broadcast event types
 */
package com.example.alarm.model;

public enum TransitionType {
  TRIGGERED("incident.triggered"),
  COALESCED("incident.coalesced"),
  ACKNOWLEDGED("incident.acknowledged"),
  ESCALATED("incident.escalated"),
  RESOLVED("incident.resolved");

  private final String eventType;

  TransitionType(String eventType) {
    this.eventType = eventType;
  }

  public String eventType() {
    return eventType;
  }
}
