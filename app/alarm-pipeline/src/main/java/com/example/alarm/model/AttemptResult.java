/*
 * Where: Alarm pipeline domain model
 * What: Result recorded for each delivery attempt in the audit trail
 */
package com.example.alarm.model;

public enum AttemptResult {
  SENT,
  TRANSIENT_FAILURE,
  PERMANENT_FAILURE,
  NO_CHANNEL,
  CANCELLED;

  public boolean isFailure() {
    return this == TRANSIENT_FAILURE || this == PERMANENT_FAILURE || this == NO_CHANNEL;
  }
}
