/*
 * Where: Alarm pipeline domain model
 * What: Kinds of uplink messages a gateway sends
 * Why: Maps the messageKind topic level to a closed set of event kinds
 */
package com.example.alarm.model;

public enum EventKind {
  POWER_ON("power_on"),
  HEARTBEAT("heartbeat"),
  SMOKE_ALARM("smoke_alarm"),
  REGISTRATION("smoke_register"),
  DELETION_ACK("delete_response"),
  SELF_TEST("self_test"),
  LOW_BATTERY("low_battery");

  private final String topicValue;

  EventKind(String topicValue) {
    this.topicValue = topicValue;
  }

  public String topicValue() {
    return topicValue;
  }

  /**
   * Resolves the messageKind level of an uplink topic. Matching is exact; topic levels are
   * case sensitive. Unsupported values raise IllegalArgumentException.
   */
  public static EventKind fromTopicValue(String value) {
    for (EventKind kind : values()) {
      if (kind.topicValue.equals(value)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("unsupported message kind: " + value);
  }
}
