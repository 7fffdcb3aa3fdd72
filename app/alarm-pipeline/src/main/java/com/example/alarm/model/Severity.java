/*
 * Where: Alarm pipeline domain model
 * What: Incident severity tiers, ordered low < medium < high < critical
 * Why: Coalescing and escalation compare tiers by declaration order
 */
package com.example.alarm.model;

public enum Severity {
  LOW("low"),
  MEDIUM("medium"),
  HIGH("high"),
  CRITICAL("critical");

  private final String value;

  Severity(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public boolean isHigherThan(Severity other) {
    return compareTo(other) > 0;
  }

  public boolean isAtLeast(Severity other) {
    return compareTo(other) >= 0;
  }

  /** Next tier up; critical stays critical. */
  public Severity raised() {
    final Severity[] tiers = values();
    return tiers[Math.min(ordinal() + 1, tiers.length - 1)];
  }

  public static Severity fromValue(String value) {
    for (Severity severity : values()) {
      if (severity.value.equalsIgnoreCase(value)) {
        return severity;
      }
    }
    throw new IllegalArgumentException("unsupported severity: " + value);
  }
}
