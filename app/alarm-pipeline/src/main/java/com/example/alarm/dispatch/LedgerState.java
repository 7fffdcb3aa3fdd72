package com.example.alarm.dispatch;

public enum LedgerState {
  PENDING,
  IN_FLIGHT,
  SENT,
  FAILED,
  CANCELLED;

  /** States that block another task for the same recipient and incident. */
  boolean blocksDuplicate() {
    return this != FAILED && this != CANCELLED;
  }
}
