/*
 * Where: Common utilities
 * What: Generates or reuses trace identifiers for log correlation
 * Why: One uplink message and all work derived from it share a trace_id in the MDC
 */
package com.example.common;

import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  public static String resolve(String candidate) {
    if (candidate != null && !candidate.isBlank()) {
      return candidate;
    }
    return newTraceId();
  }
}
