/*
 * Where: Alarm pipeline domain model
 * What: State-change event fanned out to live realtime connections
 * Why: Immutable; the scope selects which subscriptions receive it and is not part of the frame
 */
package com.example.alarm.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record BroadcastEnvelope(
    String eventType, SubscriptionScope scope, Map<String, Object> payload, Instant timestamp) {

  public BroadcastEnvelope {
    scope = scope == null ? SubscriptionScope.ALL : scope;
    payload =
        payload == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
  }
}
