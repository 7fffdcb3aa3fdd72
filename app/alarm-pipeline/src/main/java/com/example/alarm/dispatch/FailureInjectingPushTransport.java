/*
 * Where: Alarm pipeline delivery
 * What: CI/test-only transport that injects transient or permanent failures by recipient prefix
 * Why: Retry, exhaustion and permanent-failure paths can be reproduced end to end
 */
package com.example.alarm.dispatch;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Component
@Primary
@RequiredArgsConstructor
@Profile({"ci", "test"})
@ConditionalOnProperty(
    prefix = "alarm.dispatch.failure-injection",
    name = "enabled",
    havingValue = "true")
public class FailureInjectingPushTransport implements PushTransport {

  private final LocalPushTransport delegate;
  private final ConcurrentMap<String, AtomicInteger> transientFailures = new ConcurrentHashMap<>();

  @Value("${alarm.dispatch.failure-injection.permanent-prefix:}")
  private String permanentPrefix;

  @Value("${alarm.dispatch.failure-injection.transient-prefix:}")
  private String transientPrefix;

  @Value("${alarm.dispatch.failure-injection.transient-failures:0}")
  private int transientFailuresPerMessage;

  @Override
  public void send(String recipientId, PushMessage message) {
    if (matches(permanentPrefix, recipientId)) {
      throw new PermanentDeliveryException(
          "delivery failure injection rejected recipientId=" + recipientId);
    }
    if (matches(transientPrefix, recipientId)) {
      // counted per recipient and incident so each notification fails the same number of times
      final int failures =
          transientFailures
              .computeIfAbsent(recipientId + ':' + message.incidentId(), k -> new AtomicInteger())
              .incrementAndGet();
      if (failures <= transientFailuresPerMessage) {
        throw new TransientDeliveryException(
            "delivery failure injection timed out recipientId="
                + recipientId
                + " failure="
                + failures);
      }
    }
    delegate.send(recipientId, message);
  }

  private boolean matches(String prefix, String recipientId) {
    if (prefix == null || prefix.isBlank()) {
      return false;
    }
    return recipientId.startsWith(prefix);
  }
}
