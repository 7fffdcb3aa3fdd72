/*
 * Where: Alarm pipeline domain model
 * What: Tenant/house filter of a realtime connection, also used as the scope of an envelope
 * Why: A null field on the subscription side matches any value
 */
package com.example.alarm.model;

import java.util.Objects;

public record SubscriptionScope(String tenantId, String houseId) {

  public static final SubscriptionScope ALL = new SubscriptionScope(null, null);

  public static SubscriptionScope of(String tenantId, String houseId) {
    return new SubscriptionScope(blankToNull(tenantId), blankToNull(houseId));
  }

  public boolean covers(SubscriptionScope eventScope) {
    final SubscriptionScope target = eventScope == null ? ALL : eventScope;
    return matches(tenantId, target.tenantId()) && matches(houseId, target.houseId());
  }

  private static boolean matches(String filter, String value) {
    return filter == null || Objects.equals(filter, value);
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
