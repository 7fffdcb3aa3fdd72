/*
 * Where: Alarm pipeline delivery
 * What: Outbound push/SMS/email transport used by the delivery dispatcher
 * Why: The real provider is swapped per environment; failures are classified by exception type
 */
package com.example.alarm.dispatch;

public interface PushTransport {

  /**
   * Sends one notification.
   *
   * @throws TransientDeliveryException network or timeout failures worth retrying
   * @throws PermanentDeliveryException invalid token or rejected recipient
   */
  void send(String recipientId, PushMessage message);
}
