/*
 * Where: Alarm pipeline delivery
 * What: Transport that only logs the notification it would send
 */
package com.example.alarm.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LocalPushTransport implements PushTransport {

  private static final Logger logger = LoggerFactory.getLogger(LocalPushTransport.class);

  @Override
  public void send(String recipientId, PushMessage message) {
    logger.info(
        "notification simulated send recipientId={} incidentId={} channel={}",
        recipientId,
        message.incidentId(),
        message.channel());
  }
}
