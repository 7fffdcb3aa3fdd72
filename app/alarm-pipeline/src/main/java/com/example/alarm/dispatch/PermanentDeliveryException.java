/*
 * Where: Alarm pipeline delivery
 * What: The transport rejected the notification for good (invalid token, unknown recipient)
 * Why: The dispatcher records the failure immediately and never retries it
 */
package com.example.alarm.dispatch;

public class PermanentDeliveryException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public PermanentDeliveryException(String message) {
    super(message);
  }

  public PermanentDeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
