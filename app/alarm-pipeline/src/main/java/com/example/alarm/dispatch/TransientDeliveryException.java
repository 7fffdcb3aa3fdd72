package com.example.alarm.dispatch;

public class TransientDeliveryException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public TransientDeliveryException(String message) {
    super(message);
  }

  public TransientDeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
