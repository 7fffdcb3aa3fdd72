/*
 * Where: Alarm pipeline ingest
 * What: Raised when an uplink message cannot be turned into a DeviceEvent
 * Why: Redelivery never fixes a bad message, so callers drop it (JetStream TERM / HTTP 400)
 */
package com.example.alarm.ingest;

public class UplinkDecodeException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final DecodeErrorKind kind;
  private final String topic;

  public UplinkDecodeException(DecodeErrorKind kind, String topic, String message) {
    super(message);
    this.kind = kind;
    this.topic = topic;
  }

  public UplinkDecodeException(
      DecodeErrorKind kind, String topic, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.topic = topic;
  }

  public DecodeErrorKind getKind() {
    return kind;
  }

  public String getTopic() {
    return topic;
  }
}
