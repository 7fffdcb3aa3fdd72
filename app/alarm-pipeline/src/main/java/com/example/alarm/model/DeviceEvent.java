/*
 * Where: Alarm pipeline domain model
 * What: Typed event decoded from one uplink message
 * Why: Produced by the decoder and consumed once by the tracker and the state machine
 */
package com.example.alarm.model;

import java.time.Instant;

public record DeviceEvent(
    String sourceId, EventKind eventKind, DeviceEventPayload payload, Instant receivedAt) {

  /** Id of the device the event is about: the embedded sensor when present, else the gateway. */
  public String subjectId() {
    return payload.hasSensor() ? payload.sensorId() : sourceId;
  }
}
