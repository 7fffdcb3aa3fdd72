package com.example.alarm.ingest;

import java.util.Locale;

public enum DecodeErrorKind {
  /** The messageKind topic level is not a supported event kind. */
  UNKNOWN_KIND,
  /** Body is not a JSON object, or a required field is missing or has the wrong type. */
  MALFORMED_PAYLOAD,
  /** Topic does not follow uplink/{gatewayId}/{messageKind}. */
  MALFORMED_TOPIC;

  public String metricValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
