package com.example.alarm.routing;

/** Fan-out for an incident cannot be planned, typically because the sensor has no placement. */
public class RoutingException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public RoutingException(String message) {
    super(message);
  }
}
