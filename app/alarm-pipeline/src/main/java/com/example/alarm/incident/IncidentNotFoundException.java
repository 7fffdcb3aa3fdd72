package com.example.alarm.incident;

import java.util.UUID;

public class IncidentNotFoundException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public IncidentNotFoundException(UUID incidentId) {
    super("incident not found: " + incidentId);
  }
}
