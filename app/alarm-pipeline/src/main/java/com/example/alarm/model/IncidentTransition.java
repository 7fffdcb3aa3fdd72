/*
 * Where: Alarm pipeline domain model
 * What: One applied incident transition with the state it left
 */
package com.example.alarm.model;

import java.time.Instant;

public record IncidentTransition(
    TransitionType type, AlarmIncident incident, IncidentState previousState, Instant occurredAt) {}
