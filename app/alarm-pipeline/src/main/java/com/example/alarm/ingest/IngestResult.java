package com.example.alarm.ingest;

import com.example.alarm.model.AlarmIncident;
import com.example.alarm.model.DeviceEvent;
import com.example.alarm.model.DeviceState;

/** Outcome of one ingested message; {@code incident} is null unless the event raised an alarm. */
public record IngestResult(DeviceEvent event, DeviceState device, AlarmIncident incident) {}
