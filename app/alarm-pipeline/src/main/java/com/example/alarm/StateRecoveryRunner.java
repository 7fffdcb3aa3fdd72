/*
 * Where: Alarm pipeline startup
 * What: Reloads sensor placements, device states and open incidents from PostgreSQL
 * Why: In-memory trackers resume where the previous process stopped, before any uplink arrives
 */
package com.example.alarm;

import com.example.alarm.device.DeviceStateTracker;
import com.example.alarm.device.SensorDirectory;
import com.example.alarm.incident.AlarmStateMachine;
import com.example.alarm.repository.AlarmIncidentRepository;
import com.example.alarm.repository.DeviceStateRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs recovery while the context is refreshing.
 *
 * <p>Beans that feed the trackers declare {@code @DependsOn(StateRecoveryRunner.BEAN_NAME)}, so
 * recovery has finished before they subscribe. Scheduled workers and the web server only start
 * once refresh completes, after every singleton including this one is initialized.
 */
@Component(StateRecoveryRunner.BEAN_NAME)
@RequiredArgsConstructor
public class StateRecoveryRunner {

  public static final String BEAN_NAME = "stateRecoveryRunner";

  private static final Logger logger = LoggerFactory.getLogger(StateRecoveryRunner.class);

  private final SensorDirectory sensorDirectory;
  private final DeviceStateRepository deviceStateRepository;
  private final DeviceStateTracker tracker;
  private final AlarmIncidentRepository incidentRepository;
  private final AlarmStateMachine stateMachine;

  @PostConstruct
  public void run() {
    // store failures propagate and abort startup
    final int placements = sensorDirectory.reload();
    tracker.restore(deviceStateRepository.findAll());
    final int incidents = stateMachine.restore(incidentRepository.findOpen());
    logger.info(
        "state recovered placements={} devices={} openIncidents={}",
        placements,
        tracker.snapshot().size(),
        incidents);
  }
}
