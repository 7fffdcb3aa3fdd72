/*
 * Where: Alarm pipeline device layer
 * What: Runs the staleness sweep on a fixed delay
 */
package com.example.alarm.device;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DeviceStalenessWorker {

  private final DeviceStateTracker tracker;

  @Scheduled(fixedDelayString = "${alarm.device.sweep-interval}")
  public void run() {
    tracker.sweep();
  }
}
