/*
 * Where: Alarm pipeline API
 * What: Read-only view of tracked gateway and sensor state
 */
package com.example.alarm.api;

import com.example.alarm.api.response.DeviceListResponse;
import com.example.alarm.api.response.DeviceResponse;
import com.example.alarm.device.DeviceStateTracker;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/devices")
@RequiredArgsConstructor
public class DeviceController {

  private final DeviceStateTracker tracker;

  @GetMapping
  public ResponseEntity<DeviceListResponse> list() {
    return ResponseEntity.ok(
        new DeviceListResponse(tracker.snapshot().stream().map(DeviceResponse::from).toList()));
  }

  @GetMapping("/{deviceId}")
  public ResponseEntity<DeviceResponse> get(@PathVariable("deviceId") String deviceId) {
    return ResponseEntity.ok(
        tracker
            .find(deviceId)
            .map(DeviceResponse::from)
            .orElseThrow(() -> new DeviceNotFoundException(deviceId)));
  }
}
