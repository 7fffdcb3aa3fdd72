/*
 * Where: Alarm pipeline debug API
 * What: Injects mock uplink messages and test fire alarms
 * Why: Exercises the pipeline end to end without gateways or a broker
 */
package com.example.alarm.api;

import com.example.alarm.api.request.TestAlarmRequest;
import com.example.alarm.api.request.UplinkDebugRequest;
import com.example.alarm.api.response.IncidentResponse;
import com.example.alarm.api.response.IngestResponse;
import com.example.alarm.incident.AlarmStateMachine;
import com.example.alarm.ingest.UplinkIngestService;
import com.example.alarm.model.Severity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/debug")
@RequiredArgsConstructor
public class DebugController {

  private final UplinkIngestService ingestService;
  private final AlarmStateMachine stateMachine;
  private final ObjectMapper objectMapper;

  @PostMapping("/uplink")
  public ResponseEntity<IngestResponse> uplink(@Valid @RequestBody UplinkDebugRequest request)
      throws JsonProcessingException {
    final byte[] body = objectMapper.writeValueAsBytes(request.body());
    return ResponseEntity.ok(IngestResponse.from(ingestService.ingest(request.topic(), body)));
  }

  @PostMapping("/incidents")
  public ResponseEntity<IncidentResponse> testAlarm(
      @Valid @RequestBody TestAlarmRequest request) {
    final Severity severity =
        request.severity() == null ? null : Severity.fromValue(request.severity());
    return ResponseEntity.ok(
        IncidentResponse.from(
            stateMachine.trigger(request.sensorId(), request.gatewayId(), severity)));
  }
}
