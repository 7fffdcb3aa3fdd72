/*
 * Where: Alarm pipeline API
 * What: Incident lookup and operator transitions (acknowledge, escalate, resolve)
 */
package com.example.alarm.api;

import com.example.alarm.api.response.IncidentListResponse;
import com.example.alarm.api.response.IncidentResponse;
import com.example.alarm.incident.AlarmStateMachine;
import com.example.alarm.incident.IncidentNotFoundException;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/incidents")
@RequiredArgsConstructor
public class IncidentController {

  private static final String HEADER_USER_ID = "X-User-Id";
  private final AlarmStateMachine stateMachine;

  @GetMapping
  public ResponseEntity<IncidentListResponse> listOpen() {
    return ResponseEntity.ok(
        new IncidentListResponse(
            stateMachine.openIncidents().stream().map(IncidentResponse::from).toList()));
  }

  @GetMapping("/{incidentId}")
  public ResponseEntity<IncidentResponse> get(@PathVariable("incidentId") UUID incidentId) {
    return ResponseEntity.ok(
        stateMachine
            .find(incidentId)
            .map(IncidentResponse::from)
            .orElseThrow(() -> new IncidentNotFoundException(incidentId)));
  }

  @PostMapping("/{incidentId}/acknowledge")
  public ResponseEntity<IncidentResponse> acknowledge(
      @PathVariable("incidentId") UUID incidentId, @RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(IncidentResponse.from(stateMachine.acknowledge(incidentId, userId)));
  }

  @PostMapping("/{incidentId}/escalate")
  public ResponseEntity<IncidentResponse> escalate(@PathVariable("incidentId") UUID incidentId) {
    return ResponseEntity.ok(IncidentResponse.from(stateMachine.escalate(incidentId)));
  }

  @PostMapping("/{incidentId}/resolve")
  public ResponseEntity<IncidentResponse> resolve(@PathVariable("incidentId") UUID incidentId) {
    return ResponseEntity.ok(IncidentResponse.from(stateMachine.resolve(incidentId)));
  }
}
