/*
 * Where: Alarm pipeline API
 * What: Read access to the delivery audit trail
 * Why: Compliance review of failed and retried notifications
 */
package com.example.alarm.api;

import com.example.alarm.api.response.DeliveryAttemptListResponse;
import com.example.alarm.api.response.DeliveryAttemptResponse;
import com.example.alarm.dispatch.DeliveryAuditTrail;
import com.example.alarm.model.DeliveryAttemptRecord;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/deliveries")
@RequiredArgsConstructor
public class DeliveryController {

  private static final int MAX_LIMIT = 500;
  private final DeliveryAuditTrail auditTrail;

  @GetMapping("/failures")
  public ResponseEntity<DeliveryAttemptListResponse> failures(
      @RequestParam(name = "limit", defaultValue = "50") int limit) {
    if (limit < 1 || limit > MAX_LIMIT) {
      throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
    }
    return ResponseEntity.ok(toResponse(auditTrail.findFailures(limit)));
  }

  @GetMapping("/audit")
  public ResponseEntity<DeliveryAttemptListResponse> audit(
      @RequestParam("recipientId") String recipientId,
      @RequestParam("incidentId") UUID incidentId) {
    return ResponseEntity.ok(
        toResponse(auditTrail.findByRecipientAndIncident(recipientId, incidentId)));
  }

  private DeliveryAttemptListResponse toResponse(List<DeliveryAttemptRecord> records) {
    return new DeliveryAttemptListResponse(
        records.stream().map(DeliveryAttemptResponse::from).toList());
  }
}
