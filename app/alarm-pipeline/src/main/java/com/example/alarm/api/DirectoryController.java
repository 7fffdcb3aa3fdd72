/*
 * Where: Alarm pipeline API
 * What: Maintains sensor placements and notification recipients used by routing
 */
package com.example.alarm.api;

import com.example.alarm.api.request.RecipientRequest;
import com.example.alarm.api.request.SensorPlacementRequest;
import com.example.alarm.device.SensorDirectory;
import com.example.alarm.model.GeoPoint;
import com.example.alarm.model.Recipient;
import com.example.alarm.model.RecipientRole;
import com.example.alarm.model.SensorPlacement;
import com.example.alarm.repository.RecipientRepository;
import jakarta.validation.Valid;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class DirectoryController {

  private final SensorDirectory sensorDirectory;
  private final RecipientRepository recipientRepository;

  @PutMapping("/sensors/{sensorId}/placement")
  public ResponseEntity<Void> putPlacement(
      @PathVariable("sensorId") String sensorId,
      @Valid @RequestBody SensorPlacementRequest request) {
    sensorDirectory.register(
        new SensorPlacement(
            sensorId,
            request.gatewayId(),
            request.houseId(),
            request.tenantId(),
            toPoint(request.latitude(), request.longitude())));
    return ResponseEntity.noContent().build();
  }

  @DeleteMapping("/sensors/{sensorId}/placement")
  public ResponseEntity<Void> deletePlacement(@PathVariable("sensorId") String sensorId) {
    sensorDirectory.remove(sensorId);
    return ResponseEntity.noContent().build();
  }

  @PutMapping("/recipients/{recipientId}")
  public ResponseEntity<Void> putRecipient(
      @PathVariable("recipientId") String recipientId,
      @Valid @RequestBody RecipientRequest request) {
    recipientRepository.upsert(
        new Recipient(
            recipientId,
            request.houseId(),
            RecipientRole.valueOf(request.role().toUpperCase(Locale.ROOT)),
            request.pushToken(),
            request.phoneNumber(),
            request.email(),
            new GeoPoint(request.latitude(), request.longitude())));
    return ResponseEntity.noContent().build();
  }

  private static GeoPoint toPoint(Double latitude, Double longitude) {
    if (latitude == null && longitude == null) {
      return null;
    }
    if (latitude == null || longitude == null) {
      throw new IllegalArgumentException("latitude and longitude must be given together");
    }
    return new GeoPoint(latitude, longitude);
  }
}
