package com.example.alarm.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.alarm.device.SensorDirectory;
import com.example.alarm.model.GeoPoint;
import com.example.alarm.model.Recipient;
import com.example.alarm.model.RecipientRole;
import com.example.alarm.model.SensorPlacement;
import com.example.alarm.repository.RecipientRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(DirectoryController.class)
@Import(ApiExceptionHandler.class)
class DirectoryControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private SensorDirectory sensorDirectory;
  @MockitoBean private RecipientRepository recipientRepository;

  @Test
  void putPlacementRegistersSensor() throws Exception {
    mockMvc
        .perform(
            put("/v1/sensors/s-1/placement")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"gateway_id":"gw-1","house_id":"h-1","tenant_id":"t-1",
                     "latitude":35.0,"longitude":139.0}
                    """))
        .andExpect(status().isNoContent());

    verify(sensorDirectory)
        .register(new SensorPlacement("s-1", "gw-1", "h-1", "t-1", new GeoPoint(35.0d, 139.0d)));
  }

  @Test
  void placementWithHalfALocationIs400() throws Exception {
    mockMvc
        .perform(
            put("/v1/sensors/s-1/placement")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"gateway_id\":\"gw-1\",\"latitude\":35.0}"))
        .andExpect(status().isBadRequest());

    verifyNoInteractions(sensorDirectory);
  }

  @Test
  void deletePlacementRemovesSensor() throws Exception {
    mockMvc.perform(delete("/v1/sensors/s-1/placement")).andExpect(status().isNoContent());

    verify(sensorDirectory).remove("s-1");
  }

  @Test
  void putRecipientUpsertsWithRole() throws Exception {
    mockMvc
        .perform(
            put("/v1/recipients/u-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"house_id":"h-1","role":"emergency","phone_number":"+810000000",
                     "latitude":35.0,"longitude":139.0}
                    """))
        .andExpect(status().isNoContent());

    verify(recipientRepository)
        .upsert(
            new Recipient(
                "u-1",
                "h-1",
                RecipientRole.EMERGENCY,
                null,
                "+810000000",
                null,
                new GeoPoint(35.0d, 139.0d)));
  }

  @Test
  void recipientWithoutLocationIs400() throws Exception {
    mockMvc
        .perform(
            put("/v1/recipients/u-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"house_id\":\"h-1\",\"role\":\"occupant\"}"))
        .andExpect(status().isBadRequest());

    verify(recipientRepository, never()).upsert(any(Recipient.class));
  }
}
