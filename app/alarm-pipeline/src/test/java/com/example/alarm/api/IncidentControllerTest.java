/*
 * Where: Alarm pipeline API tests
 * What: Incident endpoints, status mapping of lifecycle errors and snake_case bodies
 */
package com.example.alarm.api;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.alarm.incident.AlarmStateMachine;
import com.example.alarm.incident.IncidentNotFoundException;
import com.example.alarm.incident.InvalidTransitionException;
import com.example.alarm.model.AlarmIncident;
import com.example.alarm.model.IncidentState;
import com.example.alarm.model.Severity;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(IncidentController.class)
@Import(ApiExceptionHandler.class)
class IncidentControllerTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-03-01T10:00:00Z");
  private static final UUID INCIDENT_ID = UUID.fromString("6f1c2d3e-0000-4000-8000-000000000001");

  @MockitoBean private AlarmStateMachine stateMachine;

  @Autowired private MockMvc mockMvc;

  private final AlarmIncident incident =
      AlarmIncident.open(INCIDENT_ID, "s-1", "gw-1", Severity.HIGH, FIXED_NOW);

  @Test
  void listReturnsOpenIncidents() throws Exception {
    when(stateMachine.openIncidents()).thenReturn(List.of(incident));

    mockMvc
        .perform(get("/v1/incidents"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.incidents[0].incident_id").value(INCIDENT_ID.toString()))
        .andExpect(jsonPath("$.incidents[0].state").value("active"))
        .andExpect(jsonPath("$.incidents[0].triggered_at").value("2026-03-01T10:00:00Z"));
  }

  @Test
  void unknownIncidentIs404() throws Exception {
    when(stateMachine.find(INCIDENT_ID)).thenReturn(Optional.empty());

    mockMvc
        .perform(get("/v1/incidents/{id}", INCIDENT_ID))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("ALARM_INCIDENT_NOT_FOUND"));
  }

  @Test
  void acknowledgeUsesUserHeader() throws Exception {
    when(stateMachine.acknowledge(INCIDENT_ID, "operator-1"))
        .thenReturn(incident.acknowledge("operator-1", FIXED_NOW.plusSeconds(30)));

    mockMvc
        .perform(
            post("/v1/incidents/{id}/acknowledge", INCIDENT_ID)
                .header("X-User-Id", "operator-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.state").value("acknowledged"))
        .andExpect(jsonPath("$.acknowledged_by").value("operator-1"));
  }

  @Test
  void acknowledgeWithoutUserIs400() throws Exception {
    mockMvc
        .perform(post("/v1/incidents/{id}/acknowledge", INCIDENT_ID))
        .andExpect(status().isBadRequest());
  }

  @Test
  void illegalTransitionIs409() throws Exception {
    when(stateMachine.escalate(INCIDENT_ID))
        .thenThrow(
            new InvalidTransitionException(INCIDENT_ID, IncidentState.ACKNOWLEDGED, "escalate"));

    mockMvc
        .perform(post("/v1/incidents/{id}/escalate", INCIDENT_ID))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("ALARM_INVALID_TRANSITION"));
  }

  @Test
  void resolveOfUnknownIncidentIs404() throws Exception {
    when(stateMachine.resolve(INCIDENT_ID)).thenThrow(new IncidentNotFoundException(INCIDENT_ID));

    mockMvc
        .perform(post("/v1/incidents/{id}/resolve", INCIDENT_ID))
        .andExpect(status().isNotFound());
  }

  @Test
  void malformedIdIs400() throws Exception {
    mockMvc.perform(get("/v1/incidents/not-a-uuid")).andExpect(status().isBadRequest());
  }
}
