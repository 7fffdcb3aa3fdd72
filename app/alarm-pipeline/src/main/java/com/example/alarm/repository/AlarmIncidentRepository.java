/*
 * Where: Alarm pipeline data access
 * What: Write-through persistence of alarm_incidents
 * Why: Open incidents survive a restart and resolved ones remain for audit until retention
 */
package com.example.alarm.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.alarm.model.AlarmIncident;
import com.example.alarm.model.IncidentState;
import com.example.alarm.model.Severity;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class AlarmIncidentRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT incident_id, sensor_id, gateway_id, severity, state, triggered_at, updated_at,
             acknowledged_by, acknowledged_at, escalated_at, resolved_at
      FROM alarm_incidents
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void upsert(AlarmIncident incident) {
    final String sql =
        """
        INSERT INTO alarm_incidents (
          incident_id, sensor_id, gateway_id, severity, state, triggered_at, updated_at,
          acknowledged_by, acknowledged_at, escalated_at, resolved_at
        ) VALUES (
          :incidentId, :sensorId, :gatewayId, :severity, :state, :triggeredAt, :updatedAt,
          :acknowledgedBy, :acknowledgedAt, :escalatedAt, :resolvedAt
        )
        ON CONFLICT (incident_id) DO UPDATE SET
          severity = EXCLUDED.severity,
          state = EXCLUDED.state,
          updated_at = EXCLUDED.updated_at,
          acknowledged_by = EXCLUDED.acknowledged_by,
          acknowledged_at = EXCLUDED.acknowledged_at,
          escalated_at = EXCLUDED.escalated_at,
          resolved_at = EXCLUDED.resolved_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("incidentId", incident.id())
            .addValue("sensorId", incident.sensorId())
            .addValue("gatewayId", incident.gatewayId())
            .addValue("severity", incident.severity().name())
            .addValue("state", incident.state().name())
            .addValue("triggeredAt", toTimestamp(incident.triggeredAt()))
            .addValue("updatedAt", toTimestamp(incident.updatedAt()))
            .addValue("acknowledgedBy", incident.acknowledgedBy())
            .addValue("acknowledgedAt", toTimestamp(incident.acknowledgedAt()))
            .addValue("escalatedAt", toTimestamp(incident.escalatedAt()))
            .addValue("resolvedAt", toTimestamp(incident.resolvedAt()));
    jdbcTemplate.update(sql, params);
  }

  public List<AlarmIncident> findOpen() {
    final String sql = SELECT_COLUMNS + " WHERE state <> 'RESOLVED' ORDER BY triggered_at";
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  public Optional<AlarmIncident> findById(UUID incidentId) {
    final String sql = SELECT_COLUMNS + " WHERE incident_id = :incidentId";
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource("incidentId", incidentId), this::mapRow)
        .stream()
        .findFirst();
  }

  public int deleteResolvedBefore(Instant threshold) {
    final String sql =
        "DELETE FROM alarm_incidents WHERE state = 'RESOLVED' AND resolved_at < :threshold";
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource("threshold", toTimestamp(threshold)));
  }

  private AlarmIncident mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new AlarmIncident(
        rs.getObject("incident_id", UUID.class),
        rs.getString("sensor_id"),
        rs.getString("gateway_id"),
        Severity.valueOf(rs.getString("severity")),
        IncidentState.valueOf(rs.getString("state")),
        toInstant(rs.getTimestamp("triggered_at")),
        toInstant(rs.getTimestamp("updated_at")),
        rs.getString("acknowledged_by"),
        toInstant(rs.getTimestamp("acknowledged_at")),
        toInstant(rs.getTimestamp("escalated_at")),
        toInstant(rs.getTimestamp("resolved_at")));
  }
}
