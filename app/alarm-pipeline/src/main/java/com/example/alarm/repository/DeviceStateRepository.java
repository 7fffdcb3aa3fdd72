/*
 * Where: Alarm pipeline data access
 * What: Write-through persistence of device_states
 * Why: Dashboards and restarts read the last known device status from PostgreSQL
 */
package com.example.alarm.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.alarm.model.DeviceKind;
import com.example.alarm.model.DeviceState;
import com.example.alarm.model.DeviceStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DeviceStateRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void upsert(DeviceState state) {
    final String sql =
        """
        INSERT INTO device_states (
          device_id, kind, parent_gateway_id, status, battery_level, signal_strength,
          firmware_version, last_heartbeat_at, updated_at
        ) VALUES (
          :deviceId, :kind, :parentGatewayId, :status, :batteryLevel, :signalStrength,
          :firmwareVersion, :lastHeartbeatAt, :updatedAt
        )
        ON CONFLICT (device_id) DO UPDATE SET
          kind = EXCLUDED.kind,
          parent_gateway_id = EXCLUDED.parent_gateway_id,
          status = EXCLUDED.status,
          battery_level = EXCLUDED.battery_level,
          signal_strength = EXCLUDED.signal_strength,
          firmware_version = EXCLUDED.firmware_version,
          last_heartbeat_at = EXCLUDED.last_heartbeat_at,
          updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("deviceId", state.id())
            .addValue("kind", state.kind().name())
            .addValue("parentGatewayId", state.parentGatewayId())
            .addValue("status", state.status().name())
            .addValue("batteryLevel", state.batteryLevel())
            .addValue("signalStrength", state.signalStrength())
            .addValue("firmwareVersion", state.firmwareVersion())
            .addValue("lastHeartbeatAt", toTimestamp(state.lastHeartbeatAt()))
            .addValue("updatedAt", toTimestamp(state.updatedAt()));
    jdbcTemplate.update(sql, params);
  }

  public int delete(String deviceId) {
    final String sql = "DELETE FROM device_states WHERE device_id = :deviceId";
    return jdbcTemplate.update(sql, new MapSqlParameterSource("deviceId", deviceId));
  }

  public Optional<DeviceState> findById(String deviceId) {
    final String sql =
        """
        SELECT device_id, kind, parent_gateway_id, status, battery_level, signal_strength,
               firmware_version, last_heartbeat_at, updated_at
        FROM device_states
        WHERE device_id = :deviceId
        """;
    final List<DeviceState> rows =
        jdbcTemplate.query(sql, new MapSqlParameterSource("deviceId", deviceId), this::mapRow);
    return rows.stream().findFirst();
  }

  public List<DeviceState> findAll() {
    final String sql =
        """
        SELECT device_id, kind, parent_gateway_id, status, battery_level, signal_strength,
               firmware_version, last_heartbeat_at, updated_at
        FROM device_states
        ORDER BY device_id
        """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  private DeviceState mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new DeviceState(
        rs.getString("device_id"),
        DeviceKind.valueOf(rs.getString("kind")),
        rs.getString("parent_gateway_id"),
        DeviceStatus.valueOf(rs.getString("status")),
        rs.getObject("battery_level", Double.class),
        rs.getObject("signal_strength", Double.class),
        rs.getString("firmware_version"),
        toInstant(rs.getTimestamp("last_heartbeat_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
