/*
 * Where: Alarm pipeline data access
 * What: Registration placements of sensors (gateway, house, tenant, location)
 */
package com.example.alarm.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.alarm.model.GeoPoint;
import com.example.alarm.model.SensorPlacement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class SensorPlacementRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void upsert(SensorPlacement placement, Instant now) {
    final String sql =
        """
        INSERT INTO sensor_placements (
          sensor_id, gateway_id, house_id, tenant_id, latitude, longitude, updated_at
        ) VALUES (
          :sensorId, :gatewayId, :houseId, :tenantId, :latitude, :longitude, :updatedAt
        )
        ON CONFLICT (sensor_id) DO UPDATE SET
          gateway_id = EXCLUDED.gateway_id,
          house_id = EXCLUDED.house_id,
          tenant_id = EXCLUDED.tenant_id,
          latitude = EXCLUDED.latitude,
          longitude = EXCLUDED.longitude,
          updated_at = EXCLUDED.updated_at
        """;
    final GeoPoint location = placement.location();
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sensorId", placement.sensorId())
            .addValue("gatewayId", placement.gatewayId())
            .addValue("houseId", placement.houseId())
            .addValue("tenantId", placement.tenantId())
            .addValue("latitude", location == null ? null : location.latitude())
            .addValue("longitude", location == null ? null : location.longitude())
            .addValue("updatedAt", toTimestamp(now));
    jdbcTemplate.update(sql, params);
  }

  public Optional<SensorPlacement> findBySensorId(String sensorId) {
    final String sql =
        """
        SELECT sensor_id, gateway_id, house_id, tenant_id, latitude, longitude
        FROM sensor_placements
        WHERE sensor_id = :sensorId
        """;
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource("sensorId", sensorId), this::mapRow)
        .stream()
        .findFirst();
  }

  public List<SensorPlacement> findAll() {
    final String sql =
        """
        SELECT sensor_id, gateway_id, house_id, tenant_id, latitude, longitude
        FROM sensor_placements
        ORDER BY sensor_id
        """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  public int delete(String sensorId) {
    return jdbcTemplate.update(
        "DELETE FROM sensor_placements WHERE sensor_id = :sensorId",
        new MapSqlParameterSource("sensorId", sensorId));
  }

  private SensorPlacement mapRow(ResultSet rs, int rowNum) throws SQLException {
    final Double latitude = rs.getObject("latitude", Double.class);
    final Double longitude = rs.getObject("longitude", Double.class);
    return new SensorPlacement(
        rs.getString("sensor_id"),
        rs.getString("gateway_id"),
        rs.getString("house_id"),
        rs.getString("tenant_id"),
        latitude == null || longitude == null ? null : new GeoPoint(latitude, longitude));
  }
}
