/*
 * Where: Alarm pipeline data access
 * What: Recipient lookups by house and by great-circle distance
 * Why: The notification router needs the radius query primitive over registered recipients
 */
package com.example.alarm.repository;

import com.example.alarm.model.GeoPoint;
import com.example.alarm.model.Recipient;
import com.example.alarm.model.RecipientRole;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class RecipientRepository {

  static final double EARTH_RADIUS_METERS = 6_371_000.0d;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** Recipients whose haversine distance from {@code point} is at most {@code radiusMeters}. */
  public List<Recipient> findWithinRadius(GeoPoint point, double radiusMeters) {
    // LEAST clamps rounding overshoot so ASIN never sees a value above 1
    final String sql =
        """
        SELECT recipient_id, house_id, role, push_token, phone_number, email, latitude, longitude
        FROM (
          SELECT r.*,
                 2 * :earthRadius * ASIN(LEAST(1, SQRT(
                   POWER(SIN(RADIANS(r.latitude - :latitude) / 2), 2)
                   + COS(RADIANS(:latitude)) * COS(RADIANS(r.latitude))
                     * POWER(SIN(RADIANS(r.longitude - :longitude) / 2), 2)
                 ))) AS distance_m
          FROM recipients r
        ) d
        WHERE d.distance_m <= :radius
        ORDER BY recipient_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("earthRadius", EARTH_RADIUS_METERS)
            .addValue("latitude", point.latitude())
            .addValue("longitude", point.longitude())
            .addValue("radius", radiusMeters);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<Recipient> findByHouseId(String houseId) {
    final String sql =
        """
        SELECT recipient_id, house_id, role, push_token, phone_number, email, latitude, longitude
        FROM recipients
        WHERE house_id = :houseId
        ORDER BY recipient_id
        """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource("houseId", houseId), this::mapRow);
  }

  public void upsert(Recipient recipient) {
    final String sql =
        """
        INSERT INTO recipients (
          recipient_id, house_id, role, push_token, phone_number, email, latitude, longitude
        ) VALUES (
          :recipientId, :houseId, :role, :pushToken, :phoneNumber, :email, :latitude, :longitude
        )
        ON CONFLICT (recipient_id) DO UPDATE SET
          house_id = EXCLUDED.house_id,
          role = EXCLUDED.role,
          push_token = EXCLUDED.push_token,
          phone_number = EXCLUDED.phone_number,
          email = EXCLUDED.email,
          latitude = EXCLUDED.latitude,
          longitude = EXCLUDED.longitude
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("recipientId", recipient.recipientId())
            .addValue("houseId", recipient.houseId())
            .addValue("role", recipient.role().name())
            .addValue("pushToken", recipient.pushToken())
            .addValue("phoneNumber", recipient.phoneNumber())
            .addValue("email", recipient.email())
            .addValue("latitude", recipient.location().latitude())
            .addValue("longitude", recipient.location().longitude());
    jdbcTemplate.update(sql, params);
  }

  private Recipient mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new Recipient(
        rs.getString("recipient_id"),
        rs.getString("house_id"),
        RecipientRole.valueOf(rs.getString("role")),
        rs.getString("push_token"),
        rs.getString("phone_number"),
        rs.getString("email"),
        new GeoPoint(rs.getDouble("latitude"), rs.getDouble("longitude")));
  }
}
