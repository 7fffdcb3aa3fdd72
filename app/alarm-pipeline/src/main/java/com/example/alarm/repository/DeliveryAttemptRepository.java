/*
 * Where: Alarm pipeline data access
 * What: Append-only audit trail of notification delivery attempts
 * Why: Every attempt, sent or failed, is reviewable per (recipient, incident)
 */
package com.example.alarm.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.alarm.model.AttemptResult;
import com.example.alarm.model.DeliveryAttemptRecord;
import com.example.alarm.model.NotificationChannel;
import com.example.alarm.model.NotificationTier;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DeliveryAttemptRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT attempt_id, recipient_id, incident_id, task_id, channel, tier, attempt, result,
             terminal, error, attempted_at
      FROM delivery_attempts
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(DeliveryAttemptRecord record) {
    final String sql =
        """
        INSERT INTO delivery_attempts (
          attempt_id, recipient_id, incident_id, task_id, channel, tier, attempt, result,
          terminal, error, attempted_at
        ) VALUES (
          :attemptId, :recipientId, :incidentId, :taskId, :channel, :tier, :attempt, :result,
          :terminal, :error, :attemptedAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("attemptId", record.attemptId())
            .addValue("recipientId", record.recipientId())
            .addValue("incidentId", record.incidentId())
            .addValue("taskId", record.taskId())
            .addValue("channel", record.channel().name())
            .addValue("tier", record.tier().name())
            .addValue("attempt", record.attempt())
            .addValue("result", record.result().name())
            .addValue("terminal", record.terminal())
            .addValue("error", record.error())
            .addValue("attemptedAt", toTimestamp(record.attemptedAt()));
    jdbcTemplate.update(sql, params);
  }

  public List<DeliveryAttemptRecord> findByRecipientAndIncident(
      String recipientId, UUID incidentId) {
    final String sql =
        SELECT_COLUMNS
            + " WHERE recipient_id = :recipientId AND incident_id = :incidentId"
            + " ORDER BY attempted_at, attempt";
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("recipientId", recipientId)
            .addValue("incidentId", incidentId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /** Terminal failures, newest first. */
  public List<DeliveryAttemptRecord> findFailures(int limit) {
    final String sql =
        SELECT_COLUMNS
            + " WHERE terminal AND result NOT IN ('SENT', 'CANCELLED')"
            + " ORDER BY attempted_at DESC LIMIT :limit";
    return jdbcTemplate.query(sql, new MapSqlParameterSource("limit", limit), this::mapRow);
  }

  public int deleteOlderThan(Instant threshold) {
    return jdbcTemplate.update(
        "DELETE FROM delivery_attempts WHERE attempted_at < :threshold",
        new MapSqlParameterSource("threshold", toTimestamp(threshold)));
  }

  private DeliveryAttemptRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new DeliveryAttemptRecord(
        rs.getObject("attempt_id", UUID.class),
        rs.getString("recipient_id"),
        rs.getObject("incident_id", UUID.class),
        rs.getObject("task_id", UUID.class),
        NotificationChannel.valueOf(rs.getString("channel")),
        NotificationTier.valueOf(rs.getString("tier")),
        rs.getInt("attempt"),
        AttemptResult.valueOf(rs.getString("result")),
        rs.getBoolean("terminal"),
        rs.getString("error"),
        toInstant(rs.getTimestamp("attempted_at")));
  }
}
