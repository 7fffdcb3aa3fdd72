package com.example.alarm.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.alarm.AbstractPostgresContainerTest;
import com.example.alarm.model.GeoPoint;
import com.example.alarm.model.SensorPlacement;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class SensorPlacementRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant BASE_TIME = Instant.parse("2026-03-01T10:00:00Z");

  @Autowired private SensorPlacementRepository repository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM sensor_placements", new MapSqlParameterSource());
  }

  @Test
  void upsertStoresLocationAndScope() {
    final SensorPlacement placement =
        new SensorPlacement("s-1", "gw-1", "h-1", "t-1", new GeoPoint(35.0d, 139.0d));
    repository.upsert(placement, BASE_TIME);

    assertThat(repository.findBySensorId("s-1")).contains(placement);
  }

  @Test
  void placementWithoutLocationIsAllowed() {
    repository.upsert(new SensorPlacement("s-1", "gw-1", null, null, null), BASE_TIME);
    repository.upsert(new SensorPlacement("s-1", "gw-2", "h-1", null, null), BASE_TIME);

    final SensorPlacement stored = repository.findBySensorId("s-1").orElseThrow();

    assertThat(stored.gatewayId()).isEqualTo("gw-2");
    assertThat(stored.location()).isNull();
  }

  @Test
  void deleteRemovesPlacement() {
    repository.upsert(new SensorPlacement("s-1", "gw-1", "h-1", null, null), BASE_TIME);

    assertThat(repository.delete("s-1")).isEqualTo(1);
    assertThat(repository.findAll()).isEmpty();
  }
}
