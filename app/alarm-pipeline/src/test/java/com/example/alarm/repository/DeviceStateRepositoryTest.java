package com.example.alarm.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.alarm.AbstractPostgresContainerTest;
import com.example.alarm.model.DeviceKind;
import com.example.alarm.model.DeviceState;
import com.example.alarm.model.DeviceStatus;
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
class DeviceStateRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant BASE_TIME = Instant.parse("2026-03-01T10:00:00Z");

  @Autowired private DeviceStateRepository repository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM device_states", new MapSqlParameterSource());
  }

  @Test
  void upsertOverwritesPreviousState() {
    final DeviceState registered =
        DeviceState.register("s-1", DeviceKind.SENSOR, "gw-1", BASE_TIME);
    repository.upsert(registered);
    final DeviceState heard =
        registered
            .heardAt(BASE_TIME.plusSeconds(10))
            .withTelemetry(2.9d, -71.0d, BASE_TIME.plusSeconds(10))
            .withFirmware("1.4.2", BASE_TIME.plusSeconds(10));
    repository.upsert(heard);

    final DeviceState stored = repository.findById("s-1").orElseThrow();

    assertThat(stored).isEqualTo(heard);
    assertThat(stored.status()).isEqualTo(DeviceStatus.ONLINE);
  }

  @Test
  void nullableTelemetryRoundTripsAsNull() {
    repository.upsert(DeviceState.register("gw-1", DeviceKind.GATEWAY, null, BASE_TIME));

    final DeviceState stored = repository.findById("gw-1").orElseThrow();

    assertThat(stored.batteryLevel()).isNull();
    assertThat(stored.signalStrength()).isNull();
    assertThat(stored.parentGatewayId()).isNull();
    assertThat(stored.lastHeartbeatAt()).isNull();
  }

  @Test
  void deleteRemovesDevice() {
    repository.upsert(DeviceState.register("s-1", DeviceKind.SENSOR, "gw-1", BASE_TIME));
    repository.upsert(DeviceState.register("s-2", DeviceKind.SENSOR, "gw-1", BASE_TIME));

    assertThat(repository.delete("s-1")).isEqualTo(1);
    assertThat(repository.delete("s-1")).isZero();
    assertThat(repository.findAll()).extracting(DeviceState::id).containsExactly("s-2");
  }
}
