/*
 * Where: Alarm pipeline repository integration tests
 * What: Haversine radius query and house lookup over recipients
 */
package com.example.alarm.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.alarm.AbstractPostgresContainerTest;
import com.example.alarm.model.GeoPoint;
import com.example.alarm.model.Recipient;
import com.example.alarm.model.RecipientRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class RecipientRepositoryTest extends AbstractPostgresContainerTest {

  private static final GeoPoint ORIGIN = new GeoPoint(35.6812d, 139.7671d);
  // one degree of latitude is about 111.2 km
  private static final double METERS_PER_DEGREE_LAT = 111_195.0d;

  @Autowired private RecipientRepository repository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM recipients", new MapSqlParameterSource());
  }

  @Test
  void findWithinRadiusUsesGreatCircleDistance() {
    repository.upsert(recipient("u-at-origin", "h-1", ORIGIN));
    repository.upsert(recipient("u-150m", "h-2", northOf(150)));
    repository.upsert(recipient("u-250m", "h-3", northOf(250)));

    assertThat(repository.findWithinRadius(ORIGIN, 200))
        .extracting(Recipient::recipientId)
        .containsExactly("u-150m", "u-at-origin");
    assertThat(repository.findWithinRadius(ORIGIN, 600))
        .extracting(Recipient::recipientId)
        .containsExactly("u-150m", "u-250m", "u-at-origin");
  }

  @Test
  void zeroRadiusMatchesOnlyTheExactPoint() {
    repository.upsert(recipient("u-at-origin", "h-1", ORIGIN));
    repository.upsert(recipient("u-150m", "h-2", northOf(150)));

    assertThat(repository.findWithinRadius(ORIGIN, 0))
        .extracting(Recipient::recipientId)
        .containsExactly("u-at-origin");
  }

  @Test
  void upsertReplacesContactsAndFindByHouse() {
    repository.upsert(recipient("u-1", "h-1", ORIGIN));
    repository.upsert(
        new Recipient("u-1", "h-1", RecipientRole.OCCUPANT, null, "+810000000", null, ORIGIN));
    repository.upsert(recipient("u-2", "h-2", ORIGIN));

    assertThat(repository.findByHouseId("h-1"))
        .singleElement()
        .satisfies(
            stored -> {
              assertThat(stored.pushToken()).isNull();
              assertThat(stored.phoneNumber()).isEqualTo("+810000000");
            });
  }

  private Recipient recipient(String id, String houseId, GeoPoint location) {
    return new Recipient(
        id, houseId, RecipientRole.OCCUPANT, "token-" + id, null, id + "@example.com", location);
  }

  private GeoPoint northOf(double meters) {
    return new GeoPoint(ORIGIN.latitude() + meters / METERS_PER_DEGREE_LAT, ORIGIN.longitude());
  }
}
