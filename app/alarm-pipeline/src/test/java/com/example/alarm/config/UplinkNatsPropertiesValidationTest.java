/*
 * Where: Alarm pipeline configuration validation tests
 * What: Bean Validation of UplinkNatsProperties
 */
package com.example.alarm.config;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class UplinkNatsPropertiesValidationTest {

  private static final String SUBJECT = "uplink.>";
  private static final String STREAM = "alarm-uplink";
  private static final String DURABLE = "alarm-pipeline-uplink";
  private static final Duration DUPLICATE_WINDOW = Duration.ofMinutes(2);
  private static final Duration ACK_WAIT = Duration.ofSeconds(30);
  private static final int MAX_DELIVER = 5;

  private Validator validator;

  @BeforeEach
  void setUp() {
    validator = Validation.buildDefaultValidatorFactory().getValidator();
  }

  @Test
  void validationPassesWhenAllFieldsValid() {
    final UplinkNatsProperties properties =
        new UplinkNatsProperties(SUBJECT, STREAM, DURABLE, DUPLICATE_WINDOW, ACK_WAIT, MAX_DELIVER);

    assertThat(validator.validate(properties)).isEmpty();
  }

  @Test
  void validationFailsWhenAckWaitIsZero() {
    final UplinkNatsProperties properties =
        new UplinkNatsProperties(
            SUBJECT, STREAM, DURABLE, DUPLICATE_WINDOW, Duration.ZERO, MAX_DELIVER);

    assertThat(validator.validate(properties)).isNotEmpty();
  }

  @Test
  void validationFailsWhenDuplicateWindowIsNegative() {
    final UplinkNatsProperties properties =
        new UplinkNatsProperties(
            SUBJECT, STREAM, DURABLE, Duration.ofSeconds(-1), ACK_WAIT, MAX_DELIVER);

    assertThat(validator.validate(properties)).isNotEmpty();
  }

  @Test
  void validationFailsWhenMaxDeliverIsZero() {
    final UplinkNatsProperties properties =
        new UplinkNatsProperties(SUBJECT, STREAM, DURABLE, DUPLICATE_WINDOW, ACK_WAIT, 0);

    assertThat(validator.validate(properties)).isNotEmpty();
  }

  @Test
  void validationFailsWhenSubjectIsBlank() {
    final UplinkNatsProperties properties =
        new UplinkNatsProperties(" ", STREAM, DURABLE, DUPLICATE_WINDOW, ACK_WAIT, MAX_DELIVER);

    assertThat(validator.validate(properties)).isNotEmpty();
  }
}
