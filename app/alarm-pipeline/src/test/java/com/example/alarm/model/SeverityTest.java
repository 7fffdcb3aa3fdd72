package com.example.alarm.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class SeverityTest {

  @Test
  void tiersAreOrderedLowToCritical() {
    assertThat(Severity.MEDIUM.isHigherThan(Severity.LOW)).isTrue();
    assertThat(Severity.HIGH.isHigherThan(Severity.HIGH)).isFalse();
    assertThat(Severity.HIGH.isAtLeast(Severity.HIGH)).isTrue();
    assertThat(Severity.LOW.isAtLeast(Severity.MEDIUM)).isFalse();
  }

  @Test
  void raisedStopsAtCritical() {
    assertThat(Severity.LOW.raised()).isEqualTo(Severity.MEDIUM);
    assertThat(Severity.HIGH.raised()).isEqualTo(Severity.CRITICAL);
    assertThat(Severity.CRITICAL.raised()).isEqualTo(Severity.CRITICAL);
  }

  @Test
  void fromValueIsCaseInsensitiveAndRejectsUnknown() {
    assertThat(Severity.fromValue("Critical")).isEqualTo(Severity.CRITICAL);
    assertThatThrownBy(() -> Severity.fromValue("extreme"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
