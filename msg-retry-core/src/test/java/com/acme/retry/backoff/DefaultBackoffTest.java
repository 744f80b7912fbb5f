package com.acme.retry.backoff;

import static org.assertj.core.api.Assertions.*;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class DefaultBackoffTest {

  @ParameterizedTest
  @ValueSource(ints = {1, 2, 3, 4, 5, 10})
  @DisplayName("delay stays within [base - 2, 2 * base - 3]")
  void testDelayWithinRange(int attempt) {
    DefaultBackoff backoff = new DefaultBackoff();
    long base = (long) Math.pow(attempt, 4) + 5;

    for (int i = 0; i < 200; i++) {
      assertThat(backoff.delaySeconds(attempt)).isBetween((int) base - 2, (int) (2 * base - 3));
    }
  }

  @Test
  @DisplayName("bounds of the first attempt are 4 and 9 seconds")
  void testFirstAttemptBounds() {
    assertThat(DefaultBackoff.baseDelaySeconds(1)).isEqualTo(6);
    assertThat(DefaultBackoff.minDelaySeconds(1)).isEqualTo(4);
    assertThat(DefaultBackoff.maxDelaySeconds(1)).isEqualTo(9);
  }

  @Test
  @DisplayName("jitter extremes map to the range ends")
  void testJitterExtremes() {
    Random lowest =
        new Random() {
          @Override
          public int nextInt(int bound) {
            return 0;
          }
        };
    Random highest =
        new Random() {
          @Override
          public int nextInt(int bound) {
            return bound - 1;
          }
        };

    assertThat(new DefaultBackoff(() -> lowest).delaySeconds(2)).isEqualTo(19);
    assertThat(new DefaultBackoff(() -> highest).delaySeconds(2)).isEqualTo(39);
  }

  @Test
  @DisplayName("seeded backoffs produce the same schedule")
  void testSeededIsDeterministic() {
    DefaultBackoff first = DefaultBackoff.seeded(42L);
    DefaultBackoff second = DefaultBackoff.seeded(42L);

    for (int attempt = 1; attempt <= 5; attempt++) {
      assertThat(first.delaySeconds(attempt)).isEqualTo(second.delaySeconds(attempt));
    }
  }

  @Test
  @DisplayName("jitter varies between messages at the same attempt")
  void testJitterSpreads() {
    DefaultBackoff backoff = DefaultBackoff.seeded(7L);
    Set<Integer> delays = new HashSet<>();

    for (int i = 0; i < 100; i++) {
      delays.add(backoff.delaySeconds(3));
    }

    assertThat(delays).hasSizeGreaterThan(1);
  }

  @Test
  @DisplayName("large attempt numbers do not overflow")
  void testLargeAttempt() {
    DefaultBackoff backoff = DefaultBackoff.seeded(1L);

    assertThat(DefaultBackoff.baseDelaySeconds(Integer.MAX_VALUE))
        .isEqualTo(DefaultBackoff.MAX_BASE_SECONDS);
    assertThat(backoff.delaySeconds(Integer.MAX_VALUE)).isPositive();
    assertThat(backoff.delaySeconds(1_000)).isPositive();
  }
}
