package com.acme.retry.backoff;

import java.time.Instant;

/** How long a retry waits in the retry queue and when it is due back on the main queue. */
public record DelayDecision(int delaySeconds, Instant expiresAt) {

  public long delayMillis() {
    return delaySeconds * 1000L;
  }

  /** Per-message TTL in the form the AMQP {@code expiration} property expects. */
  public String expirationMillis() {
    return String.valueOf(delayMillis());
  }
}
