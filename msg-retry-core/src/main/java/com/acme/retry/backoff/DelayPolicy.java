package com.acme.retry.backoff;

import com.acme.retry.config.RetryCallOptions;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides the delay of one retry. An explicit per-call delay wins over the backoff function;
 * otherwise the backoff is consulted and negative results are clamped to zero.
 */
public class DelayPolicy {
  private static final Logger log = LoggerFactory.getLogger(DelayPolicy.class);

  private final Clock clock;

  public DelayPolicy() {
    this(Clock.systemUTC());
  }

  public DelayPolicy(Clock clock) {
    this.clock = clock;
  }

  public int computeDelaySeconds(RetryCallOptions options, int attempt, BackoffFunction backoff) {
    if (options != null && options.getDelayInSeconds().isPresent()) {
      int delay = options.getDelayInSeconds().get();
      log.info("Using configured delay_in_second: {}", delay);
      return delay;
    }
    int delay = backoff.delaySeconds(attempt);
    if (delay < 0) {
      log.warn("Backoff returned negative delay {} for attempt {}, using 0", delay, attempt);
      return 0;
    }
    return delay;
  }

  public DelayDecision computeDelay(RetryCallOptions options, int attempt, BackoffFunction backoff) {
    int delaySeconds = computeDelaySeconds(options, attempt, backoff);
    Instant expiresAt = clock.instant().plusSeconds(delaySeconds);
    return new DelayDecision(delaySeconds, expiresAt);
  }
}
