package com.acme.retry.config;

import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Overrides for a single retry call. */
public final class RetryCallOptions {
  private static final Logger log = LoggerFactory.getLogger(RetryCallOptions.class);

  public static final String DELAY_IN_SECOND_KEY = "delay_in_second";

  private static final RetryCallOptions NONE = new RetryCallOptions(null);

  private final Integer delayInSeconds;

  private RetryCallOptions(Integer delayInSeconds) {
    if (delayInSeconds != null && delayInSeconds < 0) {
      throw new IllegalArgumentException("delay_in_second must not be negative, got " + delayInSeconds);
    }
    this.delayInSeconds = delayInSeconds;
  }

  public static RetryCallOptions none() {
    return NONE;
  }

  /** Retry after exactly {@code seconds}, bypassing the backoff function. */
  public static RetryCallOptions delayInSeconds(int seconds) {
    return new RetryCallOptions(seconds);
  }

  public static RetryCallOptions fromMap(Map<String, ?> options) {
    if (options == null || options.isEmpty()) {
      return NONE;
    }
    RetryCallOptions result = NONE;
    for (Map.Entry<String, ?> e : options.entrySet()) {
      if (!DELAY_IN_SECOND_KEY.equals(e.getKey())) {
        log.debug("Ignoring unrecognized retry call option '{}'", e.getKey());
        continue;
      }
      if (e.getValue() instanceof Integer) {
        result = delayInSeconds((Integer) e.getValue());
      } else {
        log.warn(
            "Ignoring '{}' of type {}, expected an integer",
            e.getKey(),
            RetryOptions.typeOf(e.getValue()));
      }
    }
    return result;
  }

  public Optional<Integer> getDelayInSeconds() {
    return Optional.ofNullable(delayInSeconds);
  }
}
