package com.acme.retry.config;

import com.acme.retry.backoff.BackoffFunction;
import java.util.Objects;

/**
 * Resolved retry settings for one consumer: the topology names plus the attempt ceiling and the
 * backoff. Immutable, so a single instance can be shared by every worker of the consumer.
 */
public record RetryConfig(
    String mainExchange,
    String mainQueue,
    String retryQueue,
    String mainRoutingKey,
    String retryRoutingKey,
    int maxAttempts,
    BackoffFunction backoff) {

  public static final int DEFAULT_MAX_ATTEMPTS = 5;

  public RetryConfig {
    requireName(mainExchange, "mainExchange");
    requireName(mainQueue, "mainQueue");
    requireName(retryQueue, "retryQueue");
    requireName(mainRoutingKey, "mainRoutingKey");
    requireName(retryRoutingKey, "retryRoutingKey");
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be positive, got " + maxAttempts);
    }
    Objects.requireNonNull(backoff, "backoff");
  }

  static String requireName(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(field + " must not be blank");
    }
    return value;
  }
}
