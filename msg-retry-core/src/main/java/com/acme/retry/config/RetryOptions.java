package com.acme.retry.config;

import com.acme.retry.backoff.BackoffFunction;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Overrides applied once, when the topology is initialized. Absent values fall back to the
 * defaults ({@value RetryConfig#DEFAULT_MAX_ATTEMPTS} attempts, {@link
 * com.acme.retry.backoff.DefaultBackoff}).
 */
public final class RetryOptions {
  private static final Logger log = LoggerFactory.getLogger(RetryOptions.class);

  public static final String MAX_ATTEMPTS_KEY = "max-attempts";
  public static final String BACKOFF_KEY = "backoff";

  private static final RetryOptions NONE = new RetryOptions(null, null);

  private final Integer maxAttempts;
  private final BackoffFunction backoff;

  private RetryOptions(Integer maxAttempts, BackoffFunction backoff) {
    if (maxAttempts != null && maxAttempts < 1) {
      throw new IllegalArgumentException("max-attempts must be positive, got " + maxAttempts);
    }
    this.maxAttempts = maxAttempts;
    this.backoff = backoff;
  }

  public static RetryOptions none() {
    return NONE;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Reads the recognized keys of a loosely typed option map. Values of the wrong type are ignored
   * with a notice, as are unknown keys.
   */
  public static RetryOptions fromMap(Map<String, ?> options) {
    if (options == null || options.isEmpty()) {
      return NONE;
    }
    Builder builder = builder();
    for (Map.Entry<String, ?> e : options.entrySet()) {
      Object value = e.getValue();
      switch (e.getKey()) {
        case MAX_ATTEMPTS_KEY -> {
          if (value instanceof Integer) {
            builder.maxAttempts((Integer) value);
          } else {
            log.warn("Ignoring '{}' of type {}, expected an integer", e.getKey(), typeOf(value));
          }
        }
        case BACKOFF_KEY -> {
          if (value instanceof BackoffFunction) {
            builder.backoff((BackoffFunction) value);
          } else {
            log.warn("Ignoring '{}' of type {}, expected a backoff function", e.getKey(), typeOf(value));
          }
        }
        default -> log.debug("Ignoring unrecognized retry option '{}'", e.getKey());
      }
    }
    return builder.build();
  }

  static String typeOf(Object value) {
    return value == null ? "null" : value.getClass().getSimpleName();
  }

  public Optional<Integer> getMaxAttempts() {
    return Optional.ofNullable(maxAttempts);
  }

  public Optional<BackoffFunction> getBackoff() {
    return Optional.ofNullable(backoff);
  }

  public static final class Builder {
    private Integer maxAttempts;
    private BackoffFunction backoff;

    private Builder() {}

    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    public Builder backoff(BackoffFunction backoff) {
      this.backoff = backoff;
      return this;
    }

    public RetryOptions build() {
      return new RetryOptions(maxAttempts, backoff);
    }
  }
}
