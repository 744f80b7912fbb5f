package com.acme.retry.service;

import com.acme.retry.backoff.DelayDecision;
import com.acme.retry.backoff.DelayPolicy;
import com.acme.retry.config.RetryCallOptions;
import com.acme.retry.config.RetryConfig;
import com.acme.retry.core.MaxAttemptsExceededException;
import com.acme.retry.core.PublishException;
import com.acme.retry.core.RetryCounter;
import com.acme.retry.core.RetryHeaders;
import com.acme.retry.core.RetryMessage;
import com.acme.retry.spi.BrokerChannel;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reschedules a failed message by publishing a copy to the retry queue with a TTL equal to the
 * computed delay. The broker dead-letters it back to the main queue once the TTL elapses.
 *
 * <p>Holds no channel of its own; the caller passes the channel of the worker that received the
 * message, so one instance can serve every worker.
 */
public class Republisher {
  private static final Logger log = LoggerFactory.getLogger(Republisher.class);

  private final RetryConfig config;
  private final DelayPolicy delayPolicy;

  public Republisher(RetryConfig config) {
    this(config, new DelayPolicy());
  }

  public Republisher(RetryConfig config, DelayPolicy delayPolicy) {
    this.config = config;
    this.delayPolicy = delayPolicy;
  }

  /**
   * @return the delay the message was scheduled with
   * @throws MaxAttemptsExceededException if the message already used all its attempts; nothing is
   *     published
   * @throws PublishException if the broker rejected the publish or the channel is closed
   */
  public DelayDecision retry(RetryMessage message, RetryCallOptions options, BrokerChannel channel) {
    int attempt = RetryCounter.getRetryCount(message);
    if (attempt > config.maxAttempts()) {
      log.warn("Max retry attempts reached ({}), not rescheduling", config.maxAttempts());
      throw new MaxAttemptsExceededException(attempt, config.maxAttempts());
    }

    DelayDecision decision =
        delayPolicy.computeDelay(
            options == null ? RetryCallOptions.none() : options, attempt, config.backoff());
    RetryMessage outgoing = message.withHeaders(buildRetryHeaders(message, attempt));

    log.info(
        "Attempt {}/{} with delay {} seconds. Retry at: {}",
        attempt,
        config.maxAttempts(),
        decision.delaySeconds(),
        decision.expiresAt());

    try {
      channel.publish(
          config.mainExchange(), config.retryRoutingKey(), outgoing, decision.expirationMillis());
    } catch (IOException | RuntimeException e) {
      throw new PublishException(
          "Failed to publish retry to exchange '"
              + config.mainExchange()
              + "' with key '"
              + config.retryRoutingKey()
              + "'",
          e);
    }
    return decision;
  }

  /** Shallow copy of the original headers with the retry count set to {@code attempt}. */
  static Map<String, Object> buildRetryHeaders(RetryMessage message, int attempt) {
    Map<String, Object> headers = new LinkedHashMap<>(message.headers());
    headers.put(RetryHeaders.RETRY_COUNT, attempt);
    return headers;
  }
}
