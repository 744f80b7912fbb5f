package com.acme.retry.service;

import com.acme.retry.backoff.BackoffFunction;
import com.acme.retry.backoff.DefaultBackoff;
import com.acme.retry.config.RetryConfig;
import com.acme.retry.config.RetryOptions;
import com.acme.retry.config.RetryTopologyConfig;
import com.acme.retry.core.RetryHeaders;
import com.acme.retry.core.TopologyException;
import com.acme.retry.core.TopologyStep;
import com.acme.retry.spi.BrokerChannel;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Declares the exchange and queues that make delayed retry work without a scheduler.
 *
 * <p>Messages are consumed from the main queue. A retry is published to the retry queue with a
 * per-message TTL; nobody consumes the retry queue, so when the TTL elapses the broker dead-letters
 * the message to the main exchange under the main routing key, which puts it back on the main
 * queue.
 *
 * <p>There is no rollback when a step fails. Every declaration is idempotent on the broker, so
 * running {@link #initialize} again is the recovery path.
 */
public class TopologyInitializer {
  private static final Logger log = LoggerFactory.getLogger(TopologyInitializer.class);

  static final String EXCHANGE_TYPE_DIRECT = "direct";

  private final BrokerChannel channel;

  public TopologyInitializer(BrokerChannel channel) {
    this.channel = channel;
  }

  public RetryConfig initialize(RetryTopologyConfig names, RetryOptions options) {
    names.validate();
    String exchange = names.getMainExchange();

    run(
        TopologyStep.DECLARE_EXCHANGE,
        exchange,
        () -> channel.declareExchange(exchange, EXCHANGE_TYPE_DIRECT, true, false));

    run(
        TopologyStep.DECLARE_MAIN_QUEUE,
        names.getMainQueue(),
        () -> channel.declareQueue(names.getMainQueue(), true, mainQueueArguments()));
    run(
        TopologyStep.BIND_MAIN_QUEUE,
        names.getMainQueue(),
        () -> channel.bindQueue(names.getMainQueue(), exchange, names.getMainRoutingKey()));

    run(
        TopologyStep.DECLARE_RETRY_QUEUE,
        names.getRetryQueue(),
        () ->
            channel.declareQueue(
                names.getRetryQueue(), true, retryQueueArguments(exchange, names.getMainRoutingKey())));
    run(
        TopologyStep.BIND_RETRY_QUEUE,
        names.getRetryQueue(),
        () -> channel.bindQueue(names.getRetryQueue(), exchange, names.getRetryRoutingKey()));

    log.info(
        "Retry topology ready: exchange={}, mainQueue={} ({}), retryQueue={} ({}) -> {}/{}",
        exchange,
        names.getMainQueue(),
        names.getMainRoutingKey(),
        names.getRetryQueue(),
        names.getRetryRoutingKey(),
        exchange,
        names.getMainRoutingKey());

    return new RetryConfig(
        exchange,
        names.getMainQueue(),
        names.getRetryQueue(),
        names.getMainRoutingKey(),
        names.getRetryRoutingKey(),
        resolveMaxAttempts(options),
        resolveBackoff(options));
  }

  static Map<String, Object> mainQueueArguments() {
    Map<String, Object> args = new LinkedHashMap<>();
    args.put(RetryHeaders.QUEUE_TYPE, RetryHeaders.QUEUE_TYPE_QUORUM);
    return args;
  }

  static Map<String, Object> retryQueueArguments(String deadLetterExchange, String deadLetterKey) {
    Map<String, Object> args = new LinkedHashMap<>();
    args.put(RetryHeaders.DEAD_LETTER_EXCHANGE, deadLetterExchange);
    args.put(RetryHeaders.DEAD_LETTER_ROUTING_KEY, deadLetterKey);
    args.put(RetryHeaders.QUEUE_TYPE, RetryHeaders.QUEUE_TYPE_QUORUM);
    return args;
  }

  private static int resolveMaxAttempts(RetryOptions options) {
    if (options != null && options.getMaxAttempts().isPresent()) {
      int maxAttempts = options.getMaxAttempts().get();
      log.info("Using configured max-attempts: {}", maxAttempts);
      return maxAttempts;
    }
    log.info("'max-attempts' not set, using default: {}", RetryConfig.DEFAULT_MAX_ATTEMPTS);
    return RetryConfig.DEFAULT_MAX_ATTEMPTS;
  }

  private static BackoffFunction resolveBackoff(RetryOptions options) {
    if (options != null && options.getBackoff().isPresent()) {
      log.info("Using configured backoff function");
      return options.getBackoff().get();
    }
    return new DefaultBackoff();
  }

  private void run(TopologyStep step, String target, BrokerAction action) {
    try {
      action.run();
      log.debug("Topology step {} done for '{}'", step, target);
    } catch (IOException | RuntimeException e) {
      log.error("Topology step {} failed for '{}': {}", step, target, e.getMessage());
      throw new TopologyException(step, target, e);
    }
  }

  @FunctionalInterface
  private interface BrokerAction {
    void run() throws IOException;
  }
}
