package com.acme.retry.spi;

import com.acme.retry.core.RetryMessage;
import java.io.IOException;
import java.util.Map;

/**
 * The slice of a broker channel the retry orchestration needs. Implementations wrap a single
 * client channel and, like it, are not safe for concurrent use: callers serialize access, usually
 * with one channel per consumer worker.
 */
public interface BrokerChannel {

  void declareExchange(String exchange, String type, boolean durable, boolean autoDelete)
      throws IOException;

  void declareQueue(String queue, boolean durable, Map<String, Object> arguments)
      throws IOException;

  void bindQueue(String queue, String exchange, String routingKey) throws IOException;

  /**
   * Publishes a message.
   *
   * @param expiration per-message TTL in milliseconds as a decimal string, or {@code null} for
   *     none
   */
  void publish(String exchange, String routingKey, RetryMessage message, String expiration)
      throws IOException;

  /**
   * Starts a manual-ack subscription on {@code queue}.
   *
   * @return the consumer tag identifying the subscription
   */
  String subscribe(String queue, DeliveryListener listener) throws IOException;

  void cancel(String consumerTag) throws IOException;
}
