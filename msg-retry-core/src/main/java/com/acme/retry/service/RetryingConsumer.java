package com.acme.retry.service;

import com.acme.retry.backoff.DelayDecision;
import com.acme.retry.config.RetryCallOptions;
import com.acme.retry.config.RetryConfig;
import com.acme.retry.core.SubscriptionException;
import com.acme.retry.spi.BrokerChannel;
import com.acme.retry.spi.DeliveryListener;
import com.acme.retry.spi.RetryDelivery;
import java.io.IOException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consumer-side entry point: reads the main queue and reschedules failed deliveries. Bound to one
 * channel, so one instance per worker.
 */
public class RetryingConsumer {
  private static final Logger log = LoggerFactory.getLogger(RetryingConsumer.class);

  private final RetryConfig config;
  private final BrokerChannel channel;
  private final Republisher republisher;

  public RetryingConsumer(RetryConfig config, BrokerChannel channel) {
    this(config, channel, new Republisher(config));
  }

  public RetryingConsumer(RetryConfig config, BrokerChannel channel, Republisher republisher) {
    this.config = config;
    this.channel = channel;
    this.republisher = republisher;
  }

  public RetryConfig getConfig() {
    return config;
  }

  /**
   * Subscribes to the main queue. The returned stream is lazy and unbounded; it blocks waiting for
   * the next delivery and ends once the subscription ends. It cannot be restarted, call again for a
   * new subscription. Closing the stream cancels the subscription, and so does interrupting the
   * thread that waits on it.
   *
   * @throws SubscriptionException if the broker refused the subscription or the channel is closed
   */
  public Stream<RetryDelivery> consume() {
    DeliveryBuffer buffer = new DeliveryBuffer();
    String consumerTag;
    try {
      consumerTag = channel.subscribe(config.mainQueue(), buffer);
    } catch (IOException | RuntimeException e) {
      throw new SubscriptionException("Failed to consume from queue '" + config.mainQueue() + "'", e);
    }
    log.info("Consuming from {} with consumer tag {}", config.mainQueue(), consumerTag);
    buffer.onInterrupt = () -> cancel(consumerTag, buffer);

    return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(buffer, Spliterator.ORDERED | Spliterator.NONNULL),
            false)
        .onClose(() -> cancel(consumerTag, buffer));
  }

  public DelayDecision retry(RetryDelivery delivery, RetryCallOptions options) {
    return republisher.retry(delivery.message(), options, channel);
  }

  private void cancel(String consumerTag, DeliveryBuffer buffer) {
    if (buffer.ended) {
      return;
    }
    buffer.ended = true;
    try {
      channel.cancel(consumerTag);
    } catch (IOException | RuntimeException e) {
      throw new SubscriptionException("Failed to cancel consumer " + consumerTag, e);
    }
  }

  /** Hands deliveries from the broker's dispatch thread to the stream's consuming thread. */
  static final class DeliveryBuffer implements DeliveryListener, Iterator<RetryDelivery> {
    private static final Object END = new Object();

    private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();
    private Object next;
    private volatile boolean ended;
    private volatile Runnable onInterrupt;

    @Override
    public void onDelivery(RetryDelivery delivery) {
      queue.add(delivery);
    }

    @Override
    public void onSubscriptionEnd(String consumerTag, String reason) {
      log.info("Subscription {} ended: {}", consumerTag, reason);
      ended = true;
      queue.add(END);
    }

    @Override
    public boolean hasNext() {
      if (next == null) {
        try {
          next = queue.take();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          next = END;
          if (onInterrupt != null) {
            onInterrupt.run();
          }
        }
      }
      return next != END;
    }

    @Override
    public RetryDelivery next() {
      if (!hasNext()) {
        throw new NoSuchElementException("Subscription has ended");
      }
      RetryDelivery delivery = (RetryDelivery) next;
      next = null;
      return delivery;
    }
  }
}
