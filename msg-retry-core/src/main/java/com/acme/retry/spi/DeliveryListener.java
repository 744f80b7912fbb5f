package com.acme.retry.spi;

/** Receives deliveries of a subscription started through {@link BrokerChannel#subscribe}. */
public interface DeliveryListener {

  void onDelivery(RetryDelivery delivery);

  /** The subscription is over: cancelled by either side or the channel shut down. */
  void onSubscriptionEnd(String consumerTag, String reason);
}
