package com.acme.retry.spi;

import com.acme.retry.core.RetryMessage;
import java.io.IOException;

/** A message received from the main queue, together with the means to settle it. */
public interface RetryDelivery {

  RetryMessage message();

  long deliveryTag();

  boolean redelivered();

  void ack() throws IOException;

  void nack(boolean requeue) throws IOException;
}
