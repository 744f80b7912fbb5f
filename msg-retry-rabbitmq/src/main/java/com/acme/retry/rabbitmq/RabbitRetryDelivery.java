package com.acme.retry.rabbitmq;

import com.acme.retry.core.RetryMessage;
import com.acme.retry.spi.RetryDelivery;
import com.rabbitmq.client.Channel;
import java.io.IOException;

/** A delivery received on a RabbitMQ channel; settled on the same channel. */
class RabbitRetryDelivery implements RetryDelivery {

    private final Channel channel;
    private final long deliveryTag;
    private final boolean redelivered;
    private final RetryMessage message;

    RabbitRetryDelivery(Channel channel, long deliveryTag, boolean redelivered, RetryMessage message) {
        this.channel = channel;
        this.deliveryTag = deliveryTag;
        this.redelivered = redelivered;
        this.message = message;
    }

    @Override
    public RetryMessage message() {
        return message;
    }

    @Override
    public long deliveryTag() {
        return deliveryTag;
    }

    @Override
    public boolean redelivered() {
        return redelivered;
    }

    @Override
    public void ack() throws IOException {
        channel.basicAck(deliveryTag, false);
    }

    @Override
    public void nack(boolean requeue) throws IOException {
        channel.basicNack(deliveryTag, false, requeue);
    }
}
