package com.acme.retry.rabbitmq;

import com.acme.retry.core.RetryMessage;
import com.acme.retry.spi.BrokerChannel;
import com.acme.retry.spi.DeliveryListener;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import java.io.IOException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link BrokerChannel} over a RabbitMQ {@link Channel}. Like the channel it wraps, an instance
 * must not be used from several threads at once.
 */
public class RabbitBrokerChannel implements BrokerChannel {
    private static final Logger LOG = LoggerFactory.getLogger(RabbitBrokerChannel.class);

    private final Channel channel;

    public RabbitBrokerChannel(Channel channel) {
        this.channel = channel;
    }

    public Channel getChannel() {
        return channel;
    }

    @Override
    public void declareExchange(String exchange, String type, boolean durable, boolean autoDelete)
            throws IOException {
        channel.exchangeDeclare(exchange, type, durable, autoDelete, false, null);
    }

    @Override
    public void declareQueue(String queue, boolean durable, Map<String, Object> arguments)
            throws IOException {
        channel.queueDeclare(queue, durable, false, false, arguments);
    }

    @Override
    public void bindQueue(String queue, String exchange, String routingKey) throws IOException {
        channel.queueBind(queue, exchange, routingKey);
    }

    @Override
    public void publish(String exchange, String routingKey, RetryMessage message, String expiration)
            throws IOException {
        channel.basicPublish(
                exchange, routingKey, false, Mappers.toProperties(message, expiration), message.body());
    }

    @Override
    public String subscribe(String queue, DeliveryListener listener) throws IOException {
        return channel.basicConsume(queue, false, new ListenerConsumer(channel, listener));
    }

    @Override
    public void cancel(String consumerTag) throws IOException {
        channel.basicCancel(consumerTag);
    }

    /** Forwards deliveries and end-of-subscription signals to a {@link DeliveryListener}. */
    static class ListenerConsumer extends DefaultConsumer {
        private final DeliveryListener listener;

        ListenerConsumer(Channel channel, DeliveryListener listener) {
            super(channel);
            this.listener = listener;
        }

        @Override
        public void handleDelivery(
                String consumerTag, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
            listener.onDelivery(
                    new RabbitRetryDelivery(
                            getChannel(),
                            envelope.getDeliveryTag(),
                            envelope.isRedeliver(),
                            Mappers.toRetryMessage(properties, body)));
        }

        @Override
        public void handleCancelOk(String consumerTag) {
            listener.onSubscriptionEnd(consumerTag, "cancelled");
        }

        @Override
        public void handleCancel(String consumerTag) {
            LOG.warn("Consumer {} cancelled by broker", consumerTag);
            listener.onSubscriptionEnd(consumerTag, "cancelled by broker");
        }

        @Override
        public void handleShutdownSignal(String consumerTag, ShutdownSignalException sig) {
            LOG.warn("Channel shut down under consumer {}: {}", consumerTag, sig.getMessage());
            listener.onSubscriptionEnd(consumerTag, "shutdown: " + sig.getMessage());
        }
    }
}
