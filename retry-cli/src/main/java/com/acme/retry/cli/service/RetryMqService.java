package com.acme.retry.cli.service;

import com.acme.retry.cli.config.CliConfiguration;
import com.acme.retry.config.RetryCallOptions;
import com.acme.retry.config.RetryConfig;
import com.acme.retry.config.RetryOptions;
import com.acme.retry.config.RetryTopologyConfig;
import com.acme.retry.core.MaxAttemptsExceededException;
import com.acme.retry.core.RetryMessage;
import com.acme.retry.rabbitmq.Mappers;
import com.acme.retry.rabbitmq.RabbitRetry;
import com.acme.retry.service.RetryingConsumer;
import com.acme.retry.spi.RetryDelivery;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.stream.Stream;

/** RabbitMQ operations behind the CLI commands. Opens a connection per operation. */
public class RetryMqService {
    private static final Logger logger = LoggerFactory.getLogger(RetryMqService.class);

    private final ConnectionFactory factory;
    private final RetryTopologyConfig topology;

    public RetryMqService(CliConfiguration config) {
        this(newConnectionFactory(config), config.getTopologyConfig());
    }

    RetryMqService(ConnectionFactory factory, RetryTopologyConfig topology) {
        this.factory = factory;
        this.topology = topology;
    }

    static ConnectionFactory newConnectionFactory(CliConfiguration config) {
        ConnectionFactory factory = new ConnectionFactory();
        factory.setHost(config.getRabbitmqHost());
        factory.setPort(config.getRabbitmqPort());
        factory.setUsername(config.getRabbitmqUser());
        factory.setPassword(config.getRabbitmqPassword());
        factory.setVirtualHost(config.getRabbitmqVhost());
        factory.setConnectionTimeout(config.getRabbitmqConnectionTimeoutMillis());
        return factory;
    }

    public RetryTopologyConfig getTopology() {
        return topology;
    }

    public RetryConfig declareTopology(RetryOptions options) throws IOException, TimeoutException {
        try (Connection conn = factory.newConnection();
             Channel channel = conn.createChannel()) {
            return RabbitRetry.init(channel, topology, options).getConfig();
        }
    }

    /** Publishes a message to the main exchange under the main routing key. */
    public void publish(String body, String contentType) throws IOException, TimeoutException {
        RetryMessage message =
                new RetryMessage(body.getBytes(StandardCharsets.UTF_8), contentType, Map.of());
        try (Connection conn = factory.newConnection();
             Channel channel = conn.createChannel()) {
            channel.basicPublish(
                    topology.getMainExchange(),
                    topology.getMainRoutingKey(),
                    Mappers.toProperties(message, null),
                    message.body());
            logger.info("Published message to {}/{}", topology.getMainExchange(), topology.getMainRoutingKey());
        }
    }

    /**
     * Declares the topology, then retries every message read from the main queue and acks it.
     * Messages out of attempts are acked and dropped.
     *
     * @param limit stop after this many messages; 0 for no limit
     */
    public ConsumeSummary consume(RetryOptions options, RetryCallOptions callOptions, int limit)
            throws IOException, TimeoutException {
        try (Connection conn = factory.newConnection();
             Channel channel = conn.createChannel()) {
            channel.basicQos(1);
            RetryingConsumer consumer = RabbitRetry.init(channel, topology, options);
            logger.info("Ready to consume messages. Press Ctrl+C to exit.");
            return drain(consumer, callOptions, limit);
        }
    }

    static ConsumeSummary drain(RetryingConsumer consumer, RetryCallOptions callOptions, int limit)
            throws IOException {
        int retried = 0;
        int dropped = 0;
        try (Stream<RetryDelivery> deliveries = consumer.consume()) {
            Iterator<RetryDelivery> it = deliveries.iterator();
            while ((limit <= 0 || retried + dropped < limit) && it.hasNext()) {
                RetryDelivery delivery = it.next();
                logger.info(
                        "Received message: {}",
                        new String(delivery.message().body(), StandardCharsets.UTF_8));
                try {
                    consumer.retry(delivery, callOptions);
                    retried++;
                } catch (MaxAttemptsExceededException e) {
                    logger.warn("Dropping message after {} attempts", e.getMaxAttempts());
                    dropped++;
                }
                delivery.ack();
            }
        }
        return new ConsumeSummary(retried, dropped);
    }

    public record ConsumeSummary(int retried, int dropped) {
        public int total() {
            return retried + dropped;
        }
    }
}
