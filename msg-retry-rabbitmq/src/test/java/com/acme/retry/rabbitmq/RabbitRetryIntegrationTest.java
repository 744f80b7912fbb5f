package com.acme.retry.rabbitmq;

import com.acme.retry.config.RetryCallOptions;
import com.acme.retry.config.RetryOptions;
import com.acme.retry.config.RetryTopologyConfig;
import com.acme.retry.core.MaxAttemptsExceededException;
import com.acme.retry.core.RetryHeaders;
import com.acme.retry.core.RetryMessage;
import com.acme.retry.service.Republisher;
import com.acme.retry.service.RetryingConsumer;
import com.acme.retry.spi.RetryDelivery;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.GetResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;
import org.testcontainers.containers.RabbitMQContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Testcontainers
@EnabledIfEnvironmentVariable(named = "RUN_INTEGRATION_TESTS", matches = "true")
class RabbitRetryIntegrationTest {

    @Container
    static RabbitMQContainer rabbit = new RabbitMQContainer("rabbitmq:3.13-management");

    private Connection connection;
    private Channel channel;
    private RetryTopologyConfig names;

    @BeforeEach
    void setUp() throws Exception {
        ConnectionFactory factory = new ConnectionFactory();
        factory.setHost(rabbit.getHost());
        factory.setPort(rabbit.getAmqpPort());
        factory.setUsername(rabbit.getAdminUsername());
        factory.setPassword(rabbit.getAdminPassword());
        connection = factory.newConnection();
        channel = connection.createChannel();
        names = new RetryTopologyConfig("it_exchange", "it_main_queue", "it_retry_queue", "it_main", "it_retry");
    }

    @AfterEach
    void tearDown() throws Exception {
        if (channel.isOpen()) {
            channel.queuePurge(names.getMainQueue());
            channel.queuePurge(names.getRetryQueue());
            channel.close();
        }
        connection.close();
    }

    private void publishToMain(String body) throws Exception {
        channel.basicPublish(names.getMainExchange(), names.getMainRoutingKey(),
                new AMQP.BasicProperties.Builder().contentType("text/plain").build(),
                body.getBytes(StandardCharsets.UTF_8));
    }

    private GetResponse poll(String queue, Duration timeout) throws Exception {
        Instant deadline = Instant.now().plus(timeout);
        while (Instant.now().isBefore(deadline)) {
            GetResponse response = channel.basicGet(queue, false);
            if (response != null) {
                return response;
            }
            Thread.sleep(100);
        }
        return null;
    }

    @Test
    void testRetriedMessageComesBackAfterTtl() throws Exception {
        RetryingConsumer consumer = RabbitRetry.init(channel, names, RetryOptions.none());
        publishToMain("order-1");

        GetResponse first = poll(names.getMainQueue(), Duration.ofSeconds(5));
        assertThat(first).isNotNull();
        RetryMessage message = Mappers.toRetryMessage(first.getProps(), first.getBody());
        assertThat(message.hasHeader(RetryHeaders.RETRY_COUNT)).isFalse();

        new Republisher(consumer.getConfig())
                .retry(message, RetryCallOptions.delayInSeconds(1), new RabbitBrokerChannel(channel));
        channel.basicAck(first.getEnvelope().getDeliveryTag(), false);

        GetResponse second = poll(names.getMainQueue(), Duration.ofSeconds(15));
        assertThat(second).isNotNull();
        assertThat(new String(second.getBody(), StandardCharsets.UTF_8)).isEqualTo("order-1");
        assertThat(second.getProps().getContentType()).isEqualTo("text/plain");
        assertThat(second.getProps().getHeaders().get(RetryHeaders.RETRY_COUNT)).isEqualTo(1);
        channel.basicAck(second.getEnvelope().getDeliveryTag(), false);
    }

    @Test
    void testConsumeStreamAndMaxAttempts() throws Exception {
        RetryingConsumer consumer = RabbitRetry.init(channel, names,
                RetryOptions.builder().maxAttempts(1).build());
        publishToMain("order-2");

        try (Stream<RetryDelivery> deliveries = consumer.consume()) {
            Iterator<RetryDelivery> it = deliveries.iterator();

            RetryDelivery first = it.next();
            consumer.retry(first, RetryCallOptions.delayInSeconds(1));
            first.ack();

            RetryDelivery second = it.next();
            assertThat(second.message().header(RetryHeaders.RETRY_COUNT)).isEqualTo(1);
            assertThatThrownBy(() -> consumer.retry(second, RetryCallOptions.none()))
                    .isInstanceOf(MaxAttemptsExceededException.class);
            second.ack();
        }
    }

    @Test
    void testInitializeIsIdempotent() {
        RabbitRetry.init(channel, names, RetryOptions.none());
        RetryingConsumer again = RabbitRetry.init(channel, names, RetryOptions.none());

        assertThat(again.getConfig().maxAttempts()).isEqualTo(5);
    }
}
