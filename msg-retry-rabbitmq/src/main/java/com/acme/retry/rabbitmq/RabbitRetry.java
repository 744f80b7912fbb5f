package com.acme.retry.rabbitmq;

import com.acme.retry.config.RetryConfig;
import com.acme.retry.config.RetryOptions;
import com.acme.retry.config.RetryTopologyConfig;
import com.acme.retry.service.RetryingConsumer;
import com.acme.retry.service.TopologyInitializer;
import com.rabbitmq.client.Channel;

/** Wires the retry orchestration onto a RabbitMQ channel. */
public final class RabbitRetry {

    private RabbitRetry() {}

    /**
     * Declares the retry topology on {@code channel} and returns a consumer bound to it.
     *
     * @throws com.acme.retry.core.TopologyException if a declaration fails
     */
    public static RetryingConsumer init(
            Channel channel, RetryTopologyConfig names, RetryOptions options) {
        RabbitBrokerChannel brokerChannel = new RabbitBrokerChannel(channel);
        RetryConfig config = new TopologyInitializer(brokerChannel).initialize(names, options);
        return new RetryingConsumer(config, brokerChannel);
    }
}
