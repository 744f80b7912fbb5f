package com.acme.retry.cli.config;

import com.acme.retry.config.RetryTopologyConfig;
import io.github.cdimascio.dotenv.Dotenv;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CliConfigurationTest {

    @Test
    void testGetInstance_returnsSingleton() {
        CliConfiguration instance1 = CliConfiguration.getInstance();
        CliConfiguration instance2 = CliConfiguration.getInstance();

        assertThat(instance1).isSameAs(instance2);
    }

    @Test
    void testDefaults_whenNothingIsSet() {
        Dotenv dotenv = mock(Dotenv.class);
        when(dotenv.get(anyString())).thenReturn(null);
        CliConfiguration config = new CliConfiguration(dotenv);

        assertThat(config.getRabbitmqHost()).isEqualTo("localhost");
        assertThat(config.getRabbitmqPort()).isEqualTo(5672);
        assertThat(config.getRabbitmqUser()).isEqualTo("guest");
        assertThat(config.getRabbitmqVhost()).isEqualTo("/");
        assertThat(config.getMaxAttempts()).isEqualTo(5);

        RetryTopologyConfig names = config.getTopologyConfig();
        assertThat(names.getMainExchange()).isEqualTo("main_exchange");
        assertThat(names.getMainQueue()).isEqualTo("main_queue");
        assertThat(names.getRetryQueue()).isEqualTo("retry_queue");
        assertThat(names.getMainRoutingKey()).isEqualTo("main_key");
        assertThat(names.getRetryRoutingKey()).isEqualTo("retry_key");
    }

    @Test
    void testValues_fromEnvironment() {
        Dotenv dotenv = mock(Dotenv.class);
        when(dotenv.get(anyString())).thenReturn(null);
        when(dotenv.get("RABBITMQ_HOST")).thenReturn("rabbit.internal");
        when(dotenv.get("RABBITMQ_PORT")).thenReturn("5673");
        when(dotenv.get("RETRY_MAIN_QUEUE")).thenReturn("orders");
        when(dotenv.get("RETRY_MAX_ATTEMPTS")).thenReturn("3");
        CliConfiguration config = new CliConfiguration(dotenv);

        assertThat(config.getRabbitmqHost()).isEqualTo("rabbit.internal");
        assertThat(config.getRabbitmqPort()).isEqualTo(5673);
        assertThat(config.getTopologyConfig().getMainQueue()).isEqualTo("orders");
        assertThat(config.getMaxAttempts()).isEqualTo(3);
    }

    @Test
    void testInvalidInteger_fallsBackToDefault() {
        Dotenv dotenv = mock(Dotenv.class);
        when(dotenv.get(anyString())).thenReturn(null);
        when(dotenv.get("RABBITMQ_PORT")).thenReturn("not-a-port");
        when(dotenv.get("RETRY_MAX_ATTEMPTS")).thenReturn("");
        CliConfiguration config = new CliConfiguration(dotenv);

        assertThat(config.getRabbitmqPort()).isEqualTo(5672);
        assertThat(config.getMaxAttempts()).isEqualTo(5);
    }
}
