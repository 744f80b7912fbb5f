package com.acme.retry.cli.config;

import com.acme.retry.config.RetryConfig;
import com.acme.retry.config.RetryTopologyConfig;
import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Settings read from a {@code .env} file, falling back to the process environment. */
public class CliConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(CliConfiguration.class);
    private static CliConfiguration instance;
    private final Dotenv dotenv;

    private CliConfiguration() {
        this(loadDotenv());
    }

    CliConfiguration(Dotenv dotenv) {
        this.dotenv = dotenv;
    }

    private static Dotenv loadDotenv() {
        try {
            Dotenv dotenv = Dotenv.configure()
                    .ignoreIfMissing()
                    .load();
            logger.info("Configuration loaded successfully");
            return dotenv;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to initialize configuration", e);
        }
    }

    public static synchronized CliConfiguration getInstance() {
        if (instance == null) {
            instance = new CliConfiguration();
        }
        return instance;
    }

    private String get(String key, String defaultValue) {
        String value = dotenv.get(key);
        return value != null && !value.isBlank() ? value : defaultValue;
    }

    private int getInt(String key, int defaultValue) {
        String value = dotenv.get(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value for {}: {}, using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    // RabbitMQ Configuration
    public String getRabbitmqHost() {
        return get("RABBITMQ_HOST", "localhost");
    }

    public int getRabbitmqPort() {
        return getInt("RABBITMQ_PORT", 5672);
    }

    public String getRabbitmqUser() {
        return get("RABBITMQ_USER", "guest");
    }

    public String getRabbitmqPassword() {
        return get("RABBITMQ_PASSWORD", "guest");
    }

    public String getRabbitmqVhost() {
        return get("RABBITMQ_VHOST", "/");
    }

    public int getRabbitmqConnectionTimeoutMillis() {
        return getInt("RABBITMQ_CONNECTION_TIMEOUT_MS", 10000);
    }

    // Retry topology
    public String getMainExchange() {
        return get("RETRY_MAIN_EXCHANGE", "main_exchange");
    }

    public String getMainQueue() {
        return get("RETRY_MAIN_QUEUE", "main_queue");
    }

    public String getRetryQueue() {
        return get("RETRY_RETRY_QUEUE", "retry_queue");
    }

    public String getMainRoutingKey() {
        return get("RETRY_MAIN_KEY", "main_key");
    }

    public String getRetryRoutingKey() {
        return get("RETRY_RETRY_KEY", "retry_key");
    }

    public int getMaxAttempts() {
        return getInt("RETRY_MAX_ATTEMPTS", RetryConfig.DEFAULT_MAX_ATTEMPTS);
    }

    public RetryTopologyConfig getTopologyConfig() {
        return new RetryTopologyConfig(
                getMainExchange(),
                getMainQueue(),
                getRetryQueue(),
                getMainRoutingKey(),
                getRetryRoutingKey());
    }
}
