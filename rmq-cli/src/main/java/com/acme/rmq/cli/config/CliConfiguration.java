package com.acme.rmq.cli.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Settings read from environment variables, optionally overridden by a {@code .env} file in the
 * working directory.
 */
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
            logger.debug("Configuration loaded successfully");
            return dotenv;
        } catch (Exception e) {
            logger.warn("Failed to load .env file", e);
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

    // RabbitMQ connection
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

    public int getRabbitmqConnectionTimeoutMs() {
        return getInt("RABBITMQ_CONNECTION_TIMEOUT_MS", 10000);
    }

    // Output
    /** Messages per output file before rotating; {@code 0} writes a single file. */
    public int getMessagesPerFile() {
        return Math.max(0, getInt("RMQ_MESSAGES_PER_FILE", 0));
    }

    public int getShutdownGraceSeconds() {
        return Math.max(0, getInt("RMQ_SHUTDOWN_GRACE_SECONDS", 30));
    }
}
