package com.acme.rmq.cli.service;

import com.acme.rmq.cli.config.CliConfiguration;
import com.acme.rmq.retrieval.broker.ChannelProvider;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Owns the broker connection of one CLI invocation and hands out channels on it.
 */
public class RabbitConnectionService implements ChannelProvider, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(RabbitConnectionService.class);
    private static final String CONNECTION_NAME = "rmq-cli";

    private final ConnectionFactory factory;
    private Connection connection;

    public RabbitConnectionService(CliConfiguration config) {
        this(createFactory(config));
    }

    public RabbitConnectionService(ConnectionFactory factory) {
        this.factory = factory;
    }

    private static ConnectionFactory createFactory(CliConfiguration config) {
        ConnectionFactory factory = new ConnectionFactory();
        factory.setHost(config.getRabbitmqHost());
        factory.setPort(config.getRabbitmqPort());
        factory.setUsername(config.getRabbitmqUser());
        factory.setPassword(config.getRabbitmqPassword());
        factory.setVirtualHost(config.getRabbitmqVhost());
        factory.setConnectionTimeout(config.getRabbitmqConnectionTimeoutMs());
        logger.debug("Connecting to {}:{} (vhost '{}')",
                config.getRabbitmqHost(), config.getRabbitmqPort(), config.getRabbitmqVhost());
        return factory;
    }

    private synchronized Connection getConnection() throws IOException {
        if (connection == null || !connection.isOpen()) {
            try {
                connection = factory.newConnection(CONNECTION_NAME);
                logger.debug("RabbitMQ connection established");
            } catch (TimeoutException e) {
                throw new IOException("Timed out connecting to RabbitMQ at "
                        + factory.getHost() + ":" + factory.getPort(), e);
            }
        }
        return connection;
    }

    @Override
    public Channel openChannel() throws IOException {
        Channel channel = getConnection().createChannel();
        if (channel == null) {
            throw new IOException("No channel available on the RabbitMQ connection");
        }
        return channel;
    }

    @Override
    public synchronized void close() {
        if (connection != null && connection.isOpen()) {
            try {
                connection.close();
                logger.debug("RabbitMQ connection closed");
            } catch (IOException e) {
                logger.error("Error closing RabbitMQ connection", e);
            }
        }
    }
}
