package com.indigententerprises.applications.rabbitbus.infrastructure;

import com.indigententerprises.applications.rabbitbus.serviceimplementations.RabbitEventBusConfig;

import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ShutdownSignalException;

import org.slf4j.Logger;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.io.IOException;
import java.net.URISyntaxException;
import java.security.GeneralSecurityException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * owns the broker connection, a consumer channel and a confirm-mode producer channel.
 * the client's own recovery is off: a lost connection is rebuilt from scratch after a fixed delay
 * and listeners are told so they can re-declare what lives on the new channels.
 */
public class RabbitConnection {

    private final ConnectionFactory connectionFactory;
    private final RabbitEventBusConfig config;
    private final Logger logger;
    private final ScheduledExecutorService reconnectionScheduler;
    private final List<Runnable> reconnectionListeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean waiting = new AtomicBoolean(false);

    private volatile boolean stopping;
    private volatile Connection connection;
    private volatile Channel consumerChannel;
    private volatile Channel producerChannel;

    public RabbitConnection(final ConnectionFactory connectionFactory, final RabbitEventBusConfig config) {
        this.connectionFactory = connectionFactory;
        this.connectionFactory.setAutomaticRecoveryEnabled(false);
        this.connectionFactory.setTopologyRecoveryEnabled(false);
        this.config = config;
        this.logger = config.getLogger(RabbitConnection.class);
        this.reconnectionScheduler = Executors.newSingleThreadScheduledExecutor(
                new CustomizableThreadFactory("rabbit-reconnection-")
        );
    }

    public static RabbitConnection fromUri(final RabbitEventBusConfig config) {
        final ConnectionFactory connectionFactory = new ConnectionFactory();

        try {
            connectionFactory.setUri(config.getAmqpUri());
        } catch (URISyntaxException | GeneralSecurityException e) {
            throw new IllegalArgumentException("invalid amqp uri", e);
        }

        return new RabbitConnection(connectionFactory, config);
    }

    public synchronized void setupConnection() throws IOException, TimeoutException {
        logger.debug("Starting Rabbit connection");
        stopping = false;

        try {
            final Connection created = connectionFactory.newConnection();
            connection = created;
            created.addShutdownListener(cause -> onShutdown("Connection", created, cause));

            final Channel consumer = created.createChannel();
            consumerChannel = consumer;
            consumer.basicQos(config.getConsumerPrefetch());
            consumer.addShutdownListener(cause -> onShutdown("Consumer channel", consumer, cause));

            final Channel producer = created.createChannel();
            producerChannel = producer;
            producer.confirmSelect();
            producer.addShutdownListener(cause -> onShutdown("Producer channel", producer, cause));

            declareTopology();
        } catch (IOException | TimeoutException e) {
            logger.error("Error connecting to rabbit", e);
            throw e;
        }

        logger.debug("Rabbit connection established");
    }

    public Channel getConsumerChannel() {
        return consumerChannel;
    }

    public Channel getProducerChannel() {
        return producerChannel;
    }

    public void addReconnectionListener(final Runnable listener) {
        reconnectionListeners.add(listener);
    }

    public synchronized void terminate() throws IOException, TimeoutException {
        logger.debug("Stopping rabbit connection");
        stopping = true;
        reconnectionScheduler.shutdownNow();

        if (connection != null && connection.isOpen()) {
            connection.close();
        }

        logger.debug("Rabbit connection stopped");
    }

    private void declareTopology() throws IOException {
        producerChannel.exchangeDeclare(config.getExchangeName(), BuiltinExchangeType.DIRECT, true);
        producerChannel.exchangeDeclare(config.getDeadLetterExchangeName(), BuiltinExchangeType.TOPIC, true);

        consumerChannel.queueDeclare(
                config.getDeadLetterQueueName(),
                true,
                false,
                false,
                Map.of("x-queue-type", "quorum")
        );
        consumerChannel.queueBind(config.getDeadLetterQueueName(), config.getDeadLetterExchangeName(), "#");
    }

    /**
     * the client closes a channel itself on a confirm timeout or nack, so an application-initiated
     * close is as much a reason to reconnect as a broker-initiated one. only a deliberate stop and
     * closes of objects already replaced are ignored.
     */
    private void onShutdown(final String what, final Object source, final ShutdownSignalException cause) {
        if (stopping || (source != connection && source != consumerChannel && source != producerChannel)) {
            return;
        }

        logger.error("{} with rabbit closed, trying to reconnect", what, cause);
        scheduleReconnection();
    }

    private void scheduleReconnection() {
        if (!waiting.compareAndSet(false, true)) {
            logger.warn("Reconnection already scheduled");
            return;
        }

        reconnectionScheduler.schedule(this::reconnect, config.getReconnectionDelayMs(), TimeUnit.MILLISECONDS);
    }

    private void reconnect() {
        waiting.set(false);

        if (stopping) {
            return;
        }

        closeStaleConnection();

        try {
            setupConnection();

            for (final Runnable listener : reconnectionListeners) {
                listener.run();
            }
        } catch (IOException | TimeoutException | RuntimeException e) {
            logger.error("Unable to connect with rabbit, scheduling a new connection", e);
            scheduleReconnection();
        }
    }

    private void closeStaleConnection() {
        final Connection stale = connection;
        connection = null;
        consumerChannel = null;
        producerChannel = null;

        if (stale != null && stale.isOpen()) {
            try {
                stale.abort();
            } catch (RuntimeException e) {
                logger.debug("Stale rabbit connection could not be aborted", e);
            }
        }
    }
}
