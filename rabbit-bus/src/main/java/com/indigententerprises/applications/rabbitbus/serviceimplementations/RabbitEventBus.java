package com.indigententerprises.applications.rabbitbus.serviceimplementations;

import com.indigententerprises.applications.rabbitbus.infrastructure.RabbitConnection;
import com.indigententerprises.applications.rabbitbus.serviceinterfaces.PublishFailedException;
import com.indigententerprises.applications.toolkit.domain.Envelope;
import com.indigententerprises.applications.toolkit.domain.Event;
import com.indigententerprises.applications.toolkit.domain.EventType;
import com.indigententerprises.applications.toolkit.serviceinterfaces.DuplicateHandlerException;
import com.indigententerprises.applications.toolkit.serviceinterfaces.EventBus;
import com.indigententerprises.applications.toolkit.serviceinterfaces.EventHandler;

import com.fasterxml.jackson.databind.ObjectMapper;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.ShutdownSignalException;

import org.slf4j.Logger;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * event bus over a direct exchange. every handler consumes from its own durable queue, named after
 * the handler, so each handler receives every matching event once per deployment rather than once
 * per process.
 */
public class RabbitEventBus implements EventBus {

    private static final String DELIVERY_COUNT_HEADER = "x-delivery-count";

    private final RabbitConnection connection;
    private final ObjectMapper objectMapper;
    private final RabbitEventBusConfig config;
    private final Logger logger;
    private final ScheduledExecutorService requeueScheduler;
    private final Map<String, QueueSubscription<?>> subscriptionsByQueue = new ConcurrentHashMap<>();

    public RabbitEventBus(
            final RabbitConnection connection,
            final ObjectMapper objectMapper,
            final RabbitEventBusConfig config
    ) {
        this.connection = connection;
        this.objectMapper = objectMapper;
        this.config = config;
        this.logger = config.getLogger(RabbitEventBus.class);
        this.requeueScheduler = Executors.newSingleThreadScheduledExecutor(
                new CustomizableThreadFactory("rabbit-requeue-")
        );
        this.connection.addReconnectionListener(this::redeclareSubscriptions);
    }

    public void init() throws IOException, TimeoutException {
        connection.setupConnection();
    }

    @Override
    public <P> void subscribe(final EventType<P> eventType, final String handlerName, final EventHandler<P> handler) {
        final String queueName = config.getQueuePrefix() + toKebabCase(handlerName);
        final QueueSubscription<P> subscription = new QueueSubscription<>(eventType, handlerName, queueName, handler);

        if (subscriptionsByQueue.putIfAbsent(queueName, subscription) != null) {
            throw new DuplicateHandlerException("Handler " + handlerName + " already exists");
        }

        try {
            declareAndConsume(subscription);
        } catch (IOException e) {
            subscriptionsByQueue.remove(queueName);
            throw new UncheckedIOException("subscription of " + handlerName + " to " + eventType.name() + " failed", e);
        }
    }

    /**
     * returns once the broker has confirmed the message.
     *
     * @throws PublishFailedException when the message could not be sent or was not confirmed in time
     */
    @Override
    public synchronized void publish(final Event<?> event) {
        try {
            final byte[] body = objectMapper.writeValueAsBytes(
                    new Envelope(event.getName(), objectMapper.valueToTree(event.getPayload()))
            );
            final AMQP.BasicProperties properties = new AMQP.BasicProperties.Builder()
                    .contentType("application/json")
                    .deliveryMode(2)
                    .build();
            final Channel channel = connection.getProducerChannel();

            channel.basicPublish(config.getExchangeName(), event.getName(), properties, body);
            channel.waitForConfirmsOrDie(config.getConfirmTimeoutMs());
        } catch (IOException | TimeoutException | ShutdownSignalException e) {
            throw new PublishFailedException("event " + event.getName() + " was not confirmed by the broker", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PublishFailedException("interrupted while waiting for confirmation of " + event.getName(), e);
        }
    }

    public void terminate() throws IOException, TimeoutException {
        requeueScheduler.shutdownNow();
        connection.terminate();
    }

    void onMessage(final Channel channel, final String queueName, final Delivery delivery) {
        final long deliveryTag = delivery.getEnvelope().getDeliveryTag();
        final Envelope envelope = parse(delivery.getBody());

        if (envelope == null || !envelope.isComplete()) {
            nack(channel, deliveryTag, false);
            logger.warn("Message discarded due to invalid format");
            return;
        }

        final QueueSubscription<?> subscription = subscriptionsByQueue.get(queueName);

        if (subscription == null || !subscription.eventType().name().equals(envelope.name())) {
            nack(channel, deliveryTag, false);
            logger.warn("Message discarded due to missing handler for {}", envelope.name());
            return;
        }

        try {
            subscription.deliver(new Event<>(envelope.name(), envelope.payload()), objectMapper);
        } catch (Exception e) {
            onHandlerFailure(channel, delivery, envelope.name(), subscription.handlerName(), e);
            return;
        }

        try {
            channel.basicAck(deliveryTag, false);
        } catch (IOException | ShutdownSignalException e) {
            logger.warn("Unable to ack message {} of {}; the broker will redeliver it", deliveryTag, envelope.name(), e);
        }
    }

    private void onHandlerFailure(
            final Channel channel,
            final Delivery delivery,
            final String eventName,
            final String handlerName,
            final Exception failure
    ) {
        final long deliveryTag = delivery.getEnvelope().getDeliveryTag();
        final int deliveryCount = deliveryCount(delivery.getProperties());

        logger.warn("{} failed to handle {} event", handlerName, eventName, failure);

        if (deliveryCount < config.getMaxAttempts()) {
            final long delay = config.getRetryMechanism().getDelay(deliveryCount + 1);

            try {
                requeueScheduler.schedule(
                        () -> {
                            nack(channel, deliveryTag, true);
                            logger.warn("Message of {} re-queued for {} after {}ms", eventName, handlerName, delay);
                        },
                        delay,
                        TimeUnit.MILLISECONDS
                );
            } catch (RejectedExecutionException e) {
                logger.warn("Bus terminated; message of {} left to the broker", eventName);
            }
        } else {
            nack(channel, deliveryTag, false);
            logger.error("Message of {} sent to dlq after {} deliveries", eventName, deliveryCount, failure);
        }
    }

    private void declareAndConsume(final QueueSubscription<?> subscription) throws IOException {
        final Channel channel = connection.getConsumerChannel();
        final String queueName = subscription.queueName();

        channel.queueDeclare(
                queueName,
                true,
                false,
                false,
                Map.of(
                        "x-queue-type", "quorum",
                        "x-expires", config.getQueueExpirationMs(),
                        "x-dead-letter-exchange", config.getDeadLetterExchangeName()
                )
        );
        channel.queueBind(queueName, config.getExchangeName(), subscription.eventType().name());
        channel.basicConsume(
                queueName,
                false,
                (consumerTag, delivery) -> onMessage(channel, queueName, delivery),
                consumerTag -> logger.warn("Consumer of {} cancelled by the broker", queueName)
        );

        logger.debug("{} consuming {} from {}", subscription.handlerName(), subscription.eventType().name(), queueName);
    }

    private void redeclareSubscriptions() {
        for (final QueueSubscription<?> subscription : subscriptionsByQueue.values()) {
            try {
                declareAndConsume(subscription);
            } catch (IOException e) {
                logger.error("Unable to resume consumption of {}", subscription.queueName(), e);
            }
        }
    }

    private Envelope parse(final byte[] body) {
        try {
            return objectMapper.readValue(body, Envelope.class);
        } catch (IOException e) {
            logger.debug("Unparseable message body", e);
            return null;
        }
    }

    private void nack(final Channel channel, final long deliveryTag, final boolean requeue) {
        try {
            channel.basicNack(deliveryTag, false, requeue);
        } catch (IOException | ShutdownSignalException e) {
            logger.warn("Unable to nack message {}; the broker will redeliver it", deliveryTag, e);
        }
    }

    static int deliveryCount(final AMQP.BasicProperties properties) {
        if (properties == null || properties.getHeaders() == null) {
            return 0;
        }

        final Object count = properties.getHeaders().get(DELIVERY_COUNT_HEADER);
        return count instanceof Number number ? number.intValue() : 0;
    }

    static String toKebabCase(final String handlerName) {
        return handlerName.replaceAll("([a-z0-9])([A-Z])", "$1-$2").toLowerCase(Locale.ROOT);
    }

    private record QueueSubscription<P>(
            EventType<P> eventType,
            String handlerName,
            String queueName,
            EventHandler<P> handler
    ) {
        void deliver(final Event<?> event, final ObjectMapper objectMapper) throws Exception {
            handler.handle(eventType.coerce(event, objectMapper));
        }
    }
}
