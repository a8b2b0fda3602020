package com.indigententerprises.applications.rabbitbus.serviceimplementations;

import com.indigententerprises.applications.rabbitbus.infrastructure.RabbitConnection;
import com.indigententerprises.applications.rabbitbus.serviceinterfaces.PublishFailedException;
import com.indigententerprises.applications.toolkit.domain.EventType;
import com.indigententerprises.applications.toolkit.serviceimplementations.ExponentialBackoff;
import com.indigententerprises.applications.toolkit.serviceinterfaces.DuplicateHandlerException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.CancelCallback;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DeliverCallback;
import com.rabbitmq.client.Delivery;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
public class RabbitEventBusTest {

    public record Shipment(String parcel) {}

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final EventType<Shipment> SHIPPED = EventType.of("Shipped", Shipment.class);
    private static final String QUEUE = "svc.shipment-notifier";

    @Mock
    private RabbitConnection connection;

    @Mock
    private Channel consumerChannel;

    @Mock
    private Channel producerChannel;

    @Mock
    private Channel reconnectedChannel;

    private final List<Shipment> handled = new CopyOnWriteArrayList<>();

    private RabbitEventBus eventBus;

    @BeforeEach
    public void setUp() {
        lenient().when(connection.getConsumerChannel()).thenReturn(consumerChannel);
        lenient().when(connection.getProducerChannel()).thenReturn(producerChannel);

        eventBus = new RabbitEventBus(
                connection,
                OBJECT_MAPPER,
                RabbitEventBusConfig.builder("amqp://localhost", "events")
                        .queuePrefix("svc.")
                        .maxAttempts(3)
                        .retryMechanism(new ExponentialBackoff(10L))
                        .build()
        );
    }

    @AfterEach
    public void tearDown() throws Exception {
        eventBus.terminate();
    }

    @Test
    public void testSubscribeDeclaresQuorumQueueNamedAfterHandler() throws Exception {
        eventBus.subscribe(SHIPPED, "ShipmentNotifier", event -> handled.add(event.getPayload()));

        verify(consumerChannel).queueDeclare(
                eq(QUEUE),
                eq(true),
                eq(false),
                eq(false),
                argThat(arguments -> "quorum".equals(arguments.get("x-queue-type"))
                        && Long.valueOf(1_800_000L).equals(arguments.get("x-expires"))
                        && "events.dlx".equals(arguments.get("x-dead-letter-exchange")))
        );
        verify(consumerChannel).queueBind(QUEUE, "events", "Shipped");
        verify(consumerChannel).basicConsume(eq(QUEUE), eq(false), any(DeliverCallback.class), any(CancelCallback.class));
    }

    @Test
    public void testSubscriptionsAreRedeclaredAfterReconnection() throws Exception {
        final ArgumentCaptor<Runnable> reconnectionListener = ArgumentCaptor.forClass(Runnable.class);
        verify(connection).addReconnectionListener(reconnectionListener.capture());

        eventBus.subscribe(SHIPPED, "ShipmentNotifier", event -> handled.add(event.getPayload()));
        eventBus.subscribe(SHIPPED, "ShipmentAuditor", event -> {});

        lenient().when(connection.getConsumerChannel()).thenReturn(reconnectedChannel);
        reconnectionListener.getValue().run();

        for (final String queue : List.of(QUEUE, "svc.shipment-auditor")) {
            verify(reconnectedChannel).queueDeclare(eq(queue), eq(true), eq(false), eq(false), any());
            verify(reconnectedChannel).queueBind(queue, "events", "Shipped");
            verify(reconnectedChannel).basicConsume(eq(queue), eq(false), any(DeliverCallback.class), any(CancelCallback.class));
        }
    }

    @Test
    public void testHandlersResolvingToSameQueueAreRejected() {
        eventBus.subscribe(SHIPPED, "ShipmentNotifier", event -> {});

        Assertions.assertThrows(
                DuplicateHandlerException.class,
                () -> eventBus.subscribe(SHIPPED, "shipmentNotifier", event -> {})
        );
    }

    @Test
    public void testPublishWaitsForConfirmation() throws Exception {
        eventBus.publish(SHIPPED.create(new Shipment("p-1")));

        final ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
        verify(producerChannel).basicPublish(eq("events"), eq("Shipped"), any(AMQP.BasicProperties.class), body.capture());
        verify(producerChannel).waitForConfirmsOrDie(5000L);

        final JsonNode envelope = OBJECT_MAPPER.readTree(body.getValue());
        Assertions.assertEquals("Shipped", envelope.get("name").asText());
        Assertions.assertEquals("p-1", envelope.get("payload").get("parcel").asText());
    }

    @Test
    public void testUnconfirmedPublishFails() throws Exception {
        doThrow(new TimeoutException("no confirm")).when(producerChannel).waitForConfirmsOrDie(anyLong());

        Assertions.assertThrows(
                PublishFailedException.class,
                () -> eventBus.publish(SHIPPED.create(new Shipment("p-1")))
        );
    }

    @Test
    public void testHandledMessageIsAcknowledged() throws Exception {
        eventBus.subscribe(SHIPPED, "ShipmentNotifier", event -> handled.add(event.getPayload()));

        eventBus.onMessage(consumerChannel, QUEUE, delivery("{\"name\":\"Shipped\",\"payload\":{\"parcel\":\"p-1\"}}", null));

        Assertions.assertEquals(List.of(new Shipment("p-1")), handled);
        verify(consumerChannel).basicAck(7L, false);
    }

    @Test
    public void testMalformedMessageIsDiscarded() throws Exception {
        eventBus.subscribe(SHIPPED, "ShipmentNotifier", event -> handled.add(event.getPayload()));

        eventBus.onMessage(consumerChannel, QUEUE, delivery("not json", null));
        eventBus.onMessage(consumerChannel, QUEUE, delivery("{\"name\":\"Shipped\"}", null));

        verify(consumerChannel, times(2)).basicNack(7L, false, false);
        verify(consumerChannel, never()).basicAck(anyLong(), anyBoolean());
        Assertions.assertTrue(handled.isEmpty());
    }

    @Test
    public void testMessageWithoutHandlerIsDiscarded() throws Exception {
        eventBus.subscribe(SHIPPED, "ShipmentNotifier", event -> handled.add(event.getPayload()));

        eventBus.onMessage(consumerChannel, QUEUE, delivery("{\"name\":\"Returned\",\"payload\":{}}", null));

        verify(consumerChannel).basicNack(7L, false, false);
        Assertions.assertTrue(handled.isEmpty());
    }

    @Test
    public void testFailedMessageIsRequeuedAfterDelay() throws Exception {
        eventBus.subscribe(SHIPPED, "ShipmentNotifier", event -> {
            throw new IllegalStateException("mailer down");
        });

        eventBus.onMessage(consumerChannel, QUEUE, delivery("{\"name\":\"Shipped\",\"payload\":{\"parcel\":\"p-1\"}}", 1L));

        verify(consumerChannel, timeout(1000)).basicNack(7L, false, true);
        verify(consumerChannel, never()).basicNack(7L, false, false);
    }

    @Test
    public void testMessageIsDeadLetteredOnceAttemptsAreExhausted() throws Exception {
        eventBus.subscribe(SHIPPED, "ShipmentNotifier", event -> {
            throw new IllegalStateException("mailer down");
        });

        eventBus.onMessage(consumerChannel, QUEUE, delivery("{\"name\":\"Shipped\",\"payload\":{\"parcel\":\"p-1\"}}", 3L));

        verify(consumerChannel).basicNack(7L, false, false);
        verify(consumerChannel, never()).basicNack(7L, false, true);
    }

    @Test
    public void testDeliveryCountDefaultsToZero() {
        Assertions.assertEquals(0, RabbitEventBus.deliveryCount(null));
        Assertions.assertEquals(0, RabbitEventBus.deliveryCount(new AMQP.BasicProperties.Builder().build()));
        Assertions.assertEquals(
                2,
                RabbitEventBus.deliveryCount(new AMQP.BasicProperties.Builder().headers(Map.of("x-delivery-count", 2L)).build())
        );
    }

    @Test
    public void testQueueNameIsKebabCase() {
        Assertions.assertEquals("order-projector", RabbitEventBus.toKebabCase("OrderProjector"));
        Assertions.assertEquals("v2-order-projector", RabbitEventBus.toKebabCase("v2OrderProjector"));
        Assertions.assertEquals("audit", RabbitEventBus.toKebabCase("audit"));
    }

    private static Delivery delivery(final String body, final Long deliveryCount) {
        final AMQP.BasicProperties properties = deliveryCount == null
                ? new AMQP.BasicProperties.Builder().build()
                : new AMQP.BasicProperties.Builder().headers(Map.of("x-delivery-count", deliveryCount)).build();

        return new Delivery(
                new com.rabbitmq.client.Envelope(7L, false, "events", "Shipped"),
                properties,
                body.getBytes(StandardCharsets.UTF_8)
        );
    }
}
