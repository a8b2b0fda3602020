package com.indigententerprises.applications.toolkit.serviceimplementations;

import com.indigententerprises.applications.toolkit.domain.Event;
import com.indigententerprises.applications.toolkit.domain.EventType;
import com.indigententerprises.applications.toolkit.serviceinterfaces.HandlerExecutionException;

import com.fasterxml.jackson.databind.ObjectMapper;

import ch.qos.logback.classic.Level;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;

public class LocalEventBusTest {

    public record Greeting(String text) {}

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final EventType<Greeting> GREETED = EventType.of("Greeted", Greeting.class);

    private final LogCapture logCapture = LogCapture.create();

    private LocalEventBus eventBus;

    @AfterEach
    public void tearDown() {
        if (eventBus != null) {
            eventBus.terminate();
        }
    }

    @Test
    public void testPublishWithoutHandlersOnlyWarns() {
        eventBus = new LocalEventBus(OBJECT_MAPPER, busConfig(1));

        eventBus.publish(GREETED.create(new Greeting("hello")));

        Assertions.assertEquals(List.of("No handler found for Greeted"), logCapture.messages(Level.WARN));
    }

    @Test
    public void testEveryHandlerRunsOncePerPublish() {
        eventBus = new LocalEventBus(OBJECT_MAPPER, busConfig(1));
        final List<String> received = new CopyOnWriteArrayList<>();

        eventBus.subscribe(GREETED, "FirstHandler", event -> received.add("first:" + event.getPayload().text()));
        eventBus.subscribe(GREETED, "SecondHandler", event -> received.add("second:" + event.getPayload().text()));

        eventBus.publish(GREETED.create(new Greeting("hello")));

        await().atMost(Duration.ofSeconds(5)).until(() -> received.size() == 2);
        Assertions.assertTrue(received.containsAll(List.of("first:hello", "second:hello")));
    }

    @Test
    public void testFailingHandlerIsRetriedUntilItSucceeds() {
        eventBus = new LocalEventBus(OBJECT_MAPPER, busConfig(3));
        final AtomicInteger invocations = new AtomicInteger();

        eventBus.subscribe(GREETED, "FlakyHandler", event -> {
            if (invocations.incrementAndGet() < 3) {
                throw new IllegalStateException("not yet");
            }
        });

        eventBus.publish(GREETED.create(new Greeting("hello")));

        await().atMost(Duration.ofSeconds(5)).until(() -> invocations.get() == 3);
        Assertions.assertEquals(2, logCapture.count(Level.WARN));
        Assertions.assertEquals(0, logCapture.count(Level.ERROR));
        Assertions.assertEquals(
                "FlakyHandler failed to handle Greeted event. Attempt 2/3. Delaying for 20ms.",
                logCapture.messages(Level.WARN).get(0)
        );
    }

    @Test
    public void testExhaustedRetriesAreLoggedAsError() {
        eventBus = new LocalEventBus(OBJECT_MAPPER, busConfig(2));
        final AtomicInteger invocations = new AtomicInteger();

        eventBus.subscribe(GREETED, "BrokenHandler", event -> {
            invocations.incrementAndGet();
            throw new IllegalStateException("broken");
        });

        eventBus.publish(GREETED.create(new Greeting("hello")));

        await().atMost(Duration.ofSeconds(5)).until(() -> logCapture.count(Level.ERROR) == 1);
        Assertions.assertEquals(2, invocations.get());
        Assertions.assertEquals(1, logCapture.count(Level.WARN));
    }

    @Test
    public void testPublishAndWaitReturnsOnceHandlersCompleted() {
        eventBus = new LocalEventBus(OBJECT_MAPPER, busConfig(1));
        final AtomicInteger invocations = new AtomicInteger();

        eventBus.subscribe(GREETED, "SlowHandler", event -> {
            Thread.sleep(50L);
            invocations.incrementAndGet();
        });

        eventBus.publishAndWaitForHandlers(GREETED.create(new Greeting("hello")));

        Assertions.assertEquals(1, invocations.get());
    }

    @Test
    public void testPublishAndWaitRaisesHandlerFailure() {
        eventBus = new LocalEventBus(OBJECT_MAPPER, busConfig(2));
        final AtomicInteger invocations = new AtomicInteger();

        eventBus.subscribe(GREETED, "BrokenHandler", event -> {
            invocations.incrementAndGet();
            throw new IllegalStateException("broken");
        });
        eventBus.subscribe(GREETED, "HealthyHandler", event -> {});

        final HandlerExecutionException thrown = Assertions.assertThrows(
                HandlerExecutionException.class,
                () -> eventBus.publishAndWaitForHandlers(GREETED.create(new Greeting("hello")))
        );

        Assertions.assertEquals("broken", thrown.getCause().getMessage());
        Assertions.assertEquals(2, invocations.get());
        Assertions.assertEquals(0, logCapture.count(Level.ERROR));
    }

    @Test
    public void testJsonPayloadIsReboundToSubscribedType() {
        eventBus = new LocalEventBus(OBJECT_MAPPER, busConfig(1));
        final List<Greeting> received = new CopyOnWriteArrayList<>();

        eventBus.subscribe(GREETED, "TypedHandler", event -> received.add(event.getPayload()));

        eventBus.publish(new Event<>("Greeted", OBJECT_MAPPER.createObjectNode().put("text", "from json")));

        await().atMost(Duration.ofSeconds(5)).until(() -> !received.isEmpty());
        Assertions.assertEquals(new Greeting("from json"), received.get(0));
    }

    private LocalBusConfig busConfig(final int maxAttempts) {
        return LocalBusConfig.builder()
                .maxAttempts(maxAttempts)
                .retryMechanism(new ExponentialBackoff(10L))
                .logger(logCapture.logger())
                .build();
    }
}
