package com.indigententerprises.applications.toolkit.serviceimplementations;

import com.indigententerprises.applications.toolkit.domain.QueryType;
import com.indigententerprises.applications.toolkit.serviceinterfaces.DuplicateHandlerException;
import com.indigententerprises.applications.toolkit.serviceinterfaces.NoHandlerException;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

public class LocalQueryBusTest {

    private static final QueryType<String, String> SHOUT = QueryType.of("Shout", String.class, String.class);

    @Test
    public void testExecuteReturnsHandlerResult() {
        final LocalQueryBus queryBus = new LocalQueryBus();
        queryBus.register(SHOUT, query -> query.getPayload().toUpperCase());

        Assertions.assertEquals("HEY", queryBus.execute(SHOUT.create("hey")));
    }

    @Test
    public void testExecuteWithoutHandlerThrows() {
        Assertions.assertThrows(NoHandlerException.class, () -> new LocalQueryBus().execute(SHOUT.create("hey")));
    }

    @Test
    public void testSecondRegistrationIsRejected() {
        final LocalQueryBus queryBus = new LocalQueryBus();
        queryBus.register(SHOUT, query -> "");

        Assertions.assertThrows(DuplicateHandlerException.class, () -> queryBus.register(SHOUT, query -> ""));
    }

    @Test
    public void testQueryOfAnotherTypeWithSameNameIsRejected() {
        final LocalQueryBus queryBus = new LocalQueryBus();
        queryBus.register(SHOUT, query -> query.getPayload().toUpperCase());
        final QueryType<Integer, String> impostor = QueryType.of("Shout", Integer.class, String.class);

        Assertions.assertThrows(IllegalArgumentException.class, () -> queryBus.execute(impostor.create(7)));
        Assertions.assertEquals("HEY", queryBus.execute(SHOUT.create("hey")));
    }

    @Test
    public void testFailureIsNotRetried() {
        final LocalQueryBus queryBus = new LocalQueryBus();
        final AtomicInteger invocations = new AtomicInteger();

        queryBus.register(SHOUT, query -> {
            invocations.incrementAndGet();
            throw new IllegalArgumentException("cannot shout");
        });

        Assertions.assertThrows(IllegalArgumentException.class, () -> queryBus.execute(SHOUT.create("hey")));
        Assertions.assertEquals(1, invocations.get());
    }
}
