package com.indigententerprises.applications.toolkit.infrastructure;

import com.indigententerprises.applications.toolkit.serviceimplementations.JdbcOutbox;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class OutboxSweeperTest {

    @Mock
    private JdbcOutbox outbox;

    @Test
    public void testEventSeenOnceIsOnlyWatched() {
        final OutboxSweeper sweeper = sweeper();
        when(outbox.findScheduledIds()).thenReturn(List.of("a", "b"));

        final Set<String> watched = sweeper.sweep(Set.of());

        Assertions.assertEquals(Set.of("a", "b"), watched);
        verify(outbox).reviveExpiredClaims();
        verify(outbox, never()).publishEvents(anyCollection());
    }

    @Test
    public void testEventSeenTwiceIsPublished() {
        final OutboxSweeper sweeper = sweeper();
        when(outbox.findScheduledIds()).thenReturn(List.of("a", "b"), List.of("b", "c"));

        final Set<String> watched = sweeper.sweep(sweeper.sweep(Set.of()));

        Assertions.assertEquals(Set.of("c"), watched);
        verify(outbox).publishEvents(argThat(ids -> ids.size() == 1 && ids.contains("b")));
    }

    @Test
    public void testPublishedEventIsForgotten() {
        final OutboxSweeper sweeper = sweeper();
        when(outbox.findScheduledIds()).thenReturn(List.of());

        Assertions.assertEquals(Set.of(), sweeper.sweep(Set.of("a")));
        verify(outbox, never()).publishEvents(anyCollection());
    }

    private OutboxSweeper sweeper() {
        return new OutboxSweeper(outbox, 100L, LoggerFactory.getLogger(OutboxSweeperTest.class));
    }
}
