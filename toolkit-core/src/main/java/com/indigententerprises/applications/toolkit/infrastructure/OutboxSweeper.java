package com.indigententerprises.applications.toolkit.infrastructure;

import com.indigententerprises.applications.toolkit.serviceimplementations.JdbcOutbox;

import org.slf4j.Logger;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * republishes events that stay scheduled for two consecutive cycles. an event seen only once may
 * still be in the hands of the process that scheduled it.
 */
public class OutboxSweeper implements Runnable {

    private final JdbcOutbox outbox;
    private final long monitoringIntervalMs;
    private final Logger logger;

    private volatile boolean stopping;

    public OutboxSweeper(final JdbcOutbox outbox, final long monitoringIntervalMs, final Logger logger) {
        this.outbox = outbox;
        this.monitoringIntervalMs = monitoringIntervalMs;
        this.logger = logger;
    }

    public void stop() {
        stopping = true;
    }

    @Override
    public void run() {

        // mutable data
        Set<String> watched = Set.of();

        while (!stopping && !Thread.currentThread().isInterrupted()) {
            try {
                Thread.sleep(monitoringIntervalMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }

            if (stopping) {
                break;
            }

            try {
                watched = sweep(watched);
            } catch (RuntimeException e) {
                logger.error("Outbox sweep failed", e);
                watched = Set.of();
            }
        }
    }

    /**
     * one cycle: publishes what was already watched and is still scheduled.
     *
     * @return the ids to watch during the next cycle
     */
    public Set<String> sweep(final Set<String> watched) {
        outbox.reviveExpiredClaims();

        final List<String> scheduled = outbox.findScheduledIds();
        final Set<String> stuck = new LinkedHashSet<>();
        final Set<String> nextWatched = new HashSet<>();

        for (final String id : scheduled) {
            if (watched.contains(id)) {
                stuck.add(id);
            } else {
                nextWatched.add(id);
            }
        }

        if (!stuck.isEmpty()) {
            logger.warn("Events {} are still scheduled.", stuck);
            outbox.publishEvents(stuck);
        }

        return nextWatched;
    }
}
