package com.indigententerprises.applications.toolkit.serviceinterfaces;

import com.indigententerprises.applications.toolkit.domain.Event;

import org.springframework.transaction.TransactionStatus;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;

public interface Outbox {

    /**
     * starts the background sweep that republishes events left scheduled.
     */
    void init();

    /**
     * stops the sweep; returns after one monitoring interval.
     */
    void terminate();

    /**
     * inserts one scheduled record per event inside the caller's transaction.
     *
     * @return the ids of the inserted records, in event order
     */
    List<String> scheduleEvents(List<Event<?>> events, TransactionStatus transaction);

    /**
     * claims and publishes each record independently; never throws for a single record's failure.
     */
    void publishEvents(Collection<String> recordIds);

    /**
     * same as {@link #publishEvents(Collection)} without blocking the caller.
     */
    CompletableFuture<Void> publishEventsAsync(Collection<String> recordIds);
}
