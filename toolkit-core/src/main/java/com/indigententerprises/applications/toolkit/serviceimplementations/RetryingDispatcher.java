package com.indigententerprises.applications.toolkit.serviceimplementations;

import com.indigententerprises.applications.toolkit.serviceinterfaces.RetryMechanism;

import org.slf4j.Logger;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * runs handler invocations off the caller's thread. a failed attempt goes back on the
 * scheduler's delay queue as a new task.
 */
final class RetryingDispatcher {

    @FunctionalInterface
    interface Invocation {
        void run() throws Exception;
    }

    private final ScheduledExecutorService scheduler;
    private final RetryMechanism retryMechanism;
    private final int maxAttempts;
    private final Logger logger;

    RetryingDispatcher(final LocalBusConfig config, final Logger logger, final String threadNamePrefix) {
        this.scheduler = Executors.newScheduledThreadPool(
                config.getDispatchThreads(),
                new CustomizableThreadFactory(threadNamePrefix)
        );
        this.retryMechanism = config.getRetryMechanism();
        this.maxAttempts = config.getMaxAttempts();
        this.logger = logger;
    }

    /**
     * @param reportFailure log the final failure at error level; otherwise only the returned
     *                      future carries it
     */
    CompletableFuture<Void> dispatch(
            final String handlerName,
            final String messageName,
            final String messageKind,
            final Invocation invocation,
            final boolean reportFailure
    ) {
        final CompletableFuture<Void> outcome = new CompletableFuture<>();
        enqueue(new RetryTask(handlerName, messageName, messageKind, invocation, reportFailure, 1, outcome), 0L);
        return outcome;
    }

    void shutdown() {
        scheduler.shutdownNow();
    }

    private void enqueue(final RetryTask task, final long delayMs) {
        try {
            scheduler.schedule(task, delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.warn("{} will not handle {} {}: bus terminated", task.handlerName, task.messageName, task.messageKind);
            task.outcome.completeExceptionally(e);
        }
    }

    private final class RetryTask implements Runnable {
        private final String handlerName;
        private final String messageName;
        private final String messageKind;
        private final Invocation invocation;
        private final boolean reportFailure;
        private final int attempt;
        private final CompletableFuture<Void> outcome;

        private RetryTask(
                final String handlerName,
                final String messageName,
                final String messageKind,
                final Invocation invocation,
                final boolean reportFailure,
                final int attempt,
                final CompletableFuture<Void> outcome
        ) {
            this.handlerName = handlerName;
            this.messageName = messageName;
            this.messageKind = messageKind;
            this.invocation = invocation;
            this.reportFailure = reportFailure;
            this.attempt = attempt;
            this.outcome = outcome;
        }

        @Override
        public void run() {
            try {
                invocation.run();
                outcome.complete(null);
            } catch (Exception e) {
                if (attempt < maxAttempts) {
                    final int nextAttempt = attempt + 1;
                    final long delay = retryMechanism.getDelay(nextAttempt);
                    logger.warn(
                            "{} failed to handle {} {}. Attempt {}/{}. Delaying for {}ms.",
                            handlerName,
                            messageName,
                            messageKind,
                            nextAttempt,
                            maxAttempts,
                            delay
                    );
                    enqueue(
                            new RetryTask(handlerName, messageName, messageKind, invocation, reportFailure, nextAttempt, outcome),
                            delay
                    );
                } else {
                    if (reportFailure) {
                        logger.error("{} failed to handle {} {}", handlerName, messageName, messageKind, e);
                    }
                    outcome.completeExceptionally(e);
                }
            }
        }
    }
}
