package com.indigententerprises.applications.toolkit.serviceimplementations;

import com.indigententerprises.applications.toolkit.domain.Envelope;
import com.indigententerprises.applications.toolkit.domain.Event;
import com.indigententerprises.applications.toolkit.domain.OutboxRecord;
import com.indigententerprises.applications.toolkit.domain.OutboxStatus;
import com.indigententerprises.applications.toolkit.infrastructure.OutboxSweeper;
import com.indigententerprises.applications.toolkit.repositories.OutboxRepository;
import com.indigententerprises.applications.toolkit.serviceinterfaces.Outbox;
import com.indigententerprises.applications.toolkit.serviceinterfaces.PublishEventsCallback;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * transactional outbox over a relational table.
 *
 * <p>a record is published by whoever wins the scheduled -> processing claim. the claim commits on
 * its own, so a worker that dies mid-publish leaves a processing record behind; the sweep revives
 * those once their claim lease has expired.
 *
 * <p>claims held by this process are renewed every third of the lease while their callback runs,
 * so only claims of a dead process ever expire. a callback may therefore take longer than the
 * lease, but a process stalled for a whole lease loses its claims.
 */
public class JdbcOutbox implements Outbox {

    private final OutboxRepository outboxRepository;
    private final ObjectMapper objectMapper;
    private final PublishEventsCallback publishEventsCallback;
    private final TransactionTemplate claimTransactionTemplate;
    private final OutboxConfig config;
    private final Logger logger;
    private final ExecutorService publishExecutor;
    private final ExecutorService sweepExecutor;
    private final ScheduledExecutorService leaseExecutor;
    private final Map<String, String> claimsInFlight = new ConcurrentHashMap<>();
    private final AtomicBoolean started = new AtomicBoolean(false);

    private volatile OutboxSweeper sweeper;

    public JdbcOutbox(
            final JdbcTemplate jdbcTemplate,
            final PlatformTransactionManager transactionManager,
            final ObjectMapper objectMapper,
            final PublishEventsCallback publishEventsCallback,
            final OutboxConfig config
    ) {
        this.outboxRepository = new OutboxRepository(jdbcTemplate, config.getTableName());
        this.objectMapper = objectMapper;
        this.publishEventsCallback = publishEventsCallback;
        this.config = config;
        this.logger = config.getLogger(JdbcOutbox.class);

        this.claimTransactionTemplate = new TransactionTemplate(transactionManager);
        this.claimTransactionTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        this.claimTransactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);

        this.publishExecutor = Executors.newFixedThreadPool(
                config.getPublishThreads(),
                new CustomizableThreadFactory("outbox-publisher-")
        );
        this.sweepExecutor = Executors.newSingleThreadExecutor(new CustomizableThreadFactory("outbox-sweeper-"));
        this.leaseExecutor = Executors.newSingleThreadScheduledExecutor(new CustomizableThreadFactory("outbox-lease-"));
    }

    public void createTableIfMissing() {
        outboxRepository.createTableIfMissing();
    }

    @Override
    public void init() {
        if (started.compareAndSet(false, true)) {
            logger.debug(
                    "Starting outbox monitoring of context {} every {}ms",
                    config.getContextName(),
                    config.getMonitoringIntervalMs()
            );
            sweeper = new OutboxSweeper(this, config.getMonitoringIntervalMs(), logger);
            sweepExecutor.submit(sweeper);

            final long renewalPeriodMs = Math.max(1L, config.getClaimLeaseMs() / 3);
            leaseExecutor.scheduleAtFixedRate(this::renewClaims, renewalPeriodMs, renewalPeriodMs, TimeUnit.MILLISECONDS);
        }
    }

    @Override
    public void terminate() {
        final OutboxSweeper running = sweeper;

        if (running != null) {
            running.stop();
        }

        try {
            Thread.sleep(config.getMonitoringIntervalMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        sweepExecutor.shutdownNow();
        leaseExecutor.shutdownNow();
        publishExecutor.shutdown();
        logger.debug("Outbox monitoring of context {} stopped", config.getContextName());
    }

    @Override
    public List<String> scheduleEvents(final List<Event<?>> events, final TransactionStatus transaction) {
        if (transaction == null
                || transaction.isCompleted()
                || !TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new IllegalStateException("events can only be scheduled inside an active transaction");
        }

        if (events.isEmpty()) {
            return List.of();
        }

        final Instant now = Instant.now();
        final List<OutboxRecord> outboxRecords = new ArrayList<>(events.size());
        final List<String> ids = new ArrayList<>(events.size());

        for (final Event<?> event : events) {
            final OutboxRecord outboxRecord = new OutboxRecord();
            outboxRecord.setId(UUID.randomUUID().toString());
            outboxRecord.setEventName(event.getName());
            outboxRecord.setEnvelopeJson(toEnvelopeJson(event));
            outboxRecord.setStatus(OutboxStatus.SCHEDULED);
            outboxRecord.setContextName(config.getContextName());
            outboxRecord.setAttemptCount(0);
            outboxRecord.setScheduledAt(now);

            outboxRecords.add(outboxRecord);
            ids.add(outboxRecord.getId());
        }

        outboxRepository.insertAll(outboxRecords);
        logger.debug("Scheduled events {}", ids);

        return ids;
    }

    @Override
    public void publishEvents(final Collection<String> recordIds) {
        try {
            publishEventsAsync(recordIds).join();
        } catch (CompletionException e) {
            logger.warn("Publishing of events {} did not complete", recordIds, e.getCause());
        }
    }

    @Override
    public CompletableFuture<Void> publishEventsAsync(final Collection<String> recordIds) {
        final List<CompletableFuture<Void>> publications = new ArrayList<>(recordIds.size());

        for (final String id : recordIds) {
            try {
                publications.add(CompletableFuture.runAsync(() -> publishEventWithConcurrencyControl(id), publishExecutor));
            } catch (RejectedExecutionException e) {
                logger.warn("Event {} left scheduled: outbox is terminated", id);
            }
        }

        return CompletableFuture.allOf(publications.toArray(new CompletableFuture[0]));
    }

    /**
     * processing records whose claim is older than the lease go back to scheduled.
     */
    public int reviveExpiredClaims() {
        renewClaims();

        final Instant cutoff = Instant.now().minusMillis(config.getClaimLeaseMs());
        final int revived = outboxRepository.reviveExpiredClaims(config.getContextName(), cutoff);

        if (revived > 0) {
            logger.warn("Revived {} events whose claim expired", revived);
        }

        return revived;
    }

    public List<String> findScheduledIds() {
        return outboxRepository.findScheduledIds(config.getContextName());
    }

    private void publishEventWithConcurrencyControl(final String id) {
        final String claimToken = UUID.randomUUID().toString();

        try {
            final Integer claimed = claimTransactionTemplate.execute(new TransactionCallback<Integer>() {
                @Override
                public Integer doInTransaction(final TransactionStatus status) {
                    return outboxRepository.claim(id, claimToken, Instant.now());
                }
            });

            if (claimed == null || claimed != 1) {
                logger.debug("Event {} is already being processed.", id);
                return;
            }
        } catch (RuntimeException e) {
            logger.warn("Event {} could not be claimed", id, e);
            return;
        }

        logger.debug("Event {} is being processed.", id);
        claimsInFlight.put(id, claimToken);

        try {
            final OutboxRecord outboxRecord = outboxRepository.findById(id)
                    .orElseThrow(() -> new IllegalStateException("claimed event " + id + " disappeared"));

            publishEventsCallback.publish(List.of(toEvent(outboxRecord)));
        } catch (Exception e) {
            claimsInFlight.remove(id, claimToken);
            logger.warn("Failed to publish event {}", id, e);
            releaseClaim(id, claimToken);
            return;
        }

        // the last renewal is at most a third of a lease old
        claimsInFlight.remove(id, claimToken);

        try {
            final Integer marked = claimTransactionTemplate.execute(
                    status -> outboxRepository.markPublished(id, claimToken, Instant.now())
            );

            if (marked == null || marked != 1) {
                logger.warn("Event {} was published after its claim was lost; it may be published again", id);
            } else {
                logger.debug("Event {} published.", id);
            }
        } catch (RuntimeException e) {
            logger.warn("Event {} was published but could not be marked; it will be published again", id, e);
            releaseClaim(id, claimToken);
        }
    }

    private void releaseClaim(final String id, final String claimToken) {
        try {
            final Integer released = claimTransactionTemplate.execute(status -> outboxRepository.release(id, claimToken));

            if (released == null || released != 1) {
                logger.debug("Claim on event {} was already lost", id);
            }
        } catch (RuntimeException e) {
            logger.error("Claim on event {} could not be released; it waits for the claim lease to expire", id, e);
        }
    }

    private void renewClaims() {
        final Instant now = Instant.now();

        for (final Map.Entry<String, String> claim : claimsInFlight.entrySet()) {
            try {
                final int renewed = outboxRepository.renewClaim(claim.getKey(), claim.getValue(), now);

                if (renewed != 1) {
                    logger.warn("Claim on event {} was lost while publishing", claim.getKey());
                }
            } catch (RuntimeException e) {
                logger.warn("Claim on event {} could not be renewed", claim.getKey(), e);
            }
        }
    }

    private String toEnvelopeJson(final Event<?> event) {
        try {
            return objectMapper.writeValueAsString(new Envelope(event.getName(), objectMapper.valueToTree(event.getPayload())));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new IllegalArgumentException("event " + event.getName() + " cannot be serialized", e);
        }
    }

    private Event<JsonNode> toEvent(final OutboxRecord outboxRecord) throws JsonProcessingException {
        final Envelope envelope = objectMapper.readValue(outboxRecord.getEnvelopeJson(), Envelope.class);
        return new Event<>(envelope.name(), envelope.payload());
    }
}
