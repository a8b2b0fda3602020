package com.indigententerprises.applications.toolkit.serviceimplementations;

import com.indigententerprises.applications.toolkit.domain.DocumentWithId;
import com.indigententerprises.applications.toolkit.domain.Event;
import com.indigententerprises.applications.toolkit.domain.StoredDocument;
import com.indigententerprises.applications.toolkit.domain.WithVersion;
import com.indigententerprises.applications.toolkit.repositories.VersionedDocumentRepository;
import com.indigententerprises.applications.toolkit.serviceinterfaces.AggregateNotFoundException;
import com.indigententerprises.applications.toolkit.serviceinterfaces.AggregateRepository;
import com.indigententerprises.applications.toolkit.serviceinterfaces.AggregateSerializer;
import com.indigententerprises.applications.toolkit.serviceinterfaces.DuplicatedIdException;
import com.indigententerprises.applications.toolkit.serviceinterfaces.OptimisticLockException;
import com.indigententerprises.applications.toolkit.serviceinterfaces.Outbox;
import com.indigententerprises.applications.toolkit.serviceinterfaces.RepoHookException;
import com.indigententerprises.applications.toolkit.serviceinterfaces.RepoHooks;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * optimistic-locked aggregate store. a save is one transaction holding the document write,
 * the save hook and, for {@link #saveAndPublish}, the outbox records of the accompanying events.
 */
public class JdbcAggregateRepository<A, M extends DocumentWithId> implements AggregateRepository<A> {

    private final VersionedDocumentRepository documentRepository;
    private final ObjectMapper objectMapper;
    private final AggregateSerializer<A, M> serializer;
    private final Class<M> modelClass;
    private final RepoHooks<M> repoHooks;
    private final Outbox outbox;
    private final Logger logger;
    private final TransactionTemplate transactionTemplate;

    public JdbcAggregateRepository(
            final JdbcTemplate jdbcTemplate,
            final PlatformTransactionManager transactionManager,
            final ObjectMapper objectMapper,
            final AggregateSerializer<A, M> serializer,
            final AggregateRepositoryConfig<M> config
    ) {
        this.documentRepository = new VersionedDocumentRepository(jdbcTemplate, config.getTableName());
        this.objectMapper = objectMapper;
        this.serializer = serializer;
        this.modelClass = config.getModelClass();
        this.repoHooks = config.getRepoHooks();
        this.outbox = config.getOutbox();
        this.logger = config.getLogger(JdbcAggregateRepository.class);
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
    }

    public void init() {
        documentRepository.createTableIfMissing();
    }

    @Override
    public Optional<WithVersion<A>> getById(final String id) {
        final Optional<StoredDocument> document = documentRepository.findById(id);
        logger.debug("Retrieving aggregate {}. Found: {}", id, document.map(StoredDocument::json).orElse(null));

        return document.map(this::toAggregate);
    }

    @Override
    public WithVersion<A> getByIdOrThrow(final String id) throws AggregateNotFoundException {
        final Optional<WithVersion<A>> aggregate = getById(id);

        if (aggregate.isEmpty()) {
            throw new AggregateNotFoundException("Aggregate " + id + " not found.");
        }

        return aggregate.get();
    }

    @Override
    public void save(final WithVersion<A> aggregate)
            throws DuplicatedIdException, OptimisticLockException, RepoHookException {
        saveInTransaction(aggregate, List.of());
    }

    @Override
    public void saveAndPublish(final WithVersion<A> aggregate, final List<Event<?>> events)
            throws DuplicatedIdException, OptimisticLockException, RepoHookException {
        if (outbox == null) {
            throw new IllegalStateException("Outbox not configured for repository of " + documentRepository.getTableName());
        }

        final List<String> scheduledIds = saveInTransaction(aggregate, events);

        if (!scheduledIds.isEmpty()) {
            outbox.publishEventsAsync(scheduledIds);
        }
    }

    private List<String> saveInTransaction(final WithVersion<A> aggregate, final List<Event<?>> events)
            throws DuplicatedIdException, OptimisticLockException, RepoHookException {
        final M model = serializer.aggregateToModel(aggregate.getAggregate());
        final int version = aggregate.getVersion();
        final String json = toJson(model);

        try {
            final List<String> scheduledIds = transactionTemplate.execute(new TransactionCallback<List<String>>() {
                @Override
                public List<String> doInTransaction(final TransactionStatus status) {
                    upsert(model.getId(), version, json);
                    handleRepoHooks(model, status);

                    if (outbox == null || events.isEmpty()) {
                        return List.of();
                    } else {
                        return outbox.scheduleEvents(events, status);
                    }
                }
            });

            return scheduledIds == null ? List.of() : scheduledIds;
        } catch (DataIntegrityViolationException e) {
            if (aggregate.isFirstSave()) {
                throw new DuplicatedIdException(
                        "Cannot save aggregate with id: " + model.getId() + " due to duplicated id.",
                        e
                );
            } else {
                throw new OptimisticLockException(
                        "Cannot save aggregate with id: " + model.getId() + " due to optimistic locking.",
                        e
                );
            }
        } catch (HookFailure e) {
            throw new RepoHookException("RepoHook onSave method failed with error: " + e.getCause().getMessage(), e.getCause());
        }
    }

    private void upsert(final String id, final int version, final String json) {
        final Instant now = Instant.now();
        final int updated = documentRepository.updateIfVersionMatches(id, version, json, now);

        if (updated == 0) {
            // no row at this version: either a first save or a lost race, the primary key decides
            documentRepository.insert(id, version + 1, json, now);
        }

        logger.debug("Saved aggregate {} at version {}", id, version + 1);
    }

    private void handleRepoHooks(final M model, final TransactionStatus status) {
        if (repoHooks != null) {
            try {
                repoHooks.onSave(model, status);
            } catch (Exception e) {
                throw new HookFailure(e);
            }
        }
    }

    private WithVersion<A> toAggregate(final StoredDocument document) {
        try {
            final M model = objectMapper.readValue(document.json(), modelClass);
            return WithVersion.of(serializer.modelToAggregate(model), document.version());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("stored document " + document.id() + " is not a valid " + modelClass.getSimpleName(), e);
        }
    }

    private String toJson(final M model) {
        try {
            return objectMapper.writeValueAsString(model);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("model " + model.getId() + " cannot be serialized", e);
        }
    }

    /**
     * carries a hook's exception out of the transaction callback, which must roll back.
     */
    private static final class HookFailure extends RuntimeException {
        private HookFailure(final Exception cause) {
            super(cause);
        }
    }
}
