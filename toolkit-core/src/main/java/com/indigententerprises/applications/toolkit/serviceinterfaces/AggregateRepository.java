package com.indigententerprises.applications.toolkit.serviceinterfaces;

import com.indigententerprises.applications.toolkit.domain.Event;
import com.indigententerprises.applications.toolkit.domain.WithVersion;

import java.util.List;
import java.util.Optional;

public interface AggregateRepository<A> {

    Optional<WithVersion<A>> getById(String id);

    WithVersion<A> getByIdOrThrow(String id) throws AggregateNotFoundException;

    /**
     * optimistic-locked upsert.
     *
     * @throws DuplicatedIdException   a first save collided with an existing id
     * @throws OptimisticLockException the presented version is no longer the stored one
     * @throws RepoHookException       the save hook failed; nothing was written
     */
    void save(WithVersion<A> aggregate)
            throws DuplicatedIdException, OptimisticLockException, RepoHookException;

    /**
     * like {@link #save(WithVersion)}, also scheduling the events in the outbox within the same
     * transaction and publishing them once it has committed.
     */
    void saveAndPublish(WithVersion<A> aggregate, List<Event<?>> events)
            throws DuplicatedIdException, OptimisticLockException, RepoHookException;
}
