package com.indigententerprises.applications.toolkit.serviceimplementations;

import com.indigententerprises.applications.toolkit.domain.DocumentWithId;
import com.indigententerprises.applications.toolkit.serviceinterfaces.Outbox;
import com.indigententerprises.applications.toolkit.serviceinterfaces.RepoHooks;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * @param <M> stored model type; read back from json as {@code modelClass}
 */
public final class AggregateRepositoryConfig<M extends DocumentWithId> {

    private final String tableName;
    private final Class<M> modelClass;
    private final RepoHooks<M> repoHooks;
    private final Outbox outbox;
    private final Logger logger;

    private AggregateRepositoryConfig(final Builder<M> builder) {
        this.tableName = builder.tableName;
        this.modelClass = builder.modelClass;
        this.repoHooks = builder.repoHooks;
        this.outbox = builder.outbox;
        this.logger = builder.logger;
    }

    public static <M extends DocumentWithId> Builder<M> builder(final String tableName, final Class<M> modelClass) {
        return new Builder<>(tableName, modelClass);
    }

    public String getTableName() {
        return tableName;
    }

    public Class<M> getModelClass() {
        return modelClass;
    }

    /**
     * @return the save hook, or null
     */
    public RepoHooks<M> getRepoHooks() {
        return repoHooks;
    }

    /**
     * @return the outbox events are scheduled in, or null
     */
    public Outbox getOutbox() {
        return outbox;
    }

    public Logger getLogger(final Class<?> component) {
        return logger != null ? logger : LoggerFactory.getLogger(component);
    }

    public static final class Builder<M extends DocumentWithId> {
        private final String tableName;
        private final Class<M> modelClass;
        private RepoHooks<M> repoHooks;
        private Outbox outbox;
        private Logger logger;

        private Builder(final String tableName, final Class<M> modelClass) {
            this.tableName = Objects.requireNonNull(tableName, "tableName");
            this.modelClass = Objects.requireNonNull(modelClass, "modelClass");
        }

        public Builder<M> repoHooks(final RepoHooks<M> repoHooks) {
            this.repoHooks = repoHooks;
            return this;
        }

        public Builder<M> outbox(final Outbox outbox) {
            this.outbox = outbox;
            return this;
        }

        public Builder<M> logger(final Logger logger) {
            this.logger = logger;
            return this;
        }

        public AggregateRepositoryConfig<M> build() {
            return new AggregateRepositoryConfig<>(this);
        }
    }
}
