package com.indigententerprises.applications.toolkit.domain;

import java.util.Objects;

/**
 * an aggregate together with the version it was read at.
 * version 0 means "never saved"; it can only be expressed through {@link #firstSave(Object)}.
 */
public final class WithVersion<A> {
    private final A aggregate;
    private final int version;

    private WithVersion(final A aggregate, final int version) {
        this.aggregate = Objects.requireNonNull(aggregate, "aggregate");
        this.version = version;
    }

    public static <A> WithVersion<A> firstSave(final A aggregate) {
        return new WithVersion<>(aggregate, 0);
    }

    public static <A> WithVersion<A> of(final A aggregate, final int version) {
        if (version < 1) {
            throw new IllegalArgumentException("a loaded aggregate has a version >= 1, got " + version);
        }

        return new WithVersion<>(aggregate, version);
    }

    public A getAggregate() {
        return aggregate;
    }

    public int getVersion() {
        return version;
    }

    public boolean isFirstSave() {
        return version == 0;
    }

    /**
     * same version, different state; the usual shape of a load, mutate, save cycle.
     */
    public WithVersion<A> withAggregate(final A mutated) {
        return new WithVersion<>(mutated, version);
    }

    @Override
    public String toString() {
        return "WithVersion{version=" + version + ", aggregate=" + aggregate + "}";
    }
}
