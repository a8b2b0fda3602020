package com.indigententerprises.applications.toolkit.serviceinterfaces;

import org.springframework.transaction.TransactionStatus;

/**
 * side effect run inside the save transaction of an aggregate, e.g. maintaining a lookup table.
 * throwing rolls the whole save back.
 */
@FunctionalInterface
public interface RepoHooks<M> {
    void onSave(M model, TransactionStatus transaction) throws Exception;
}
