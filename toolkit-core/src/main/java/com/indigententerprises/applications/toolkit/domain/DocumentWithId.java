package com.indigententerprises.applications.toolkit.domain;

/**
 * stored model of an aggregate; the id is unique per table.
 */
public interface DocumentWithId {
    String getId();
}
