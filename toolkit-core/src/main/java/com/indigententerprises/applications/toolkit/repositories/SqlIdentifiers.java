package com.indigententerprises.applications.toolkit.repositories;

import java.util.regex.Pattern;

/**
 * table names come from configuration and end up inside sql text.
 */
final class SqlIdentifiers {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    private SqlIdentifiers() {}

    static String requireValid(final String identifier) {
        if (identifier == null || !IDENTIFIER.matcher(identifier).matches()) {
            throw new IllegalArgumentException("not a valid table name: " + identifier);
        } else {
            return identifier;
        }
    }
}
