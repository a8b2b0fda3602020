package com.indigententerprises.applications.toolkit.repositories;

import com.indigententerprises.applications.toolkit.domain.StoredDocument;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * one json document per id, guarded by a version column.
 * all statements join the transaction bound to the calling thread, if any.
 */
public class VersionedDocumentRepository {

    private static final RowMapper<StoredDocument> ROW_MAPPER = (rs, rowNum) -> new StoredDocument(
            rs.getString("id"),
            rs.getInt("version"),
            rs.getString("document"),
            rs.getTimestamp("created_at").toInstant(),
            rs.getTimestamp("updated_at").toInstant()
    );

    private final JdbcTemplate jdbcTemplate;
    private final String tableName;

    public VersionedDocumentRepository(final JdbcTemplate jdbcTemplate, final String tableName) {
        this.jdbcTemplate = jdbcTemplate;
        this.tableName = SqlIdentifiers.requireValid(tableName);
    }

    public String getTableName() {
        return tableName;
    }

    public void createTableIfMissing() {
        jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS %s (
                  id         VARCHAR(255) NOT NULL,
                  version    INTEGER      NOT NULL,
                  document   VARCHAR      NOT NULL,
                  created_at TIMESTAMP    NOT NULL,
                  updated_at TIMESTAMP    NOT NULL,
                  PRIMARY KEY (id)
                )
                """.formatted(tableName));
    }

    public Optional<StoredDocument> findById(final String id) {
        final List<StoredDocument> rows = jdbcTemplate.query(
                "SELECT id, version, document, created_at, updated_at FROM " + tableName + " WHERE id = ?",
                ROW_MAPPER,
                id
        );
        return rows.stream().findFirst();
    }

    /**
     * compare-and-set on the version column.
     *
     * @return number of rows affected: 1 when the stored version matched, 0 otherwise
     */
    public int updateIfVersionMatches(
            final String id,
            final int expectedVersion,
            final String json,
            final Instant now
    ) {
        return jdbcTemplate.update(
                "UPDATE " + tableName + " SET version = ?, document = ?, updated_at = ? WHERE id = ? AND version = ?",
                expectedVersion + 1,
                json,
                Timestamp.from(now),
                id,
                expectedVersion
        );
    }

    /**
     * @throws org.springframework.dao.DataIntegrityViolationException when the id already exists
     */
    public void insert(final String id, final int version, final String json, final Instant now) {
        final Timestamp timestamp = Timestamp.from(now);
        jdbcTemplate.update(
                "INSERT INTO " + tableName + " (id, version, document, created_at, updated_at) VALUES (?, ?, ?, ?, ?)",
                id,
                version,
                json,
                timestamp,
                timestamp
        );
    }
}
