package com.indigententerprises.applications.toolkit.repositories;

import com.indigententerprises.applications.toolkit.domain.OutboxRecord;
import com.indigententerprises.applications.toolkit.domain.OutboxStatus;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * every status transition is a conditional update; the affected-row count tells the caller
 * whether it won.
 */
public class OutboxRepository {

    private static final RowMapper<OutboxRecord> ROW_MAPPER = (rs, rowNum) -> {
        final OutboxRecord outboxRecord = new OutboxRecord();
        outboxRecord.setId(rs.getString("outbox_id"));
        outboxRecord.setEventName(rs.getString("event_name"));
        outboxRecord.setEnvelopeJson(rs.getString("envelope_json"));
        outboxRecord.setStatus(OutboxStatus.valueOf(rs.getString("status")));
        outboxRecord.setContextName(rs.getString("context_name"));
        outboxRecord.setAttemptCount(rs.getInt("attempt_count"));
        outboxRecord.setScheduledAt(toInstant(rs.getTimestamp("scheduled_at")));
        outboxRecord.setClaimToken(rs.getString("claim_token"));
        outboxRecord.setClaimedAt(toInstant(rs.getTimestamp("claimed_at")));
        outboxRecord.setPublishedAt(toInstant(rs.getTimestamp("published_at")));
        return outboxRecord;
    };

    private final JdbcTemplate jdbcTemplate;
    private final String tableName;

    public OutboxRepository(final JdbcTemplate jdbcTemplate, final String tableName) {
        this.jdbcTemplate = jdbcTemplate;
        this.tableName = SqlIdentifiers.requireValid(tableName);
    }

    public void createTableIfMissing() {
        jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS %s (
                  outbox_id     VARCHAR(64)  NOT NULL,
                  event_name    VARCHAR(255) NOT NULL,
                  envelope_json VARCHAR      NOT NULL,
                  status        VARCHAR(16)  NOT NULL,
                  context_name  VARCHAR(255),
                  attempt_count INTEGER      NOT NULL,
                  scheduled_at  TIMESTAMP    NOT NULL,
                  claim_token   VARCHAR(64),
                  claimed_at    TIMESTAMP,
                  published_at  TIMESTAMP,
                  PRIMARY KEY (outbox_id)
                )
                """.formatted(tableName));
    }

    public void insertAll(final List<OutboxRecord> outboxRecords) {
        final List<Object[]> batch = new ArrayList<>(outboxRecords.size());

        for (final OutboxRecord outboxRecord : outboxRecords) {
            batch.add(new Object[] {
                    outboxRecord.getId(),
                    outboxRecord.getEventName(),
                    outboxRecord.getEnvelopeJson(),
                    outboxRecord.getStatus().name(),
                    outboxRecord.getContextName(),
                    outboxRecord.getAttemptCount(),
                    Timestamp.from(outboxRecord.getScheduledAt())
            });
        }

        jdbcTemplate.batchUpdate(
                "INSERT INTO " + tableName +
                        " (outbox_id, event_name, envelope_json, status, context_name, attempt_count, scheduled_at)" +
                        " VALUES (?, ?, ?, ?, ?, ?, ?)",
                batch
        );
    }

    public Optional<OutboxRecord> findById(final String id) {
        final List<OutboxRecord> rows = jdbcTemplate.query(
                "SELECT * FROM " + tableName + " WHERE outbox_id = ?",
                ROW_MAPPER,
                id
        );
        return rows.stream().findFirst();
    }

    public List<String> findScheduledIds(final String contextName) {
        if (contextName == null) {
            return jdbcTemplate.queryForList(
                    "SELECT outbox_id FROM " + tableName +
                            " WHERE status = ? AND context_name IS NULL ORDER BY scheduled_at, outbox_id",
                    String.class,
                    OutboxStatus.SCHEDULED.name()
            );
        } else {
            return jdbcTemplate.queryForList(
                    "SELECT outbox_id FROM " + tableName +
                            " WHERE status = ? AND context_name = ? ORDER BY scheduled_at, outbox_id",
                    String.class,
                    OutboxStatus.SCHEDULED.name(),
                    contextName
            );
        }
    }

    /**
     * scheduled -> processing. this single statement is the only mutual exclusion between publishers.
     * the token identifies this claim in every later transition of the record.
     */
    public int claim(final String id, final String claimToken, final Instant now) {
        return jdbcTemplate.update(
                "UPDATE " + tableName +
                        " SET status = ?, claim_token = ?, claimed_at = ?, attempt_count = attempt_count + 1" +
                        " WHERE outbox_id = ? AND status = ?",
                OutboxStatus.PROCESSING.name(),
                claimToken,
                Timestamp.from(now),
                id,
                OutboxStatus.SCHEDULED.name()
        );
    }

    /**
     * pushes the lease of a live claim forward. 0 means the claim was lost.
     */
    public int renewClaim(final String id, final String claimToken, final Instant now) {
        return jdbcTemplate.update(
                "UPDATE " + tableName + " SET claimed_at = ? WHERE outbox_id = ? AND status = ? AND claim_token = ?",
                Timestamp.from(now),
                id,
                OutboxStatus.PROCESSING.name(),
                claimToken
        );
    }

    public int markPublished(final String id, final String claimToken, final Instant now) {
        return jdbcTemplate.update(
                "UPDATE " + tableName + " SET status = ?, published_at = ?" +
                        " WHERE outbox_id = ? AND status = ? AND claim_token = ?",
                OutboxStatus.PUBLISHED.name(),
                Timestamp.from(now),
                id,
                OutboxStatus.PROCESSING.name(),
                claimToken
        );
    }

    /**
     * processing -> scheduled, after a failed publish attempt.
     */
    public int release(final String id, final String claimToken) {
        return jdbcTemplate.update(
                "UPDATE " + tableName + " SET status = ?, claim_token = NULL, claimed_at = NULL" +
                        " WHERE outbox_id = ? AND status = ? AND claim_token = ?",
                OutboxStatus.SCHEDULED.name(),
                id,
                OutboxStatus.PROCESSING.name(),
                claimToken
        );
    }

    /**
     * processing -> scheduled for claims older than the cutoff; their worker is presumed dead.
     */
    public int reviveExpiredClaims(final String contextName, final Instant cutoff) {
        if (contextName == null) {
            return jdbcTemplate.update(
                    "UPDATE " + tableName + " SET status = ?, claim_token = NULL, claimed_at = NULL" +
                            " WHERE status = ? AND claimed_at < ? AND context_name IS NULL",
                    OutboxStatus.SCHEDULED.name(),
                    OutboxStatus.PROCESSING.name(),
                    Timestamp.from(cutoff)
            );
        } else {
            return jdbcTemplate.update(
                    "UPDATE " + tableName + " SET status = ?, claim_token = NULL, claimed_at = NULL" +
                            " WHERE status = ? AND claimed_at < ? AND context_name = ?",
                    OutboxStatus.SCHEDULED.name(),
                    OutboxStatus.PROCESSING.name(),
                    Timestamp.from(cutoff),
                    contextName
            );
        }
    }

    public int countAll() {
        final Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + tableName, Integer.class);
        return count == null ? 0 : count;
    }

    private static Instant toInstant(final Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
