package com.trendradar.radar.persistence;

import com.trendradar.config.RadarProperties;
import com.trendradar.radar.model.RecordIdentity;
import com.trendradar.radar.report.HistoryCorruptException;
import com.trendradar.radar.report.RunHistoryStore;
import com.trendradar.radar.util.RunSignatures;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Run history keyed by signature. Items are stored under a SHA-256 of the normalized title so
 * titles of any length fit the primary key; a run and its items are written in one transaction.
 */
@Repository
public class JdbcRunHistoryStore implements RunHistoryStore {
    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;
    private final RadarProperties properties;

    public JdbcRunHistoryStore(
        NamedParameterJdbcTemplate jdbc,
        PlatformTransactionManager transactionManager,
        RadarProperties properties
    ) {
        this.jdbc = jdbc;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.properties = properties;
    }

    @Override
    public Map<RecordIdentity, Instant> loadSeen(String signature) {
        Map<RecordIdentity, Instant> seen = new LinkedHashMap<>();
        try {
            jdbc.query(
                """
                    SELECT i.platform, i.title_key, MIN(i.first_seen_at) AS first_seen_at
                    FROM run_history_items i
                    JOIN run_history_runs r ON r.id = i.run_id
                    WHERE r.signature = :signature
                    GROUP BY i.platform, i.title_hash, i.title_key
                    """,
                new MapSqlParameterSource().addValue("signature", signature),
                rs -> {
                    Timestamp firstSeen = rs.getTimestamp("first_seen_at");
                    seen.put(
                        new RecordIdentity(rs.getString("platform"), rs.getString("title_key")),
                        firstSeen == null ? null : firstSeen.toInstant()
                    );
                }
            );
        } catch (DataAccessException e) {
            throw new HistoryCorruptException("Run history unreadable for signature " + signature, e);
        }
        return seen;
    }

    @Override
    public void recordRun(String signature, Instant recordedAt, Map<RecordIdentity, Instant> identities) {
        transactionTemplate.executeWithoutResult(status -> insertRun(signature, recordedAt, identities));
    }

    private void insertRun(String signature, Instant recordedAt, Map<RecordIdentity, Instant> identities) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO run_history_runs (signature, recorded_at, identity_count)
                VALUES (:signature, :recordedAt, :identityCount)
                """,
            new MapSqlParameterSource()
                .addValue("signature", signature)
                .addValue("recordedAt", Timestamp.from(recordedAt))
                .addValue("identityCount", identities.size()),
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert run history row");
        }
        long runId = key.longValue();

        List<MapSqlParameterSource> rows = new ArrayList<>(identities.size());
        for (Map.Entry<RecordIdentity, Instant> entry : identities.entrySet()) {
            Instant firstSeen = entry.getValue() == null ? recordedAt : entry.getValue();
            rows.add(new MapSqlParameterSource()
                .addValue("runId", runId)
                .addValue("platform", entry.getKey().platform())
                .addValue("titleHash", RunSignatures.sha256Hex(entry.getKey().titleKey()))
                .addValue("titleKey", entry.getKey().titleKey())
                .addValue("firstSeenAt", Timestamp.from(firstSeen)));
        }
        if (!rows.isEmpty()) {
            jdbc.batchUpdate(
                """
                    INSERT INTO run_history_items (run_id, platform, title_hash, title_key, first_seen_at)
                    VALUES (:runId, :platform, :titleHash, :titleKey, :firstSeenAt)
                    """,
                rows.toArray(new MapSqlParameterSource[0])
            );
        }
        prune(signature);
    }

    public int countRuns(String signature) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM run_history_runs WHERE signature = :signature",
            new MapSqlParameterSource().addValue("signature", signature),
            Integer.class
        );
        return count == null ? 0 : count;
    }

    private void prune(String signature) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("signature", signature)
            .addValue("retain", properties.getHistory().getRetainRuns());
        List<Long> stale = jdbc.queryForList(
            """
                SELECT id
                FROM run_history_runs
                WHERE signature = :signature
                ORDER BY recorded_at DESC, id DESC
                OFFSET :retain ROWS
                """,
            params,
            Long.class
        );
        if (stale.isEmpty()) {
            return;
        }
        MapSqlParameterSource ids = new MapSqlParameterSource().addValue("ids", stale);
        jdbc.update("DELETE FROM run_history_items WHERE run_id IN (:ids)", ids);
        jdbc.update("DELETE FROM run_history_runs WHERE id IN (:ids)", ids);
    }
}
