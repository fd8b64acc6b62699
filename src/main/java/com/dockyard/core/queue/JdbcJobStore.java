package com.dockyard.core.queue;

import com.dockyard.core.persistence.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import static com.dockyard.core.persistence.JdbcSupport.instant;
import static com.dockyard.core.persistence.JdbcSupport.isUniqueViolation;
import static com.dockyard.core.persistence.JdbcSupport.timestamp;

/**
 * JDBC-based {@link JobStore} backed by the {@code jobs} and {@code queue_settings}
 * tables (PostgreSQL in production).
 * <p>
 * Claiming is a two-step select-then-conditional-update: candidates are read
 * without locks and each one is moved to running by an
 * {@code UPDATE ... WHERE state = 'queued'}. A concurrent dispatcher that loses
 * the race simply sees zero updated rows. Dedupe uniqueness is enforced by a
 * unique index on {@code (dedupe_key, dedupe_active)}, where {@code dedupe_active}
 * is {@code NULL} once the job is terminal.
 * <p>
 * The tables are created automatically via {@link #createTables()}.
 */
public class JdbcJobStore implements JobStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobStore.class);

    private static final String TABLE_NAME = "jobs";
    private static final String SETTINGS_TABLE = "queue_settings";
    private static final int DEDUPE_INSERT_ATTEMPTS = 3;

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id                  VARCHAR(64) PRIMARY KEY,
                type                VARCHAR(100) NOT NULL,
                state               VARCHAR(20) NOT NULL,
                payload             VARCHAR NOT NULL,
                project_id          VARCHAR(255),
                priority            INTEGER NOT NULL DEFAULT 0,
                attempts            INTEGER NOT NULL DEFAULT 0,
                max_attempts        INTEGER NOT NULL DEFAULT 3,
                run_at              TIMESTAMP NOT NULL,
                locked_at           TIMESTAMP,
                lock_expires_at     TIMESTAMP,
                locked_by           VARCHAR(255),
                dedupe_key          VARCHAR(255),
                dedupe_active       BOOLEAN,
                cancel_requested_at TIMESTAMP,
                cancelled_at        TIMESTAMP,
                last_error          VARCHAR,
                created_at          TIMESTAMP NOT NULL,
                updated_at          TIMESTAMP NOT NULL
            )
            """.formatted(TABLE_NAME);

    private static final String CREATE_DEDUPE_INDEX_SQL = """
            CREATE UNIQUE INDEX IF NOT EXISTS jobs_dedupe_active_uq
            ON %s (dedupe_key, dedupe_active)
            """.formatted(TABLE_NAME);

    private static final String CREATE_CLAIM_INDEX_SQL = """
            CREATE INDEX IF NOT EXISTS jobs_claim_idx
            ON %s (state, priority, run_at)
            """.formatted(TABLE_NAME);

    private static final String CREATE_SETTINGS_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id          INTEGER PRIMARY KEY,
                paused      BOOLEAN NOT NULL,
                concurrency INTEGER NOT NULL,
                updated_at  TIMESTAMP
            )
            """.formatted(SETTINGS_TABLE);

    private static final String INSERT_SQL = """
            INSERT INTO %s (id, type, state, payload, project_id, priority, attempts, max_attempts,
                            run_at, dedupe_key, dedupe_active, created_at, updated_at)
            VALUES (?, ?, 'queued', ?, ?, ?, 0, ?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_ID_SQL = """
            SELECT * FROM %s WHERE id = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_ACTIVE_DEDUPE_SQL = """
            SELECT * FROM %s WHERE dedupe_key = ? AND dedupe_active = TRUE
            """.formatted(TABLE_NAME);

    private static final String COUNT_RUNNING_SQL = """
            SELECT COUNT(*) FROM %s WHERE state = 'running'
            """.formatted(TABLE_NAME);

    private static final String SELECT_LATEST_FAILED_SQL = """
            SELECT * FROM %s
            WHERE project_id = ? AND state = 'failed'
            ORDER BY updated_at DESC
            LIMIT 1
            """.formatted(TABLE_NAME);

    private static final String SELECT_CANDIDATES_SQL = """
            SELECT id FROM %s
            WHERE state = 'queued'
              AND run_at <= ?
              AND (lock_expires_at IS NULL OR lock_expires_at < ?)
            ORDER BY priority DESC, run_at ASC
            LIMIT ?
            """.formatted(TABLE_NAME);

    private static final String CLAIM_SQL = """
            UPDATE %1$s
            SET state = 'running', locked_at = ?, lock_expires_at = ?, locked_by = ?, updated_at = ?
            WHERE id = ?
              AND state = 'queued'
              AND (project_id IS NULL OR NOT EXISTS (
                    SELECT 1 FROM %1$s r WHERE r.project_id = %1$s.project_id AND r.state = 'running'))
            """.formatted(TABLE_NAME);

    private static final String RENEW_LEASE_SQL = """
            UPDATE %s SET lock_expires_at = ?, updated_at = ?
            WHERE id = ? AND state = 'running' AND locked_by = ?
            """.formatted(TABLE_NAME);

    private static final String FINISH_OWNED_SQL = """
            UPDATE %s
            SET state = ?, attempts = COALESCE(?, attempts), last_error = COALESCE(?, last_error),
                cancelled_at = ?, dedupe_active = NULL,
                locked_at = NULL, lock_expires_at = NULL, locked_by = NULL, updated_at = ?
            WHERE id = ? AND state = 'running' AND locked_by = ?
            """.formatted(TABLE_NAME);

    private static final String REQUEUE_OWNED_SQL = """
            UPDATE %s
            SET state = 'queued', attempts = COALESCE(?, attempts), last_error = COALESCE(?, last_error),
                run_at = ?, locked_at = NULL, lock_expires_at = NULL, locked_by = NULL, updated_at = ?
            WHERE id = ? AND state = 'running' AND locked_by = ?
            """.formatted(TABLE_NAME);

    private static final String RECOVER_EXPIRED_SQL = """
            UPDATE %s
            SET state = 'queued', run_at = ?, locked_at = NULL, lock_expires_at = NULL, locked_by = NULL,
                updated_at = ?
            WHERE state = 'running' AND lock_expires_at < ?
            """.formatted(TABLE_NAME);

    private static final String FORCE_UNLOCK_SQL = """
            UPDATE %s
            SET state = 'queued', run_at = ?, locked_at = NULL, lock_expires_at = NULL, locked_by = NULL,
                updated_at = ?
            WHERE id = ? AND state = 'running' AND lock_expires_at < ?
            """.formatted(TABLE_NAME);

    private static final String CANCEL_QUEUED_SQL = """
            UPDATE %s
            SET state = 'cancelled', cancelled_at = ?, dedupe_active = NULL, updated_at = ?
            WHERE id = ? AND state = 'queued'
            """.formatted(TABLE_NAME);

    private static final String REQUEST_CANCEL_SQL = """
            UPDATE %s
            SET cancel_requested_at = COALESCE(cancel_requested_at, ?), updated_at = ?
            WHERE id = ? AND state = 'running'
            """.formatted(TABLE_NAME);

    private static final String SELECT_CANCEL_REQUESTED_SQL = """
            SELECT cancel_requested_at FROM %s WHERE id = ?
            """.formatted(TABLE_NAME);

    private static final String RUN_NOW_SQL = """
            UPDATE %s SET run_at = ?, updated_at = ?
            WHERE id = ? AND state = 'queued'
            """.formatted(TABLE_NAME);

    private static final String DELETE_SQL = """
            DELETE FROM %s WHERE id = ? AND state IN ('succeeded', 'failed', 'cancelled')
            """.formatted(TABLE_NAME);

    private static final String DELETE_BY_STATE_SQL = """
            DELETE FROM %s WHERE state = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_SETTINGS_SQL = """
            SELECT paused, concurrency FROM %s WHERE id = 1
            """.formatted(SETTINGS_TABLE);

    private static final String UPDATE_SETTINGS_SQL = """
            UPDATE %s SET paused = ?, concurrency = ?, updated_at = CURRENT_TIMESTAMP WHERE id = 1
            """.formatted(SETTINGS_TABLE);

    private static final String INSERT_SETTINGS_SQL = """
            INSERT INTO %s (id, paused, concurrency, updated_at) VALUES (1, ?, ?, CURRENT_TIMESTAMP)
            """.formatted(SETTINGS_TABLE);

    private final DataSource dataSource;

    public JdbcJobStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    /**
     * Creates the job and settings tables if they do not already exist.
     * Should be called once during application startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            for (String sql : List.of(CREATE_TABLE_SQL, CREATE_DEDUPE_INDEX_SQL,
                    CREATE_CLAIM_INDEX_SQL, CREATE_SETTINGS_SQL)) {
                try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                    stmt.execute();
                }
            }
            log.info("Job tables '{}' and '{}' ensured", TABLE_NAME, SETTINGS_TABLE);
        }
    }

    @Override
    public Job enqueue(String type, String payload, EnqueueOptions options, int defaultMaxAttempts, Instant now) {
        int maxAttempts = options.maxAttempts() != null ? options.maxAttempts() : defaultMaxAttempts;
        Instant runAt = options.runAt() != null ? options.runAt() : now;

        for (int attempt = 0; attempt < DEDUPE_INSERT_ATTEMPTS; attempt++) {
            String id = UUID.randomUUID().toString();
            try (Connection conn = dataSource.getConnection();
                 PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
                stmt.setString(1, id);
                stmt.setString(2, type);
                stmt.setString(3, payload);
                stmt.setString(4, options.projectId());
                stmt.setInt(5, options.priority());
                stmt.setInt(6, maxAttempts);
                stmt.setTimestamp(7, timestamp(runAt));
                stmt.setString(8, options.dedupeKey());
                if (options.dedupeKey() != null) {
                    stmt.setBoolean(9, true);
                } else {
                    stmt.setNull(9, Types.BOOLEAN);
                }
                stmt.setTimestamp(10, timestamp(now));
                stmt.setTimestamp(11, timestamp(now));
                stmt.executeUpdate();
                return findById(id).orElseThrow(() -> new IllegalStateException("Inserted job vanished: " + id));
            } catch (SQLException e) {
                if (options.dedupeKey() == null || !isUniqueViolation(e)) {
                    throw new StoreException("Failed to enqueue job of type " + type, e);
                }
            }
            // Dedupe collision: hand back the active holder of the key. It may have
            // finished between the failed insert and this read, in which case retry.
            Optional<Job> existing = findActiveByDedupeKey(options.dedupeKey());
            if (existing.isPresent()) {
                log.debug("Dedupe key '{}' already held by job {}", options.dedupeKey(), existing.get().id());
                return existing.get();
            }
        }
        throw new StoreException("Could not enqueue job with dedupe key " + options.dedupeKey(), null);
    }

    @Override
    public Optional<Job> findById(String id) {
        return queryOne(SELECT_BY_ID_SQL, id);
    }

    private Optional<Job> findActiveByDedupeKey(String dedupeKey) {
        return queryOne(SELECT_ACTIVE_DEDUPE_SQL, dedupeKey);
    }

    @Override
    public List<Job> list(JobFilter filter, int limit, int offset) {
        List<Object> params = new ArrayList<>();
        String sql = "SELECT * FROM " + TABLE_NAME + whereClause(filter, params)
                + " ORDER BY created_at DESC LIMIT ? OFFSET ?";
        params.add(limit);
        params.add(offset);
        return queryList(sql, params);
    }

    @Override
    public long count(JobFilter filter) {
        List<Object> params = new ArrayList<>();
        String sql = "SELECT COUNT(*) FROM " + TABLE_NAME + whereClause(filter, params);
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            bind(stmt, params);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to count jobs", e);
        }
    }

    @Override
    public int countRunning() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(COUNT_RUNNING_SQL);
             ResultSet rs = stmt.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to count running jobs", e);
        }
    }

    @Override
    public List<Job> findActive(String projectId, Collection<String> types) {
        if (types.isEmpty()) {
            return List.of();
        }
        String placeholders = String.join(", ", Collections.nCopies(types.size(), "?"));
        String sql = "SELECT * FROM " + TABLE_NAME
                + " WHERE project_id = ? AND state IN ('queued', 'running') AND type IN (" + placeholders + ")"
                + " ORDER BY created_at ASC";
        List<Object> params = new ArrayList<>();
        params.add(projectId);
        params.addAll(types);
        return queryList(sql, params);
    }

    @Override
    public Optional<Job> findLatestFailed(String projectId) {
        return queryOne(SELECT_LATEST_FAILED_SQL, projectId);
    }

    // ── Dispatcher transitions ──────────────────────────────────────────

    @Override
    public List<Job> claim(int limit, String workerId, Instant now, Duration lease) {
        if (limit <= 0) {
            return List.of();
        }
        List<String> candidates = new ArrayList<>();
        try (Connection conn = dataSource.getConnection()) {
            try (PreparedStatement stmt = conn.prepareStatement(SELECT_CANDIDATES_SQL)) {
                stmt.setTimestamp(1, timestamp(now));
                stmt.setTimestamp(2, timestamp(now));
                // Over-fetch so candidates skipped for project exclusion don't starve the batch
                stmt.setInt(3, limit * 4 + 10);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        candidates.add(rs.getString("id"));
                    }
                }
            }

            List<String> claimedIds = new ArrayList<>();
            for (String id : candidates) {
                if (claimedIds.size() >= limit) {
                    break;
                }
                try (PreparedStatement stmt = conn.prepareStatement(CLAIM_SQL)) {
                    stmt.setTimestamp(1, timestamp(now));
                    stmt.setTimestamp(2, timestamp(now.plus(lease)));
                    stmt.setString(3, workerId);
                    stmt.setTimestamp(4, timestamp(now));
                    stmt.setString(5, id);
                    if (stmt.executeUpdate() == 1) {
                        claimedIds.add(id);
                    }
                }
            }

            List<Job> claimed = new ArrayList<>();
            for (String id : claimedIds) {
                findById(id).ifPresent(claimed::add);
            }
            return claimed;
        } catch (SQLException e) {
            throw new StoreException("Failed to claim jobs", e);
        }
    }

    @Override
    public boolean renewLease(String id, String workerId, Instant lockExpiresAt, Instant now) {
        return update(RENEW_LEASE_SQL, timestamp(lockExpiresAt), timestamp(now), id, workerId);
    }

    @Override
    public boolean markSucceeded(String id, String workerId, Instant now) {
        return update(FINISH_OWNED_SQL, JobState.SUCCEEDED.value(), null, null, null, timestamp(now), id, workerId);
    }

    @Override
    public boolean markFailed(String id, String workerId, int attempts, String error, Instant now) {
        return update(FINISH_OWNED_SQL, JobState.FAILED.value(), attempts, error, null, timestamp(now), id, workerId);
    }

    @Override
    public boolean retryLater(String id, String workerId, int attempts, Instant runAt, String error, Instant now) {
        return update(REQUEUE_OWNED_SQL, attempts, error, timestamp(runAt), timestamp(now), id, workerId);
    }

    @Override
    public boolean reschedule(String id, String workerId, Instant runAt, Instant now) {
        return update(REQUEUE_OWNED_SQL, null, null, timestamp(runAt), timestamp(now), id, workerId);
    }

    @Override
    public boolean markCancelled(String id, String workerId, Instant now) {
        return update(FINISH_OWNED_SQL, JobState.CANCELLED.value(), null, null, timestamp(now), timestamp(now),
                id, workerId);
    }

    @Override
    public int recoverExpired(Instant now) {
        return updateCount(RECOVER_EXPIRED_SQL, timestamp(now), timestamp(now), timestamp(now));
    }

    // ── Administrative transitions ──────────────────────────────────────

    @Override
    public boolean cancelQueued(String id, Instant now) {
        return update(CANCEL_QUEUED_SQL, timestamp(now), timestamp(now), id);
    }

    @Override
    public boolean requestCancel(String id, Instant now) {
        return update(REQUEST_CANCEL_SQL, timestamp(now), timestamp(now), id);
    }

    @Override
    public boolean isCancelRequested(String id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_CANCEL_REQUESTED_SQL)) {
            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() && rs.getTimestamp(1) != null;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read cancel flag for job " + id, e);
        }
    }

    @Override
    public boolean forceUnlock(String id, Instant now) {
        return update(FORCE_UNLOCK_SQL, timestamp(now), timestamp(now), id, timestamp(now));
    }

    @Override
    public boolean runNow(String id, Instant now) {
        return update(RUN_NOW_SQL, timestamp(Instant.EPOCH), timestamp(now), id);
    }

    @Override
    public boolean delete(String id) {
        return update(DELETE_SQL, id);
    }

    @Override
    public int deleteByState(JobState state) {
        if (!state.isTerminal()) {
            return 0;
        }
        return updateCount(DELETE_BY_STATE_SQL, state.value());
    }

    // ── Settings ────────────────────────────────────────────────────────

    @Override
    public QueueSettings getSettings() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_SETTINGS_SQL);
             ResultSet rs = stmt.executeQuery()) {
            if (rs.next()) {
                return new QueueSettings(rs.getBoolean("paused"), rs.getInt("concurrency"));
            }
            return QueueSettings.defaults();
        } catch (SQLException e) {
            throw new StoreException("Failed to read queue settings", e);
        }
    }

    @Override
    public void saveSettings(QueueSettings settings) {
        if (updateCount(UPDATE_SETTINGS_SQL, settings.paused(), settings.concurrency()) == 0) {
            updateCount(INSERT_SETTINGS_SQL, settings.paused(), settings.concurrency());
        }
        log.info("Queue settings saved: paused={}, concurrency={}", settings.paused(), settings.concurrency());
    }

    // ── Helpers ─────────────────────────────────────────────────────────

    private static String whereClause(JobFilter filter, List<Object> params) {
        List<String> clauses = new ArrayList<>();
        if (filter.state() != null) {
            clauses.add("state = ?");
            params.add(filter.state().value());
        }
        if (filter.type() != null) {
            clauses.add("type = ?");
            params.add(filter.type());
        }
        if (filter.projectId() != null) {
            clauses.add("project_id = ?");
            params.add(filter.projectId());
        }
        if (filter.text() != null && !filter.text().isBlank()) {
            clauses.add("(LOWER(payload) LIKE ? OR LOWER(last_error) LIKE ?)");
            String pattern = "%" + filter.text().toLowerCase() + "%";
            params.add(pattern);
            params.add(pattern);
        }
        return clauses.isEmpty() ? "" : " WHERE " + String.join(" AND ", clauses);
    }

    private Optional<Job> queryOne(String sql, Object... params) {
        List<Job> jobs = queryList(sql, List.of(params));
        return jobs.isEmpty() ? Optional.empty() : Optional.of(jobs.get(0));
    }

    private List<Job> queryList(String sql, List<Object> params) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            bind(stmt, params);
            List<Job> jobs = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    jobs.add(fromResultSet(rs));
                }
            }
            return jobs;
        } catch (SQLException e) {
            throw new StoreException("Failed to query jobs", e);
        }
    }

    private boolean update(String sql, Object... params) {
        return updateCount(sql, params) > 0;
    }

    private int updateCount(String sql, Object... params) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            bind(stmt, Arrays.asList(params));
            return stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Job store update failed", e);
        }
    }

    private static void bind(PreparedStatement stmt, List<Object> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            stmt.setObject(i + 1, params.get(i));
        }
    }

    private static Job fromResultSet(ResultSet rs) throws SQLException {
        boolean dedupeActive = rs.getBoolean("dedupe_active");
        return new Job(
                rs.getString("id"),
                rs.getString("type"),
                JobState.fromValue(rs.getString("state")),
                rs.getString("payload"),
                rs.getString("project_id"),
                rs.getInt("priority"),
                rs.getInt("attempts"),
                rs.getInt("max_attempts"),
                instant(rs, "run_at"),
                instant(rs, "locked_at"),
                instant(rs, "lock_expires_at"),
                rs.getString("locked_by"),
                rs.getString("dedupe_key"),
                dedupeActive,
                instant(rs, "cancel_requested_at"),
                instant(rs, "cancelled_at"),
                rs.getString("last_error"),
                instant(rs, "created_at"),
                instant(rs, "updated_at")
        );
    }
}
