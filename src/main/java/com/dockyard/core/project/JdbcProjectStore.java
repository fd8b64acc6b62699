package com.dockyard.core.project;

import com.dockyard.core.persistence.StoreException;
import com.dockyard.core.production.ProductionState;
import com.dockyard.core.production.ProductionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static com.dockyard.core.persistence.JdbcSupport.instant;
import static com.dockyard.core.persistence.JdbcSupport.isUniqueViolation;
import static com.dockyard.core.persistence.JdbcSupport.nullableInt;
import static com.dockyard.core.persistence.JdbcSupport.timestamp;

/**
 * JDBC-based {@link ProjectStore} backed by the {@code projects} table.
 */
public class JdbcProjectStore implements ProjectStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcProjectStore.class);

    private static final String TABLE_NAME = "projects";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id                   VARCHAR(255) PRIMARY KEY,
                name                 VARCHAR(255) NOT NULL,
                path                 VARCHAR(1024) NOT NULL,
                status               VARCHAR(20) NOT NULL,
                dev_port             INTEGER,
                runtime_port         INTEGER,
                bootstrap_session_id VARCHAR(255),
                production_status    VARCHAR(20) NOT NULL,
                production_hash      VARCHAR(64),
                production_port      INTEGER,
                production_url       VARCHAR(1024),
                production_error     VARCHAR(1000),
                production_started_at TIMESTAMP,
                created_at           TIMESTAMP NOT NULL,
                updated_at           TIMESTAMP NOT NULL
            )
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_ID_SQL = """
            SELECT * FROM %s WHERE id = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_ALL_SQL = """
            SELECT * FROM %s ORDER BY created_at ASC
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (id, name, path, status, dev_port, runtime_port, bootstrap_session_id,
                            production_status, production_hash, production_port, production_url,
                            production_error, production_started_at, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String UPDATE_STATUS_SQL = """
            UPDATE %s SET status = ?, updated_at = ? WHERE id = ?
            """.formatted(TABLE_NAME);

    private static final String UPDATE_SESSION_SQL = """
            UPDATE %s SET bootstrap_session_id = ?, updated_at = ? WHERE id = ?
            """.formatted(TABLE_NAME);

    private static final String UPDATE_PRODUCTION_SQL = """
            UPDATE %s
               SET production_status = ?, production_hash = ?, production_port = ?,
                   production_url = ?, production_error = ?, production_started_at = ?,
                   updated_at = ?
             WHERE id = ? AND production_status = ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;
    private final Clock clock;

    public JdbcProjectStore(DataSource dataSource, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.clock = clock;
    }

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_TABLE_SQL);
            log.info("Project table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public Optional<Project> findById(String id) {
        List<Project> rows = query(SELECT_BY_ID_SQL, id);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public List<Project> findAll() {
        return query(SELECT_ALL_SQL);
    }

    @Override
    public Project insert(Project project) {
        ProductionState production = project.production();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setString(1, project.id());
            stmt.setString(2, project.name());
            stmt.setString(3, project.path());
            stmt.setString(4, project.status().value());
            stmt.setObject(5, project.devPort());
            stmt.setObject(6, project.runtimePort());
            stmt.setString(7, project.bootstrapSessionId());
            stmt.setString(8, production.status().value());
            stmt.setString(9, production.hash());
            stmt.setObject(10, production.port());
            stmt.setString(11, production.url());
            stmt.setString(12, production.error());
            stmt.setTimestamp(13, timestamp(production.startedAt()));
            stmt.setTimestamp(14, timestamp(project.createdAt()));
            stmt.setTimestamp(15, timestamp(project.updatedAt()));
            stmt.executeUpdate();
            return project;
        } catch (SQLException e) {
            if (isUniqueViolation(e)) {
                throw new IllegalArgumentException("Project already exists: " + project.id());
            }
            throw new StoreException("Failed to insert project " + project.id(), e);
        }
    }

    @Override
    public boolean updateStatus(String id, ProjectStatus status) {
        return update(UPDATE_STATUS_SQL, status.value(), timestamp(clock.instant()), id);
    }

    @Override
    public boolean updateBootstrapSession(String id, String sessionId) {
        return update(UPDATE_SESSION_SQL, sessionId, timestamp(clock.instant()), id);
    }

    @Override
    public boolean updateProduction(String id, ProductionStatus expected, ProductionState next) {
        return update(UPDATE_PRODUCTION_SQL,
                next.status().value(), next.hash(), next.port(), next.url(), next.error(),
                timestamp(next.startedAt()), timestamp(clock.instant()), id, expected.value());
    }

    private boolean update(String sql, Object... params) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                stmt.setObject(i + 1, params[i]);
            }
            return stmt.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to update project", e);
        }
    }

    private List<Project> query(String sql, Object... params) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                stmt.setObject(i + 1, params[i]);
            }
            List<Project> rows = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    rows.add(fromResultSet(rs));
                }
            }
            return rows;
        } catch (SQLException e) {
            throw new StoreException("Failed to query projects", e);
        }
    }

    private static Project fromResultSet(ResultSet rs) throws SQLException {
        ProductionState production = new ProductionState(
                ProductionStatus.fromValue(rs.getString("production_status")),
                rs.getString("production_hash"),
                nullableInt(rs, "production_port"),
                rs.getString("production_url"),
                rs.getString("production_error"),
                instant(rs, "production_started_at"));
        return new Project(
                rs.getString("id"),
                rs.getString("name"),
                rs.getString("path"),
                ProjectStatus.fromValue(rs.getString("status")),
                nullableInt(rs, "dev_port"),
                nullableInt(rs, "runtime_port"),
                rs.getString("bootstrap_session_id"),
                production,
                instant(rs, "created_at"),
                instant(rs, "updated_at"));
    }
}
