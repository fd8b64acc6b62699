package com.dockyard.core.ports;

import com.dockyard.core.persistence.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static com.dockyard.core.persistence.JdbcSupport.instant;
import static com.dockyard.core.persistence.JdbcSupport.isUniqueViolation;
import static com.dockyard.core.persistence.JdbcSupport.timestamp;

/**
 * JDBC-based {@link PortStore} backed by the {@code ports} table.
 * The primary key on {@code port} enforces global uniqueness.
 */
public class JdbcPortStore implements PortStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcPortStore.class);

    private static final String TABLE_NAME = "ports";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                port       INTEGER PRIMARY KEY,
                port_type  VARCHAR(20) NOT NULL,
                project_id VARCHAR(255),
                hash       VARCHAR(64),
                created_at TIMESTAMP NOT NULL,
                updated_at TIMESTAMP NOT NULL
            )
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_PORT_SQL = """
            SELECT * FROM %s WHERE port = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_PROJECT_TYPE_SQL = """
            SELECT * FROM %s WHERE project_id = ? AND port_type = ?
            ORDER BY created_at ASC
            LIMIT 1
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_PROJECT_SQL = """
            SELECT * FROM %s WHERE project_id = ? ORDER BY port ASC
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (port, port_type, project_id, hash, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String DELETE_SQL = """
            DELETE FROM %s WHERE port = ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;

    public JdbcPortStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Port table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public Optional<PortAllocation> findByPort(int port) {
        List<PortAllocation> rows = query(SELECT_BY_PORT_SQL, port);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public Optional<PortAllocation> findByProject(String projectId, PortType portType) {
        List<PortAllocation> rows = query(SELECT_BY_PROJECT_TYPE_SQL, projectId, portType.value());
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public List<PortAllocation> listByProject(String projectId) {
        return query(SELECT_BY_PROJECT_SQL, projectId);
    }

    @Override
    public PortAllocation register(PortAllocation allocation) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setInt(1, allocation.port());
            stmt.setString(2, allocation.portType().value());
            stmt.setString(3, allocation.projectId());
            stmt.setString(4, allocation.hash());
            stmt.setTimestamp(5, timestamp(allocation.createdAt()));
            stmt.setTimestamp(6, timestamp(allocation.updatedAt()));
            stmt.executeUpdate();
            return allocation;
        } catch (SQLException e) {
            if (isUniqueViolation(e)) {
                throw new PortConflictException("Port " + allocation.port() + " is already registered");
            }
            throw new StoreException("Failed to register port " + allocation.port(), e);
        }
    }

    @Override
    public boolean unregister(int port) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_SQL)) {
            stmt.setInt(1, port);
            return stmt.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to unregister port " + port, e);
        }
    }

    private List<PortAllocation> query(String sql, Object... params) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                stmt.setObject(i + 1, params[i]);
            }
            List<PortAllocation> rows = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    rows.add(new PortAllocation(
                            rs.getInt("port"),
                            PortType.fromValue(rs.getString("port_type")),
                            rs.getString("project_id"),
                            rs.getString("hash"),
                            instant(rs, "created_at"),
                            instant(rs, "updated_at")));
                }
            }
            return rows;
        } catch (SQLException e) {
            throw new StoreException("Failed to query ports", e);
        }
    }
}
