package com.ivamare.workflow.health;

import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Health indicator for the workflow store.
 *
 * <p>Checks:
 * <ul>
 *   <li>workflow schema exists</li>
 *   <li>Reports queued, processing and quota-blocked item counts</li>
 *   <li>Reports unresolved dead letters</li>
 * </ul>
 */
public class WorkflowHealthIndicator implements HealthIndicator {

    private static final int CONNECTION_VALIDITY_TIMEOUT_SECONDS = 3;

    private final JdbcTemplate jdbcTemplate;
    private final DataSource dataSource;

    public WorkflowHealthIndicator(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.dataSource = null;
    }

    public WorkflowHealthIndicator(JdbcTemplate jdbcTemplate, DataSource dataSource) {
        this.jdbcTemplate = jdbcTemplate;
        this.dataSource = dataSource;
    }

    @Override
    public Health health() {
        try {
            if (dataSource != null && !isConnectionValid()) {
                return Health.down()
                    .withDetail("error", "Database connection invalid")
                    .build();
            }

            Boolean schemaExists = jdbcTemplate.queryForObject(
                "SELECT EXISTS (SELECT 1 FROM information_schema.schemata WHERE schema_name = 'workflow')",
                Boolean.class
            );

            if (!Boolean.TRUE.equals(schemaExists)) {
                return Health.down()
                    .withDetail("error", "workflow schema not found")
                    .build();
            }

            Health.Builder builder = Health.up()
                .withDetail("schema", "workflow")
                .withDetail("queued", countInState("queued"))
                .withDetail("processing", countInState("processing"))
                .withDetail("quotaExceeded", countInState("quota_exceeded"))
                .withDetail("unresolvedDeadLetters", count(
                    "SELECT COUNT(*) FROM workflow.workflow_deadletter WHERE resolved_at IS NULL"));

            addPoolStats(builder);

            return builder.build();

        } catch (Exception e) {
            return Health.down()
                .withDetail("error", e.getMessage())
                .build();
        }
    }

    private long countInState(String state) {
        Long total = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM workflow.workflow_item WHERE state = ?", Long.class, state);
        return total != null ? total : 0L;
    }

    private long count(String sql) {
        Long total = jdbcTemplate.queryForObject(sql, Long.class);
        return total != null ? total : 0L;
    }

    private boolean isConnectionValid() {
        try (Connection conn = dataSource.getConnection()) {
            return conn.isValid(CONNECTION_VALIDITY_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            return false;
        }
    }

    private void addPoolStats(Health.Builder builder) {
        if (dataSource instanceof HikariDataSource hikari) {
            HikariPoolMXBean pool = hikari.getHikariPoolMXBean();
            if (pool != null) {
                builder.withDetail("pool.active", pool.getActiveConnections());
                builder.withDetail("pool.idle", pool.getIdleConnections());
                builder.withDetail("pool.total", pool.getTotalConnections());
                builder.withDetail("pool.pending", pool.getThreadsAwaitingConnection());
            }
        }
    }
}
