package com.ivamare.workflow.repository.impl;

import com.ivamare.workflow.model.QuotaLimit;
import com.ivamare.workflow.repository.QuotaLimitRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

import static com.ivamare.workflow.repository.impl.JsonColumns.instant;
import static com.ivamare.workflow.repository.impl.JsonColumns.timestamp;

/**
 * JDBC implementation of QuotaLimitRepository.
 */
public class JdbcQuotaLimitRepository implements QuotaLimitRepository {

    private static final String SELECT_COLUMNS = """
        SELECT service_name, quota_type, limit_value, window_seconds, is_active, created_at, updated_at
        FROM workflow.quota_limit
        """;

    private final JdbcTemplate jdbcTemplate;
    private final QuotaLimitRowMapper rowMapper = new QuotaLimitRowMapper();

    public JdbcQuotaLimitRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void save(QuotaLimit limit) {
        String sql = """
            INSERT INTO workflow.quota_limit
                (service_name, quota_type, limit_value, window_seconds, is_active, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (service_name, quota_type) DO UPDATE SET
                limit_value = EXCLUDED.limit_value,
                window_seconds = EXCLUDED.window_seconds,
                is_active = EXCLUDED.is_active,
                updated_at = EXCLUDED.updated_at
            """;

        jdbcTemplate.update(sql, insertArgs(limit));
    }

    @Override
    public boolean insertIfAbsent(QuotaLimit limit) {
        String sql = """
            INSERT INTO workflow.quota_limit
                (service_name, quota_type, limit_value, window_seconds, is_active, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (service_name, quota_type) DO NOTHING
            """;

        return jdbcTemplate.update(sql, insertArgs(limit)) == 1;
    }

    @Override
    public Optional<QuotaLimit> find(String serviceName, String quotaType) {
        List<QuotaLimit> results = jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE service_name = ? AND quota_type = ?",
            rowMapper, serviceName, quotaType);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<QuotaLimit> findActiveByService(String serviceName) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE service_name = ? AND is_active = TRUE ORDER BY quota_type",
            rowMapper, serviceName);
    }

    @Override
    public List<QuotaLimit> findAll() {
        return jdbcTemplate.query(SELECT_COLUMNS + "ORDER BY service_name, quota_type", rowMapper);
    }

    @Override
    public boolean deactivate(String serviceName, String quotaType) {
        String sql = """
            UPDATE workflow.quota_limit
            SET is_active = FALSE, updated_at = NOW()
            WHERE service_name = ? AND quota_type = ? AND is_active = TRUE
            """;
        return jdbcTemplate.update(sql, serviceName, quotaType) > 0;
    }

    @Override
    public boolean delete(String serviceName, String quotaType) {
        String sql = "DELETE FROM workflow.quota_limit WHERE service_name = ? AND quota_type = ?";
        return jdbcTemplate.update(sql, serviceName, quotaType) > 0;
    }

    private Object[] insertArgs(QuotaLimit limit) {
        return new Object[]{
            limit.serviceName(),
            limit.quotaType(),
            limit.limitValue(),
            limit.windowSeconds(),
            limit.active(),
            timestamp(limit.createdAt()),
            timestamp(limit.updatedAt())
        };
    }

    private static class QuotaLimitRowMapper implements RowMapper<QuotaLimit> {
        @Override
        public QuotaLimit mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new QuotaLimit(
                rs.getString("service_name"),
                rs.getString("quota_type"),
                rs.getLong("limit_value"),
                rs.getInt("window_seconds"),
                rs.getBoolean("is_active"),
                instant(rs.getTimestamp("created_at")),
                instant(rs.getTimestamp("updated_at"))
            );
        }
    }
}
