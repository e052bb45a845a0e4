package com.ivamare.workflow.repository.impl;

import com.ivamare.workflow.model.QuotaUsage;
import com.ivamare.workflow.model.QuotaUsage.CostTracking;
import com.ivamare.workflow.model.QuotaUsage.QuotaWindowUsage;
import com.ivamare.workflow.model.QuotaUsageSnapshot;
import com.ivamare.workflow.repository.QuotaUsageRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

import static com.ivamare.workflow.repository.impl.JsonColumns.instant;
import static com.ivamare.workflow.repository.impl.JsonColumns.timestamp;

/**
 * JDBC implementation of QuotaUsageRepository.
 *
 * <p>Usage is stored as jsonb in the shape
 * {@code {"quotas": {type: {used, limit, remaining, percentage}}, "cost_tracking": {...}}}.
 */
public class JdbcQuotaUsageRepository implements QuotaUsageRepository {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcQuotaUsageRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void save(QuotaUsageSnapshot snapshot) {
        String sql = """
            INSERT INTO workflow.quota_usage_log (log_id, workflow_id, service_name, usage_data, created_at)
            VALUES (?, ?, ?, ?::jsonb, ?)
            """;

        jdbcTemplate.update(sql,
            snapshot.logId(),
            snapshot.workflowId(),
            snapshot.serviceName(),
            JsonColumns.write(objectMapper, toUsageData(snapshot.usage())),
            timestamp(snapshot.createdAt())
        );
    }

    @Override
    public Optional<QuotaUsageSnapshot> findLatest(String serviceName, Instant since) {
        String sql = """
            SELECT log_id, workflow_id, service_name, usage_data, created_at
            FROM workflow.quota_usage_log
            WHERE service_name = ? AND created_at >= ?
            ORDER BY created_at DESC
            LIMIT 1
            """;

        List<QuotaUsageSnapshot> results = jdbcTemplate.query(sql, (rs, rowNum) -> new QuotaUsageSnapshot(
            rs.getObject("log_id", UUID.class),
            rs.getObject("workflow_id", UUID.class),
            rs.getString("service_name"),
            fromUsageData(JsonColumns.readMap(objectMapper, rs.getString("usage_data"))),
            instant(rs.getTimestamp("created_at"))
        ), serviceName, timestamp(since));
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    static Map<String, Object> toUsageData(QuotaUsage usage) {
        Map<String, Object> quotas = new TreeMap<>();
        usage.quotas().forEach((type, window) -> {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("used", window.used());
            entry.put("limit", window.limit());
            entry.put("remaining", window.remaining());
            entry.put("percentage", window.percentage());
            quotas.put(type, entry);
        });

        CostTracking cost = usage.costTracking();
        Map<String, Object> costTracking = new LinkedHashMap<>();
        costTracking.put("total_tokens", cost.totalTokens());
        costTracking.put("input_tokens", cost.inputTokens());
        costTracking.put("output_tokens", cost.outputTokens());
        costTracking.put("image_count", cost.imageCount());
        costTracking.put("total_requests", cost.totalRequests());
        costTracking.put("total_cost_usd", cost.totalCostUsd());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("quotas", quotas);
        data.put("cost_tracking", costTracking);
        return data;
    }

    @SuppressWarnings("unchecked")
    static QuotaUsage fromUsageData(Map<String, Object> data) {
        Map<String, QuotaWindowUsage> quotas = new TreeMap<>();
        if (data.get("quotas") instanceof Map<?, ?> rawQuotas) {
            rawQuotas.forEach((type, value) -> {
                if (value instanceof Map<?, ?> window) {
                    Map<String, Object> w = (Map<String, Object>) window;
                    quotas.put(String.valueOf(type), new QuotaWindowUsage(
                        longValue(w.get("used")),
                        longValue(w.get("limit")),
                        longValue(w.get("remaining"))));
                }
            });
        }

        CostTracking cost = CostTracking.EMPTY;
        if (data.get("cost_tracking") instanceof Map<?, ?> rawCost) {
            Map<String, Object> c = (Map<String, Object>) rawCost;
            Object totalCost = c.get("total_cost_usd");
            cost = new CostTracking(
                longValue(c.get("total_tokens")),
                longValue(c.get("input_tokens")),
                longValue(c.get("output_tokens")),
                longValue(c.get("image_count")),
                longValue(c.get("total_requests")),
                totalCost != null ? new BigDecimal(totalCost.toString()) : BigDecimal.ZERO);
        }
        return new QuotaUsage(quotas, cost);
    }

    private static long longValue(Object value) {
        return value instanceof Number number ? number.longValue() : 0L;
    }
}
