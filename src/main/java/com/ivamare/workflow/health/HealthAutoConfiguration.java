package com.ivamare.workflow.health;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Auto-configuration for workflow health indicators.
 */
@AutoConfiguration
@ConditionalOnClass({HealthIndicator.class, JdbcTemplate.class})
@ConditionalOnProperty(prefix = "workflow", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HealthAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(WorkflowHealthIndicator.class)
    public WorkflowHealthIndicator workflowHealthIndicator(JdbcTemplate jdbcTemplate,
                                                           ObjectProvider<DataSource> dataSource) {
        return new WorkflowHealthIndicator(jdbcTemplate, dataSource.getIfAvailable());
    }
}
