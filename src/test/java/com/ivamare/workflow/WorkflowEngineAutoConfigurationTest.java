package com.ivamare.workflow;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.workflow.api.WorkflowQueue;
import com.ivamare.workflow.deadletter.DeadLetterStore;
import com.ivamare.workflow.engine.StateTransitionEngine;
import com.ivamare.workflow.events.EventEmitter;
import com.ivamare.workflow.lease.LeaseManager;
import com.ivamare.workflow.ops.WorkflowInsights;
import com.ivamare.workflow.quota.QuotaThrottle;
import com.ivamare.workflow.quota.QuotaTracker;
import com.ivamare.workflow.repository.WorkflowItemRepository;
import com.ivamare.workflow.retry.BackoffPolicy;
import com.ivamare.workflow.retry.RetryScheduler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

@DisplayName("WorkflowEngineAutoConfiguration")
class WorkflowEngineAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(WorkflowEngineAutoConfiguration.class))
        .withUserConfiguration(MockDataSourceConfig.class);

    @Test
    @DisplayName("should create all beans when enabled")
    void shouldCreateAllBeansWhenEnabled() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(ObjectMapper.class);
            assertThat(context).hasSingleBean(Clock.class);
            assertThat(context).hasSingleBean(WorkflowItemRepository.class);
            assertThat(context).hasSingleBean(EventEmitter.class);
            assertThat(context).hasSingleBean(StateTransitionEngine.class);
            assertThat(context).hasSingleBean(LeaseManager.class);
            assertThat(context).hasSingleBean(QuotaTracker.class);
            assertThat(context).hasSingleBean(DeadLetterStore.class);
            assertThat(context).hasSingleBean(RetryScheduler.class);
            assertThat(context).hasSingleBean(WorkflowQueue.class);
            assertThat(context).hasSingleBean(WorkflowInsights.class);
            assertThat(context).hasBean("workflowQuotaSeeder");
            assertThat(context).doesNotHaveBean(QuotaThrottle.class);
            assertThat(context).doesNotHaveBean("workflowWorkers");
        });
    }

    @Test
    @DisplayName("should not create beans when disabled")
    void shouldNotCreateBeansWhenDisabled() {
        contextRunner
            .withPropertyValues("workflow.enabled=false")
            .run(context -> {
                assertThat(context).doesNotHaveBean(WorkflowQueue.class);
                assertThat(context).doesNotHaveBean(RetryScheduler.class);
            });
    }

    @Test
    @DisplayName("should bind retry properties into the backoff policy")
    void shouldBindRetryProperties() {
        contextRunner
            .withPropertyValues("workflow.retry.max-retries=5", "workflow.retry.base-delay=1m")
            .run(context -> {
                BackoffPolicy policy = context.getBean(BackoffPolicy.class);
                assertThat(policy.maxRetries()).isEqualTo(5);
                assertThat(policy.baseDelay()).isEqualTo(Duration.ofMinutes(1));
            });
    }

    @Test
    @DisplayName("should skip quota seeding when disabled")
    void shouldSkipQuotaSeeding() {
        contextRunner
            .withPropertyValues("workflow.quota.seed-defaults=false")
            .run(context -> assertThat(context).doesNotHaveBean("workflowQuotaSeeder"));
    }

    @Test
    @DisplayName("should use custom Clock if provided")
    void shouldUseCustomClock() {
        contextRunner
            .withUserConfiguration(FixedClockConfig.class)
            .run(context -> {
                assertThat(context).hasSingleBean(Clock.class);
                assertThat(context.getBean(Clock.class)).isSameAs(FixedClockConfig.FIXED);
            });
    }

    @Test
    @DisplayName("should register worker beans when auto-start is enabled")
    void shouldRegisterWorkerBeansWhenAutoStartEnabled() {
        contextRunner
            .withPropertyValues("workflow.worker.auto-start=true")
            .run(context -> {
                assertThat(context).hasSingleBean(WorkerAutoStartConfiguration.class);
                assertThat(context).hasBean("workflowWorkers");
                assertThat(context).hasBean("workerHealthIndicator");
            });
    }

    @Configuration
    static class MockDataSourceConfig {
        @Bean
        public DataSource dataSource() {
            return mock(DataSource.class);
        }

        @Bean
        public JdbcTemplate jdbcTemplate() {
            return mock(JdbcTemplate.class);
        }

        @Bean
        public PlatformTransactionManager transactionManager() {
            return mock(PlatformTransactionManager.class);
        }
    }

    @Configuration
    static class FixedClockConfig {
        static final Clock FIXED = Clock.fixed(Instant.parse("2024-05-01T10:15:30Z"), ZoneOffset.UTC);

        @Bean
        public Clock customClock() {
            return FIXED;
        }
    }
}
