package com.ivamare.workflow;

import com.ivamare.workflow.api.WorkflowQueue;
import com.ivamare.workflow.api.impl.DefaultWorkflowQueue;
import com.ivamare.workflow.deadletter.DeadLetterStore;
import com.ivamare.workflow.deadletter.impl.DefaultDeadLetterStore;
import com.ivamare.workflow.engine.StateTransitionEngine;
import com.ivamare.workflow.engine.impl.DefaultStateTransitionEngine;
import com.ivamare.workflow.events.EventEmitter;
import com.ivamare.workflow.events.impl.DefaultEventEmitter;
import com.ivamare.workflow.lease.LeaseManager;
import com.ivamare.workflow.lease.impl.DefaultLeaseManager;
import com.ivamare.workflow.ops.WorkflowInsights;
import com.ivamare.workflow.ops.impl.JdbcWorkflowInsights;
import com.ivamare.workflow.quota.QuotaThrottle;
import com.ivamare.workflow.quota.QuotaTracker;
import com.ivamare.workflow.quota.impl.DefaultQuotaTracker;
import com.ivamare.workflow.repository.DeadLetterRepository;
import com.ivamare.workflow.repository.DomainEventRepository;
import com.ivamare.workflow.repository.MetricRepository;
import com.ivamare.workflow.repository.QuotaLimitRepository;
import com.ivamare.workflow.repository.QuotaUsageRepository;
import com.ivamare.workflow.repository.TransitionRepository;
import com.ivamare.workflow.repository.WorkflowItemRepository;
import com.ivamare.workflow.repository.impl.JdbcDeadLetterRepository;
import com.ivamare.workflow.repository.impl.JdbcDomainEventRepository;
import com.ivamare.workflow.repository.impl.JdbcMetricRepository;
import com.ivamare.workflow.repository.impl.JdbcQuotaLimitRepository;
import com.ivamare.workflow.repository.impl.JdbcQuotaUsageRepository;
import com.ivamare.workflow.repository.impl.JdbcTransitionRepository;
import com.ivamare.workflow.repository.impl.JdbcWorkflowItemRepository;
import com.ivamare.workflow.retry.BackoffPolicy;
import com.ivamare.workflow.retry.RetryScheduler;
import com.ivamare.workflow.retry.impl.DefaultRetryScheduler;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.autoconfigure.transaction.TransactionAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Auto-configuration for the workflow engine.
 *
 * <p>Automatically configures:
 * <ul>
 *   <li>Repositories (items, transitions, events, metrics, dead letters, quotas)</li>
 *   <li>State transition engine, lease manager and event emitter</li>
 *   <li>Quota tracker, with an optional request throttle</li>
 *   <li>Retry scheduler and dead-letter store</li>
 *   <li>Workflow queue and insights</li>
 * </ul>
 *
 * <p>To disable auto-configuration:
 * <pre>
 * workflow.enabled=false
 * </pre>
 */
@AutoConfiguration(after = {
    DataSourceAutoConfiguration.class,
    DataSourceTransactionManagerAutoConfiguration.class,
    TransactionAutoConfiguration.class
})
@ConditionalOnClass(JdbcTemplate.class)
@ConditionalOnProperty(prefix = "workflow", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(WorkflowEngineProperties.class)
@Import(WorkerAutoStartConfiguration.class)
public class WorkflowEngineAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(WorkflowEngineAutoConfiguration.class);

    // --- Infrastructure ---

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper workflowObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules(); // JSR310
        return mapper;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock workflowClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public TransactionTemplate workflowTransactionTemplate(PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }

    // --- Repositories ---

    @Bean
    @ConditionalOnMissingBean
    public WorkflowItemRepository workflowItemRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcWorkflowItemRepository(jdbcTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public TransitionRepository transitionRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcTransitionRepository(jdbcTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public DomainEventRepository domainEventRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcDomainEventRepository(jdbcTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public MetricRepository metricRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcMetricRepository(jdbcTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public DeadLetterRepository deadLetterRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcDeadLetterRepository(jdbcTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public QuotaUsageRepository quotaUsageRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcQuotaUsageRepository(jdbcTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public QuotaLimitRepository quotaLimitRepository(JdbcTemplate jdbcTemplate) {
        return new JdbcQuotaLimitRepository(jdbcTemplate);
    }

    // --- Core services ---

    @Bean
    @ConditionalOnMissingBean
    public EventEmitter eventEmitter(DomainEventRepository eventRepository, MetricRepository metricRepository,
                                     Clock clock) {
        return new DefaultEventEmitter(eventRepository, metricRepository, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public StateTransitionEngine stateTransitionEngine(
            WorkflowItemRepository itemRepository,
            TransitionRepository transitionRepository,
            DomainEventRepository eventRepository,
            TransactionTemplate transactionTemplate,
            Clock clock) {
        return new DefaultStateTransitionEngine(
            itemRepository, transitionRepository, eventRepository, transactionTemplate, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public LeaseManager leaseManager(
            WorkflowItemRepository itemRepository,
            EventEmitter eventEmitter,
            TransactionTemplate transactionTemplate,
            Clock clock) {
        return new DefaultLeaseManager(itemRepository, eventEmitter, transactionTemplate, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public QuotaTracker quotaTracker(
            QuotaUsageRepository usageRepository,
            QuotaLimitRepository limitRepository,
            Clock clock,
            WorkflowEngineProperties properties) {
        return new DefaultQuotaTracker(usageRepository, limitRepository, clock,
            properties.getQuota().getRecencyWindow());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "workflow.quota", name = "throttle-enabled", havingValue = "true")
    public QuotaThrottle quotaThrottle(DataSource dataSource, QuotaLimitRepository limitRepository) {
        return new QuotaThrottle(dataSource, limitRepository);
    }

    @Bean
    @ConditionalOnMissingBean
    public DeadLetterStore deadLetterStore(
            DeadLetterRepository repository,
            EventEmitter eventEmitter,
            TransactionTemplate transactionTemplate,
            Clock clock) {
        return new DefaultDeadLetterStore(repository, eventEmitter, transactionTemplate, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public BackoffPolicy backoffPolicy(WorkflowEngineProperties properties) {
        WorkflowEngineProperties.RetryProperties retry = properties.getRetry();
        return new BackoffPolicy(retry.getMaxRetries(), retry.getBaseDelay(), retry.getMultiplier());
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryScheduler retryScheduler(
            WorkflowItemRepository itemRepository,
            StateTransitionEngine transitionEngine,
            LeaseManager leaseManager,
            DeadLetterStore deadLetterStore,
            QuotaTracker quotaTracker,
            EventEmitter eventEmitter,
            BackoffPolicy backoffPolicy,
            TransactionTemplate transactionTemplate,
            Clock clock) {
        return new DefaultRetryScheduler(itemRepository, transitionEngine, leaseManager, deadLetterStore,
            quotaTracker, eventEmitter, backoffPolicy, transactionTemplate, clock);
    }

    // --- Queue API ---

    @Bean
    @ConditionalOnMissingBean
    public WorkflowQueue workflowQueue(
            WorkflowItemRepository itemRepository,
            TransitionRepository transitionRepository,
            StateTransitionEngine transitionEngine,
            LeaseManager leaseManager,
            RetryScheduler retryScheduler,
            EventEmitter eventEmitter,
            BackoffPolicy backoffPolicy,
            TransactionTemplate transactionTemplate,
            Clock clock) {
        return new DefaultWorkflowQueue(itemRepository, transitionRepository, transitionEngine, leaseManager,
            retryScheduler, eventEmitter, backoffPolicy, transactionTemplate, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowInsights workflowInsights(JdbcTemplate jdbcTemplate, Clock clock) {
        return new JdbcWorkflowInsights(jdbcTemplate, clock);
    }

    // --- Startup ---

    @Bean
    @ConditionalOnProperty(prefix = "workflow.quota", name = "seed-defaults", havingValue = "true",
        matchIfMissing = true)
    public ApplicationRunner workflowQuotaSeeder(QuotaTracker quotaTracker, WorkflowEngineProperties properties) {
        return args -> {
            String service = properties.getQuota().getDefaultService();
            int inserted = quotaTracker.seedDefaults(service);
            log.debug("Quota defaults checked for service {}, {} inserted", service, inserted);
        };
    }
}
