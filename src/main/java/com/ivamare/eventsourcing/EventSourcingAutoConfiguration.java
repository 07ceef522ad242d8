package com.ivamare.eventsourcing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.eventsourcing.aggregate.AggregateFactories;
import com.ivamare.eventsourcing.aggregate.EventSourcedRepository;
import com.ivamare.eventsourcing.command.CommandBus;
import com.ivamare.eventsourcing.command.CommandMiddleware;
import com.ivamare.eventsourcing.command.impl.DefaultCommandBus;
import com.ivamare.eventsourcing.command.middleware.LoggingMiddleware;
import com.ivamare.eventsourcing.command.middleware.RateLimitMiddleware;
import com.ivamare.eventsourcing.command.middleware.RetryMiddleware;
import com.ivamare.eventsourcing.command.middleware.TransactionalMiddleware;
import com.ivamare.eventsourcing.command.middleware.ValidationMiddleware;
import com.ivamare.eventsourcing.dispatch.EventDispatcher;
import com.ivamare.eventsourcing.dispatch.impl.DefaultEventDispatcher;
import com.ivamare.eventsourcing.handler.impl.DefaultHandlerRegistry;
import com.ivamare.eventsourcing.health.ProjectionHealthIndicator;
import com.ivamare.eventsourcing.notify.InProcessNotificationChannel;
import com.ivamare.eventsourcing.notify.NotificationChannel;
import com.ivamare.eventsourcing.policy.RetryPolicy;
import com.ivamare.eventsourcing.projection.Projection;
import com.ivamare.eventsourcing.projection.ProjectionRunner;
import com.ivamare.eventsourcing.query.QueryBus;
import com.ivamare.eventsourcing.query.QueryCache;
import com.ivamare.eventsourcing.query.QueryMiddleware;
import com.ivamare.eventsourcing.query.impl.DefaultQueryBus;
import com.ivamare.eventsourcing.query.middleware.AuthorizationMiddleware;
import com.ivamare.eventsourcing.query.middleware.FieldSelectionMiddleware;
import com.ivamare.eventsourcing.query.middleware.PaginationMiddleware;
import com.ivamare.eventsourcing.query.middleware.PerformanceTrackingMiddleware;
import com.ivamare.eventsourcing.query.middleware.TransformMiddleware;
import com.ivamare.eventsourcing.replay.ReplayEngine;
import com.ivamare.eventsourcing.snapshot.SnapshotManager;
import com.ivamare.eventsourcing.snapshot.impl.DefaultSnapshotManager;
import com.ivamare.eventsourcing.store.EventStore;
import com.ivamare.eventsourcing.store.EventSubscriptions;
import com.ivamare.eventsourcing.store.impl.InMemoryEventStore;
import com.ivamare.eventsourcing.store.impl.JdbcEventStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.core.annotation.Order;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.Duration;

/**
 * Auto-configuration for the event sourcing core.
 *
 * <p>Automatically configures:
 * <ul>
 *   <li>Event Store (JDBC when a JdbcTemplate is available, in-memory otherwise)</li>
 *   <li>Event Dispatcher and Notification Channel</li>
 *   <li>Aggregate factories, Snapshot Manager and repository</li>
 *   <li>Command Bus and Query Bus with their built-in middlewares</li>
 *   <li>Projection Runner and Replay Engine</li>
 * </ul>
 *
 * <p>To disable auto-configuration:
 * <pre>
 * eventsourcing.enabled=false
 * </pre>
 */
@AutoConfiguration(after = {
    DataSourceAutoConfiguration.class,
    JdbcTemplateAutoConfiguration.class,
    DataSourceTransactionManagerAutoConfiguration.class
})
@ConditionalOnProperty(prefix = "eventsourcing", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(EventSourcingProperties.class)
@Import({ProjectionAutoStartConfiguration.class, SnapshotMaintenanceConfiguration.class})
public class EventSourcingAutoConfiguration {

    // --- Object Mapper ---

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper eventSourcingObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules(); // Register JSR310 module
        return mapper;
    }

    // --- Event Store ---

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(JdbcTemplate.class)
    @ConditionalOnBean({JdbcTemplate.class, DataSource.class})
    @ConditionalOnProperty(prefix = "eventsourcing.store", name = "type", havingValue = "jdbc", matchIfMissing = true)
    static class JdbcEventStoreConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public EventStore eventStore(JdbcTemplate jdbcTemplate, DataSource dataSource,
                                     ObjectProvider<PlatformTransactionManager> transactionManager,
                                     ObjectMapper objectMapper) {
            PlatformTransactionManager manager = transactionManager.getIfAvailable(
                () -> new DataSourceTransactionManager(dataSource));
            return new JdbcEventStore(jdbcTemplate, new TransactionTemplate(manager), objectMapper);
        }
    }

    @Bean
    @ConditionalOnMissingBean
    public EventStore inMemoryEventStore() {
        return new InMemoryEventStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public EventSubscriptions eventSubscriptions(EventStore eventStore, EventSourcingProperties properties) {
        EventSourcingProperties.SubscriptionProperties subscription = properties.getSubscription();
        return new EventSubscriptions(eventStore, subscription.getBatchSize(),
            Duration.ofMillis(subscription.getPollIntervalMs()));
    }

    // --- Dispatch ---

    @Bean
    @ConditionalOnMissingBean
    public NotificationChannel notificationChannel() {
        return new InProcessNotificationChannel();
    }

    @Bean
    @ConditionalOnMissingBean
    public EventDispatcher eventDispatcher(NotificationChannel notificationChannel) {
        return new DefaultEventDispatcher(notificationChannel);
    }

    // --- Aggregates and Snapshots ---

    @Bean
    @ConditionalOnMissingBean
    public AggregateFactories aggregateFactories() {
        return new AggregateFactories();
    }

    @Bean
    @ConditionalOnMissingBean
    public SnapshotManager snapshotManager(EventStore eventStore, AggregateFactories aggregateFactories,
                                           EventSourcingProperties properties) {
        EventSourcingProperties.SnapshotProperties snapshot = properties.getSnapshot();
        return new DefaultSnapshotManager(eventStore, aggregateFactories,
            snapshot.getFrequency(), snapshot.getMaxAgeDays());
    }

    @Bean
    @ConditionalOnMissingBean
    public EventSourcedRepository eventSourcedRepository(EventStore eventStore, SnapshotManager snapshotManager,
                                                         EventDispatcher eventDispatcher) {
        return new EventSourcedRepository(eventStore, snapshotManager, eventDispatcher);
    }

    // --- Command Bus ---

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy retryPolicy(EventSourcingProperties properties) {
        EventSourcingProperties.RetryProperties retry = properties.getCommand().getRetry();
        return new RetryPolicy(retry.getMaxAttempts(), retry.getDelay());
    }

    @Bean
    @Order(100)
    @ConditionalOnProperty(prefix = "eventsourcing.command", name = "logging-enabled", havingValue = "true",
        matchIfMissing = true)
    public LoggingMiddleware loggingCommandMiddleware() {
        return new LoggingMiddleware();
    }

    @Bean
    @Order(200)
    @ConditionalOnProperty(prefix = "eventsourcing.command", name = "validation-enabled", havingValue = "true",
        matchIfMissing = true)
    public ValidationMiddleware validationCommandMiddleware() {
        return new ValidationMiddleware();
    }

    @Bean
    @Order(300)
    @ConditionalOnProperty(prefix = "eventsourcing.command", name = "rate-limit-enabled", havingValue = "true")
    public RateLimitMiddleware rateLimitCommandMiddleware(EventSourcingProperties properties) {
        EventSourcingProperties.RateLimitProperties rateLimit = properties.getCommand().getRateLimit();
        return new RateLimitMiddleware(rateLimit.getLimit(), rateLimit.getWindow());
    }

    @Bean
    @Order(400)
    @ConditionalOnProperty(prefix = "eventsourcing.command", name = "retry-enabled", havingValue = "true")
    public RetryMiddleware retryCommandMiddleware(RetryPolicy retryPolicy) {
        return new RetryMiddleware(retryPolicy);
    }

    @Bean
    @Order(500)
    @ConditionalOnBean(PlatformTransactionManager.class)
    @ConditionalOnProperty(prefix = "eventsourcing.command", name = "transactional-enabled", havingValue = "true")
    public TransactionalMiddleware transactionalCommandMiddleware(PlatformTransactionManager transactionManager) {
        return new TransactionalMiddleware(new TransactionTemplate(transactionManager));
    }

    @Bean
    @ConditionalOnMissingBean
    public CommandBus commandBus(ObjectProvider<CommandMiddleware> middlewares) {
        DefaultCommandBus bus = new DefaultCommandBus();
        middlewares.orderedStream().forEach(bus::use);
        return bus;
    }

    // --- Query Bus ---

    @Bean
    @ConditionalOnMissingBean
    public QueryCache queryCache(EventSourcingProperties properties) {
        return new QueryCache(properties.getQuery().getCacheTtl());
    }

    @Bean
    @Order(100)
    @ConditionalOnProperty(prefix = "eventsourcing.query", name = "performance-tracking-enabled",
        havingValue = "true", matchIfMissing = true)
    public PerformanceTrackingMiddleware performanceTrackingQueryMiddleware(EventSourcingProperties properties) {
        return new PerformanceTrackingMiddleware(properties.getQuery().getSlowQueryThreshold());
    }

    @Bean
    @Order(200)
    @ConditionalOnProperty(prefix = "eventsourcing.query", name = "authorization-enabled", havingValue = "true")
    public AuthorizationMiddleware authorizationQueryMiddleware() {
        return new AuthorizationMiddleware();
    }

    @Bean
    @Order(300)
    @ConditionalOnProperty(prefix = "eventsourcing.query", name = "pagination-enabled", havingValue = "true",
        matchIfMissing = true)
    public PaginationMiddleware paginationQueryMiddleware(EventSourcingProperties properties) {
        EventSourcingProperties.QueryProperties query = properties.getQuery();
        return new PaginationMiddleware(query.getDefaultPageSize(), query.getMaxPageSize());
    }

    @Bean
    @Order(400)
    @ConditionalOnMissingBean
    public FieldSelectionMiddleware fieldSelectionQueryMiddleware(ObjectMapper objectMapper) {
        return new FieldSelectionMiddleware(objectMapper);
    }

    @Bean
    @Order(500)
    @ConditionalOnMissingBean
    public TransformMiddleware transformQueryMiddleware() {
        return new TransformMiddleware();
    }

    @Bean
    @ConditionalOnMissingBean
    public QueryBus queryBus(QueryCache queryCache, ObjectProvider<QueryMiddleware> middlewares) {
        DefaultQueryBus bus = new DefaultQueryBus(new DefaultHandlerRegistry<>("query"), queryCache);
        middlewares.orderedStream().forEach(bus::use);
        return bus;
    }

    // --- Projections and Replay ---

    @Bean
    @ConditionalOnMissingBean
    public ProjectionRunner projectionRunner(EventStore eventStore, EventSourcingProperties properties,
                                             ObjectProvider<Projection> projections) {
        EventSourcingProperties.ProjectionProperties projection = properties.getProjection();
        ProjectionRunner runner = new ProjectionRunner(eventStore,
            projection.getBatchSize(),
            projection.getRebuildBatchSize(),
            projection.getIdleBackoffMs(),
            projection.getErrorBackoffMs());
        projections.orderedStream().forEach(runner::register);
        return runner;
    }

    @Bean
    @ConditionalOnMissingBean
    public ReplayEngine replayEngine(EventStore eventStore, EventDispatcher eventDispatcher,
                                     NotificationChannel notificationChannel,
                                     AggregateFactories aggregateFactories,
                                     EventSourcingProperties properties) {
        EventSourcingProperties.ReplayProperties replay = properties.getReplay();
        return new ReplayEngine(eventStore, eventDispatcher, notificationChannel, aggregateFactories,
            replay.getBatchSize(),
            replay.getPauseBetweenBatchesMs(),
            replay.getMaxEventDelayMs(),
            replay.getPausePollMs());
    }

    // --- Registry ---

    @Bean
    @ConditionalOnMissingBean
    public EventSourcingRegistry eventSourcingRegistry(CommandBus commandBus, QueryBus queryBus,
                                                       EventDispatcher eventDispatcher,
                                                       ProjectionRunner projectionRunner,
                                                       AggregateFactories aggregateFactories) {
        return new EventSourcingRegistry(commandBus, queryBus, eventDispatcher, projectionRunner, aggregateFactories);
    }

    // --- Health ---

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(HealthIndicator.class)
    static class ProjectionHealthConfiguration {

        @Bean
        @ConditionalOnMissingBean(name = "projectionHealthIndicator")
        public ProjectionHealthIndicator projectionHealthIndicator(ProjectionRunner projectionRunner) {
            return new ProjectionHealthIndicator(projectionRunner);
        }
    }
}
