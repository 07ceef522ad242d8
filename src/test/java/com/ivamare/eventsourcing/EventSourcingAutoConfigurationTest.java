package com.ivamare.eventsourcing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.eventsourcing.aggregate.AggregateFactories;
import com.ivamare.eventsourcing.aggregate.EventSourcedRepository;
import com.ivamare.eventsourcing.command.CommandBus;
import com.ivamare.eventsourcing.command.middleware.LoggingMiddleware;
import com.ivamare.eventsourcing.command.middleware.RateLimitMiddleware;
import com.ivamare.eventsourcing.command.middleware.RetryMiddleware;
import com.ivamare.eventsourcing.command.middleware.TransactionalMiddleware;
import com.ivamare.eventsourcing.command.middleware.ValidationMiddleware;
import com.ivamare.eventsourcing.dispatch.EventDispatcher;
import com.ivamare.eventsourcing.health.ProjectionHealthIndicator;
import com.ivamare.eventsourcing.notify.NotificationChannel;
import com.ivamare.eventsourcing.policy.RetryPolicy;
import com.ivamare.eventsourcing.projection.PortalSummaryProjection;
import com.ivamare.eventsourcing.projection.ProjectionRunner;
import com.ivamare.eventsourcing.query.QueryBus;
import com.ivamare.eventsourcing.query.QueryCache;
import com.ivamare.eventsourcing.query.middleware.AuthorizationMiddleware;
import com.ivamare.eventsourcing.query.middleware.PaginationMiddleware;
import com.ivamare.eventsourcing.query.middleware.PerformanceTrackingMiddleware;
import com.ivamare.eventsourcing.replay.ReplayEngine;
import com.ivamare.eventsourcing.snapshot.SnapshotManager;
import com.ivamare.eventsourcing.store.EventStore;
import com.ivamare.eventsourcing.store.EventSubscriptions;
import com.ivamare.eventsourcing.store.impl.InMemoryEventStore;
import com.ivamare.eventsourcing.store.impl.JdbcEventStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

@DisplayName("EventSourcingAutoConfiguration")
class EventSourcingAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(EventSourcingAutoConfiguration.class))
        .withUserConfiguration(MockDataSourceConfig.class);

    @Test
    @DisplayName("should create all beans when enabled")
    void shouldCreateAllBeansWhenEnabled() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(ObjectMapper.class);
            assertThat(context).hasSingleBean(EventStore.class);
            assertThat(context).hasSingleBean(EventSubscriptions.class);
            assertThat(context).hasSingleBean(NotificationChannel.class);
            assertThat(context).hasSingleBean(EventDispatcher.class);
            assertThat(context).hasSingleBean(AggregateFactories.class);
            assertThat(context).hasSingleBean(SnapshotManager.class);
            assertThat(context).hasSingleBean(EventSourcedRepository.class);
            assertThat(context).hasSingleBean(RetryPolicy.class);
            assertThat(context).hasSingleBean(CommandBus.class);
            assertThat(context).hasSingleBean(QueryCache.class);
            assertThat(context).hasSingleBean(QueryBus.class);
            assertThat(context).hasSingleBean(ProjectionRunner.class);
            assertThat(context).hasSingleBean(ReplayEngine.class);
            assertThat(context).hasSingleBean(EventSourcingRegistry.class);
            assertThat(context).hasSingleBean(ProjectionHealthIndicator.class);
        });
    }

    @Test
    @DisplayName("should use JDBC event store when a JdbcTemplate is available")
    void shouldUseJdbcEventStore() {
        contextRunner.run(context ->
            assertThat(context.getBean(EventStore.class)).isInstanceOf(JdbcEventStore.class));
    }

    @Test
    @DisplayName("should fall back to in-memory event store without a database")
    void shouldFallBackToInMemoryEventStore() {
        new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(EventSourcingAutoConfiguration.class))
            .run(context ->
                assertThat(context.getBean(EventStore.class)).isInstanceOf(InMemoryEventStore.class));
    }

    @Test
    @DisplayName("should use in-memory event store when configured")
    void shouldUseInMemoryEventStoreWhenConfigured() {
        contextRunner
            .withPropertyValues("eventsourcing.store.type=memory")
            .run(context ->
                assertThat(context.getBean(EventStore.class)).isInstanceOf(InMemoryEventStore.class));
    }

    @Test
    @DisplayName("should not create beans when disabled")
    void shouldNotCreateBeansWhenDisabled() {
        contextRunner
            .withPropertyValues("eventsourcing.enabled=false")
            .run(context -> {
                assertThat(context).doesNotHaveBean(EventStore.class);
                assertThat(context).doesNotHaveBean(CommandBus.class);
                assertThat(context).doesNotHaveBean(QueryBus.class);
            });
    }

    @Test
    @DisplayName("should register default middlewares only")
    void shouldRegisterDefaultMiddlewares() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(LoggingMiddleware.class);
            assertThat(context).hasSingleBean(ValidationMiddleware.class);
            assertThat(context).doesNotHaveBean(RateLimitMiddleware.class);
            assertThat(context).doesNotHaveBean(RetryMiddleware.class);
            assertThat(context).doesNotHaveBean(TransactionalMiddleware.class);
            assertThat(context).hasSingleBean(PerformanceTrackingMiddleware.class);
            assertThat(context).hasSingleBean(PaginationMiddleware.class);
            assertThat(context).doesNotHaveBean(AuthorizationMiddleware.class);
        });
    }

    @Test
    @DisplayName("should register optional middlewares when enabled")
    void shouldRegisterOptionalMiddlewaresWhenEnabled() {
        contextRunner
            .withUserConfiguration(MockTransactionManagerConfig.class)
            .withPropertyValues(
                "eventsourcing.command.rate-limit-enabled=true",
                "eventsourcing.command.retry-enabled=true",
                "eventsourcing.command.transactional-enabled=true",
                "eventsourcing.query.authorization-enabled=true",
                "eventsourcing.command.logging-enabled=false"
            )
            .run(context -> {
                assertThat(context).hasSingleBean(RateLimitMiddleware.class);
                assertThat(context).hasSingleBean(RetryMiddleware.class);
                assertThat(context).hasSingleBean(TransactionalMiddleware.class);
                assertThat(context).hasSingleBean(AuthorizationMiddleware.class);
                assertThat(context).doesNotHaveBean(LoggingMiddleware.class);
            });
    }

    @Test
    @DisplayName("should register projection beans with the runner")
    void shouldRegisterProjectionBeans() {
        contextRunner
            .withUserConfiguration(ProjectionConfig.class)
            .run(context -> {
                ProjectionRunner runner = context.getBean(ProjectionRunner.class);
                assertThat(runner.projectionNames()).containsExactly("portal-summary");
            });
    }

    @Test
    @DisplayName("should create auto-start configuration when enabled")
    void shouldCreateAutoStartConfigurationWhenEnabled() {
        contextRunner
            .withPropertyValues("eventsourcing.projection.auto-start=true")
            .run(context -> assertThat(context).hasSingleBean(ProjectionAutoStartConfiguration.class));
    }

    @Test
    @DisplayName("should not create optional configurations by default")
    void shouldNotCreateOptionalConfigurationsByDefault() {
        contextRunner.run(context -> {
            assertThat(context).doesNotHaveBean(ProjectionAutoStartConfiguration.class);
            assertThat(context).doesNotHaveBean(SnapshotMaintenanceConfiguration.class);
        });
    }

    @Test
    @DisplayName("should create snapshot maintenance when enabled")
    void shouldCreateSnapshotMaintenanceWhenEnabled() {
        contextRunner
            .withPropertyValues("eventsourcing.snapshot.maintenance-enabled=true")
            .run(context -> assertThat(context).hasSingleBean(SnapshotMaintenanceConfiguration.class));
    }

    @Test
    @DisplayName("should use custom EventStore if provided")
    void shouldUseCustomEventStoreIfProvided() {
        contextRunner
            .withUserConfiguration(CustomEventStoreConfig.class)
            .run(context -> {
                assertThat(context).hasSingleBean(EventStore.class);
                assertThat(context.getBean(EventStore.class)).isSameAs(CustomEventStoreConfig.CUSTOM_STORE);
            });
    }

    @Test
    @DisplayName("should use custom ObjectMapper if provided")
    void shouldUseCustomObjectMapperIfProvided() {
        contextRunner
            .withUserConfiguration(CustomObjectMapperConfig.class)
            .run(context -> {
                assertThat(context).hasSingleBean(ObjectMapper.class);
                assertThat(context.getBean(ObjectMapper.class)).isSameAs(CustomObjectMapperConfig.CUSTOM_MAPPER);
            });
    }

    @Test
    @DisplayName("should configure RetryPolicy from properties")
    void shouldConfigureRetryPolicyFromProperties() {
        contextRunner
            .withPropertyValues(
                "eventsourcing.command.retry.max-attempts=5",
                "eventsourcing.command.retry.delay=250ms"
            )
            .run(context -> {
                RetryPolicy policy = context.getBean(RetryPolicy.class);
                assertThat(policy.maxAttempts()).isEqualTo(5);
                assertThat(policy.delay()).isEqualTo(Duration.ofMillis(250));
            });
    }

    @Test
    @DisplayName("should bind EventSourcingProperties")
    void shouldBindEventSourcingProperties() {
        contextRunner
            .withPropertyValues(
                "eventsourcing.snapshot.frequency=50",
                "eventsourcing.snapshot.max-age-days=7",
                "eventsourcing.projection.batch-size=25",
                "eventsourcing.replay.max-event-delay-ms=2000",
                "eventsourcing.command.rate-limit.limit=10",
                "eventsourcing.command.rate-limit.window=30s",
                "eventsourcing.query.cache-ttl=5m",
                "eventsourcing.query.max-page-size=500",
                "eventsourcing.subscription.poll-interval-ms=250"
            )
            .run(context -> {
                EventSourcingProperties props = context.getBean(EventSourcingProperties.class);
                assertThat(props.getSnapshot().getFrequency()).isEqualTo(50);
                assertThat(props.getSnapshot().getMaxAgeDays()).isEqualTo(7);
                assertThat(props.getProjection().getBatchSize()).isEqualTo(25);
                assertThat(props.getReplay().getMaxEventDelayMs()).isEqualTo(2000);
                assertThat(props.getCommand().getRateLimit().getLimit()).isEqualTo(10);
                assertThat(props.getCommand().getRateLimit().getWindow()).isEqualTo(Duration.ofSeconds(30));
                assertThat(props.getQuery().getCacheTtl()).isEqualTo(Duration.ofMinutes(5));
                assertThat(props.getQuery().getMaxPageSize()).isEqualTo(500);
                assertThat(props.getSubscription().getPollIntervalMs()).isEqualTo(250);
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
    }

    @Configuration
    static class MockTransactionManagerConfig {
        @Bean
        public PlatformTransactionManager transactionManager() {
            return mock(PlatformTransactionManager.class);
        }
    }

    @Configuration
    static class ProjectionConfig {
        @Bean
        public PortalSummaryProjection portalSummaryProjection() {
            return new PortalSummaryProjection();
        }
    }

    @Configuration
    static class CustomEventStoreConfig {
        static final EventStore CUSTOM_STORE = new InMemoryEventStore();

        @Bean
        public EventStore eventStore() {
            return CUSTOM_STORE;
        }
    }

    @Configuration
    static class CustomObjectMapperConfig {
        static final ObjectMapper CUSTOM_MAPPER = new ObjectMapper();

        @Bean
        public ObjectMapper objectMapper() {
            return CUSTOM_MAPPER;
        }
    }
}
