package com.indigententerprises.applications.toolkitwiring.configuration;

import com.indigententerprises.applications.rabbitbus.serviceimplementations.RabbitEventBus;
import com.indigententerprises.applications.toolkit.domain.Event;
import com.indigententerprises.applications.toolkit.serviceimplementations.JdbcOutbox;
import com.indigententerprises.applications.toolkit.serviceimplementations.LocalBusConfig;
import com.indigententerprises.applications.toolkit.serviceimplementations.LocalCommandBus;
import com.indigententerprises.applications.toolkit.serviceimplementations.LocalEventBus;
import com.indigententerprises.applications.toolkit.serviceimplementations.LocalQueryBus;
import com.indigententerprises.applications.toolkit.serviceimplementations.OutboxConfig;
import com.indigententerprises.applications.toolkit.serviceinterfaces.EventBus;
import com.indigententerprises.applications.toolkit.serviceinterfaces.PublishEventsCallback;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import javax.sql.DataSource;

/**
 * assembles the toolkit around the application's {@link DataSource}.
 * outbox events go to the broker bus when {@link RabbitBusWiring} is imported, to the local bus
 * otherwise.
 */
@Configuration
@PropertySource("classpath:toolkit-defaults.properties")
public class ToolkitWiring {

    @Value("${toolkit.outbox.table}")
    private String outboxTable;

    @Value("${toolkit.outbox.context}")
    private String outboxContext;

    @Value("${toolkit.outbox.monitoring-interval-ms}")
    private long monitoringIntervalMs;

    @Value("${toolkit.outbox.claim-lease-ms}")
    private long claimLeaseMs;

    @Value("${toolkit.outbox.publish-threads}")
    private int publishThreads;

    @Value("${toolkit.bus.max-attempts}")
    private int busMaxAttempts;

    @Value("${toolkit.bus.retry-initial-delay-ms}")
    private long busRetryInitialDelayMs;

    @Value("${toolkit.bus.dispatch-threads}")
    private int busDispatchThreads;

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public JdbcTemplate jdbcTemplate(final DataSource dataSource) {
        return new JdbcTemplate(dataSource);
    }

    @Bean
    public PlatformTransactionManager transactionManager(final DataSource dataSource) {
        return new DataSourceTransactionManager(dataSource);
    }

    @Bean
    public LocalBusConfig localBusConfig() {
        return LocalBusConfig.builder()
                .maxAttempts(busMaxAttempts)
                .retryInitialDelayMs(busRetryInitialDelayMs)
                .dispatchThreads(busDispatchThreads)
                .build();
    }

    @Bean(destroyMethod="terminate")
    public LocalEventBus localEventBus(final ObjectMapper objectMapper, final LocalBusConfig localBusConfig) {
        return new LocalEventBus(objectMapper, localBusConfig);
    }

    @Bean(destroyMethod="terminate")
    public LocalCommandBus<Void> localCommandBus(final LocalBusConfig localBusConfig) {
        return new LocalCommandBus<>(localBusConfig);
    }

    @Bean
    public LocalQueryBus localQueryBus() {
        return new LocalQueryBus();
    }

    @Bean
    public PublishEventsCallback publishEventsCallback(
            final LocalEventBus localEventBus,
            final ObjectProvider<RabbitEventBus> rabbitEventBus
    ) {
        final RabbitEventBus broker = rabbitEventBus.getIfAvailable();
        final EventBus target = broker != null ? broker : localEventBus;

        return events -> {
            for (final Event<?> event : events) {
                target.publish(event);
            }
        };
    }

    @Bean
    public OutboxConfig outboxConfig() {
        return OutboxConfig.builder()
                .tableName(outboxTable)
                .contextName(outboxContext == null || outboxContext.isBlank() ? null : outboxContext)
                .monitoringIntervalMs(monitoringIntervalMs)
                .claimLeaseMs(claimLeaseMs)
                .publishThreads(publishThreads)
                .build();
    }

    @Bean(destroyMethod="terminate")
    public JdbcOutbox outbox(
            final JdbcTemplate jdbcTemplate,
            final PlatformTransactionManager transactionManager,
            final ObjectMapper objectMapper,
            final PublishEventsCallback publishEventsCallback,
            final OutboxConfig outboxConfig
    ) {
        return new JdbcOutbox(jdbcTemplate, transactionManager, objectMapper, publishEventsCallback, outboxConfig);
    }

    @Bean
    public ApplicationRunner outboxRunner(final JdbcOutbox outbox) {
        return args -> {
            outbox.createTableIfMissing();
            outbox.init();
        };
    }
}
