package com.indigententerprises.applications.toolkitwiring.configuration;

import com.indigententerprises.applications.rabbitbus.infrastructure.RabbitConnection;
import com.indigententerprises.applications.rabbitbus.serviceimplementations.RabbitEventBus;
import com.indigententerprises.applications.rabbitbus.serviceimplementations.RabbitEventBusConfig;
import com.indigententerprises.applications.toolkit.serviceimplementations.ExponentialBackoff;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * opt-in: import next to {@link ToolkitWiring} to publish outbox events through rabbit.
 */
@Configuration
@PropertySource("classpath:toolkit-defaults.properties")
public class RabbitBusWiring {

    @Value("${toolkit.rabbit.uri}")
    private String amqpUri;

    @Value("${toolkit.rabbit.exchange}")
    private String exchangeName;

    @Value("${toolkit.rabbit.queue-prefix}")
    private String queuePrefix;

    @Value("${toolkit.rabbit.prefetch}")
    private int prefetch;

    @Value("${toolkit.rabbit.max-attempts}")
    private int maxAttempts;

    @Value("${toolkit.rabbit.retry-initial-delay-ms}")
    private long retryInitialDelayMs;

    @Value("${toolkit.rabbit.queue-expiration-ms}")
    private long queueExpirationMs;

    @Value("${toolkit.rabbit.reconnection-delay-ms}")
    private long reconnectionDelayMs;

    @Value("${toolkit.rabbit.confirm-timeout-ms}")
    private long confirmTimeoutMs;

    @Bean
    public RabbitEventBusConfig rabbitEventBusConfig() {
        return RabbitEventBusConfig.builder(amqpUri, exchangeName)
                .queuePrefix(queuePrefix)
                .consumerPrefetch(prefetch)
                .maxAttempts(maxAttempts)
                .retryMechanism(new ExponentialBackoff(retryInitialDelayMs))
                .queueExpirationMs(queueExpirationMs)
                .reconnectionDelayMs(reconnectionDelayMs)
                .confirmTimeoutMs(confirmTimeoutMs)
                .build();
    }

    @Bean
    public RabbitConnection rabbitConnection(final RabbitEventBusConfig rabbitEventBusConfig) {
        return RabbitConnection.fromUri(rabbitEventBusConfig);
    }

    @Bean(initMethod="init", destroyMethod="terminate")
    public RabbitEventBus rabbitEventBus(
            final RabbitConnection rabbitConnection,
            final ObjectMapper objectMapper,
            final RabbitEventBusConfig rabbitEventBusConfig
    ) {
        return new RabbitEventBus(rabbitConnection, objectMapper, rabbitEventBusConfig);
    }
}
