package com.aporkolab.maxretry.spring.autoconfigure;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.aporkolab.maxretry.handler.MaxRetryOptions;
import com.aporkolab.maxretry.metrics.RetryMetrics;
import com.aporkolab.maxretry.metrics.micrometer.MicrometerRetryMetrics;

import io.micrometer.core.instrument.MeterRegistry;

/**
 * Spring Boot Auto-Configuration for the max-retry handler.
 * 
 * Automatically configures:
 * - MaxRetryOptions bound from max-retry.*
 * - RetryMetrics backed by Micrometer when a MeterRegistry is available, no-op otherwise
 * - MaxRetryHandlerFactory for creating handlers per worker queue
 * 
 * Disable with: max-retry.enabled=false
 */
@AutoConfiguration(afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@EnableConfigurationProperties(MaxRetryProperties.class)
@ConditionalOnProperty(prefix = "max-retry", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MaxRetryAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public MaxRetryOptions maxRetryOptions(MaxRetryProperties properties) {
        return properties.toOptions();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryMetrics retryMetrics() {
        return RetryMetrics.noop();
    }

    @Bean
    @ConditionalOnMissingBean
    public MaxRetryHandlerFactory maxRetryHandlerFactory(MaxRetryOptions options, RetryMetrics metrics) {
        return new MaxRetryHandlerFactory(options, metrics);
    }

    // ==================== METRICS ====================

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnProperty(prefix = "max-retry.metrics", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class MicrometerMetricsConfiguration {

        @Bean
        @ConditionalOnMissingBean(RetryMetrics.class)
        public RetryMetrics micrometerRetryMetrics(MeterRegistry registry, MaxRetryProperties properties) {
            return new MicrometerRetryMetrics(registry, properties.getMetrics().getPrefix());
        }
    }
}
