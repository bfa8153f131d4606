package com.microsoft.capacityadvisor.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.microsoft.capacityadvisor.pricing.PricingCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Wiring for the rightsizing pipeline: the bounded worker pool and the
 * pricing catalog.
 *
 * When the pool queue is full the submitting thread runs the resource itself,
 * so a large batch slows down instead of losing resources.
 */
@Configuration
@EnableConfigurationProperties(RightsizingProperties.class)
@Slf4j
public class RightsizingConfig {

    @Bean(name = "rightsizingExecutor")
    public ThreadPoolTaskExecutor rightsizingExecutor(RightsizingProperties properties) {
        var settings = properties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.getPoolSize());
        executor.setMaxPoolSize(settings.getPoolSize());
        executor.setQueueCapacity(settings.getQueueCapacity());
        executor.setThreadNamePrefix("rightsizing-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean
    public PricingCatalog pricingCatalog(RightsizingProperties properties,
                                         ResourceLoader resourceLoader,
                                         ObjectMapper objectMapper) {
        String location = properties.getPricing().getCatalog();
        Resource resource = resourceLoader.getResource(location);

        try (InputStream in = resource.getInputStream()) {
            PricingCatalog catalog = PricingCatalog.fromJson(in, objectMapper);
            log.info("Loaded pricing catalog from {}", location);
            return catalog;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load pricing catalog from " + location, e);
        }
    }
}
