package com.universe.manager.commandcenter.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.universe.manager.commandcenter.fetch.HttpStatusFetcher;
import com.universe.manager.commandcenter.fetch.RetryPolicy;
import com.universe.manager.commandcenter.fetch.RetryingFetchOperation;
import com.universe.manager.commandcenter.fetch.StatusFetcher;
import com.universe.manager.commandcenter.metrics.Metrics;
import com.universe.manager.commandcenter.output.StateSink;
import com.universe.manager.commandcenter.polling.PollingLoop;
import com.universe.manager.commandcenter.polling.RefreshCoordinator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Wiring for the status polling engine.
 *
 * Defaults match the compiled-in constants:
 * - 3 retries with 1s, 2s, 4s backoff, no jitter
 * - 30s between ticks
 * - connect/read timeouts on the HTTP client only; the engine itself has no
 *   per-attempt timeout
 */
@Configuration
public class CommandCenterConfig {

    @Value("${command-center.polling.auto-refresh-interval-ms:" + PollingLoop.AUTO_REFRESH_INTERVAL_MS + "}")
    private long autoRefreshIntervalMs;

    @Value("${command-center.retry.max-attempts:" + RetryPolicy.MAX_RETRY_ATTEMPTS + "}")
    private int maxRetryAttempts;

    @Value("${command-center.retry.base-delay-ms:" + RetryPolicy.BASE_RETRY_DELAY_MS + "}")
    private long baseRetryDelayMs;

    @Value("${command-center.backend.base-url:http://localhost:8081}")
    private String backendBaseUrl;

    @Value("${command-center.backend.health-path:/api/system/health}")
    private String healthPath;

    @Value("${command-center.backend.connect-timeout-ms:2000}")
    private long connectTimeoutMs;

    @Value("${command-center.backend.read-timeout-ms:5000}")
    private long readTimeoutMs;

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RetryPolicy retryPolicy() {
        return new RetryPolicy(maxRetryAttempts, Duration.ofMillis(baseRetryDelayMs));
    }

    @Bean
    public RestTemplate backendRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .build();
    }

    /**
     * Single-attempt backend capability; swapped for a scripted fetcher in tests.
     */
    @Bean
    public StatusFetcher statusFetcher(RestTemplate backendRestTemplate, ObjectMapper objectMapper) {
        return new HttpStatusFetcher(backendRestTemplate, objectMapper, backendBaseUrl + healthPath);
    }

    @Bean
    public RefreshCoordinator refreshCoordinator(
            StatusFetcher statusFetcher,
            RetryingFetchOperation retryingFetchOperation,
            StateSink stateSink,
            Metrics metrics,
            Clock clock
    ) {
        if (autoRefreshIntervalMs <= 0) {
            throw new IllegalArgumentException(
                    "command-center.polling.auto-refresh-interval-ms must be positive, got " + autoRefreshIntervalMs);
        }
        return new RefreshCoordinator(
                statusFetcher,
                retryingFetchOperation,
                stateSink,
                metrics,
                clock,
                Duration.ofMillis(autoRefreshIntervalMs)
        );
    }
}
