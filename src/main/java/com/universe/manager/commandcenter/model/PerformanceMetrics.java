package com.universe.manager.commandcenter.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Numeric performance metrics of a {@link HealthSnapshot}.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class PerformanceMetrics {

    @JsonProperty("db_response_time")
    int dbResponseTime;

    @JsonProperty("db_health_score")
    int dbHealthScore;

    // MB
    @JsonProperty("memory_usage")
    int memoryUsage;

    // percent, 0-100
    @JsonProperty("cpu_usage")
    int cpuUsage;

    @JsonProperty("requests_per_minute")
    int requestsPerMinute;

    // percent, 0-100
    @JsonProperty("error_rate")
    double errorRate;
}
