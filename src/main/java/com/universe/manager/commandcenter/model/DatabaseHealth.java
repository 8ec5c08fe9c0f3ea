package com.universe.manager.commandcenter.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Database health block of a {@link HealthSnapshot}.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class DatabaseHealth {

    // Average query response time in milliseconds
    @JsonProperty("avg_response_time")
    int avgResponseTime;

    @JsonProperty("connection_pool_healthy")
    boolean connectionPoolHealthy;

    // 0-100
    @JsonProperty("health_score")
    int healthScore;

    @JsonProperty("active_connections")
    int activeConnections;

    @JsonProperty("queries_last_hour")
    int queriesLastHour;
}
