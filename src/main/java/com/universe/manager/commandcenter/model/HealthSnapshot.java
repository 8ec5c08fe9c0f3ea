package com.universe.manager.commandcenter.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Immutable health report produced by one successful fetch.
 *
 * Lists are never null and cannot be modified; alerts and pending decisions keep
 * the order the backend sent them in.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class HealthSnapshot {

    @JsonProperty("status")
    SystemStatus status;

    @JsonProperty("uptime_seconds")
    long uptimeSeconds;

    @JsonProperty("database_health")
    DatabaseHealth databaseHealth;

    @JsonProperty("performance_metrics")
    PerformanceMetrics performanceMetrics;

    @Singular(ignoreNullCollections = true)
    @JsonProperty("active_alerts")
    List<SystemAlert> activeAlerts;

    @Singular(ignoreNullCollections = true)
    @JsonProperty("recent_operations")
    List<OperationLog> recentOperations;

    @Singular(ignoreNullCollections = true)
    @JsonProperty("pending_decisions")
    List<String> pendingDecisions;

    @JsonProperty("version")
    String version;

    // bytes
    @JsonProperty("database_size")
    long databaseSize;

    // MB
    @JsonProperty("memory_usage")
    int memoryUsage;

    /**
     * Producer-side timestamp. Null when the backend does not send one.
     */
    @JsonProperty("generated_at")
    Instant generatedAt;
}
