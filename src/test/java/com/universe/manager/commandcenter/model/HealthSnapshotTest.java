package com.universe.manager.commandcenter.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.universe.manager.commandcenter.config.CommandCenterConfig;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class HealthSnapshotTest {

    private final ObjectMapper objectMapper = new CommandCenterConfig().objectMapper();

    /**
     * Backend payload keeps alert and decision order and relays alert priority as-is.
     */
    @Test
    public void testDecodeKeepsAlertAndDecisionOrder() throws Exception {
        String json = """
                {
                  "status": "Critical",
                  "uptime_seconds": 120,
                  "database_health": {"avg_response_time": 400, "connection_pool_healthy": false,
                                      "health_score": 40, "active_connections": 30, "queries_last_hour": 90000},
                  "performance_metrics": {"db_response_time": 400, "db_health_score": 40, "memory_usage": 2048,
                                          "cpu_usage": 97, "requests_per_minute": 3000, "error_rate": 12.5},
                  "active_alerts": [
                    {"message": "Database slow", "priority": "Critical", "created_at": "2026-01-24T11:59:00.250Z",
                     "category": "performance", "requires_action": true},
                    {"message": "Title vacant", "priority": "Info", "created_at": "2026-01-24T11:00:00Z",
                     "category": "business", "requires_action": false}
                  ],
                  "recent_operations": [
                    {"timestamp": "2026-01-24T11:58:00Z", "operation": "Backup", "status": "Success",
                     "performed_by": "system", "details": null, "duration_ms": 1500}
                  ],
                  "pending_decisions": ["Book main event", "Approve roster change"],
                  "version": "2.0.1",
                  "database_size": 10485760,
                  "memory_usage": 2048,
                  "generated_at": "2026-01-24T12:00:00Z",
                  "some_future_field": 1
                }
                """;

        HealthSnapshot snapshot = objectMapper.readValue(json, HealthSnapshot.class);

        assertThat(snapshot.getStatus()).isEqualTo(SystemStatus.CRITICAL);
        assertThat(snapshot.getDatabaseHealth().isConnectionPoolHealthy()).isFalse();
        assertThat(snapshot.getPerformanceMetrics().getErrorRate()).isEqualTo(12.5);
        assertThat(snapshot.getActiveAlerts())
                .extracting(SystemAlert::getMessage)
                .containsExactly("Database slow", "Title vacant");
        assertThat(snapshot.getActiveAlerts().get(0).getPriority()).isEqualTo(AlertPriority.CRITICAL);
        assertThat(snapshot.getActiveAlerts().get(0).getCreatedAt())
                .isEqualTo(Instant.parse("2026-01-24T11:59:00.250Z"));
        assertThat(snapshot.getRecentOperations().get(0).getDurationMs()).isEqualTo(1500);
        assertThat(snapshot.getRecentOperations().get(0).getDetails()).isNull();
        assertThat(snapshot.getPendingDecisions()).containsExactly("Book main event", "Approve roster change");
        assertThat(snapshot.getGeneratedAt()).isEqualTo(Instant.parse("2026-01-24T12:00:00Z"));
    }

    @Test
    public void testMissingListsDecodeAsEmptyAndImmutable() throws Exception {
        String json = """
                {"status": "Operational",
                 "database_health": {"health_score": 100},
                 "performance_metrics": {"cpu_usage": 3}}
                """;

        HealthSnapshot snapshot = objectMapper.readValue(json, HealthSnapshot.class);

        assertThat(snapshot.getActiveAlerts()).isEmpty();
        assertThat(snapshot.getPendingDecisions()).isEmpty();
        assertThatThrownBy(() -> snapshot.getPendingDecisions().add("x"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    public void testStatusLabelsAreLenient() {
        assertThat(SystemStatus.fromLabel("Operational")).isEqualTo(SystemStatus.OPERATIONAL);
        assertThat(SystemStatus.fromLabel(" warning ")).isEqualTo(SystemStatus.WARNING);
        assertThat(SystemStatus.fromLabel("Degraded")).isEqualTo(SystemStatus.UNKNOWN);
        assertThat(SystemStatus.fromLabel(null)).isEqualTo(SystemStatus.UNKNOWN);
    }

    @Test
    public void testSerializesWithBackendFieldNames() throws Exception {
        HealthSnapshot snapshot = HealthSnapshot.builder()
                .status(SystemStatus.OPERATIONAL)
                .pendingDecision("Sign free agent")
                .generatedAt(Instant.parse("2026-01-24T12:00:00Z"))
                .build();

        String json = objectMapper.writeValueAsString(snapshot);

        assertThat(json)
                .contains("\"status\":\"Operational\"")
                .contains("\"pending_decisions\":[\"Sign free agent\"]")
                .contains("\"generated_at\":\"2026-01-24T12:00:00Z\"");
    }
}
