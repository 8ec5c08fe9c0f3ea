package com.universe.manager.commandcenter.fetch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.universe.manager.commandcenter.model.HealthSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Reads the health snapshot from the backend over HTTP.
 *
 * One call per attempt, no retries. Connect and read timeouts come from the
 * RestTemplate this is built with.
 */
@Slf4j
public class HttpStatusFetcher implements StatusFetcher {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String healthUrl;

    public HttpStatusFetcher(RestTemplate restTemplate, ObjectMapper objectMapper, String healthUrl) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.healthUrl = healthUrl;
        log.info("Initialized HttpStatusFetcher with health endpoint: {}", healthUrl);
    }

    /**
     * - GET the health endpoint as raw bytes
     * - Any client or HTTP status error is TRANSPORT
     * - Empty body is TRANSPORT
     * - Unparseable body or missing mandatory blocks is DECODE
     */
    @Override
    public HealthSnapshot fetchHealth() throws StatusFetchException {
        byte[] body;
        try {
            // raw bytes: Jackson detects the JSON encoding itself, whatever the Content-Type says
            ResponseEntity<byte[]> response = restTemplate.getForEntity(healthUrl, byte[].class);
            body = response.getBody();
        } catch (RestClientException e) {
            throw StatusFetchException.transport("Failed to invoke system health: " + e.getMessage(), e);
        }

        if (body == null || isBlank(body)) {
            throw StatusFetchException.transport("Empty system health response");
        }

        HealthSnapshot snapshot;
        try {
            snapshot = objectMapper.readValue(body, HealthSnapshot.class);
        } catch (JsonProcessingException e) {
            throw StatusFetchException.decode("Failed to parse system health: " + e.getOriginalMessage(), e);
        }

        if (snapshot == null) {
            throw StatusFetchException.decode("Failed to parse system health: null document");
        }
        requirePresent(snapshot.getStatus(), "status");
        requirePresent(snapshot.getDatabaseHealth(), "database_health");
        requirePresent(snapshot.getPerformanceMetrics(), "performance_metrics");

        log.debug("Fetched system health: status={}, alerts={}, pendingDecisions={}",
                snapshot.getStatus(), snapshot.getActiveAlerts().size(), snapshot.getPendingDecisions().size());
        return snapshot;
    }

    private static boolean isBlank(byte[] body) {
        for (byte b : body) {
            if (!Character.isWhitespace(b)) {
                return false;
            }
        }
        return true;
    }

    private static void requirePresent(Object value, String field) throws StatusFetchException {
        if (value == null) {
            throw StatusFetchException.decode("Failed to parse system health: missing field `" + field + "`");
        }
    }
}
