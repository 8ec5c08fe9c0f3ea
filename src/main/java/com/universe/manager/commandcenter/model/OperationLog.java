package com.universe.manager.commandcenter.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * One entry of the backend's recent operations log.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class OperationLog {

    @JsonProperty("timestamp")
    Instant timestamp;

    @JsonProperty("operation")
    String operation;

    // Success, Warning, Error
    @JsonProperty("status")
    String status;

    @JsonProperty("performed_by")
    String performedBy;

    @JsonProperty("details")
    String details;

    @JsonProperty("duration_ms")
    Integer durationMs;
}
