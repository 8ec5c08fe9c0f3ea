package com.universe.manager.commandcenter.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Alert computed upstream. Relayed as-is, never evaluated here.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class SystemAlert {

    @JsonProperty("message")
    String message;

    @JsonProperty("priority")
    AlertPriority priority;

    @JsonProperty("created_at")
    Instant createdAt;

    // performance, security, business...
    @JsonProperty("category")
    String category;

    @JsonProperty("requires_action")
    boolean requiresAction;
}
