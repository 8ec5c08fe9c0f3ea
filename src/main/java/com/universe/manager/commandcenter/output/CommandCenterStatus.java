package com.universe.manager.commandcenter.output;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.universe.manager.commandcenter.polling.SessionState;

/**
 * Response body of GET /command-center/status.
 */
public record CommandCenterStatus(
        @JsonProperty("dashboard") DashboardState dashboard,
        @JsonProperty("session_state") SessionState sessionState,
        @JsonProperty("polling") boolean polling
) {}
