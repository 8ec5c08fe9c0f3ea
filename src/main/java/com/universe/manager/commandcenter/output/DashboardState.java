package com.universe.manager.commandcenter.output;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.universe.manager.commandcenter.model.HealthSnapshot;

import java.time.Instant;

/**
 * What the command center view renders.
 *
 * The last good snapshot is kept through failures so stale data stays visible
 * next to the error.
 *
 * @param snapshot            last successful snapshot, null before the first success
 * @param error               current error message, null when the last fetch succeeded
 * @param loading             a fetch is in flight
 * @param lastUpdated         completion time of the last success
 * @param consecutiveFailures terminal failures since the last success
 */
public record DashboardState(
        @JsonProperty("snapshot") HealthSnapshot snapshot,
        @JsonProperty("error") String error,
        @JsonProperty("loading") boolean loading,
        @JsonProperty("last_updated") Instant lastUpdated,
        @JsonProperty("consecutive_failures") int consecutiveFailures
) {

    public static DashboardState initial() {
        return new DashboardState(null, null, true, null, 0);
    }

    DashboardState loadingStarted() {
        return new DashboardState(snapshot, null, true, lastUpdated, consecutiveFailures);
    }

    DashboardState succeeded(HealthSnapshot newSnapshot, Instant completedAt) {
        return new DashboardState(newSnapshot, null, false, completedAt, 0);
    }

    DashboardState stopped() {
        return new DashboardState(snapshot, error, false, lastUpdated, consecutiveFailures);
    }

    DashboardState failed(String message) {
        return new DashboardState(snapshot, message, false, lastUpdated, consecutiveFailures + 1);
    }
}
