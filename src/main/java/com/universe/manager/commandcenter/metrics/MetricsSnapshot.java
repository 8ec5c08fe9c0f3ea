package com.universe.manager.commandcenter.metrics;

import java.time.Instant;

/**
 * Immutable snapshot of engine counters exposed to the dashboard.
 *
 * This is a READ MODEL:
 * - No logic
 * - Null lastUpdatedAt means nothing has been recorded yet
 */
public record MetricsSnapshot(

        /* -------- Attempts -------- */
        long fetchAttempts,
        long transportErrors,
        long decodeErrors,
        long retriesScheduled,
        long totalBackoffMs,

        /* -------- Outcomes -------- */
        long successfulFetches,
        long exhaustedFetches,
        long discardedOutcomes,

        /* -------- Manual refresh -------- */
        long manualRefreshes,
        long coalescedRefreshes,

        /* -------- Health -------- */
        Instant lastUpdatedAt
) {}
