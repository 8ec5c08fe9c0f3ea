package com.universe.manager.commandcenter.metrics;

import com.universe.manager.commandcenter.model.ErrorKind;

/**
 * Lightweight metrics API used by the polling engine and exposed via /metrics.
 */

public interface Metrics {

    void onFetchAttempt();

    void onAttemptFailed(ErrorKind kind);

    void onRetryScheduled(long delayMs);

    void onFetchSucceeded();

    void onFetchExhausted();

    void onOutcomeDiscarded();

    void onManualRefreshRequested();

    void onManualRefreshCoalesced();

    MetricsSnapshot snapshot();
}
