package com.universe.manager.commandcenter.output;

import com.universe.manager.commandcenter.model.FetchOutcome;

import java.time.Instant;

/**
 * Receives published outcomes for rendering.
 */
public interface StateSink {

    /**
     * A fetch has started. Lets the view show a loading indicator.
     */
    default void onFetchStarted() {
        // no-op
    }

    /**
     * The session ended. No further callbacks follow until the next start.
     */
    default void onStopped() {
        // no-op
    }

    /**
     * Invoked at most once per accepted outcome, in request-sequence order.
     *
     * @param outcome     the outcome of one logical fetch
     * @param completedAt when the fetch completed
     */
    void onUpdate(FetchOutcome outcome, Instant completedAt);
}
