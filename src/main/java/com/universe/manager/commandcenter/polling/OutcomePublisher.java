package com.universe.manager.commandcenter.polling;

import com.universe.manager.commandcenter.model.FetchOutcome;

/**
 * Receives the results of {@link PollingLoop} ticks.
 */
public interface OutcomePublisher {

    default void fetchStarted(long sequence) {
        // no-op
    }

    void publish(FetchOutcome outcome, long sequence);
}
