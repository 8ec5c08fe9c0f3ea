package com.universe.manager.commandcenter.polling;

import com.universe.manager.commandcenter.fetch.RetryingFetchOperation;
import com.universe.manager.commandcenter.fetch.StatusFetcher;
import com.universe.manager.commandcenter.model.FetchOutcome;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Background task issuing one retrying fetch per interval until its session is cancelled.
 *
 * Ticks are strictly sequential: a fetch is never started before the previous one has
 * been published. The first tick runs immediately.
 */
@Slf4j
public class PollingLoop {

    public static final long AUTO_REFRESH_INTERVAL_MS = 30_000;

    private final RetryingFetchOperation operation;
    private final StatusFetcher fetcher;
    private final OutcomePublisher publisher;
    private final Duration interval;

    public PollingLoop(
            RetryingFetchOperation operation,
            StatusFetcher fetcher,
            OutcomePublisher publisher,
            Duration interval
    ) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive, got " + interval);
        }
        this.operation = operation;
        this.fetcher = fetcher;
        this.publisher = publisher;
        this.interval = interval;
    }

    /**
     * Per tick:
     * - check cancellation and stamp a sequence number
     * - run the retrying fetch (backoff sleeps observe cancellation)
     * - publish the outcome, success or failure; a failure never stops the loop
     * - wait for the interval, a pending manual refresh, or cancellation
     */
    public void run(PollingSession session) {
        log.info("Polling loop started for session {} (interval={}ms)", session.getId(), interval.toMillis());
        int ticks = 0;
        try {
            while (true) {
                OptionalLong sequence = session.beginFetch();
                if (sequence.isEmpty()) {
                    break;
                }
                long seq = sequence.getAsLong();
                log.debug("Session {} tick {} fetching (sequence={})", session.getId(), ticks, seq);
                publisher.fetchStarted(seq);

                Optional<FetchOutcome> outcome = operation.run(fetcher, session);
                if (outcome.isEmpty()) {
                    break;
                }

                publisher.publish(outcome.get(), seq);
                session.markIdle();
                ticks++;

                if (!session.awaitNextTick(interval)) {
                    break;
                }
            }
        } finally {
            log.info("Polling loop stopped for session {} after {} ticks", session.getId(), ticks);
        }
    }
}
