package com.universe.manager.commandcenter.polling;

import com.universe.manager.commandcenter.fetch.RetryingFetchOperation;
import com.universe.manager.commandcenter.fetch.StatusFetcher;
import com.universe.manager.commandcenter.metrics.Metrics;
import com.universe.manager.commandcenter.model.FetchOutcome;
import com.universe.manager.commandcenter.output.StateSink;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Arbitrates between scheduled ticks and manual refreshes for the dashboard.
 *
 * Guarantees:
 * - Single-flight: only the session's loop thread fetches, so at most one fetch
 *   runs at a time. A manual refresh during a fetch is owed as one follow-up.
 * - Ordering: outcomes carry the sequence stamped when their fetch began; anything
 *   not newer than the last published outcome is discarded.
 * - Delivery: each accepted outcome reaches the StateSink exactly once, and nothing
 *   reaches it once {@link #stop()} has returned.
 */
@Slf4j
public class RefreshCoordinator {

    private final StatusFetcher fetcher;
    private final RetryingFetchOperation operation;
    private final StateSink sink;
    private final Metrics metrics;
    private final Clock clock;
    private final Duration interval;

    // serialises sink delivery with cancellation
    private final Object publishLock = new Object();
    private final AtomicLong sessionIds = new AtomicLong();

    // guarded by this
    private PollingSession session;
    private ExecutorService executor;

    public RefreshCoordinator(
            StatusFetcher fetcher,
            RetryingFetchOperation operation,
            StateSink sink,
            Metrics metrics,
            Clock clock,
            Duration interval
    ) {
        this.fetcher = fetcher;
        this.operation = operation;
        this.sink = sink;
        this.metrics = metrics;
        this.clock = clock;
        this.interval = interval;
    }

    /**
     * Begin polling on a fresh session. No-op if a session is already running.
     */
    public synchronized void start() {
        if (session != null && !session.isCancelled()) {
            log.warn("Polling session {} is already running", session.getId());
            return;
        }

        PollingSession newSession = new PollingSession(sessionIds.incrementAndGet());
        PollingLoop loop = new PollingLoop(operation, fetcher, new SessionPublisher(newSession), interval);

        ExecutorService newExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "command-center-poller-" + newSession.getId());
            t.setDaemon(true);
            return t;
        });
        newExecutor.execute(() -> {
            try {
                loop.run(newSession);
            } finally {
                // the loop only returns on its own after an interrupt or an Error from the fetcher
                if (cancelSession(newSession)) {
                    log.error("Polling loop for session {} exited without stop(); session cancelled",
                            newSession.getId());
                }
            }
        });
        // no more tasks; the thread exits once the loop returns
        newExecutor.shutdown();

        this.session = newSession;
        this.executor = newExecutor;
        log.info("Started polling session {}", newSession.getId());
    }

    /**
     * Cancel the current session. Idempotent and non-blocking apart from waiting
     * for an in-progress sink delivery to finish.
     */
    public void stop() {
        PollingSession current;
        synchronized (this) {
            current = session;
        }
        if (current == null) {
            return;
        }

        if (cancelSession(current)) {
            log.info("Stopped polling session {}", current.getId());
        }
    }

    /**
     * Request an out-of-band fetch now.
     */
    public RefreshRequest manualRefresh() {
        PollingSession current;
        synchronized (this) {
            current = session;
        }
        if (current == null) {
            log.debug("Manual refresh ignored: polling never started");
            return RefreshRequest.REJECTED;
        }

        RefreshRequest result = current.requestRefresh();
        if (result.accepted()) {
            metrics.onManualRefreshRequested();
        }
        if (result == RefreshRequest.COALESCED) {
            metrics.onManualRefreshCoalesced();
        }
        log.debug("Manual refresh on session {}: {}", current.getId(), result);
        return result;
    }

    /**
     * Publish an outcome for the current session.
     */
    public void publish(FetchOutcome outcome, long sequence) {
        PollingSession current;
        synchronized (this) {
            current = session;
        }
        if (current == null) {
            metrics.onOutcomeDiscarded();
            return;
        }
        deliver(current, outcome, sequence);
    }

    /**
     * @return the current session's state; CANCELLED when no session is running
     */
    public synchronized SessionState state() {
        return session != null ? session.getState() : SessionState.CANCELLED;
    }

    public synchronized boolean isRunning() {
        return session != null && !session.isCancelled();
    }

    /**
     * Wait for the loop thread of the last session to exit.
     *
     * @return true if it exited (or none was started) within the timeout
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        ExecutorService current;
        synchronized (this) {
            current = executor;
        }
        return current == null || current.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Cancel under the publish lock and tell the sink the session ended.
     *
     * @return true if this call cancelled the session
     */
    private boolean cancelSession(PollingSession target) {
        synchronized (publishLock) {
            if (!target.cancel()) {
                return false;
            }
            try {
                sink.onStopped();
            } catch (RuntimeException e) {
                log.error("State sink failed on stop for session {}", target.getId(), e);
            }
            return true;
        }
    }

    private void deliver(PollingSession target, FetchOutcome outcome, long sequence) {
        synchronized (publishLock) {
            if (!target.acceptForPublish(sequence)) {
                log.debug("Discarding outcome for session {} sequence {} (highest published={}, cancelled={})",
                        target.getId(), sequence, target.getHighestPublished(), target.isCancelled());
                metrics.onOutcomeDiscarded();
                return;
            }
            try {
                sink.onUpdate(outcome, clock.instant());
            } catch (RuntimeException e) {
                log.error("State sink failed for session {} sequence {}", target.getId(), sequence, e);
            }
        }
    }

    /**
     * Publisher bound to one session, so a loop that outlives a restart can only
     * ever publish into its own, cancelled, session.
     */
    private final class SessionPublisher implements OutcomePublisher {

        private final PollingSession target;

        private SessionPublisher(PollingSession target) {
            this.target = target;
        }

        @Override
        public void fetchStarted(long sequence) {
            synchronized (publishLock) {
                if (target.isCancelled()) {
                    return;
                }
                try {
                    sink.onFetchStarted();
                } catch (RuntimeException e) {
                    log.error("State sink failed on fetch start for session {}", target.getId(), e);
                }
            }
        }

        @Override
        public void publish(FetchOutcome outcome, long sequence) {
            deliver(target, outcome, sequence);
        }
    }
}
