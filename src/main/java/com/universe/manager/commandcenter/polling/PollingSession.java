package com.universe.manager.commandcenter.polling;

import com.universe.manager.commandcenter.fetch.Sleeper;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.OptionalLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lifetime of one active polling instance, from start to cancellation.
 * <p>
 * Holds the state shared between the background loop and foreground callers:
 * cancellation flag, request sequence counter, pending follow-up flag and the
 * state machine. Every access goes through {@link #lock}; critical sections are
 * short and the lock is released while waiting (Condition.awaitNanos).
 * <p>
 * Also the {@link Sleeper} for retry backoff, so cancellation cuts a backoff short.
 */
@Slf4j
public class PollingSession implements Sleeper {

    private final long id;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition wakeUp = lock.newCondition();

    // guarded by lock
    private boolean cancelled;
    private boolean refreshPending;
    private long lastSequence;
    private long highestPublished;
    private SessionState state = SessionState.IDLE;

    public PollingSession(long id) {
        this.id = id;
    }

    public long getId() {
        return id;
    }

    /**
     * Start a fetch: stamp it with the next sequence number and consume any pending
     * follow-up, since this fetch serves it.
     *
     * @return the sequence number, or empty if the session is cancelled
     */
    public OptionalLong beginFetch() {
        lock.lock();
        try {
            if (cancelled) {
                return OptionalLong.empty();
            }
            refreshPending = false;
            state = SessionState.FETCHING;
            return OptionalLong.of(++lastSequence);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Decide whether an outcome may be published.
     * <p>
     * Rejected when the session is cancelled or when a request with the same or a
     * higher sequence number has already been published.
     */
    public boolean acceptForPublish(long sequence) {
        lock.lock();
        try {
            if (cancelled || sequence <= highestPublished) {
                return false;
            }
            highestPublished = sequence;
            state = SessionState.PUBLISHING;
            return true;
        } finally {
            lock.unlock();
        }
    }

    public void markIdle() {
        lock.lock();
        try {
            if (!cancelled) {
                state = SessionState.IDLE;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Record an out-of-band refresh request.
     * <p>
     * At most one follow-up is ever owed; repeated requests while one is pending
     * are no-ops.
     */
    public RefreshRequest requestRefresh() {
        lock.lock();
        try {
            if (cancelled) {
                return RefreshRequest.REJECTED;
            }
            if (refreshPending) {
                return RefreshRequest.COALESCED;
            }
            refreshPending = true;
            if (state == SessionState.IDLE) {
                wakeUp.signalAll();
                return RefreshRequest.TRIGGERED;
            }
            return RefreshRequest.QUEUED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wait out the inter-tick interval.
     * <p>
     * Returns early when a refresh is pending (including one requested while the
     * previous fetch was in flight) or when the session is cancelled.
     *
     * @return true if the loop should fetch again, false if cancelled
     */
    public boolean awaitNextTick(Duration interval) {
        lock.lock();
        try {
            long remaining = interval.toNanos();
            while (!cancelled && !refreshPending && remaining > 0) {
                remaining = wakeUp.awaitNanos(remaining);
            }
            return !cancelled;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Session {} interrupted while waiting for next tick", id);
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancellation-aware backoff. Manual refresh requests do not cut it short.
     */
    @Override
    public boolean sleep(Duration delay) {
        lock.lock();
        try {
            long remaining = delay.toNanos();
            while (!cancelled && remaining > 0) {
                remaining = wakeUp.awaitNanos(remaining);
            }
            return !cancelled;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Session {} interrupted during backoff", id);
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Signal cancellation and wake any waiter.
     *
     * @return true if this call cancelled the session, false if it already was
     */
    public boolean cancel() {
        lock.lock();
        try {
            if (cancelled) {
                return false;
            }
            cancelled = true;
            refreshPending = false;
            state = SessionState.CANCELLED;
            wakeUp.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean isCancelled() {
        lock.lock();
        try {
            return cancelled;
        } finally {
            lock.unlock();
        }
    }

    public boolean isRefreshPending() {
        lock.lock();
        try {
            return refreshPending;
        } finally {
            lock.unlock();
        }
    }

    public SessionState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public long getLastSequence() {
        lock.lock();
        try {
            return lastSequence;
        } finally {
            lock.unlock();
        }
    }

    public long getHighestPublished() {
        lock.lock();
        try {
            return highestPublished;
        } finally {
            lock.unlock();
        }
    }
}
