package com.universe.manager.commandcenter.metrics;

import com.universe.manager.commandcenter.model.ErrorKind;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

@Component
public class MetricsRegistry implements Metrics {

    private final AtomicLong fetchAttempts = new AtomicLong();
    private final AtomicLong transportErrors = new AtomicLong();
    private final AtomicLong decodeErrors = new AtomicLong();
    private final AtomicLong retriesScheduled = new AtomicLong();
    private final AtomicLong totalBackoffMs = new AtomicLong();

    private final AtomicLong successfulFetches = new AtomicLong();
    private final AtomicLong exhaustedFetches = new AtomicLong();
    private final AtomicLong discardedOutcomes = new AtomicLong();

    private final AtomicLong manualRefreshes = new AtomicLong();
    private final AtomicLong coalescedRefreshes = new AtomicLong();

    private final AtomicReference<Instant> lastUpdatedAt = new AtomicReference<>();


    @Override
    public void onFetchAttempt() {
        fetchAttempts.incrementAndGet();
        touch();
    }

    @Override
    public void onAttemptFailed(ErrorKind kind) {
        if (kind == ErrorKind.DECODE) {
            decodeErrors.incrementAndGet();
        } else {
            transportErrors.incrementAndGet();
        }
        touch();
    }

    @Override
    public void onRetryScheduled(long delayMs) {
        retriesScheduled.incrementAndGet();
        totalBackoffMs.addAndGet(delayMs);
        touch();
    }

    @Override
    public void onFetchSucceeded() {
        successfulFetches.incrementAndGet();
        touch();
    }

    @Override
    public void onFetchExhausted() {
        exhaustedFetches.incrementAndGet();
        touch();
    }

    @Override
    public void onOutcomeDiscarded() {
        discardedOutcomes.incrementAndGet();
        touch();
    }

    @Override
    public void onManualRefreshRequested() {
        manualRefreshes.incrementAndGet();
        touch();
    }

    @Override
    public void onManualRefreshCoalesced() {
        coalescedRefreshes.incrementAndGet();
        touch();
    }

    /* ---------- Snapshot ---------- */

    @Override
    public MetricsSnapshot snapshot() {
        return new MetricsSnapshot(
                fetchAttempts.get(),
                transportErrors.get(),
                decodeErrors.get(),
                retriesScheduled.get(),
                totalBackoffMs.get(),
                successfulFetches.get(),
                exhaustedFetches.get(),
                discardedOutcomes.get(),
                manualRefreshes.get(),
                coalescedRefreshes.get(),
                lastUpdatedAt.get()
        );
    }


    private void touch() {
        lastUpdatedAt.set(Instant.now());
    }
}
