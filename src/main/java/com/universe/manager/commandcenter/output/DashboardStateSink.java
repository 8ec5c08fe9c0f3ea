package com.universe.manager.commandcenter.output;

import com.universe.manager.commandcenter.model.ErrorDetail;
import com.universe.manager.commandcenter.model.FetchOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * StateSink holding the command center view model in memory.
 *
 * Written by the polling thread, read by HTTP request threads.
 */
@Slf4j
@Component
public class DashboardStateSink implements StateSink {

    static final String ERROR_PREFIX = "System monitoring error: ";

    private final AtomicReference<DashboardState> state =
            new AtomicReference<>(DashboardState.initial());

    @Override
    public void onFetchStarted() {
        state.updateAndGet(DashboardState::loadingStarted);
    }

    /**
     * A fetch cut off by stop() never completes, so clear its loading flag here.
     */
    @Override
    public void onStopped() {
        state.updateAndGet(DashboardState::stopped);
    }

    @Override
    public void onUpdate(FetchOutcome outcome, Instant completedAt) {
        if (outcome instanceof FetchOutcome.Success success) {
            state.updateAndGet(s -> s.succeeded(success.snapshot(), completedAt));
            log.debug("Dashboard updated with {} snapshot at {}", success.snapshot().getStatus(), completedAt);
        } else if (outcome instanceof FetchOutcome.Failure failure) {
            ErrorDetail error = failure.error();
            DashboardState updated = state.updateAndGet(s -> s.failed(ERROR_PREFIX + error.message()));
            log.error("Failed to load system health after retries: {} (consecutive failures: {})",
                    error.message(), updated.consecutiveFailures());
        }
    }

    public DashboardState current() {
        return state.get();
    }
}
