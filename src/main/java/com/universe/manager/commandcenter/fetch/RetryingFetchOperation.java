package com.universe.manager.commandcenter.fetch;

import com.universe.manager.commandcenter.metrics.Metrics;
import com.universe.manager.commandcenter.model.ErrorDetail;
import com.universe.manager.commandcenter.model.ErrorKind;
import com.universe.manager.commandcenter.model.FetchOutcome;
import com.universe.manager.commandcenter.model.HealthSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Wraps one logical health fetch with bounded exponential-backoff retries.
 *
 * Stateless between calls: the retry counter lives on the stack of {@link #run}.
 * TRANSPORT and DECODE errors are retried here and never surface individually;
 * only the terminal EXHAUSTED failure leaves this class.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetryingFetchOperation {

    private final RetryPolicy policy;
    private final Metrics metrics;

    /**
     * Run one logical fetch.
     *
     * - Call the fetcher
     * - On success return immediately, dropping any remaining retry budget
     * - On failure back off for base * 2^retries and try again
     * - After maxRetryAttempts retries return an EXHAUSTED failure
     *
     * @param fetcher single-attempt capability
     * @param sleeper suspension used for backoff; returning false cancels the operation
     * @return the outcome, or empty if cancelled during a backoff
     */
    public Optional<FetchOutcome> run(StatusFetcher fetcher, Sleeper sleeper) {
        int retries = 0;

        while (true) {
            int attempt = retries + 1;
            metrics.onFetchAttempt();

            ErrorDetail error;
            try {
                HealthSnapshot snapshot = fetcher.fetchHealth();
                if (snapshot != null) {
                    if (retries > 0) {
                        log.info("System health recovered on attempt {}", attempt);
                    }
                    metrics.onFetchSucceeded();
                    return Optional.of(FetchOutcome.success(snapshot));
                }
                error = ErrorDetail.of(ErrorKind.TRANSPORT, "Fetcher returned no snapshot", attempt);
            } catch (StatusFetchException e) {
                String message = e.getMessage() != null ? e.getMessage() : e.getKind() + " error";
                error = ErrorDetail.of(e.getKind(), message, attempt);
            } catch (RuntimeException e) {
                log.debug("Unexpected exception from status fetcher on attempt {}", attempt, e);
                error = ErrorDetail.of(ErrorKind.TRANSPORT, "Unexpected fetch failure: " + e, attempt);
            }
            metrics.onAttemptFailed(error.kind());

            if (retries >= policy.maxRetryAttempts()) {
                log.error("System health unavailable after {} attempts: {}", attempt, error.message());
                metrics.onFetchExhausted();
                return Optional.of(FetchOutcome.failure(
                        ErrorDetail.exhausted(policy.maxRetryAttempts(), attempt, error)));
            }

            Duration delay = policy.delayBeforeRetry(retries);
            retries++;
            log.warn("System health request failed (attempt {}/{}), retrying in {}ms: {}",
                    retries, policy.maxRetryAttempts(), delay.toMillis(), error.message());
            metrics.onRetryScheduled(delay.toMillis());

            if (!sleeper.sleep(delay)) {
                log.debug("Fetch cancelled during backoff before attempt {}", retries + 1);
                return Optional.empty();
            }
        }
    }
}
