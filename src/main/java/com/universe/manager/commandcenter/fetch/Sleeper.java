package com.universe.manager.commandcenter.fetch;

import java.time.Duration;

/**
 * Suspension point used between retry attempts.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * @return true if the full delay elapsed, false if the wait was cut short by
     * cancellation and the caller should stop
     */
    boolean sleep(Duration delay);
}
