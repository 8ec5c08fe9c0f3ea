package com.universe.manager.commandcenter.fetch;

import com.universe.manager.commandcenter.model.HealthSnapshot;

/**
 * One attempt at reading the backend health snapshot.
 *
 * Implementations perform a single remote call and do not retry; retrying is the
 * job of {@link RetryingFetchOperation}.
 */
@FunctionalInterface
public interface StatusFetcher {

    /**
     * @return the decoded snapshot, never null
     * @throws StatusFetchException with kind TRANSPORT when the call fails, DECODE when
     *                              the response does not have the snapshot shape
     */
    HealthSnapshot fetchHealth() throws StatusFetchException;
}
