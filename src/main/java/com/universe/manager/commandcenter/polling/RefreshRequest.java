package com.universe.manager.commandcenter.polling;

/**
 * What happened to a manual refresh request.
 */
public enum RefreshRequest {
    /** Session was idle; the loop wakes and fetches now. */
    TRIGGERED,
    /** A fetch is in flight; one follow-up fetch runs right after it. */
    QUEUED,
    /** A follow-up was already owed; this request is a no-op. */
    COALESCED,
    /** No running session. */
    REJECTED;

    public boolean accepted() {
        return this != REJECTED;
    }
}
