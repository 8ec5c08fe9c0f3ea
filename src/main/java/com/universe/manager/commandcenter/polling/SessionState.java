package com.universe.manager.commandcenter.polling;

/**
 * Per-session state machine: IDLE -> FETCHING -> PUBLISHING -> IDLE, with CANCELLED
 * reachable from anywhere and terminal.
 */
public enum SessionState {
    IDLE,
    FETCHING,
    PUBLISHING,
    CANCELLED
}
