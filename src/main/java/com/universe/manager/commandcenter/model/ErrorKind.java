package com.universe.manager.commandcenter.model;

/**
 * Failure taxonomy of a status fetch.
 */
public enum ErrorKind {
    /** The remote call itself failed: backend unreachable, non-2xx, empty body. */
    TRANSPORT,
    /** A response arrived but did not match the snapshot shape. */
    DECODE,
    /** TRANSPORT or DECODE persisted through every retry attempt. */
    EXHAUSTED
}
