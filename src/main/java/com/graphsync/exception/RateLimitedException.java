package com.graphsync.exception;

/**
 * Signalled by a remote hub when requests are sent too frequently. The only error that is retried.
 */
public class RateLimitedException extends SyncException {

    private static final long serialVersionUID = 1L;

    public RateLimitedException(String message) {
        super(message);
    }
}
