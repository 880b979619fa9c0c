package com.graphsync.exception;

/**
 * A lock-state assertion failed while entering a channel of a multi-writer repository.
 */
public class ChannelStateException extends SyncException {

    private static final long serialVersionUID = 1L;

    public ChannelStateException(String message) {
        super(message);
    }
}
