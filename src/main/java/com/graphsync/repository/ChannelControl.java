package com.graphsync.repository;

/**
 * Lock and exchange protocol of a multi-writer repository whose changes are shared through a remote hub.
 */
public interface ChannelControl {

    boolean isBulkMode();

    void startBulkMode();

    boolean hasPendingRequests();

    boolean holdsSchemaLock();

    boolean holdsCodeSpecLock();

    boolean isLocked(String rootId);

    /**
     * Acquire the exclusive lock on a channel root. May throw {@link com.graphsync.exception.RateLimitedException}.
     */
    void lockChannel(String rootId);

    /**
     * Pull remote changes and merge them into the local copy. May throw
     * {@link com.graphsync.exception.RateLimitedException}.
     */
    void pullAndMerge();

    /**
     * Push committed changes and release every lock held. May throw
     * {@link com.graphsync.exception.RateLimitedException}.
     */
    void push(String comment);
}
