package com.graphsync.fixtures;

import com.graphsync.exception.RateLimitedException;
import com.graphsync.repository.ChannelControl;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Records the channel protocol and lets tests put it in states the engine must refuse.
 */
public class FakeChannelControl implements ChannelControl {

    public final List<String> calls = new ArrayList<>();
    public final Set<String> locks = new HashSet<>();
    public boolean bulkMode;
    public boolean pendingRequests;
    public boolean schemaLock;
    public boolean codeSpecLock;
    public boolean keepLocksOnPush;
    public int rateLimitedLocks;

    @Override
    public boolean isBulkMode() {
        return bulkMode;
    }

    @Override
    public void startBulkMode() {
        calls.add("startBulkMode");
        bulkMode = true;
    }

    @Override
    public boolean hasPendingRequests() {
        return pendingRequests;
    }

    @Override
    public boolean holdsSchemaLock() {
        return schemaLock;
    }

    @Override
    public boolean holdsCodeSpecLock() {
        return codeSpecLock;
    }

    @Override
    public boolean isLocked(String rootId) {
        return locks.contains(rootId);
    }

    @Override
    public void lockChannel(String rootId) {
        if (rateLimitedLocks > 0) {
            rateLimitedLocks--;
            calls.add("rateLimited");
            throw new RateLimitedException("429 Too Many Requests");
        }
        calls.add("lock " + rootId);
        locks.add(rootId);
    }

    @Override
    public void pullAndMerge() {
        calls.add("pull");
    }

    @Override
    public void push(String comment) {
        calls.add("push " + comment);
        if (!keepLocksOnPush) {
            locks.clear();
        }
    }
}
