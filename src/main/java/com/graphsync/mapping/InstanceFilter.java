package com.graphsync.mapping;

import com.graphsync.ir.IRInstance;

/**
 * Decides whether a target instance should be created from an IR instance.
 */
@FunctionalInterface
public interface InstanceFilter {

    boolean doSyncInstance(IRInstance instance);
}
