package com.graphsync.mapping;

import com.graphsync.ir.IRInstance;

/**
 * Binds one IR entity to one target class.
 */
public interface Mapping {

    /**
     * Key of the IR entity whose instances this mapping turns into target instances.
     */
    String getIrEntity();

    ClassRef getTargetClass();

    InstanceFilter getDoSyncInstance();

    default boolean accepts(IRInstance instance) {
        InstanceFilter filter = getDoSyncInstance();
        return filter == null || filter.doSyncInstance(instance);
    }
}
