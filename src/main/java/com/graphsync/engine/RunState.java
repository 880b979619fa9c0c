package com.graphsync.engine;

/**
 * Phases of one sync job, in execution order. {@link #FAILED} can follow any phase.
 */
public enum RunState {
    IDLE,
    LOADER_SYNC,
    DOMAIN_SCHEMA_SYNC,
    DYNAMIC_SCHEMA_SYNC,
    DATA_SYNC,
    ORPHAN_SYNC,
    EXTENTS_SYNC,
    DONE,
    FAILED
}
