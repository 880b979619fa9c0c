package com.graphsync.engine;

/**
 * Outcome of change detection for one synchronized item.
 */
public enum ItemState {
    NEW,
    CHANGED,
    UNCHANGED
}
