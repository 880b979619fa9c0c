package com.graphsync.mapping;

/**
 * Where one end of a relationship comes from.
 */
public enum EndpointType {
    /**
     * The endpoint is an IR instance synchronized by a record node. The attribute holds its primary key value.
     */
    IR_ENTITY,

    /**
     * The endpoint already exists in the target repository. The attribute holds a locator.
     */
    TARGET_ENTITY
}
