package com.graphsync.mapping;

/**
 * Primitive property types a dynamic class may declare.
 */
public enum PrimitiveType {
    STRING,
    INTEGER,
    LONG,
    DOUBLE,
    BOOLEAN,
    DATE_TIME,
    BINARY
}
