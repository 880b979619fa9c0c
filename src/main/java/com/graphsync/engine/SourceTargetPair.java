package com.graphsync.engine;

/**
 * Resolved ids of both ends of a relationship instance.
 */
public record SourceTargetPair(String sourceId, String targetId) {
}
