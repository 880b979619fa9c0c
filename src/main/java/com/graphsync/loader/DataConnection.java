package com.graphsync.loader;

import java.util.Map;

/**
 * Describes how a loader reaches its source.
 */
public interface DataConnection {

    ConnectionKind getKind();

    /**
     * Key of the loader node that persists this connection in the target repository.
     */
    String getLoaderNodeKey();

    /**
     * JSON-friendly view, stored on the connection descriptor record.
     */
    Map<String, Object> toJson();
}
