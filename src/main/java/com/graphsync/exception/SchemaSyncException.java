package com.graphsync.exception;

/**
 * Building, comparing or importing a schema failed. Always aborts the run before any data is written.
 */
public class SchemaSyncException extends SyncException {

    private static final long serialVersionUID = 1L;

    public SchemaSyncException(String message) {
        super(message);
    }

    public SchemaSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
