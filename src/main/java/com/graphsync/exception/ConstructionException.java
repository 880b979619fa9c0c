package com.graphsync.exception;

/**
 * Raised while the node tree is being declared, before any I/O takes place.
 * Duplicate node keys, mismatched class definitions and malformed placements end up here.
 */
public class ConstructionException extends SyncException {

    private static final long serialVersionUID = 1L;

    public ConstructionException(String message) {
        super(message);
    }
}
