package com.graphsync.exception;

import java.nio.file.Path;

/**
 * Source data could not be located or read.
 */
public class SourceDataException extends SyncException {

    private static final long serialVersionUID = 1L;
    private final transient Path path;

    public SourceDataException(String message, Path path) {
        super(path != null ? message + ": " + path : message);
        this.path = path;
    }

    public SourceDataException(String message, Path path, Throwable cause) {
        super(path != null ? message + ": " + path : message, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
