package com.graphsync.cli.model;

import java.nio.file.Path;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed to run the job. Keeps SyncCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedSyncOptions {
    boolean apiSource;
    Path normalizedSourceFile;
    Path normalizedRepositoryFile;
    String logLevel;
}
