package com.graphsync;

import com.graphsync.cli.SyncCommand;
import picocli.CommandLine;

/**
 * Main entry point of the connector runner. Runs one synchronization job of an integrator's
 * connector class against a repository file.
 */
public class GraphSyncApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new SyncCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
