package com.graphsync.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.graphsync.cli.model.SyncOptions;
import com.graphsync.cli.model.ValidatedSyncOptions;
import com.graphsync.engine.ItemState;
import com.graphsync.engine.SyncReport;
import com.graphsync.node.NodeKind;

/**
 * Responsible only for printing CLI output for the "run" command.
 * No validation, no execution.
 */
public class SyncResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(SyncResultsPrinter.class);

    public void printBanner(SyncOptions o, ValidatedSyncOptions v) {
        log.info("=================================================");
        log.info("GraphSync Connector");
        log.info("=================================================");
        log.info("Connector: {}", o.getConnectorClass());
        log.info("Container: {}", o.getContainerKey());
        if (v.isApiSource()) {
            log.info("Source API: {}", o.getApiBaseUrl());
        } else {
            log.info("Source File: {}", v.getNormalizedSourceFile());
        }
        log.info("Repository: {}", v.getNormalizedRepositoryFile());
        log.info("Delete Orphans: {}", !o.isNoDelete());
        log.info("Revision Header: {}", o.getRevisionHeader());
        log.info("=================================================");
    }

    public void printSuccess(SyncReport report) {
        log.info("");
        log.info("=================================================");
        log.info("SYNC {}", report.getFinalState());
        log.info("=================================================");
        log.info("Source: {}", report.getSourceState());
        if (report.getSourceState() == ItemState.UNCHANGED) {
            log.info("Nothing to do, the source did not change since the last run.");
            log.info("=================================================");
            return;
        }
        log.info("Dynamic Schema: {}", report.getSchemaState());
        printCounts("Records", report, NodeKind.RECORD);
        printCounts("Sub-collections", report, NodeKind.MODELED_RECORD);
        printCounts("Aspects", report, NodeKind.ASPECT);
        printCounts("Links", report, NodeKind.LINK);
        printCounts("Foreign Keys", report, NodeKind.FOREIGN_KEY);
        log.info("Deleted Records: {}", report.getDeletedIds().size());
        if (report.getKeptOrphans() > 0) {
            log.info("Orphans Kept (deletion disabled): {}", report.getKeptOrphans());
        }
        log.info("Duration: {} ms", report.getDurationMs());
        log.info("=================================================");
    }

    private void printCounts(String label, SyncReport report, NodeKind kind) {
        log.info("{}: {} new, {} changed, {} unchanged, {} skipped", label,
                report.count(kind, ItemState.NEW),
                report.count(kind, ItemState.CHANGED),
                report.count(kind, ItemState.UNCHANGED),
                report.skipped(kind));
    }

    public void printFailure(Exception e) {
        log.error("Sync failed: {}", e.getMessage(), e);
    }
}
