package com.graphsync.engine;

import com.graphsync.node.NodeKind;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one sync job.
 */
@Value
@Builder
public class SyncReport {
    RunState finalState;
    /**
     * Change state of the source connection, as classified before anything was written.
     */
    ItemState sourceState;
    /**
     * Change state of the dynamic schema, {@code null} when the schema phases were skipped.
     */
    ItemState schemaState;
    Map<NodeKind, Map<ItemState, Integer>> counts;
    Map<NodeKind, Integer> skippedCounts;
    @Singular
    List<String> deletedIds;
    int keptOrphans;
    long durationMs;

    public int count(NodeKind kind, ItemState state) {
        return counts.getOrDefault(kind, Map.of()).getOrDefault(state, 0);
    }

    public int skipped(NodeKind kind) {
        return skippedCounts.getOrDefault(kind, 0);
    }

    /**
     * Items inserted, updated or deleted by the job.
     */
    public int getWriteCount() {
        int writes = deletedIds.size();
        for (Map<ItemState, Integer> byState : counts.values()) {
            writes += byState.getOrDefault(ItemState.NEW, 0) + byState.getOrDefault(ItemState.CHANGED, 0);
        }
        return writes;
    }

    public boolean isSuccess() {
        return finalState == RunState.DONE;
    }

    static SyncReport of(RunState finalState, ItemState sourceState, ItemState schemaState, SyncStats stats,
                         long durationMs) {
        return SyncReport.builder()
                .finalState(finalState)
                .sourceState(sourceState)
                .schemaState(schemaState)
                .counts(stats.snapshotCounts())
                .skippedCounts(stats.snapshotSkipped())
                .deletedIds(stats.getDeletedIds())
                .keptOrphans(stats.getKeptOrphans())
                .durationMs(durationMs)
                .build();
    }
}
