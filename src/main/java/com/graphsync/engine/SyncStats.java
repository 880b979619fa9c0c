package com.graphsync.engine;

import com.graphsync.node.NodeKind;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Counters collected while a job runs.
 */
public class SyncStats {

    private final Map<NodeKind, Map<ItemState, Integer>> counts = new EnumMap<>(NodeKind.class);
    private final Map<NodeKind, Integer> skipped = new EnumMap<>(NodeKind.class);
    private final List<String> deletedIds = new ArrayList<>();
    private int keptOrphans;

    public void record(NodeKind kind, ItemState state) {
        counts.computeIfAbsent(kind, k -> new EnumMap<>(ItemState.class)).merge(state, 1, Integer::sum);
    }

    public void skip(NodeKind kind) {
        skipped.merge(kind, 1, Integer::sum);
    }

    public void deleted(String id) {
        deletedIds.add(id);
    }

    public void keptOrphans(int count) {
        keptOrphans += count;
    }

    public int count(NodeKind kind, ItemState state) {
        return counts.getOrDefault(kind, Map.of()).getOrDefault(state, 0);
    }

    public int skipped(NodeKind kind) {
        return skipped.getOrDefault(kind, 0);
    }

    public List<String> getDeletedIds() {
        return List.copyOf(deletedIds);
    }

    public int getKeptOrphans() {
        return keptOrphans;
    }

    Map<NodeKind, Map<ItemState, Integer>> snapshotCounts() {
        Map<NodeKind, Map<ItemState, Integer>> copy = new EnumMap<>(NodeKind.class);
        counts.forEach((kind, byState) -> copy.put(kind, Map.copyOf(byState)));
        return copy;
    }

    Map<NodeKind, Integer> snapshotSkipped() {
        return Map.copyOf(skipped);
    }
}
