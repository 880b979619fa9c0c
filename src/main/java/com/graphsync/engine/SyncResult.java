package com.graphsync.engine;

public record SyncResult(String entityId, ItemState state) {
}
