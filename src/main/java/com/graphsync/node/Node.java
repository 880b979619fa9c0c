package com.graphsync.node;

import com.graphsync.engine.SyncConnector;
import com.graphsync.exception.ConstructionException;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A unit of synchronization. Its key is unique across the whole tree of its connector.
 */
@Getter
public abstract class Node {

    protected final SyncConnector connector;
    private final String key;
    private boolean synced;

    protected Node(SyncConnector connector, String key) {
        if (connector == null) {
            throw new ConstructionException("Node " + key + " needs a connector");
        }
        if (key == null || key.isBlank()) {
            throw new ConstructionException("Node key must not be blank");
        }
        this.connector = connector;
        this.key = key;
    }

    public abstract NodeKind getKind();

    /**
     * Container this node belongs to. A container belongs to itself.
     */
    public abstract ContainerNode getContainer();

    protected abstract void doSync();

    public final void sync() {
        doSync();
        synced = true;
    }

    /**
     * Clears the synced flag before a new run.
     */
    public void reset() {
        synced = false;
    }

    public Map<String, Object> toJson() {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("key", key);
        json.put("kind", getKind().name());
        json.put("synced", synced);
        return json;
    }

    @Override
    public String toString() {
        return getKind() + "(" + key + ")";
    }
}
