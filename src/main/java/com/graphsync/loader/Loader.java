package com.graphsync.loader;

import com.graphsync.ir.IREntity;
import com.graphsync.ir.IRInstance;
import com.graphsync.ir.IRRelationship;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts one source format into IR entities. Each connector reaches its source through exactly one loader.
 */
public abstract class Loader {
    private static final Logger log = LoggerFactory.getLogger(Loader.class);

    @Getter
    private final LoaderProps props;
    @Getter
    private boolean open;

    protected Loader(LoaderProps props) {
        this.props = props;
    }

    /**
     * Open the connection to the data source. Must be called before loading data.
     */
    protected abstract void doOpen(DataConnection connection);

    /**
     * Close the connection. Nothing to do if open already read the entire source.
     */
    protected abstract void doClose();

    /**
     * All entities of the source, e.g. all sheets of a workbook.
     */
    protected abstract List<IREntity> doGetEntities();

    /**
     * All relationship entities of the source, e.g. the link tables of a database.
     */
    protected abstract List<IRRelationship> doGetRelationships();

    public abstract List<IRInstance> getInstances(String entityKey);

    public void open(DataConnection connection) {
        if (open) {
            log.error("Loader is already open.");
            return;
        }
        open = true;
        doOpen(connection);
    }

    public void close() {
        if (!open) {
            log.error("Cannot close a Loader that hasn't been opened.");
            return;
        }
        open = false;
        doClose();
    }

    public List<IREntity> getEntities() {
        return doGetEntities().stream()
                .filter(entity -> props.getEntities().contains(entity.getKey()))
                .toList();
    }

    public List<IRRelationship> getRelationships() {
        return doGetRelationships().stream()
                .filter(rel -> props.getRelationships().contains(rel.getKey()))
                .toList();
    }

    public String primaryKeyOf(String entityKey) {
        return props.getPrimaryKeyMap().getOrDefault(entityKey, props.getDefaultPrimaryKey());
    }

    public String getVersion() {
        return props.getVersion();
    }

    public String getFormat() {
        return props.getFormat();
    }

    public Map<String, Object> toJson() {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("format", props.getFormat());
        json.put("entities", props.getEntities());
        json.put("relationships", props.getRelationships());
        json.put("primaryKeyMap", props.getPrimaryKeyMap());
        json.put("defaultPrimaryKey", props.getDefaultPrimaryKey());
        return json;
    }
}
