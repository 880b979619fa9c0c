package com.graphsync.loader;

import com.graphsync.exception.SourceDataException;
import com.graphsync.ir.IREntity;
import com.graphsync.ir.IRInstance;
import com.graphsync.ir.IRRelationship;
import com.graphsync.util.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads a JSON document shaped like:
 *
 * <pre>
 * {
 *   "EntityKey": [
 *     { "id": ..., "attribute": ..., ... }
 *   ]
 * }
 * </pre>
 */
public class JsonLoader extends Loader {
    private static final Logger log = LoggerFactory.getLogger(JsonLoader.class);

    private Map<String, Object> json = new LinkedHashMap<>();
    private Path sourcePath;

    public JsonLoader(LoaderProps props) {
        super(props);
    }

    @Override
    protected void doOpen(DataConnection connection) {
        if (!(connection instanceof FileConnection fileConnection)) {
            throw new IllegalArgumentException("JsonLoader requires a file connection, got " + connection.getKind());
        }
        sourcePath = fileConnection.getFilepath();
        if (!Files.isRegularFile(sourcePath)) {
            throw new SourceDataException("Source file not found", sourcePath);
        }
        try {
            json = JsonSupport.readMap(sourcePath);
        } catch (IOException e) {
            throw new SourceDataException("Failed to parse JSON source", sourcePath, e);
        }
        log.debug("Read {} top-level entities from {}", json.size(), sourcePath);
    }

    @Override
    protected void doClose() {
        // the whole document was read on open
    }

    @Override
    protected List<IREntity> doGetEntities() {
        List<IREntity> entities = new ArrayList<>();
        for (String key : json.keySet()) {
            if (getProps().getEntities().contains(key)) {
                entities.add(new IREntity(key, getInstances(key)));
            }
        }
        return entities;
    }

    @Override
    protected List<IRRelationship> doGetRelationships() {
        List<IRRelationship> relationships = new ArrayList<>();
        for (String key : json.keySet()) {
            if (getProps().getRelationships().contains(key)) {
                relationships.add(new IRRelationship(key, getInstances(key)));
            }
        }
        return relationships;
    }

    @Override
    public List<IRInstance> getInstances(String entityKey) {
        Object rows = json.get(entityKey);
        if (rows == null) {
            throw new SourceDataException("Source data does not have any entity named - " + entityKey, sourcePath);
        }
        if (!(rows instanceof List<?> list)) {
            throw new SourceDataException("Entity " + entityKey + " must be an array of objects", sourcePath);
        }
        String pkey = primaryKeyOf(entityKey);
        List<IRInstance> instances = new ArrayList<>();
        for (Object row : list) {
            if (!(row instanceof Map<?, ?> map)) {
                throw new SourceDataException("Entity " + entityKey + " contains a non-object row", sourcePath);
            }
            Map<String, Object> data = new LinkedHashMap<>();
            map.forEach((k, v) -> data.put(String.valueOf(k), v));
            try {
                instances.add(IRInstance.builder()
                        .pkey(pkey)
                        .entityKey(entityKey)
                        .data(data)
                        .build());
            } catch (IllegalArgumentException e) {
                throw new SourceDataException("Entity " + entityKey + " has an invalid row (" + e.getMessage() + ")",
                        sourcePath, e);
            }
        }
        return instances;
    }
}
