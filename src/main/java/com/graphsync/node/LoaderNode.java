package com.graphsync.node;

import com.graphsync.engine.CodeSpecs;
import com.graphsync.engine.ItemState;
import com.graphsync.engine.SyncArg;
import com.graphsync.engine.SyncConnector;
import com.graphsync.engine.SyncResult;
import com.graphsync.exception.ConstructionException;
import com.graphsync.exception.SourceDataException;
import com.graphsync.loader.ApiConnection;
import com.graphsync.loader.DataConnection;
import com.graphsync.loader.FileConnection;
import com.graphsync.loader.Loader;
import com.graphsync.repository.Code;
import com.graphsync.repository.CoreSchema;
import com.graphsync.repository.RecordProps;
import com.graphsync.util.Checksums;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Persists the description of the source connection as a record, so the next run can tell whether the source
 * changed at all. Lives in a {@link GroupKind#LINK} group; a container has at most one.
 */
@Getter
public final class LoaderNode extends Node {
    private static final Logger log = LoggerFactory.getLogger(LoaderNode.class);

    public static final String CONNECTION_DESCRIPTOR = "ConnectionDescriptor";

    private final GroupNode group;
    private final Loader loader;

    public LoaderNode(SyncConnector connector, String key, GroupNode group, Loader loader) {
        super(connector, key);
        if (group == null || loader == null) {
            throw new ConstructionException("Loader node " + key + " needs a group and a loader");
        }
        if (group.getGroupKind() != GroupKind.LINK) {
            throw new ConstructionException("Loader node " + key + " must be placed in a LINK group, not "
                    + group.getGroupKind());
        }
        this.group = group;
        this.loader = loader;
        connector.getTree().insert(this);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.LOADER;
    }

    @Override
    public ContainerNode getContainer() {
        return group.getContainer();
    }

    /**
     * Change state of the source connection, computed without writing anything. API sources cannot be
     * fingerprinted and always count as changed.
     */
    public ItemState detectChange(DataConnection connection) {
        if (connection instanceof ApiConnection) {
            return ItemState.CHANGED;
        }
        Optional<String> groupId = group.findExistingId();
        if (groupId.isEmpty()) {
            return ItemState.NEW;
        }
        SourceDescriptor descriptor = describe(connection);
        return connector.getChangeDetector().classify(groupId.get(), CONNECTION_DESCRIPTOR, getKey(),
                descriptor.version(), descriptor.checksum());
    }

    @Override
    protected void doSync() {
        DataConnection connection = connector.getJobArgs().getConnection();
        SourceDescriptor descriptor = describe(connection);
        String groupId = connector.getGroupId(group.getKey());

        RecordProps props = RecordProps.builder()
                .classFullName(CoreSchema.REPOSITORY_LINK)
                .model(groupId)
                .code(Code.of(connector.getCodeSpecId(CodeSpecs.RECORD), groupId, getKey()))
                .userLabel(getKey())
                .jsonProperties(descriptor.json())
                .build();
        SyncResult result = connector.getChangeDetector().syncRecord(SyncArg.builder()
                .props(props)
                .version(descriptor.version())
                .checksum(descriptor.checksum())
                .scope(groupId)
                .kind(CONNECTION_DESCRIPTOR)
                .identifier(getKey())
                .build());
        connector.markSeen(result.entityId());
        connector.getStats().record(NodeKind.LOADER, result.state());
        log.info("Connection descriptor {} {}", getKey(), result.state());
    }

    SourceDescriptor describe(DataConnection connection) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("nodeKey", getKey());
        json.put("connection", connection.toJson());
        json.put("loader", loader.toJson());
        String checksum = Checksums.md5OfJson(json);

        String version;
        if (connection instanceof FileConnection file) {
            try {
                long mtimeMs = Files.getLastModifiedTime(file.getFilepath()).toMillis();
                json.put("mtimeMs", mtimeMs);
                version = Long.toString(mtimeMs);
            } catch (IOException e) {
                throw new SourceDataException("Cannot read modification time", file.getFilepath(), e);
            }
        } else {
            version = Long.toString(System.currentTimeMillis());
        }
        return new SourceDescriptor(version, checksum, json);
    }

    @Override
    public Map<String, Object> toJson() {
        Map<String, Object> json = super.toJson();
        json.put("group", group.getKey());
        json.put("loader", loader.toJson());
        return json;
    }

    record SourceDescriptor(String version, String checksum, Map<String, Object> json) {
    }
}
