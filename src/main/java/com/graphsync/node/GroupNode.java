package com.graphsync.node;

import com.graphsync.engine.CodeSpecs;
import com.graphsync.engine.SyncConnector;
import com.graphsync.exception.ConstructionException;
import com.graphsync.repository.Code;
import com.graphsync.repository.CollectionProps;
import com.graphsync.repository.RecordProps;
import com.graphsync.repository.TargetRepository;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * A sub-scope of a container, backed by one partition record and the collection modelling it.
 */
@Getter
public final class GroupNode extends Node {
    private static final Logger log = LoggerFactory.getLogger(GroupNode.class);

    private final ContainerNode container;
    private final GroupKind groupKind;

    public GroupNode(SyncConnector connector, String key, ContainerNode container, GroupKind groupKind) {
        super(connector, key);
        if (container == null || groupKind == null) {
            throw new ConstructionException("Group " + key + " needs a container and a kind");
        }
        this.container = container;
        this.groupKind = groupKind;
        connector.getTree().insert(this);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.GROUP;
    }

    public boolean isDefinition() {
        return groupKind == GroupKind.DEFINITION;
    }

    /**
     * Id of the partition record (and collection), looked up without writing anything.
     */
    public Optional<String> findExistingId() {
        TargetRepository repository = connector.getRepository();
        return container.findExistingId()
                .flatMap(containerId -> repository.findCodeSpec(CodeSpecs.PARTITION)
                        .flatMap(specId -> repository.findRecordByCode(Code.of(specId, containerId, getKey()))));
    }

    @Override
    protected void doSync() {
        TargetRepository repository = connector.getRepository();
        String containerId = connector.getContainerId(container.getKey());
        Code code = Code.of(connector.getCodeSpecId(CodeSpecs.PARTITION), containerId, getKey());

        String id = repository.findRecordByCode(code).orElseGet(() -> repository.insertRecord(RecordProps.builder()
                .classFullName(groupKind.getPartitionClass())
                .model(TargetRepository.ROOT_ID)
                .parent(containerId)
                .code(code)
                .userLabel(getKey())
                .build()));
        if (repository.getCollection(id).isEmpty()) {
            repository.insertCollection(new CollectionProps(id, groupKind.getCollectionClass(), isDefinition()));
            log.info("Created {} group {} ({})", groupKind, getKey(), id);
        }
        connector.cacheGroup(getKey(), id);
    }

    @Override
    public Map<String, Object> toJson() {
        Map<String, Object> json = super.toJson();
        json.put("container", container.getKey());
        json.put("groupKind", groupKind.name());
        return json;
    }
}
