package com.graphsync.node;

import com.graphsync.engine.CodeSpecs;
import com.graphsync.engine.SyncConnector;
import com.graphsync.repository.Code;
import com.graphsync.repository.CoreSchema;
import com.graphsync.repository.RecordProps;
import com.graphsync.repository.TargetRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * A named scope under the repository root. Created when absent, never updated.
 */
public final class ContainerNode extends Node {
    private static final Logger log = LoggerFactory.getLogger(ContainerNode.class);

    public ContainerNode(SyncConnector connector, String key) {
        super(connector, key);
        connector.getTree().insert(this);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CONTAINER;
    }

    @Override
    public ContainerNode getContainer() {
        return this;
    }

    /**
     * Id of the container record, looked up without writing anything.
     */
    public Optional<String> findExistingId() {
        TargetRepository repository = connector.getRepository();
        return repository.findCodeSpec(CodeSpecs.SUBJECT)
                .flatMap(specId -> repository.findRecordByCode(Code.of(specId, TargetRepository.ROOT_ID, getKey())));
    }

    @Override
    protected void doSync() {
        String id = findExistingId().orElseGet(this::insert);
        connector.cacheContainer(getKey(), id);
    }

    private String insert() {
        Code code = Code.of(connector.getCodeSpecId(CodeSpecs.SUBJECT), TargetRepository.ROOT_ID, getKey());
        String id = connector.getRepository().insertRecord(RecordProps.builder()
                .classFullName(CoreSchema.SUBJECT)
                .model(TargetRepository.ROOT_ID)
                .parent(TargetRepository.ROOT_ID)
                .code(code)
                .userLabel(getKey())
                .build());
        log.info("Created container {} ({})", getKey(), id);
        return id;
    }
}
