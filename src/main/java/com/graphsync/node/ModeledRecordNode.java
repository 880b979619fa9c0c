package com.graphsync.node;

import com.graphsync.engine.ItemState;
import com.graphsync.engine.SyncConnector;
import com.graphsync.exception.ConstructionException;
import com.graphsync.ir.IRInstance;
import com.graphsync.mapping.ElementMapping;
import com.graphsync.repository.CollectionProps;
import com.graphsync.repository.CoreSchema;
import com.graphsync.repository.TargetRepository;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * A record node whose records each break down into a collection of their own. The collection shares the
 * record's id, is created once and never updated.
 */
@Getter
public final class ModeledRecordNode extends RecordNode {
    private static final Logger log = LoggerFactory.getLogger(ModeledRecordNode.class);

    private final String collectionClass;

    public ModeledRecordNode(SyncConnector connector, String key, ElementMapping mapping, RecordPlacement placement) {
        this(connector, key, mapping, placement, null, CoreSchema.PHYSICAL_MODEL);
    }

    public ModeledRecordNode(SyncConnector connector, String key, ElementMapping mapping, RecordPlacement placement,
                             RecordNode category, String collectionClass) {
        super(connector, key, mapping, placement, category);
        if (collectionClass == null || collectionClass.isBlank()) {
            throw new ConstructionException("Modeled record node " + key + " needs a collection class");
        }
        this.collectionClass = collectionClass;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.MODELED_RECORD;
    }

    @Override
    protected void doSync() {
        super.doSync();
        TargetRepository repository = connector.getRepository();
        for (IRInstance instance : connector.getIrModel().getEntityInstances(getMapping())) {
            Optional<String> recordId = connector.getRecordId(instance.getKey());
            if (recordId.isEmpty()) {
                continue;
            }
            if (repository.getCollection(recordId.get()).isPresent()) {
                connector.getStats().record(NodeKind.MODELED_RECORD, ItemState.UNCHANGED);
                continue;
            }
            repository.insertCollection(new CollectionProps(recordId.get(), collectionClass, false));
            connector.getStats().record(NodeKind.MODELED_RECORD, ItemState.NEW);
            log.debug("Created {} collection for {} ({})", collectionClass, instance.getKey(), recordId.get());
        }
    }

    @Override
    public Map<String, Object> toJson() {
        Map<String, Object> json = super.toJson();
        json.put("collectionClass", collectionClass);
        return json;
    }
}
