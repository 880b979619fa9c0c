package com.graphsync.node;

import com.graphsync.engine.ItemState;
import com.graphsync.engine.SourceTargetPair;
import com.graphsync.engine.SyncConnector;
import com.graphsync.exception.ConstructionException;
import com.graphsync.ir.IRInstance;
import com.graphsync.mapping.MappingValidator;
import com.graphsync.mapping.RelatedElementMapping;
import com.graphsync.repository.RecordProps;
import com.graphsync.repository.RelatedReference;
import com.graphsync.repository.TargetRepository;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Sets a reference property on the target-side record instead of inserting a relationship instance.
 * Runs after every record node, since both ends must exist.
 */
@Getter
public final class ForeignKeyNode extends Node {
    private static final Logger log = LoggerFactory.getLogger(ForeignKeyNode.class);

    private final ContainerNode container;
    private final RelatedElementMapping mapping;
    private final RecordNode source;
    private final RecordNode target;

    public ForeignKeyNode(SyncConnector connector, String key, ContainerNode container, RelatedElementMapping mapping,
                          RecordNode source, RecordNode target) {
        super(connector, key);
        if (container == null || mapping == null) {
            throw new ConstructionException("Foreign key node " + key + " needs a container and a mapping");
        }
        MappingValidator.validateRelatedElementMapping(mapping);
        LinkNode.requireEndpoint(key, "source", mapping.getFromType(), source);
        LinkNode.requireEndpoint(key, "target", mapping.getToType(), target);
        this.container = container;
        this.mapping = mapping;
        this.source = source;
        this.target = target;
        connector.getTree().insert(this);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.FOREIGN_KEY;
    }

    @Override
    protected void doSync() {
        TargetRepository repository = connector.getRepository();
        String className = connector.getSchemaRegistry().resolve(mapping.getTargetClass(), repository);
        String property = mapping.getReferenceProperty();

        for (IRInstance instance : connector.getIrModel().getRelInstances(mapping)) {
            Optional<SourceTargetPair> pair = connector.getEndpointResolver().resolve(mapping, source, target, instance);
            if (pair.isEmpty()) {
                connector.getStats().skip(NodeKind.FOREIGN_KEY);
                continue;
            }
            String ownerId = pair.get().targetId();
            RelatedReference reference = new RelatedReference(pair.get().sourceId(), className);
            if (mapping.getModifyProps() != null) {
                mapping.getModifyProps().modifyProps(connector, reference, instance);
            }
            RelatedReference current = repository.getRecord(ownerId)
                    .map(RecordProps::getReferences)
                    .map(refs -> refs.get(property))
                    .orElse(null);
            if (reference.equals(current)) {
                connector.getStats().record(NodeKind.FOREIGN_KEY, ItemState.UNCHANGED);
                continue;
            }
            repository.updateReference(ownerId, property, reference);
            connector.getStats().record(NodeKind.FOREIGN_KEY, current == null ? ItemState.NEW : ItemState.CHANGED);
            log.debug("Set {}.{} -> {}", ownerId, property, reference.getId());
        }
    }

    @Override
    public Map<String, Object> toJson() {
        Map<String, Object> json = super.toJson();
        json.put("container", container.getKey());
        json.put("irEntity", mapping.getIrEntity());
        json.put("targetClass", mapping.getTargetClass().getFullName());
        json.put("referenceProperty", mapping.getReferenceProperty());
        json.put("source", source == null ? null : source.getKey());
        json.put("target", target == null ? null : target.getKey());
        return json;
    }
}
