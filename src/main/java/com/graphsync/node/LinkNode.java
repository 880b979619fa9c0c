package com.graphsync.node;

import com.graphsync.engine.ItemState;
import com.graphsync.engine.SourceTargetPair;
import com.graphsync.engine.SyncConnector;
import com.graphsync.exception.ConstructionException;
import com.graphsync.ir.IRInstance;
import com.graphsync.mapping.EndpointType;
import com.graphsync.mapping.MappingValidator;
import com.graphsync.mapping.RelationshipMapping;
import com.graphsync.repository.RelationshipProps;
import com.graphsync.repository.TargetRepository;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Inserts relationship instances between records. A relationship is inserted once and never updated.
 */
@Getter
public final class LinkNode extends Node {
    private static final Logger log = LoggerFactory.getLogger(LinkNode.class);

    private final ContainerNode container;
    private final RelationshipMapping mapping;
    private final RecordNode source;
    private final RecordNode target;

    public LinkNode(SyncConnector connector, String key, ContainerNode container, RelationshipMapping mapping,
                    RecordNode source, RecordNode target) {
        super(connector, key);
        if (container == null || mapping == null) {
            throw new ConstructionException("Link node " + key + " needs a container and a mapping");
        }
        MappingValidator.validateRelationshipMapping(mapping);
        requireEndpoint(key, "source", mapping.getFromType(), source);
        requireEndpoint(key, "target", mapping.getToType(), target);
        this.container = container;
        this.mapping = mapping;
        this.source = source;
        this.target = target;
        connector.getTree().insert(this);
    }

    static void requireEndpoint(String key, String side, EndpointType type, RecordNode node) {
        if (type == EndpointType.IR_ENTITY && node == null) {
            throw new ConstructionException("Node " + key + " resolves its " + side
                    + " from the IR model and needs the " + side + " record node");
        }
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.LINK;
    }

    @Override
    protected void doSync() {
        TargetRepository repository = connector.getRepository();
        String className = connector.getSchemaRegistry().resolve(mapping.getTargetClass(), repository);

        for (IRInstance instance : connector.getIrModel().getRelInstances(mapping)) {
            Optional<SourceTargetPair> pair = connector.getEndpointResolver().resolve(mapping, source, target, instance);
            if (pair.isEmpty()) {
                connector.getStats().skip(NodeKind.LINK);
                continue;
            }
            RelationshipProps props = RelationshipProps.builder()
                    .classFullName(className)
                    .sourceId(pair.get().sourceId())
                    .targetId(pair.get().targetId())
                    .build();
            if (mapping.getModifyProps() != null) {
                mapping.getModifyProps().modifyProps(connector, props, instance);
            }
            if (repository.findRelationship(props.getClassFullName(), props.getSourceId(), props.getTargetId())
                    .isPresent()) {
                connector.getStats().record(NodeKind.LINK, ItemState.UNCHANGED);
                continue;
            }
            String id = repository.insertRelationship(props);
            connector.getStats().record(NodeKind.LINK, ItemState.NEW);
            log.debug("Linked {} -> {} as {} ({})", props.getSourceId(), props.getTargetId(), className, id);
        }
    }

    @Override
    public Map<String, Object> toJson() {
        Map<String, Object> json = super.toJson();
        json.put("container", container.getKey());
        json.put("irEntity", mapping.getIrEntity());
        json.put("targetClass", mapping.getTargetClass().getFullName());
        json.put("source", source == null ? null : source.getKey());
        json.put("target", target == null ? null : target.getKey());
        return json;
    }
}
