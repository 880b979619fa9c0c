package com.graphsync.node;

import com.graphsync.engine.SyncConnector;
import com.graphsync.engine.SyncResult;
import com.graphsync.exception.ConstructionException;
import com.graphsync.exception.SyncException;
import com.graphsync.ir.IRInstance;
import com.graphsync.mapping.AspectMapping;
import com.graphsync.mapping.ClassDefinition;
import com.graphsync.mapping.MappingValidator;
import com.graphsync.repository.AspectProps;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Attaches one aspect per IR instance to a record that already exists, either a record of the owner node
 * found through {@code mapping.ownerAttr} or the record {@code mapping.modifyProps} points at.
 * Runs after every record node.
 */
@Getter
public final class AspectNode extends Node {
    private static final Logger log = LoggerFactory.getLogger(AspectNode.class);

    private final ContainerNode container;
    private final AspectMapping mapping;
    private final RecordNode owner;

    public AspectNode(SyncConnector connector, String key, ContainerNode container, AspectMapping mapping,
                      RecordNode owner) {
        super(connector, key);
        if (container == null || mapping == null) {
            throw new ConstructionException("Aspect node " + key + " needs a container and a mapping");
        }
        MappingValidator.validateAspectMapping(mapping);
        if (owner != null && mapping.getOwnerAttr() == null) {
            throw new ConstructionException("Aspect node " + key + " has an owner node but its mapping has no"
                    + " ownerAttr");
        }
        if (owner == null && mapping.getModifyProps() == null) {
            throw new ConstructionException("Aspect node " + key + " needs an owner node or a modifyProps that sets"
                    + " the owning record");
        }
        this.container = container;
        this.mapping = mapping;
        this.owner = owner;
        connector.getTree().insert(this);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ASPECT;
    }

    @Override
    protected void doSync() {
        String className = connector.getSchemaRegistry().resolve(mapping.getTargetClass(), connector.getRepository());
        String scope = connector.getContainerId(container.getKey());
        ClassDefinition definition = mapping.getTargetClass().getDefinition() instanceof ClassDefinition d ? d : null;

        for (IRInstance instance : connector.getIrModel().getEntityInstances(mapping)) {
            AspectProps props = AspectProps.builder()
                    .classFullName(className)
                    .build();
            if (definition != null) {
                RecordNode.copyProperties(definition, instance, props.getProperties());
            }
            if (owner != null) {
                Object ownerValue = instance.get(mapping.getOwnerAttr());
                Optional<String> ownerId = ownerValue == null ? Optional.empty() : owner.findRecordId(ownerValue);
                if (ownerId.isEmpty()) {
                    log.warn("Skipping {}: owner {}={} not found", instance.getKey(), mapping.getOwnerAttr(),
                            ownerValue);
                    connector.getStats().skip(NodeKind.ASPECT);
                    continue;
                }
                props.setElement(ownerId.get());
            }
            if (mapping.getModifyProps() != null) {
                mapping.getModifyProps().modifyProps(connector, props, instance);
            }
            if (props.getElement() == null) {
                throw new SyncException("Aspect node " + getKey() + " did not set the owning record of "
                        + instance.getKey() + "; set props.element in modifyProps");
            }

            SyncResult result = connector.getChangeDetector().syncAspect(props, scope, instance);
            connector.markSeen(result.entityId());
            connector.getStats().record(NodeKind.ASPECT, result.state());
            log.debug("{} {} -> {}", instance.getKey(), result.state(), result.entityId());
        }
    }

    @Override
    public Map<String, Object> toJson() {
        Map<String, Object> json = super.toJson();
        json.put("container", container.getKey());
        json.put("irEntity", mapping.getIrEntity());
        json.put("targetClass", mapping.getTargetClass().getFullName());
        json.put("owner", owner == null ? null : owner.getKey());
        return json;
    }
}
