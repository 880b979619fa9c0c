package com.graphsync.node;

import com.graphsync.engine.CodeSpecs;
import com.graphsync.engine.SyncArg;
import com.graphsync.engine.SyncConnector;
import com.graphsync.engine.SyncResult;
import com.graphsync.exception.ConstructionException;
import com.graphsync.ir.IRInstance;
import com.graphsync.mapping.ClassDefinition;
import com.graphsync.mapping.ElementMapping;
import com.graphsync.mapping.MappingValidator;
import com.graphsync.mapping.PropertyDefinition;
import com.graphsync.repository.Code;
import com.graphsync.repository.RecordProps;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Turns the instances of one IR entity into records of the mapping's target class.
 */
@Getter
public class RecordNode extends Node {
    private static final Logger log = LoggerFactory.getLogger(RecordNode.class);

    private final ElementMapping mapping;
    private final RecordPlacement placement;
    /**
     * Node whose records categorize the records of this one, resolved through {@code mapping.categoryAttr}.
     */
    private final RecordNode category;

    public RecordNode(SyncConnector connector, String key, ElementMapping mapping, RecordPlacement placement) {
        this(connector, key, mapping, placement, null);
    }

    public RecordNode(SyncConnector connector, String key, ElementMapping mapping, RecordPlacement placement,
                      RecordNode category) {
        super(connector, key);
        if (mapping == null || placement == null) {
            throw new ConstructionException("Record node " + key + " needs a mapping and a placement");
        }
        MappingValidator.validateElementMapping(mapping);
        if (placement instanceof RecordPlacement.UnderParent && mapping.getParentAttr() == null) {
            throw new ConstructionException("Record node " + key + " is placed under a parent but its mapping"
                    + " has no parentAttr");
        }
        if ((category == null) != (mapping.getCategoryAttr() == null)) {
            throw new ConstructionException("Record node " + key + " needs both a category node and a categoryAttr,"
                    + " or neither");
        }
        this.mapping = mapping;
        this.placement = placement;
        this.category = category;
        connector.getTree().insert(this);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.RECORD;
    }

    public GroupNode getGroup() {
        return placement.group();
    }

    @Override
    public ContainerNode getContainer() {
        return getGroup().getContainer();
    }

    public Optional<RecordNode> getParent() {
        return placement instanceof RecordPlacement.UnderParent underParent
                ? Optional.of(underParent.parent())
                : Optional.empty();
    }

    /**
     * Id of the record this node produced (in this run or an earlier one) for the given primary key value.
     */
    public Optional<String> findRecordId(Object primaryKeyValue) {
        String irKey = IRInstance.createKey(mapping.getIrEntity(), primaryKeyValue);
        Optional<String> cached = connector.getRecordId(irKey);
        if (cached.isPresent()) {
            return cached;
        }
        return getGroup().findExistingId()
                .flatMap(groupId -> connector.getRepository().findCodeSpec(CodeSpecs.RECORD)
                        .flatMap(specId -> connector.getRepository().findRecordByCode(Code.of(specId, groupId, irKey))));
    }

    @Override
    protected void doSync() {
        String groupId = connector.getGroupId(getGroup().getKey());
        String className = connector.getSchemaRegistry().resolve(mapping.getTargetClass(), connector.getRepository());
        String specId = connector.getCodeSpecId(CodeSpecs.RECORD);
        ClassDefinition definition = mapping.getTargetClass().getDefinition() instanceof ClassDefinition d ? d : null;

        int count = 0;
        for (IRInstance instance : connector.getIrModel().getEntityInstances(mapping)) {
            RecordProps props = RecordProps.builder()
                    .classFullName(className)
                    .model(groupId)
                    .code(Code.of(specId, groupId, instance.getCodeValue()))
                    .userLabel(instance.getUserLabel())
                    .build();
            if (definition != null) {
                copyProperties(definition, instance, props.getProperties());
            }
            if (!resolveParent(instance, props) || !resolveCategory(instance, props)) {
                connector.getStats().skip(NodeKind.RECORD);
                continue;
            }
            if (mapping.getModifyProps() != null) {
                mapping.getModifyProps().modifyProps(connector, props, instance);
            }

            SyncResult result = connector.getChangeDetector().syncRecord(SyncArg.builder()
                    .props(props)
                    .version(instance.getVersion())
                    .checksum(instance.getChecksum())
                    .scope(groupId)
                    .kind(instance.getEntityKey())
                    .identifier(instance.getKey())
                    .build());
            connector.cacheRecord(instance.getKey(), result.entityId());
            connector.markSeen(result.entityId());
            connector.getStats().record(NodeKind.RECORD, result.state());
            log.debug("{} {} -> {}", instance.getKey(), result.state(), result.entityId());
            count++;
        }
        log.info("Synchronized {} {} records of {}", count, mapping.getIrEntity(), className);
    }

    /**
     * Copies the attributes named by the definition's properties, matching names case-insensitively.
     */
    static void copyProperties(ClassDefinition definition, IRInstance instance, Map<String, Object> target) {
        for (PropertyDefinition property : definition.getProperties()) {
            Object value = instance.get(property.getName());
            if (value == null) {
                value = instance.getData().entrySet().stream()
                        .filter(e -> e.getKey().equalsIgnoreCase(property.getName()))
                        .map(Map.Entry::getValue)
                        .findFirst()
                        .orElse(null);
            }
            if (value != null) {
                target.put(property.getName(), value);
            }
        }
    }

    private boolean resolveParent(IRInstance instance, RecordProps props) {
        Optional<RecordNode> parent = getParent();
        if (parent.isEmpty()) {
            return true;
        }
        Object parentValue = instance.get(mapping.getParentAttr());
        Optional<String> parentId = parentValue == null ? Optional.empty() : parent.get().findRecordId(parentValue);
        if (parentId.isEmpty()) {
            log.warn("Skipping {}: parent {}={} not found", instance.getKey(), mapping.getParentAttr(), parentValue);
            return false;
        }
        props.setParent(parentId.get());
        return true;
    }

    private boolean resolveCategory(IRInstance instance, RecordProps props) {
        if (category == null) {
            return true;
        }
        Object categoryValue = instance.get(mapping.getCategoryAttr());
        if (categoryValue == null) {
            return true;
        }
        Optional<String> categoryId = category.findRecordId(categoryValue);
        if (categoryId.isEmpty()) {
            log.warn("Skipping {}: category {}={} not found", instance.getKey(), mapping.getCategoryAttr(),
                    categoryValue);
            return false;
        }
        props.setCategory(categoryId.get());
        return true;
    }

    @Override
    public Map<String, Object> toJson() {
        Map<String, Object> json = super.toJson();
        json.put("irEntity", mapping.getIrEntity());
        json.put("targetClass", mapping.getTargetClass().getFullName());
        if (placement instanceof RecordPlacement.UnderParent underParent) {
            json.put("parent", underParent.parent().getKey());
        } else {
            json.put("group", getGroup().getKey());
        }
        if (category != null) {
            json.put("category", category.getKey());
        }
        return json;
    }
}
