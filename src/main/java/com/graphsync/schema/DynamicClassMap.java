package com.graphsync.schema;

import com.graphsync.exception.ConstructionException;
import com.graphsync.mapping.ClassDefinition;
import com.graphsync.mapping.ClassRef;
import com.graphsync.mapping.RelationshipClassDefinition;
import com.graphsync.mapping.SchemaItemDefinition;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Class definitions declared inline by mappings, collected as nodes are inserted into the tree.
 */
public class DynamicClassMap {

    private final Map<String, ClassDefinition> entityClasses = new LinkedHashMap<>();
    private final Map<String, RelationshipClassDefinition> relationshipClasses = new LinkedHashMap<>();

    /**
     * Registers the definition carried by {@code ref}, if any. Several mappings may share one definition,
     * but two different definitions may not share a name.
     */
    public void register(ClassRef ref) {
        if (!ref.isDefined()) {
            return;
        }
        SchemaItemDefinition definition = ref.getDefinition();
        if (definition instanceof ClassDefinition classDefinition) {
            put(entityClasses, classDefinition.getName(), classDefinition);
        } else if (definition instanceof RelationshipClassDefinition relDefinition) {
            put(relationshipClasses, relDefinition.getName(), relDefinition);
        } else {
            throw new ConstructionException("Unsupported class definition: " + definition.getClass().getSimpleName());
        }
    }

    private static <D> void put(Map<String, D> target, String name, D definition) {
        D existing = target.putIfAbsent(name, definition);
        if (existing != null && !existing.equals(definition)) {
            throw new ConstructionException("Class " + name + " is defined twice with different definitions");
        }
    }

    public Collection<ClassDefinition> getEntityClasses() {
        return Collections.unmodifiableCollection(entityClasses.values());
    }

    public Collection<RelationshipClassDefinition> getRelationshipClasses() {
        return Collections.unmodifiableCollection(relationshipClasses.values());
    }

    public boolean isEmpty() {
        return entityClasses.isEmpty() && relationshipClasses.isEmpty();
    }
}
