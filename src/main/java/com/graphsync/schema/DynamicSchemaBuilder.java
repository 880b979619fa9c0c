package com.graphsync.schema;

import com.graphsync.exception.SchemaSyncException;
import com.graphsync.mapping.ClassDefinition;
import com.graphsync.mapping.RelationshipClassDefinition;

import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Builds the candidate dynamic schema from the collected class definitions.
 */
public class DynamicSchemaBuilder {

    public static final String CORE_SCHEMA = "Core";

    public DynamicSchema build(DynamicSchemaSettings settings, SchemaVersion version, List<String> domainSchemaNames,
                               DynamicClassMap classMap) {
        Set<String> seen = new LinkedHashSet<>();
        DynamicSchema.DynamicSchemaBuilder builder = DynamicSchema.builder()
                .name(settings.getSchemaName())
                .alias(settings.getSchemaAlias())
                .version(version)
                .reference(CORE_SCHEMA);
        for (String domainSchema : domainSchemaNames) {
            if (!domainSchema.equalsIgnoreCase(CORE_SCHEMA)) {
                builder.reference(domainSchema);
            }
        }

        // sorted so that the serialized schema does not depend on node insertion order
        List<ClassDefinition> entities = classMap.getEntityClasses().stream()
                .sorted(Comparator.comparing(ClassDefinition::getName))
                .toList();
        for (ClassDefinition entity : entities) {
            checkUnique(seen, entity.getName());
            builder.entityClass(entity);
        }
        List<RelationshipClassDefinition> relationships = classMap.getRelationshipClasses().stream()
                .sorted(Comparator.comparing(RelationshipClassDefinition::getName))
                .toList();
        for (RelationshipClassDefinition relationship : relationships) {
            checkUnique(seen, relationship.getName());
            builder.relationshipClass(relationship);
        }
        return builder.build();
    }

    private static void checkUnique(Set<String> seen, String className) {
        if (!seen.add(className.toLowerCase(Locale.ROOT))) {
            throw new SchemaSyncException("Duplicate class name in dynamic schema: " + className);
        }
    }
}
