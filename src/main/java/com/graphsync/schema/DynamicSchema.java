package com.graphsync.schema;

import com.graphsync.mapping.ClassDefinition;
import com.graphsync.mapping.RelationshipClassDefinition;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Optional;

/**
 * A schema as it is serialized for import. Domain schema files share the same JSON shape.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class DynamicSchema {
    @NonNull
    String name;
    String alias;
    @NonNull
    SchemaVersion version;
    @Singular
    List<String> references;
    @Singular
    List<ClassDefinition> entityClasses;
    @Singular
    List<RelationshipClassDefinition> relationshipClasses;

    public Optional<ClassDefinition> findEntityClass(String className) {
        return entityClasses.stream()
                .filter(c -> c.getName().equalsIgnoreCase(className))
                .findFirst();
    }

    public Optional<RelationshipClassDefinition> findRelationshipClass(String className) {
        return relationshipClasses.stream()
                .filter(c -> c.getName().equalsIgnoreCase(className))
                .findFirst();
    }

    public boolean hasClass(String className) {
        return findEntityClass(className).isPresent() || findRelationshipClass(className).isPresent();
    }

    /**
     * Whether {@code nameOrAlias} designates this schema.
     */
    public boolean isNamed(String nameOrAlias) {
        return name.equalsIgnoreCase(nameOrAlias) || (alias != null && alias.equalsIgnoreCase(nameOrAlias));
    }
}
