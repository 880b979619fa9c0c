package com.graphsync.mapping;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

import java.util.Optional;

/**
 * Points a mapping at its target class. Either the class already exists in a schema the repository knows,
 * or the mapping carries the definition of a new class to generate.
 *
 * Full names read {@code <schema name or alias>:<class name>} or {@code <schema>.<class>}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ClassRef {
    @NonNull
    String fullName;
    SchemaItemDefinition definition;

    public static ClassRef existing(String fullName) {
        return new ClassRef(fullName, null);
    }

    public static ClassRef defined(String fullName, SchemaItemDefinition definition) {
        if (definition == null) {
            throw new IllegalArgumentException("definition is required for " + fullName);
        }
        return new ClassRef(fullName, definition);
    }

    public boolean isDefined() {
        return definition != null;
    }

    public Optional<SchemaItemDefinition> getDefinitionIfAny() {
        return Optional.ofNullable(definition);
    }

    public String getSchemaName() {
        int idx = separatorIndex(fullName);
        return idx < 0 ? "" : fullName.substring(0, idx);
    }

    public String getClassName() {
        int idx = separatorIndex(fullName);
        return idx < 0 ? fullName : fullName.substring(idx + 1);
    }

    public static int separatorIndex(String name) {
        int colon = name.indexOf(':');
        return colon >= 0 ? colon : name.indexOf('.');
    }

    @Override
    public String toString() {
        return fullName;
    }
}
