package com.graphsync.mapping;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Optional;

/**
 * Definition of a new entity class, generated into the dynamic schema.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ClassDefinition implements SchemaItemDefinition {
    @NonNull
    String name;
    @NonNull
    String baseClass;
    String label;
    String description;
    @Singular
    List<PropertyDefinition> properties;

    public Optional<PropertyDefinition> findProperty(String propertyName) {
        return properties.stream()
                .filter(p -> p.getName().equalsIgnoreCase(propertyName))
                .findFirst();
    }
}
