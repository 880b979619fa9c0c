package com.graphsync.mapping;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class PropertyDefinition {
    @NonNull
    String name;
    @NonNull
    PrimitiveType type;
    String label;

    public static PropertyDefinition of(String name, PrimitiveType type) {
        return PropertyDefinition.builder().name(name).type(type).build();
    }
}
