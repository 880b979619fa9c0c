package com.graphsync.mapping;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Definition of a new relationship class, generated into the dynamic schema.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class RelationshipClassDefinition implements SchemaItemDefinition {
    @NonNull
    String name;
    @NonNull
    String baseClass;
    @Builder.Default
    StrengthType strength = StrengthType.REFERENCING;
    @Builder.Default
    StrengthDirection strengthDirection = StrengthDirection.FORWARD;
    @NonNull
    RelationshipConstraint source;
    @NonNull
    RelationshipConstraint target;
}
