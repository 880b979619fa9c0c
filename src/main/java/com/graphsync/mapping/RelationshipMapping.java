package com.graphsync.mapping;

import com.graphsync.repository.RelationshipProps;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Maps the rows of a link table to relationship instances.
 */
@Value
@Builder
public class RelationshipMapping implements EndpointMapping {
    @NonNull
    String irEntity;
    @NonNull
    ClassRef targetClass;
    @NonNull
    String fromAttr;
    @NonNull
    @Builder.Default
    EndpointType fromType = EndpointType.IR_ENTITY;
    @NonNull
    String toAttr;
    @NonNull
    @Builder.Default
    EndpointType toType = EndpointType.IR_ENTITY;
    InstanceFilter doSyncInstance;
    PropsModifier<RelationshipProps> modifyProps;
}
