package com.graphsync.mapping;

import com.graphsync.repository.RelatedReference;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Maps a relationship onto a reference property of the target-side record instead of a link instance.
 *
 * The reference points at the record resolved from {@code fromAttr} and is stored on the record
 * resolved from {@code toAttr}.
 */
@Value
@Builder
public class RelatedElementMapping implements EndpointMapping {
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
    /**
     * Name of the reference property on the target-side record, e.g. {@code parent}.
     */
    @NonNull
    String referenceProperty;
    InstanceFilter doSyncInstance;
    PropsModifier<RelatedReference> modifyProps;
}
