package com.graphsync.mapping;

import com.graphsync.repository.AspectProps;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Maps an IR entity to aspects attached to records that already exist.
 */
@Value
@Builder
public class AspectMapping implements Mapping {
    @NonNull
    String irEntity;
    @NonNull
    ClassRef targetClass;
    /**
     * Attribute holding the primary key value of the owning record. Used together with an owner node.
     */
    String ownerAttr;
    InstanceFilter doSyncInstance;
    /**
     * Without an owner node, this must set {@link AspectProps#setElement(String)}.
     */
    PropsModifier<AspectProps> modifyProps;
}
