package com.graphsync.mapping;

import com.graphsync.repository.RecordProps;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Maps an IR entity to records of one target class.
 */
@Value
@Builder
public class ElementMapping implements Mapping {
    @NonNull
    String irEntity;
    @NonNull
    ClassRef targetClass;
    /**
     * Attribute holding the primary key value of the category record, if the records reference one.
     */
    String categoryAttr;
    /**
     * Attribute holding the primary key value of the parent record. Required for records placed under a parent.
     */
    String parentAttr;
    InstanceFilter doSyncInstance;
    PropsModifier<RecordProps> modifyProps;
}
