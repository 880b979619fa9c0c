package com.graphsync.node;

import com.graphsync.repository.CoreSchema;
import lombok.Getter;

/**
 * What a group holds. Decides the classes of its partition record and collection.
 */
@Getter
public enum GroupKind {
    DEFINITION(CoreSchema.DEFINITION_PARTITION, CoreSchema.DEFINITION_MODEL),
    PHYSICAL(CoreSchema.PHYSICAL_PARTITION, CoreSchema.PHYSICAL_MODEL),
    SPATIAL_LOCATION(CoreSchema.SPATIAL_LOCATION_PARTITION, CoreSchema.SPATIAL_LOCATION_MODEL),
    GROUP_INFORMATION(CoreSchema.GROUP_INFORMATION_PARTITION, CoreSchema.GROUP_INFORMATION_MODEL),
    DOCUMENT(CoreSchema.DOCUMENT_PARTITION, CoreSchema.DOCUMENT_LIST_MODEL),
    LINK(CoreSchema.LINK_PARTITION, CoreSchema.LINK_MODEL);

    private final String partitionClass;
    private final String collectionClass;

    GroupKind(String partitionClass, String collectionClass) {
        this.partitionClass = partitionClass;
        this.collectionClass = collectionClass;
    }
}
