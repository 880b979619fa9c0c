package com.graphsync.engine;

import com.graphsync.repository.RecordProps;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Input of change detection for one record.
 */
@Value
@Builder
public class SyncArg {
    @NonNull
    RecordProps props;
    String version;
    String checksum;
    /**
     * Id of the collection the record's code is scoped to.
     */
    @NonNull
    String scope;
    /**
     * IR entity key, or {@code ConnectionDescriptor}.
     */
    @NonNull
    String kind;
    /**
     * IR instance key.
     */
    @NonNull
    String identifier;
}
