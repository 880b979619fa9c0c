package com.graphsync.repository;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Side record attached to a target record, remembering which source instance produced it and in which state.
 * The only synchronization state that survives between runs.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ProvenanceRecord {
    private String id;
    /**
     * The target record this provenance is attached to.
     */
    private String elementId;
    private String scope;
    /**
     * IR entity key, or {@code ConnectionDescriptor} for loader records.
     */
    private String kind;
    private String identifier;
    private String version;
    private String checksum;

    public String fingerprint() {
        return nullToEmpty(version) + nullToEmpty(checksum);
    }

    public ProvenanceRecord copy() {
        return toBuilder().build();
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
