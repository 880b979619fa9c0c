package com.graphsync.repository;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One link-table style relationship instance between two records.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RelationshipProps {
    private String id;
    private String classFullName;
    private String sourceId;
    private String targetId;
    @Builder.Default
    private Map<String, Object> properties = new LinkedHashMap<>();

    public RelationshipProps copy() {
        RelationshipProps copy = toBuilder().build();
        copy.setProperties(new LinkedHashMap<>(properties));
        return copy;
    }
}
