package com.graphsync.repository;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A collection of records, modelling one partition record. Both share the same id.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CollectionProps {
    private String id;
    private String classFullName;
    /**
     * Records in definition collections are deleted last, and only once nothing refers to them.
     */
    private boolean definition;
}
