package com.graphsync.repository;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Value of a reference property: the referenced record and the relationship class that types the reference.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RelatedReference {
    private String id;
    private String relClassName;

    public RelatedReference copy() {
        return new RelatedReference(id, relClassName);
    }
}
