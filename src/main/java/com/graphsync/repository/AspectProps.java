package com.graphsync.repository;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Property bag of an aspect: extra data attached to one record. A record holds at most one aspect per class.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AspectProps {
    private String id;
    private String classFullName;
    /**
     * Id of the record owning the aspect.
     */
    private String element;
    @Builder.Default
    private Map<String, Object> properties = new LinkedHashMap<>();

    public AspectProps copy() {
        AspectProps copy = toBuilder().build();
        copy.setProperties(new LinkedHashMap<>(properties));
        return copy;
    }
}
