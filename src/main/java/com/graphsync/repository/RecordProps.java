package com.graphsync.repository;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Property bag of one target record. {@code id} is {@code null} until the record is inserted.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RecordProps {
    private String id;
    private String classFullName;
    /**
     * Id of the collection holding the record.
     */
    private String model;
    private Code code;
    private String userLabel;
    private String parent;
    private String category;
    @Builder.Default
    private Map<String, Object> properties = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, Object> jsonProperties = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, RelatedReference> references = new LinkedHashMap<>();

    public RecordProps copy() {
        RecordProps copy = toBuilder().build();
        copy.setProperties(new LinkedHashMap<>(properties));
        copy.setJsonProperties(new LinkedHashMap<>(jsonProperties));
        Map<String, RelatedReference> refs = new LinkedHashMap<>();
        references.forEach((name, ref) -> refs.put(name, ref.copy()));
        copy.setReferences(refs);
        return copy;
    }
}
