package com.graphsync.repository;

import com.graphsync.schema.DynamicSchema;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything an {@link InMemoryTargetRepository} holds. Also the on-disk shape of {@link JsonFileTargetRepository}.
 */
@Data
@NoArgsConstructor
public class RepositoryState {
    private long nextId = 1;
    private Map<String, String> codeSpecs = new LinkedHashMap<>();
    private Map<String, RecordProps> records = new LinkedHashMap<>();
    private Map<String, AspectProps> aspects = new LinkedHashMap<>();
    private Map<String, CollectionProps> collections = new LinkedHashMap<>();
    private Map<String, RelationshipProps> relationships = new LinkedHashMap<>();
    private Map<String, ProvenanceRecord> provenance = new LinkedHashMap<>();
    private Map<String, DynamicSchema> schemas = new LinkedHashMap<>();
    private List<String> changesets = new ArrayList<>();

    public String allocateId() {
        return String.format("0x%x", nextId++);
    }

    public RepositoryState copy() {
        RepositoryState copy = new RepositoryState();
        copy.nextId = nextId;
        copy.codeSpecs.putAll(codeSpecs);
        records.forEach((id, r) -> copy.records.put(id, r.copy()));
        aspects.forEach((id, a) -> copy.aspects.put(id, a.copy()));
        collections.forEach((id, c) -> copy.collections.put(id,
                new CollectionProps(c.getId(), c.getClassFullName(), c.isDefinition())));
        relationships.forEach((id, r) -> copy.relationships.put(id, r.copy()));
        provenance.forEach((id, p) -> copy.provenance.put(id, p.copy()));
        copy.schemas.putAll(schemas);
        copy.changesets.addAll(changesets);
        return copy;
    }
}
