package com.graphsync.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.graphsync.exception.SchemaSyncException;
import com.graphsync.mapping.ClassRef;
import com.graphsync.mapping.Locator;
import com.graphsync.schema.DynamicSchema;
import com.graphsync.schema.SchemaVersion;
import com.graphsync.util.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Single-writer repository kept in memory. Writes go to a working copy that {@link #commit(String)} publishes
 * and {@link #abandonChanges()} throws away.
 */
public class InMemoryTargetRepository implements TargetRepository {
    private static final Logger log = LoggerFactory.getLogger(InMemoryTargetRepository.class);

    private RepositoryState committed;
    private RepositoryState working;
    private boolean dirty;
    private final ChannelControl channelControl;

    public InMemoryTargetRepository() {
        this(null, null);
    }

    /**
     * A repository that behaves as a multi-writer copy, exchanging changes through {@code channelControl}.
     */
    public InMemoryTargetRepository(ChannelControl channelControl) {
        this(null, channelControl);
    }

    protected InMemoryTargetRepository(RepositoryState initialState, ChannelControl channelControl) {
        this.committed = initialState != null ? initialState : emptyState();
        this.working = committed.copy();
        this.channelControl = channelControl;
    }

    private static RepositoryState emptyState() {
        RepositoryState state = new RepositoryState();
        String rootId = state.allocateId();
        state.getRecords().put(rootId, RecordProps.builder()
                .id(rootId)
                .classFullName(CoreSchema.SUBJECT)
                .model(rootId)
                .userLabel("Root")
                .build());
        state.getCollections().put(rootId, new CollectionProps(rootId, CoreSchema.REPOSITORY_MODEL, false));
        DynamicSchema core = CoreSchema.create();
        state.getSchemas().put(core.getName(), core);
        return state;
    }

    protected RepositoryState committedState() {
        return committed;
    }

    // ----- code specs

    @Override
    public Optional<String> findCodeSpec(String name) {
        return Optional.ofNullable(working.getCodeSpecs().get(name));
    }

    @Override
    public String insertCodeSpec(String name) {
        if (working.getCodeSpecs().containsKey(name)) {
            throw new IllegalStateException("Code spec already exists: " + name);
        }
        String id = working.allocateId();
        working.getCodeSpecs().put(name, id);
        dirty = true;
        return id;
    }

    // ----- records

    @Override
    public Optional<String> findRecordByCode(Code code) {
        return working.getRecords().values().stream()
                .filter(r -> code.matches(r.getCode()))
                .map(RecordProps::getId)
                .findFirst();
    }

    @Override
    public Optional<RecordProps> getRecord(String id) {
        RecordProps record = working.getRecords().get(id);
        return record == null ? Optional.empty() : Optional.of(record.copy());
    }

    @Override
    public String insertRecord(RecordProps props) {
        RecordProps record = props.copy();
        record.setClassFullName(requireClass(props.getClassFullName()));
        if (!working.getCollections().containsKey(record.getModel())) {
            throw new IllegalArgumentException("Unknown collection " + record.getModel() + " for "
                    + record.getClassFullName());
        }
        if (record.getCode() != null && findRecordByCode(record.getCode()).isPresent()) {
            throw new IllegalStateException("Duplicate code: " + record.getCode());
        }
        String id = working.allocateId();
        record.setId(id);
        working.getRecords().put(id, record);
        dirty = true;
        return id;
    }

    @Override
    public void updateRecord(RecordProps props) {
        if (props.getId() == null || !working.getRecords().containsKey(props.getId())) {
            throw new IllegalArgumentException("Cannot update unknown record " + props.getId());
        }
        RecordProps record = props.copy();
        record.setClassFullName(requireClass(props.getClassFullName()));
        working.getRecords().put(record.getId(), record);
        dirty = true;
    }

    @Override
    public void deleteRecord(String id) {
        if (TargetRepository.ROOT_ID.equals(id)) {
            throw new IllegalArgumentException("The root record cannot be deleted");
        }
        if (!working.getRecords().containsKey(id)) {
            return;
        }
        Set<String> doomed = new LinkedHashSet<>();
        collectWithChildren(id, doomed);
        removeAll(doomed);
    }

    private void collectWithChildren(String id, Set<String> out) {
        if (!out.add(id)) {
            return;
        }
        for (RecordProps record : working.getRecords().values()) {
            if (id.equals(record.getParent()) || (id.equals(record.getModel()) && !id.equals(record.getId()))) {
                collectWithChildren(record.getId(), out);
            }
        }
    }

    private void removeAll(Set<String> ids) {
        ids.forEach(working.getRecords()::remove);
        ids.forEach(working.getCollections()::remove);
        working.getAspects().values().removeIf(a -> ids.contains(a.getElement()));
        working.getProvenance().values().removeIf(p -> ids.contains(p.getElementId()));
        working.getRelationships().values().removeIf(r -> ids.contains(r.getSourceId())
                || ids.contains(r.getTargetId()));
        for (RecordProps record : working.getRecords().values()) {
            record.getReferences().values().removeIf(ref -> ids.contains(ref.getId()));
            if (ids.contains(record.getCategory())) {
                record.setCategory(null);
            }
        }
        dirty = true;
        log.debug("Deleted records {}", ids);
    }

    @Override
    public Set<String> deleteDefinitionRecords(Collection<String> ids) {
        Set<String> deleted = new LinkedHashSet<>();
        for (String id : ids) {
            if (!isDefinitionRecord(id)) {
                log.warn("Record {} is not a definition record, not deleted", id);
                continue;
            }
            if (isReferenced(id)) {
                log.warn("Definition record {} is still referenced, not deleted", id);
                continue;
            }
            removeAll(Set.of(id));
            deleted.add(id);
        }
        return deleted;
    }

    private boolean isReferenced(String id) {
        for (RecordProps record : working.getRecords().values()) {
            if (id.equals(record.getCategory()) || id.equals(record.getParent())) {
                return true;
            }
            for (RelatedReference ref : record.getReferences().values()) {
                if (id.equals(ref.getId())) {
                    return true;
                }
            }
        }
        return false;
    }

    @Override
    public boolean isDefinitionRecord(String id) {
        RecordProps record = working.getRecords().get(id);
        if (record == null) {
            return false;
        }
        CollectionProps collection = working.getCollections().get(record.getModel());
        return collection != null && collection.isDefinition();
    }

    // ----- aspects

    @Override
    public Optional<AspectProps> findAspect(String elementId, String classFullName) {
        String canonical = resolveClassName(classFullName).orElse(classFullName);
        return working.getAspects().values().stream()
                .filter(a -> a.getElement().equals(elementId) && a.getClassFullName().equalsIgnoreCase(canonical))
                .map(AspectProps::copy)
                .findFirst();
    }

    @Override
    public List<AspectProps> getAspects(String elementId) {
        return working.getAspects().values().stream()
                .filter(a -> a.getElement().equals(elementId))
                .map(AspectProps::copy)
                .toList();
    }

    @Override
    public String insertAspect(AspectProps props) {
        AspectProps aspect = props.copy();
        aspect.setClassFullName(requireClass(props.getClassFullName()));
        if (aspect.getElement() == null || !working.getRecords().containsKey(aspect.getElement())) {
            throw new IllegalArgumentException("Aspect " + aspect.getClassFullName() + " must be owned by an existing"
                    + " record, got " + aspect.getElement());
        }
        if (findAspect(aspect.getElement(), aspect.getClassFullName()).isPresent()) {
            throw new IllegalStateException("Record " + aspect.getElement() + " already has an aspect of class "
                    + aspect.getClassFullName());
        }
        String id = working.allocateId();
        aspect.setId(id);
        working.getAspects().put(id, aspect);
        dirty = true;
        return id;
    }

    @Override
    public void updateAspect(AspectProps props) {
        AspectProps existing = props.getId() == null ? null : working.getAspects().get(props.getId());
        if (existing == null) {
            throw new IllegalArgumentException("Cannot update unknown aspect " + props.getId());
        }
        if (!existing.getElement().equals(props.getElement())) {
            throw new IllegalArgumentException("Aspect " + props.getId() + " cannot move to another record");
        }
        AspectProps aspect = props.copy();
        aspect.setClassFullName(requireClass(props.getClassFullName()));
        working.getAspects().put(aspect.getId(), aspect);
        dirty = true;
    }

    @Override
    public void deleteAspect(String id) {
        if (working.getAspects().remove(id) != null) {
            dirty = true;
        }
    }

    // ----- collections

    @Override
    public void insertCollection(CollectionProps props) {
        if (!working.getRecords().containsKey(props.getId())) {
            throw new IllegalArgumentException("A collection must model an existing record: " + props.getId());
        }
        working.getCollections().put(props.getId(),
                new CollectionProps(props.getId(), requireClass(props.getClassFullName()), props.isDefinition()));
        dirty = true;
    }

    @Override
    public Optional<CollectionProps> getCollection(String id) {
        return Optional.ofNullable(working.getCollections().get(id));
    }

    // ----- relationships

    @Override
    public Optional<String> findRelationship(String classFullName, String sourceId, String targetId) {
        return working.getRelationships().values().stream()
                .filter(r -> r.getClassFullName().equalsIgnoreCase(classFullName)
                        && r.getSourceId().equals(sourceId)
                        && r.getTargetId().equals(targetId))
                .map(RelationshipProps::getId)
                .findFirst();
    }

    @Override
    public String insertRelationship(RelationshipProps props) {
        RelationshipProps relationship = props.copy();
        relationship.setClassFullName(requireClass(props.getClassFullName()));
        if (!working.getRecords().containsKey(props.getSourceId())
                || !working.getRecords().containsKey(props.getTargetId())) {
            throw new IllegalArgumentException("Relationship endpoints must exist: " + props.getSourceId()
                    + " -> " + props.getTargetId());
        }
        String id = working.allocateId();
        relationship.setId(id);
        working.getRelationships().put(id, relationship);
        dirty = true;
        return id;
    }

    @Override
    public List<RelationshipProps> getRelationships(String classFullName) {
        return working.getRelationships().values().stream()
                .filter(r -> r.getClassFullName().equalsIgnoreCase(classFullName))
                .map(RelationshipProps::copy)
                .toList();
    }

    @Override
    public void updateReference(String recordId, String propertyName, RelatedReference reference) {
        RecordProps record = working.getRecords().get(recordId);
        if (record == null) {
            throw new IllegalArgumentException("Cannot set " + propertyName + " on unknown record " + recordId);
        }
        record.getReferences().put(propertyName, reference.copy());
        dirty = true;
    }

    // ----- provenance

    @Override
    public Optional<ProvenanceRecord> findProvenance(String scope, String kind, String identifier) {
        return working.getProvenance().values().stream()
                .filter(p -> p.getScope().equals(scope)
                        && p.getKind().equals(kind)
                        && p.getIdentifier().equalsIgnoreCase(identifier))
                .map(ProvenanceRecord::copy)
                .findFirst();
    }

    @Override
    public String insertProvenance(ProvenanceRecord provenance) {
        if (!working.getRecords().containsKey(provenance.getElementId())) {
            throw new IllegalArgumentException("Provenance must be attached to an existing record: "
                    + provenance.getElementId());
        }
        ProvenanceRecord record = provenance.copy();
        String id = working.allocateId();
        record.setId(id);
        working.getProvenance().put(id, record);
        dirty = true;
        return id;
    }

    @Override
    public void updateProvenance(ProvenanceRecord provenance) {
        if (provenance.getId() == null || !working.getProvenance().containsKey(provenance.getId())) {
            throw new IllegalArgumentException("Cannot update unknown provenance " + provenance.getId());
        }
        working.getProvenance().put(provenance.getId(), provenance.copy());
        dirty = true;
    }

    @Override
    public void deleteProvenance(String id) {
        if (working.getProvenance().remove(id) != null) {
            dirty = true;
        }
    }

    @Override
    public List<ProvenanceRecord> listProvenance() {
        return working.getProvenance().values().stream()
                .map(ProvenanceRecord::copy)
                .toList();
    }

    // ----- schemas

    @Override
    public void importSchema(String schemaJson) {
        DynamicSchema schema;
        try {
            schema = JsonSupport.mapper().readValue(schemaJson, DynamicSchema.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed schema document: " + e.getOriginalMessage(), e);
        }
        putSchema(schema);
    }

    private void putSchema(DynamicSchema schema) {
        for (String reference : schema.getReferences()) {
            if (findSchema(reference).isEmpty()) {
                throw new IllegalStateException("Schema " + schema.getName() + " references unknown schema "
                        + reference);
            }
        }
        DynamicSchema existing = working.getSchemas().get(schema.getName());
        if (existing != null && !existing.equals(schema)
                && schema.getVersion().compareTo(existing.getVersion()) <= 0) {
            throw new IllegalStateException("Schema " + schema.getName() + " version " + schema.getVersion()
                    + " must be greater than " + existing.getVersion());
        }
        working.getSchemas().put(schema.getName(), schema);
        dirty = true;
    }

    @Override
    public Optional<SchemaVersion> querySchemaVersion(String schemaName) {
        return getSchema(schemaName).map(DynamicSchema::getVersion);
    }

    @Override
    public Optional<DynamicSchema> getSchema(String schemaName) {
        return Optional.ofNullable(working.getSchemas().get(schemaName));
    }

    private Optional<DynamicSchema> findSchema(String nameOrAlias) {
        return working.getSchemas().values().stream()
                .filter(s -> s.isNamed(nameOrAlias))
                .findFirst();
    }

    @Override
    public List<String> importDomainSchemas(List<Path> paths) {
        List<String> names = new ArrayList<>();
        for (Path path : paths) {
            DynamicSchema schema;
            try {
                schema = JsonSupport.mapper().readValue(path.toFile(), DynamicSchema.class);
            } catch (IOException e) {
                throw new SchemaSyncException("Failed to read domain schema " + path, e);
            }
            DynamicSchema existing = working.getSchemas().get(schema.getName());
            if (existing != null && existing.getVersion().compareTo(schema.getVersion()) >= 0) {
                log.debug("Domain schema {} {} already imported", schema.getName(), existing.getVersion());
            } else {
                try {
                    putSchema(schema);
                } catch (IllegalStateException e) {
                    throw new SchemaSyncException("Failed to import domain schema " + path, e);
                }
                log.info("Imported domain schema {} {}", schema.getName(), schema.getVersion());
            }
            names.add(schema.getName());
        }
        return names;
    }

    @Override
    public Optional<String> resolveClassName(String fullName) {
        if (fullName == null) {
            return Optional.empty();
        }
        int idx = ClassRef.separatorIndex(fullName);
        if (idx <= 0) {
            return Optional.empty();
        }
        String className = fullName.substring(idx + 1);
        return findSchema(fullName.substring(0, idx))
                .flatMap(schema -> schema.findEntityClass(className)
                        .map(c -> schema.getName() + ":" + c.getName())
                        .or(() -> schema.findRelationshipClass(className)
                                .map(c -> schema.getName() + ":" + c.getName())));
    }

    private String requireClass(String fullName) {
        return resolveClassName(fullName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown class: " + fullName));
    }

    // ----- queries

    @Override
    public List<String> queryByLocator(Locator locator) {
        String className = null;
        if (locator.getClassName() != null) {
            Optional<String> resolved = resolveClassName(locator.getClassName());
            if (resolved.isEmpty()) {
                return List.of();
            }
            className = resolved.get();
        }
        List<String> matches = new ArrayList<>();
        for (RecordProps record : working.getRecords().values()) {
            if (className != null && !className.equalsIgnoreCase(record.getClassFullName())) {
                continue;
            }
            if (locator.getConstraints().entrySet().stream().allMatch(c -> matches(record, c.getKey(), c.getValue()))) {
                matches.add(record.getId());
            }
        }
        return matches;
    }

    private static boolean matches(RecordProps record, String property, Object expected) {
        Object actual = switch (property) {
            case "id", "ecinstanceid" -> record.getId();
            case "codevalue" -> record.getCode() == null ? null : record.getCode().getValue();
            case "userlabel" -> record.getUserLabel();
            case "parent" -> record.getParent();
            case "model" -> record.getModel();
            case "category" -> record.getCategory();
            default -> lookupIgnoreCase(record.getProperties(), property)
                    .orElseGet(() -> lookupIgnoreCase(record.getJsonProperties(), property).orElse(null));
        };
        return actual != null && text(actual).equalsIgnoreCase(text(expected));
    }

    private static Optional<Object> lookupIgnoreCase(Map<String, Object> values, String key) {
        return values.entrySet().stream()
                .filter(e -> e.getKey().toLowerCase(Locale.ROOT).equals(key))
                .map(Map.Entry::getValue)
                .filter(Objects::nonNull)
                .findFirst();
    }

    private static String text(Object value) {
        if (value instanceof Number number && number.doubleValue() == Math.rint(number.doubleValue())) {
            return Long.toString(number.longValue());
        }
        return String.valueOf(value);
    }

    @Override
    public void updateExtents() {
        long physical = working.getRecords().values().stream()
                .filter(r -> {
                    CollectionProps c = working.getCollections().get(r.getModel());
                    return c != null && CoreSchema.PHYSICAL_MODEL.equals(c.getClassFullName());
                })
                .count();
        log.debug("Extents recomputed over {} physical records", physical);
    }

    // ----- transactions

    @Override
    public void commit(String comment) {
        if (!dirty) {
            log.debug("Nothing to commit for '{}'", comment);
            return;
        }
        working.getChangesets().add(comment);
        committed = working.copy();
        dirty = false;
        log.info("Committed changeset #{}: {}", committed.getChangesets().size(), comment);
        onCommitted(committed);
    }

    /**
     * Called after every commit that published changes.
     */
    protected void onCommitted(RepositoryState state) {
        // in-memory only
    }

    @Override
    public void abandonChanges() {
        if (dirty) {
            log.info("Abandoning uncommitted changes");
        }
        working = committed.copy();
        dirty = false;
    }

    public boolean hasPendingChanges() {
        return dirty;
    }

    public List<String> getChangesets() {
        return List.copyOf(committed.getChangesets());
    }

    /**
     * Committed records of one class, in insertion order.
     */
    public List<RecordProps> getRecordsOfClass(String classFullName) {
        String canonical = resolveClassName(classFullName).orElse(classFullName);
        return committed.getRecords().values().stream()
                .filter(r -> canonical.equalsIgnoreCase(r.getClassFullName()))
                .map(RecordProps::copy)
                .toList();
    }

    @Override
    public Optional<ChannelControl> channelControl() {
        return Optional.ofNullable(channelControl);
    }
}
