package com.graphsync.repository;

import com.graphsync.mapping.Locator;
import com.graphsync.schema.DynamicSchema;
import com.graphsync.schema.SchemaVersion;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The versioned, hierarchical store the engine synchronizes into. Writes are staged until {@link #commit(String)}.
 */
public interface TargetRepository {

    /**
     * Id of the root record every container hangs under.
     */
    String ROOT_ID = "0x1";

    Optional<String> findCodeSpec(String name);

    String insertCodeSpec(String name);

    Optional<String> findRecordByCode(Code code);

    Optional<RecordProps> getRecord(String id);

    String insertRecord(RecordProps props);

    void updateRecord(RecordProps props);

    /**
     * Deletes the record, its children, its aspects, its provenance and every relationship touching it.
     */
    void deleteRecord(String id);

    /**
     * Deletes the given definition records, skipping the ones still referenced by other records.
     *
     * @return the ids actually deleted
     */
    Set<String> deleteDefinitionRecords(Collection<String> ids);

    boolean isDefinitionRecord(String id);

    /**
     * The aspect of class {@code classFullName} owned by {@code elementId}, if any.
     */
    Optional<AspectProps> findAspect(String elementId, String classFullName);

    List<AspectProps> getAspects(String elementId);

    String insertAspect(AspectProps props);

    void updateAspect(AspectProps props);

    void deleteAspect(String id);

    void insertCollection(CollectionProps props);

    Optional<CollectionProps> getCollection(String id);

    Optional<String> findRelationship(String classFullName, String sourceId, String targetId);

    String insertRelationship(RelationshipProps props);

    List<RelationshipProps> getRelationships(String classFullName);

    void updateReference(String recordId, String propertyName, RelatedReference reference);

    Optional<ProvenanceRecord> findProvenance(String scope, String kind, String identifier);

    String insertProvenance(ProvenanceRecord provenance);

    void updateProvenance(ProvenanceRecord provenance);

    void deleteProvenance(String id);

    List<ProvenanceRecord> listProvenance();

    /**
     * Imports a serialized schema, replacing an older version of the same schema.
     */
    void importSchema(String schemaJson);

    Optional<SchemaVersion> querySchemaVersion(String schemaName);

    Optional<DynamicSchema> getSchema(String schemaName);

    /**
     * Imports schema files the dynamic schema builds upon.
     *
     * @return names of the imported schemas
     */
    List<String> importDomainSchemas(List<Path> paths);

    /**
     * Canonical {@code Schema:Class} name of a class given by schema name or alias.
     */
    Optional<String> resolveClassName(String fullName);

    List<String> queryByLocator(Locator locator);

    void updateExtents();

    void commit(String comment);

    void abandonChanges();

    /**
     * Present only for multi-writer repositories.
     */
    Optional<ChannelControl> channelControl();
}
