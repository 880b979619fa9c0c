package com.graphsync.engine;

import com.graphsync.ir.IRInstance;
import com.graphsync.repository.AspectProps;
import com.graphsync.repository.ProvenanceRecord;
import com.graphsync.repository.RecordProps;
import com.graphsync.repository.TargetRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Decides insert, update or skip for one record by comparing the source fingerprint (version and checksum)
 * with the provenance stored next to the target record.
 */
public class ChangeDetector {
    private static final Logger log = LoggerFactory.getLogger(ChangeDetector.class);

    private final TargetRepository repository;

    public ChangeDetector(TargetRepository repository) {
        this.repository = repository;
    }

    /**
     * Classifies without writing anything.
     */
    public ItemState classify(String scope, String kind, String identifier, String version, String checksum) {
        Optional<ProvenanceRecord> provenance = repository.findProvenance(scope, kind, identifier);
        if (provenance.isEmpty() || repository.getRecord(provenance.get().getElementId()).isEmpty()) {
            return ItemState.NEW;
        }
        return provenance.get().fingerprint().equals(fingerprint(version, checksum))
                ? ItemState.UNCHANGED
                : ItemState.CHANGED;
    }

    public SyncResult syncRecord(SyncArg arg) {
        RecordProps props = arg.getProps();
        String fingerprint = fingerprint(arg.getVersion(), arg.getChecksum());
        Optional<String> existingId = props.getCode() == null
                ? Optional.empty()
                : repository.findRecordByCode(props.getCode());
        Optional<ProvenanceRecord> provenance =
                repository.findProvenance(arg.getScope(), arg.getKind(), arg.getIdentifier());

        if (provenance.isPresent()
                && (existingId.isEmpty() || !existingId.get().equals(provenance.get().getElementId()))) {
            log.debug("Dropping stale provenance of {}: its record {} is gone", arg.getIdentifier(),
                    provenance.get().getElementId());
            repository.deleteProvenance(provenance.get().getId());
            provenance = Optional.empty();
        }

        if (existingId.isEmpty()) {
            String id = repository.insertRecord(props);
            attachProvenance(id, arg);
            log.debug("Inserted {} as {}", arg.getIdentifier(), id);
            return new SyncResult(id, ItemState.NEW);
        }

        String id = existingId.get();
        props.setId(id);
        if (provenance.isEmpty()) {
            update(props);
            attachProvenance(id, arg);
            log.debug("Re-created provenance of {} on {}", arg.getIdentifier(), id);
            return new SyncResult(id, ItemState.NEW);
        }

        ProvenanceRecord current = provenance.get();
        if (current.fingerprint().equals(fingerprint)) {
            return new SyncResult(id, ItemState.UNCHANGED);
        }
        current.setVersion(nullToEmpty(arg.getVersion()));
        current.setChecksum(nullToEmpty(arg.getChecksum()));
        repository.updateProvenance(current);
        update(props);
        log.debug("Updated {} ({})", arg.getIdentifier(), id);
        return new SyncResult(id, ItemState.CHANGED);
    }

    /**
     * Same decision for an aspect. Its provenance is attached to the owning record; an instance that changed
     * owner loses the aspect on its previous owner.
     */
    public SyncResult syncAspect(AspectProps props, String scope, IRInstance instance) {
        String fingerprint = fingerprint(instance.getVersion(), instance.getChecksum());
        Optional<ProvenanceRecord> provenance =
                repository.findProvenance(scope, instance.getEntityKey(), instance.getKey());

        if (provenance.isPresent() && !provenance.get().getElementId().equals(props.getElement())) {
            String previousOwner = provenance.get().getElementId();
            log.debug("{} moved from {} to {}", instance.getKey(), previousOwner, props.getElement());
            repository.findAspect(previousOwner, props.getClassFullName())
                    .ifPresent(previous -> repository.deleteAspect(previous.getId()));
            repository.deleteProvenance(provenance.get().getId());
            provenance = Optional.empty();
        }

        Optional<AspectProps> existing = repository.findAspect(props.getElement(), props.getClassFullName());
        if (existing.isPresent() && provenance.isPresent()
                && provenance.get().fingerprint().equals(fingerprint)) {
            return new SyncResult(existing.get().getId(), ItemState.UNCHANGED);
        }

        String id;
        if (existing.isEmpty()) {
            id = repository.insertAspect(props);
        } else {
            id = existing.get().getId();
            props.setId(id);
            repository.updateAspect(props);
        }
        if (provenance.isPresent()) {
            ProvenanceRecord current = provenance.get();
            current.setVersion(nullToEmpty(instance.getVersion()));
            current.setChecksum(nullToEmpty(instance.getChecksum()));
            repository.updateProvenance(current);
        } else {
            insertProvenance(props.getElement(), scope, instance.getEntityKey(), instance.getKey(),
                    instance.getVersion(), instance.getChecksum());
        }
        ItemState state = existing.isPresent() && provenance.isPresent() ? ItemState.CHANGED : ItemState.NEW;
        log.debug("{} aspect {} of {} ({})", state, instance.getKey(), props.getElement(), id);
        return new SyncResult(id, state);
    }

    /**
     * Rewrites the record. Reference properties are owned by foreign key nodes and survive the update.
     */
    private void update(RecordProps props) {
        repository.getRecord(props.getId())
                .ifPresent(existing -> existing.getReferences().forEach(props.getReferences()::putIfAbsent));
        repository.updateRecord(props);
    }

    private void attachProvenance(String elementId, SyncArg arg) {
        insertProvenance(elementId, arg.getScope(), arg.getKind(), arg.getIdentifier(), arg.getVersion(),
                arg.getChecksum());
    }

    private void insertProvenance(String elementId, String scope, String kind, String identifier, String version,
                                  String checksum) {
        repository.insertProvenance(ProvenanceRecord.builder()
                .elementId(elementId)
                .scope(scope)
                .kind(kind)
                .identifier(identifier)
                .version(nullToEmpty(version))
                .checksum(nullToEmpty(checksum))
                .build());
    }

    private static String fingerprint(String version, String checksum) {
        return nullToEmpty(version) + nullToEmpty(checksum);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
