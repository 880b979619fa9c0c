package com.graphsync.ir;

import com.graphsync.loader.Loader;
import com.graphsync.mapping.Mapping;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The intermediate representation of the source data: a virtual entity-relationship store read by the
 * node tree during a run.
 */
@Getter
public class IRModel {
    private static final Logger log = LoggerFactory.getLogger(IRModel.class);

    private final Map<String, IREntity> entityMap = new LinkedHashMap<>();
    private final Map<String, IRRelationship> relMap = new LinkedHashMap<>();

    public IRModel(List<? extends IREntity> entities, List<IRRelationship> relationships) {
        for (IREntity entity : entities) {
            entityMap.put(entity.getKey(), normalized(entity));
        }
        for (IRRelationship relationship : relationships) {
            relMap.put(relationship.getKey(), relationship);
        }
    }

    /**
     * Reads every entity and relationship through the loader, then closes it.
     */
    public static IRModel fromLoader(Loader loader) {
        List<IREntity> entities = loader.getEntities();
        List<IRRelationship> relationships = loader.getRelationships();
        loader.close();
        IRModel model = new IRModel(entities, relationships);
        log.info("Loaded IR model: {} entities, {} relationships", model.entityMap.size(), model.relMap.size());
        return model;
    }

    /**
     * Instances of the mapping's entity that pass its filter. An unknown entity yields an empty list.
     */
    public List<IRInstance> getEntityInstances(Mapping mapping) {
        IREntity entity = entityMap.get(mapping.getIrEntity());
        return entity == null ? List.of() : filter(entity.getInstances(), mapping);
    }

    public List<IRInstance> getRelInstances(Mapping mapping) {
        IREntity entity = relMap.get(mapping.getIrEntity());
        return entity == null ? List.of() : filter(entity.getInstances(), mapping);
    }

    public void clear() {
        entityMap.values().forEach(IREntity::clearInstances);
        relMap.values().forEach(IREntity::clearInstances);
    }

    private static List<IRInstance> filter(List<IRInstance> instances, Mapping mapping) {
        if (mapping.getDoSyncInstance() == null) {
            return List.copyOf(instances);
        }
        List<IRInstance> accepted = new ArrayList<>();
        for (IRInstance instance : instances) {
            if (mapping.accepts(instance)) {
                accepted.add(instance);
            }
        }
        return accepted;
    }

    /**
     * Collapses instances whose keys only differ by case. The last one seen wins, at the position of the first.
     */
    public static <E extends IREntity> E normalized(E entity) {
        Map<String, IRInstance> byKey = new LinkedHashMap<>();
        for (IRInstance instance : entity.getInstances()) {
            byKey.put(instance.getKey().toLowerCase(Locale.ROOT), instance);
        }
        if (byKey.size() != entity.getInstances().size()) {
            log.debug("Collapsed {} duplicate instances of {}", entity.getInstances().size() - byKey.size(),
                    entity.getKey());
        }
        entity.replaceInstances(new ArrayList<>(byKey.values()));
        return entity;
    }

    /**
     * Deep equality over entities and relationships. Meant for comparing loaders, not for change detection.
     */
    public static boolean compare(IRModel modelA, IRModel modelB) {
        return modelA.entityMap.equals(modelB.entityMap) && modelA.relMap.equals(modelB.relMap);
    }
}
