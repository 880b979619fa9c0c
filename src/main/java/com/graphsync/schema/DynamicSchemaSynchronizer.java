package com.graphsync.schema;

import com.graphsync.engine.ItemState;
import com.graphsync.exception.SchemaSyncException;
import com.graphsync.repository.TargetRepository;
import com.graphsync.util.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Keeps the generated schema in the repository in step with the class definitions of the mappings.
 * A new minor version is imported only when the definitions structurally changed.
 */
public class DynamicSchemaSynchronizer {
    private static final Logger log = LoggerFactory.getLogger(DynamicSchemaSynchronizer.class);

    private final DynamicSchemaBuilder builder;
    private final SchemaComparer comparer;

    public DynamicSchemaSynchronizer() {
        this(new DynamicSchemaBuilder(), new SchemaComparer());
    }

    public DynamicSchemaSynchronizer(DynamicSchemaBuilder builder, SchemaComparer comparer) {
        this.builder = builder;
        this.comparer = comparer;
    }

    public ItemState sync(TargetRepository repository, DynamicSchemaSettings settings, List<String> domainSchemaNames,
                          DynamicClassMap classMap, SchemaRegistry registry) {
        if (classMap.isEmpty()) {
            log.info("No mapping defines new classes, dynamic schema sync skipped");
            return ItemState.UNCHANGED;
        }
        if (settings == null) {
            throw new SchemaSyncException("Mappings define new classes but no dynamic schema is configured");
        }

        Optional<DynamicSchema> existing = repository.getSchema(settings.getSchemaName());
        SchemaVersion version = existing.map(DynamicSchema::getVersion).orElse(SchemaVersion.INITIAL);
        DynamicSchema candidate = builder.build(settings, version, domainSchemaNames, classMap);

        ItemState state;
        if (existing.isEmpty()) {
            state = ItemState.NEW;
        } else {
            List<SchemaDiagnostic> diagnostics;
            try {
                diagnostics = comparer.compare(candidate, existing.get());
            } catch (RuntimeException e) {
                throw new SchemaSyncException("Failed to compare schema " + settings.getSchemaName(), e);
            }
            if (diagnostics.isEmpty()) {
                state = ItemState.UNCHANGED;
                candidate = existing.get();
            } else {
                diagnostics.forEach(d -> log.info("Schema change: {}", d));
                state = ItemState.CHANGED;
                candidate = builder.build(settings, version.nextMinor(), domainSchemaNames, classMap);
            }
        }

        if (state != ItemState.UNCHANGED) {
            try {
                repository.importSchema(JsonSupport.toPrettyJson(candidate));
            } catch (RuntimeException e) {
                throw new SchemaSyncException("Failed to import schema " + candidate.getName()
                        + " " + candidate.getVersion(), e);
            }
            log.info("Imported schema {} version {}", candidate.getName(), candidate.getVersion());
        }
        registry.register(candidate);
        log.info("Dynamic schema {} {} ({} classes bound)", candidate.getName(), state, registry.size());
        return state;
    }
}
