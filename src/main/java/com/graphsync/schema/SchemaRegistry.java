package com.graphsync.schema;

import com.graphsync.exception.SchemaSyncException;
import com.graphsync.mapping.ClassRef;
import com.graphsync.repository.TargetRepository;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Runtime bindings of the classes generated into the dynamic schema. Owned by a connector and cleared at the
 * start of every run, so nothing leaks from one job into the next.
 */
public class SchemaRegistry {

    private final Map<String, String> classes = new HashMap<>();

    /**
     * Binds every class of {@code schema} under both its schema name and alias.
     */
    public void register(DynamicSchema schema) {
        schema.getEntityClasses().forEach(c -> bind(schema, c.getName()));
        schema.getRelationshipClasses().forEach(c -> bind(schema, c.getName()));
    }

    private void bind(DynamicSchema schema, String className) {
        String canonical = schema.getName() + ":" + className;
        classes.put(lookupKey(schema.getName(), className), canonical);
        if (schema.getAlias() != null) {
            classes.put(lookupKey(schema.getAlias(), className), canonical);
        }
    }

    public boolean isRegistered(String fullName) {
        return classes.containsKey(lookupKey(fullName));
    }

    /**
     * Canonical {@code Schema:Class} name of the mapping's target class. Defined classes must have been
     * registered by the dynamic schema sync, existing ones must be known to the repository.
     */
    public String resolve(ClassRef ref, TargetRepository repository) {
        if (ref.isDefined()) {
            String canonical = classes.get(lookupKey(ref.getFullName()));
            if (canonical == null) {
                throw new SchemaSyncException("Class " + ref.getFullName() + " is not registered. "
                        + "Was the dynamic schema synchronized?");
            }
            return canonical;
        }
        return repository.resolveClassName(ref.getFullName())
                .orElseThrow(() -> new SchemaSyncException("Unknown target class: " + ref.getFullName()));
    }

    public int size() {
        return classes.size();
    }

    public void clear() {
        classes.clear();
    }

    private static String lookupKey(String fullName) {
        int idx = ClassRef.separatorIndex(fullName);
        if (idx < 0) {
            return fullName.toLowerCase(Locale.ROOT);
        }
        return lookupKey(fullName.substring(0, idx), fullName.substring(idx + 1));
    }

    private static String lookupKey(String schema, String className) {
        return (schema + ":" + className).toLowerCase(Locale.ROOT);
    }
}
