package com.graphsync.schema;

import com.graphsync.mapping.ClassDefinition;
import com.graphsync.mapping.PropertyDefinition;
import com.graphsync.mapping.RelationshipClassDefinition;
import com.graphsync.mapping.RelationshipConstraint;
import com.graphsync.schema.SchemaDiagnostic.Type;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Structural diff of two versions of the same schema. Labels, descriptions and the version itself are ignored.
 */
public class SchemaComparer {

    public List<SchemaDiagnostic> compare(DynamicSchema candidate, DynamicSchema existing) {
        if (!candidate.getName().equalsIgnoreCase(existing.getName())) {
            throw new IllegalArgumentException("Cannot compare schema " + candidate.getName()
                    + " with " + existing.getName());
        }
        List<SchemaDiagnostic> diagnostics = new ArrayList<>();

        if (!Objects.equals(candidate.getAlias(), existing.getAlias())) {
            diagnostics.add(new SchemaDiagnostic(Type.ALIAS_CHANGED, candidate.getName(),
                    existing.getAlias() + " -> " + candidate.getAlias()));
        }
        compareReferences(candidate, existing, diagnostics);

        Map<String, ClassDefinition> newEntities = index(candidate.getEntityClasses(), ClassDefinition::getName);
        Map<String, ClassDefinition> oldEntities = index(existing.getEntityClasses(), ClassDefinition::getName);
        for (Map.Entry<String, ClassDefinition> entry : newEntities.entrySet()) {
            ClassDefinition old = oldEntities.get(entry.getKey());
            if (old == null) {
                diagnostics.add(new SchemaDiagnostic(Type.CLASS_ADDED, entry.getValue().getName(), null));
            } else {
                compareEntity(entry.getValue(), old, diagnostics);
            }
        }
        for (Map.Entry<String, ClassDefinition> entry : oldEntities.entrySet()) {
            if (!newEntities.containsKey(entry.getKey())) {
                diagnostics.add(new SchemaDiagnostic(Type.CLASS_REMOVED, entry.getValue().getName(), null));
            }
        }

        Map<String, RelationshipClassDefinition> newRels =
                index(candidate.getRelationshipClasses(), RelationshipClassDefinition::getName);
        Map<String, RelationshipClassDefinition> oldRels =
                index(existing.getRelationshipClasses(), RelationshipClassDefinition::getName);
        for (Map.Entry<String, RelationshipClassDefinition> entry : newRels.entrySet()) {
            RelationshipClassDefinition old = oldRels.get(entry.getKey());
            if (old == null) {
                diagnostics.add(new SchemaDiagnostic(Type.CLASS_ADDED, entry.getValue().getName(), null));
            } else {
                compareRelationship(entry.getValue(), old, diagnostics);
            }
        }
        for (Map.Entry<String, RelationshipClassDefinition> entry : oldRels.entrySet()) {
            if (!newRels.containsKey(entry.getKey())) {
                diagnostics.add(new SchemaDiagnostic(Type.CLASS_REMOVED, entry.getValue().getName(), null));
            }
        }
        return diagnostics;
    }

    private void compareReferences(DynamicSchema candidate, DynamicSchema existing, List<SchemaDiagnostic> out) {
        Set<String> oldRefs = lowerCase(existing.getReferences());
        Set<String> newRefs = lowerCase(candidate.getReferences());
        for (String ref : candidate.getReferences()) {
            if (!oldRefs.contains(ref.toLowerCase(Locale.ROOT))) {
                out.add(new SchemaDiagnostic(Type.REFERENCE_ADDED, candidate.getName(), ref));
            }
        }
        for (String ref : existing.getReferences()) {
            if (!newRefs.contains(ref.toLowerCase(Locale.ROOT))) {
                out.add(new SchemaDiagnostic(Type.REFERENCE_REMOVED, candidate.getName(), ref));
            }
        }
    }

    private void compareEntity(ClassDefinition candidate, ClassDefinition existing, List<SchemaDiagnostic> out) {
        String name = candidate.getName();
        if (!candidate.getBaseClass().equalsIgnoreCase(existing.getBaseClass())) {
            out.add(new SchemaDiagnostic(Type.BASE_CLASS_CHANGED, name,
                    existing.getBaseClass() + " -> " + candidate.getBaseClass()));
        }
        Map<String, PropertyDefinition> newProps = index(candidate.getProperties(), PropertyDefinition::getName);
        Map<String, PropertyDefinition> oldProps = index(existing.getProperties(), PropertyDefinition::getName);
        for (Map.Entry<String, PropertyDefinition> entry : newProps.entrySet()) {
            PropertyDefinition old = oldProps.get(entry.getKey());
            String propertyName = name + "." + entry.getValue().getName();
            if (old == null) {
                out.add(new SchemaDiagnostic(Type.PROPERTY_ADDED, propertyName, entry.getValue().getType().name()));
            } else if (old.getType() != entry.getValue().getType()) {
                out.add(new SchemaDiagnostic(Type.PROPERTY_TYPE_CHANGED, propertyName,
                        old.getType() + " -> " + entry.getValue().getType()));
            }
        }
        for (Map.Entry<String, PropertyDefinition> entry : oldProps.entrySet()) {
            if (!newProps.containsKey(entry.getKey())) {
                out.add(new SchemaDiagnostic(Type.PROPERTY_REMOVED, name + "." + entry.getValue().getName(), null));
            }
        }
    }

    private void compareRelationship(RelationshipClassDefinition candidate, RelationshipClassDefinition existing,
                                     List<SchemaDiagnostic> out) {
        String name = candidate.getName();
        if (!candidate.getBaseClass().equalsIgnoreCase(existing.getBaseClass())) {
            out.add(new SchemaDiagnostic(Type.BASE_CLASS_CHANGED, name,
                    existing.getBaseClass() + " -> " + candidate.getBaseClass()));
        }
        if (candidate.getStrength() != existing.getStrength()) {
            out.add(new SchemaDiagnostic(Type.STRENGTH_CHANGED, name,
                    existing.getStrength() + " -> " + candidate.getStrength()));
        }
        if (candidate.getStrengthDirection() != existing.getStrengthDirection()) {
            out.add(new SchemaDiagnostic(Type.STRENGTH_DIRECTION_CHANGED, name,
                    existing.getStrengthDirection() + " -> " + candidate.getStrengthDirection()));
        }
        compareConstraint(name + ".Source", candidate.getSource(), existing.getSource(), out);
        compareConstraint(name + ".Target", candidate.getTarget(), existing.getTarget(), out);
    }

    private void compareConstraint(String name, RelationshipConstraint candidate, RelationshipConstraint existing,
                                   List<SchemaDiagnostic> out) {
        if (!Objects.equals(candidate.getMultiplicity(), existing.getMultiplicity())) {
            out.add(new SchemaDiagnostic(Type.MULTIPLICITY_CHANGED, name,
                    existing.getMultiplicity() + " -> " + candidate.getMultiplicity()));
        }
        if (candidate.isPolymorphic() != existing.isPolymorphic()) {
            out.add(new SchemaDiagnostic(Type.POLYMORPHISM_CHANGED, name,
                    existing.isPolymorphic() + " -> " + candidate.isPolymorphic()));
        }
        if (!lowerCase(candidate.getConstraintClasses()).equals(lowerCase(existing.getConstraintClasses()))) {
            out.add(new SchemaDiagnostic(Type.CONSTRAINT_CLASSES_CHANGED, name,
                    existing.getConstraintClasses() + " -> " + candidate.getConstraintClasses()));
        }
    }

    private static <T> Map<String, T> index(List<T> items, Function<T, String> name) {
        Map<String, T> indexed = new LinkedHashMap<>();
        for (T item : items) {
            indexed.put(name.apply(item).toLowerCase(Locale.ROOT), item);
        }
        return indexed;
    }

    private static Set<String> lowerCase(List<String> values) {
        Set<String> lowered = new HashSet<>();
        for (String value : values) {
            lowered.add(value.toLowerCase(Locale.ROOT));
        }
        return lowered;
    }
}
