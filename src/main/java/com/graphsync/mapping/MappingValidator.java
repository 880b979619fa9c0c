package com.graphsync.mapping;

import com.graphsync.exception.ConstructionException;

/**
 * Static checks run by node constructors, so misconfigured mappings fail before any I/O.
 */
public final class MappingValidator {

    private MappingValidator() {
        // Utility class
    }

    public static void validateElementMapping(ElementMapping mapping) {
        validateClassRef(mapping.getTargetClass(), ClassDefinition.class);
    }

    public static void validateAspectMapping(AspectMapping mapping) {
        validateClassRef(mapping.getTargetClass(), ClassDefinition.class);
    }

    public static void validateRelationshipMapping(RelationshipMapping mapping) {
        validateClassRef(mapping.getTargetClass(), RelationshipClassDefinition.class);
    }

    public static void validateRelatedElementMapping(RelatedElementMapping mapping) {
        validateClassRef(mapping.getTargetClass(), RelationshipClassDefinition.class);
        if (mapping.getReferenceProperty().isBlank()) {
            throw new ConstructionException("referenceProperty must not be blank for " + mapping.getIrEntity());
        }
    }

    private static void validateClassRef(ClassRef ref, Class<? extends SchemaItemDefinition> expected) {
        if (ClassRef.separatorIndex(ref.getFullName()) <= 0) {
            throw new ConstructionException("Class name must be qualified by its schema: " + ref.getFullName());
        }
        if (!ref.isDefined()) {
            return;
        }
        SchemaItemDefinition definition = ref.getDefinition();
        if (!expected.isInstance(definition)) {
            throw new ConstructionException("Class " + ref.getFullName() + " must be defined by a "
                    + expected.getSimpleName());
        }
        if (!ref.getClassName().equals(definition.getName())) {
            throw new ConstructionException("class name / ClassProps.name mismatch: " + ref.getClassName()
                    + " != " + definition.getName());
        }
    }
}
