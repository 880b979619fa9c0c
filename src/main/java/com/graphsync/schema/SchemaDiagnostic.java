package com.graphsync.schema;

/**
 * One structural difference between a candidate schema and the persisted one.
 */
public record SchemaDiagnostic(Type type, String itemName, String detail) {

    public enum Type {
        ALIAS_CHANGED,
        REFERENCE_ADDED,
        REFERENCE_REMOVED,
        CLASS_ADDED,
        CLASS_REMOVED,
        BASE_CLASS_CHANGED,
        PROPERTY_ADDED,
        PROPERTY_REMOVED,
        PROPERTY_TYPE_CHANGED,
        STRENGTH_CHANGED,
        STRENGTH_DIRECTION_CHANGED,
        MULTIPLICITY_CHANGED,
        CONSTRAINT_CLASSES_CHANGED,
        POLYMORPHISM_CHANGED
    }

    @Override
    public String toString() {
        return type + " " + itemName + (detail == null ? "" : ": " + detail);
    }
}
