package com.graphsync.mapping;

/**
 * A class definition embedded in a mapping, to be generated into the dynamic schema.
 */
public interface SchemaItemDefinition {

    String getName();

    String getBaseClass();
}
