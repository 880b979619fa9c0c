package com.graphsync.schema;

import lombok.NonNull;
import lombok.Value;

/**
 * Name and alias of the schema generated from the classes the mappings define.
 */
@Value
public class DynamicSchemaSettings {
    @NonNull
    String schemaName;
    @NonNull
    String schemaAlias;
}
