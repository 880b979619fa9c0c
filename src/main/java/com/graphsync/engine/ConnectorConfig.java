package com.graphsync.engine;

import com.graphsync.schema.DynamicSchemaSettings;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static description of a connector, declared by the integrator.
 */
@Value
@Builder
public class ConnectorConfig {
    @NonNull
    String appId;
    @NonNull
    @Builder.Default
    String appVersion = "1.0.0";
    @NonNull
    String connectorName;
    /**
     * Schema files imported before the dynamic schema, which references them.
     */
    @Singular
    List<Path> domainSchemaPaths;
    /**
     * Required only when mappings define new classes.
     */
    DynamicSchemaSettings dynamicSchema;

    public Map<String, Object> toJson() {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("appId", appId);
        json.put("appVersion", appVersion);
        json.put("connectorName", connectorName);
        json.put("domainSchemaPaths", domainSchemaPaths.stream().map(Path::toString).toList());
        if (dynamicSchema != null) {
            Map<String, Object> schema = new LinkedHashMap<>();
            schema.put("schemaName", dynamicSchema.getSchemaName());
            schema.put("schemaAlias", dynamicSchema.getSchemaAlias());
            json.put("dynamicSchema", schema);
        }
        return json;
    }
}
