package com.graphsync.loader;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Declared by the integrator: which source entities a loader reads and how their primary keys are found.
 */
@Value
@Builder
public class LoaderProps {
    /**
     * Source format, e.g. {@code json}, {@code xlsx}, {@code sqlite}.
     */
    @NonNull
    String format;
    @Singular
    List<String> entities;
    @Singular
    List<String> relationships;
    /**
     * Used when {@link #primaryKeyMap} has no entry for an entity.
     */
    @NonNull
    @Builder.Default
    String defaultPrimaryKey = "id";
    @Singular("primaryKey")
    Map<String, String> primaryKeyMap;
    @NonNull
    @Builder.Default
    String version = "0.0";
}
