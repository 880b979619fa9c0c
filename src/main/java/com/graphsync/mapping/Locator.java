package com.graphsync.mapping;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * A set of {@code property = value} constraints that should identify exactly one existing target record,
 * optionally narrowed to one class.
 */
@Value
@Builder
public class Locator {
    String className;
    /**
     * Property name (lowercase) to expected value. Values are strings or numbers.
     */
    @Singular
    Map<String, Object> constraints;
}
