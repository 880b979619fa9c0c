package com.graphsync.repository;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Identity of a target record: code spec, scope and value. Stable across runs.
 */
@Value
@Builder
@Jacksonized
public class Code {
    @NonNull
    String specId;
    @NonNull
    String scopeId;
    @NonNull
    String value;

    public static Code of(String specId, String scopeId, String value) {
        return Code.builder().specId(specId).scopeId(scopeId).value(value).build();
    }

    /**
     * Codes compare case-insensitively on their value, as keys of the IR model do.
     */
    public boolean matches(Code other) {
        return other != null
                && specId.equals(other.specId)
                && scopeId.equals(other.scopeId)
                && value.equalsIgnoreCase(other.value);
    }
}
