package com.graphsync.repository;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of resolving one relationship endpoint. Failures are recoverable.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LocateResult {
    String id;
    String error;

    public static LocateResult found(String id) {
        return new LocateResult(id, null);
    }

    public static LocateResult failed(String error) {
        return new LocateResult(null, error);
    }

    public boolean isFound() {
        return id != null;
    }
}
