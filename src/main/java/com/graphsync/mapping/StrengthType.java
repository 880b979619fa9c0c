package com.graphsync.mapping;

public enum StrengthType {
    REFERENCING,
    HOLDING,
    EMBEDDING
}
