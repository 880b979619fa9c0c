package com.graphsync.mapping;

public enum StrengthDirection {
    FORWARD,
    BACKWARD
}
