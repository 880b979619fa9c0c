package com.graphsync.loader;

public enum ConnectionKind {
    FILE,
    API
}
