package com.graphsync.node;

public enum NodeKind {
    CONTAINER,
    GROUP,
    LOADER,
    RECORD,
    MODELED_RECORD,
    ASPECT,
    LINK,
    FOREIGN_KEY
}
