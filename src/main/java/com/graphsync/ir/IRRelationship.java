package com.graphsync.ir;

import java.util.List;

/**
 * An external class whose rows describe relationships, e.g. a link table.
 */
public class IRRelationship extends IREntity {

    public IRRelationship(String key, List<IRInstance> instances) {
        super(key, instances);
    }
}
