package com.graphsync.ir;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * A named external class, e.g. one sheet of a workbook or one table of a database.
 */
@Getter
@ToString
@EqualsAndHashCode
public class IREntity {

    private final String key;
    private List<IRInstance> instances;

    public IREntity(String key, List<IRInstance> instances) {
        this.key = key;
        this.instances = instances != null ? new ArrayList<>(instances) : new ArrayList<>();
    }

    void replaceInstances(List<IRInstance> normalized) {
        this.instances = new ArrayList<>(normalized);
    }

    void clearInstances() {
        this.instances = new ArrayList<>();
    }
}
