package com.graphsync.engine;

/**
 * Names of the code specs the engine creates on demand.
 */
public final class CodeSpecs {

    /**
     * Codes of synchronized records: the IR instance key, scoped to the collection of the record's group.
     */
    public static final String RECORD = "IREntityKey-PrimaryKeyValue";
    public static final String SUBJECT = "Core:Subject";
    public static final String PARTITION = "Core:InformationPartition";

    private CodeSpecs() {
        // Utility class
    }
}
