package com.graphsync.mapping;

/**
 * A mapping whose instances connect two target records.
 */
public interface EndpointMapping extends Mapping {

    String getFromAttr();

    EndpointType getFromType();

    String getToAttr();

    EndpointType getToType();
}
