package com.graphsync.mapping;

import com.graphsync.engine.SyncConnector;
import com.graphsync.ir.IRInstance;

/**
 * Rewrites the properties the engine derived for an IR instance. Runs last, so its changes win
 * over the defaults.
 *
 * @param <P> the property bag of the target instance (record, relationship or reference)
 */
@FunctionalInterface
public interface PropsModifier<P> {

    void modifyProps(SyncConnector connector, P props, IRInstance instance);
}
