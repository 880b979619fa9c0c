package com.graphsync.engine;

import com.graphsync.ir.IRInstance;
import com.graphsync.mapping.EndpointMapping;
import com.graphsync.mapping.EndpointType;
import com.graphsync.mapping.Locator;
import com.graphsync.mapping.LocatorParser;
import com.graphsync.node.RecordNode;
import com.graphsync.repository.LocateResult;
import com.graphsync.repository.TargetRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Resolves both ends of a relationship instance. An end comes either from a record synchronized from the IR
 * model or from a locator naming an existing target record. Failures are logged and skip the instance.
 */
public class EndpointResolver {
    private static final Logger log = LoggerFactory.getLogger(EndpointResolver.class);

    private final TargetRepository repository;
    private final LocatorParser locatorParser = new LocatorParser();

    public EndpointResolver(TargetRepository repository) {
        this.repository = repository;
    }

    public Optional<SourceTargetPair> resolve(EndpointMapping mapping, RecordNode sourceNode, RecordNode targetNode,
                                              IRInstance instance) {
        LocateResult source = resolveSide(mapping.getFromType(), mapping.getFromAttr(), sourceNode, instance);
        if (!source.isFound()) {
            log.warn("Skipping {} of {}: source not resolved. {}", instance.getKey(), mapping.getIrEntity(),
                    source.getError());
            return Optional.empty();
        }
        LocateResult target = resolveSide(mapping.getToType(), mapping.getToAttr(), targetNode, instance);
        if (!target.isFound()) {
            log.warn("Skipping {} of {}: target not resolved. {}", instance.getKey(), mapping.getIrEntity(),
                    target.getError());
            return Optional.empty();
        }
        return Optional.of(new SourceTargetPair(source.getId(), target.getId()));
    }

    private LocateResult resolveSide(EndpointType type, String attr, RecordNode node, IRInstance instance) {
        Object value = instance.get(attr);
        if (value == null) {
            return LocateResult.failed("Attribute " + attr + " is missing");
        }
        return switch (type) {
            case IR_ENTITY -> node.findRecordId(value)
                    .map(LocateResult::found)
                    .orElseGet(() -> LocateResult.failed("No record for "
                            + IRInstance.createKey(node.getMapping().getIrEntity(), value)));
            case TARGET_ENTITY -> locate(String.valueOf(value));
        };
    }

    /**
     * Looks up the single record a locator string designates.
     */
    public LocateResult locate(String rawLocator) {
        Locator locator;
        try {
            locator = locatorParser.parse(rawLocator);
        } catch (IllegalArgumentException e) {
            return LocateResult.failed(e.getMessage() + " Locator: " + rawLocator);
        }
        List<String> ids = repository.queryByLocator(locator);
        if (ids.isEmpty()) {
            return LocateResult.failed("Failed to find target entity. Locator: " + rawLocator);
        }
        if (ids.size() > 1) {
            return LocateResult.failed("Found " + ids.size() + " target entities, expected one. Locator: "
                    + rawLocator);
        }
        return LocateResult.found(ids.get(0));
    }
}
