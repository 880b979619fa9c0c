package com.graphsync.engine;

import com.graphsync.exception.ChannelStateException;
import com.graphsync.exception.SyncException;
import com.graphsync.ir.IRModel;
import com.graphsync.node.AspectNode;
import com.graphsync.node.ContainerNode;
import com.graphsync.node.LoaderNode;
import com.graphsync.node.Node;
import com.graphsync.node.NodeKind;
import com.graphsync.node.NodeTree;
import com.graphsync.repository.ChannelControl;
import com.graphsync.repository.ProvenanceRecord;
import com.graphsync.repository.TargetRepository;
import com.graphsync.schema.DynamicSchemaSynchronizer;
import com.graphsync.schema.SchemaRegistry;
import com.graphsync.util.JsonSupport;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Base class of every connector. The integrator declares the configuration in {@link #config()} and builds the
 * node tree in {@link #form()}; {@link #runJob(TargetRepository, JobArgs)} then drives one synchronization:
 * loader check, domain schemas, dynamic schema, data, orphans, extents.
 */
public abstract class SyncConnector {
    private static final Logger log = LoggerFactory.getLogger(SyncConnector.class);

    @Getter
    private final NodeTree tree = new NodeTree();
    @Getter
    private final SchemaRegistry schemaRegistry = new SchemaRegistry();
    private final RetryLoop retryLoop;
    private final DynamicSchemaSynchronizer schemaSynchronizer = new DynamicSchemaSynchronizer();

    private final Map<String, String> containerCache = new HashMap<>();
    private final Map<String, String> groupCache = new HashMap<>();
    private final Map<String, String> recordCache = new HashMap<>();
    private final Set<String> seenIds = new HashSet<>();

    @Getter
    private TargetRepository repository;
    @Getter
    private JobArgs jobArgs;
    @Getter
    private IRModel irModel;
    @Getter
    private ChangeDetector changeDetector;
    @Getter
    private EndpointResolver endpointResolver;
    @Getter
    private SyncStats stats = new SyncStats();
    @Getter
    private RunState state = RunState.IDLE;
    private List<String> domainSchemaNames = List.of();
    private String channelRoot;

    protected SyncConnector() {
        this(new RetryLoop());
    }

    protected SyncConnector(RetryLoop retryLoop) {
        this.retryLoop = retryLoop;
    }

    public abstract ConnectorConfig config();

    /**
     * Builds the node tree. Called once, before the first job.
     */
    public abstract void form();

    public SyncReport runJob(TargetRepository repository, JobArgs jobArgs) {
        long start = System.currentTimeMillis();
        jobArgs.validate();
        reset(repository, jobArgs);
        LoaderNode loaderNode = tree.validate(jobArgs);
        ContainerNode container = loaderNode.getContainer();

        ItemState sourceState = null;
        ItemState schemaState = null;
        try {
            transition(RunState.LOADER_SYNC);
            sourceState = loaderNode.detectChange(jobArgs.getConnection());
            log.info("Source connection {} is {}", loaderNode.getKey(), sourceState);
            if (sourceState == ItemState.UNCHANGED) {
                log.info("Source unchanged since the last run, nothing to synchronize");
                transition(RunState.DONE);
                return SyncReport.of(state, sourceState, null, stats, System.currentTimeMillis() - start);
            }
            loaderNode.getLoader().open(jobArgs.getConnection());
            irModel = IRModel.fromLoader(loaderNode.getLoader());

            transition(RunState.DOMAIN_SCHEMA_SYNC);
            syncDomainSchemas();

            transition(RunState.DYNAMIC_SCHEMA_SYNC);
            schemaState = syncDynamicSchema();

            transition(RunState.DATA_SYNC);
            syncData(container);

            transition(RunState.ORPHAN_SYNC);
            syncOrphans(container);

            transition(RunState.EXTENTS_SYNC);
            repository.updateExtents();
            persistChanges("Data Update");

            transition(RunState.DONE);
        } catch (RuntimeException e) {
            log.warn("Sync job failed during {}: {}", state, e.getMessage());
            state = RunState.FAILED;
            repository.abandonChanges();
            if (loaderNode.getLoader().isOpen()) {
                loaderNode.getLoader().close();
            }
            throw e;
        } finally {
            if (irModel != null) {
                irModel.clear();
            }
        }
        SyncReport report = SyncReport.of(state, sourceState, schemaState, stats, System.currentTimeMillis() - start);
        log.info("Sync job finished in {} ms: {} writes, {} deleted", report.getDurationMs(), report.getWriteCount(),
                report.getDeletedIds().size());
        return report;
    }

    private void reset(TargetRepository repository, JobArgs jobArgs) {
        this.repository = repository;
        this.jobArgs = jobArgs;
        this.changeDetector = new ChangeDetector(repository);
        this.endpointResolver = new EndpointResolver(repository);
        this.stats = new SyncStats();
        this.irModel = null;
        this.domainSchemaNames = List.of();
        this.channelRoot = null;
        this.state = RunState.IDLE;
        containerCache.clear();
        groupCache.clear();
        recordCache.clear();
        seenIds.clear();
        schemaRegistry.clear();
        tree.reset();
    }

    private void transition(RunState next) {
        log.debug("{} -> {}", state, next);
        state = next;
    }

    private void syncDomainSchemas() {
        log.info("Started Domain Schema Update...");
        enterChannel(TargetRepository.ROOT_ID);
        domainSchemaNames = repository.importDomainSchemas(config().getDomainSchemaPaths());
        persistChanges("Domain Schema Update");
        log.info("Completed Domain Schema Update.");
    }

    private ItemState syncDynamicSchema() {
        log.info("Started Dynamic Schema Update...");
        enterChannel(TargetRepository.ROOT_ID);
        ItemState schemaState = schemaSynchronizer.sync(repository, config().getDynamicSchema(), domainSchemaNames,
                tree.getClassMap(), schemaRegistry);
        persistChanges("Dynamic Schema Update");
        log.info("Completed Dynamic Schema Update.");
        return schemaState;
    }

    private void syncData(ContainerNode container) {
        log.info("Started Data Update...");
        enterChannel(TargetRepository.ROOT_ID);
        container.sync();
        persistChanges("Container Update");

        enterChannel(getContainerId(container.getKey()));
        for (Node node : tree.getNodes(container.getKey())) {
            log.debug("Synchronizing {}", node);
            node.sync();
        }
        log.info("Completed Data Update.");
    }

    private void syncOrphans(ContainerNode container) {
        String containerId = getContainerId(container.getKey());
        Set<String> scopes = new HashSet<>();
        Map<String, String> aspectClasses = new HashMap<>();
        for (Node node : tree.getNodes(container.getKey())) {
            if (node.getKind() == NodeKind.GROUP) {
                scopes.add(getGroupId(node.getKey()));
            } else if (node.getKind() == NodeKind.ASPECT) {
                AspectNode aspectNode = (AspectNode) node;
                aspectClasses.put(aspectNode.getMapping().getIrEntity(),
                        schemaRegistry.resolve(aspectNode.getMapping().getTargetClass(), repository));
            }
        }

        Map<String, String> aspects = new LinkedHashMap<>();
        List<String> plain = new ArrayList<>();
        List<String> definitions = new ArrayList<>();
        for (ProvenanceRecord provenance : repository.listProvenance()) {
            if (containerId.equals(provenance.getScope()) && aspectClasses.containsKey(provenance.getKind())) {
                repository.findAspect(provenance.getElementId(), aspectClasses.get(provenance.getKind()))
                        .filter(aspect -> !seenIds.contains(aspect.getId()))
                        .ifPresent(aspect -> aspects.put(aspect.getId(), provenance.getId()));
                continue;
            }
            if (LoaderNode.CONNECTION_DESCRIPTOR.equals(provenance.getKind())
                    || !scopes.contains(provenance.getScope())
                    || seenIds.contains(provenance.getElementId())) {
                continue;
            }
            if (repository.getRecord(provenance.getElementId()).isEmpty()) {
                repository.deleteProvenance(provenance.getId());
            } else if (repository.isDefinitionRecord(provenance.getElementId())) {
                definitions.add(provenance.getElementId());
            } else {
                plain.add(provenance.getElementId());
            }
        }

        int orphans = aspects.size() + plain.size() + definitions.size();
        if (orphans == 0) {
            return;
        }
        if (!jobArgs.isEnableDelete()) {
            log.warn("Deletion is disabled: keeping {} items no longer present in the source", orphans);
            stats.keptOrphans(orphans);
            return;
        }
        log.info("Started Deleting Orphans ({} aspects, {} records, {} definitions)...", aspects.size(), plain.size(),
                definitions.size());
        aspects.forEach((aspectId, provenanceId) -> {
            repository.deleteAspect(aspectId);
            repository.deleteProvenance(provenanceId);
            stats.deleted(aspectId);
        });
        for (String id : plain) {
            if (repository.getRecord(id).isPresent()) {
                repository.deleteRecord(id);
                stats.deleted(id);
            }
        }
        for (String id : repository.deleteDefinitionRecords(definitions)) {
            stats.deleted(id);
        }
        log.info("Completed Deleting Orphans.");
    }

    /**
     * Makes {@code rootId} the root of the exclusively locked scope subsequent writes go to. Does nothing for
     * single-writer repositories.
     *
     * @throws ChannelStateException if the lock state does not allow switching channels
     */
    public void enterChannel(String rootId) {
        Optional<ChannelControl> control = repository.channelControl();
        if (control.isEmpty()) {
            return;
        }
        ChannelControl channel = control.get();
        if (!channel.isBulkMode()) {
            channel.startBulkMode();
        }
        if (channel.hasPendingRequests()) {
            throw new ChannelStateException("Cannot enter channel " + rootId + ": requests are pending");
        }
        if (channel.holdsSchemaLock()) {
            throw new ChannelStateException("Cannot enter channel " + rootId + ": the schema lock is held");
        }
        if (channel.holdsCodeSpecLock()) {
            throw new ChannelStateException("Cannot enter channel " + rootId + ": the code spec lock is held");
        }
        if (channelRoot != null && channel.isLocked(channelRoot)) {
            throw new ChannelStateException("Cannot enter channel " + rootId + ": previous channel " + channelRoot
                    + " is still locked");
        }
        retryLoop.run(() -> channel.lockChannel(rootId));
        channelRoot = rootId;
        log.debug("Entered channel {}", rootId);
    }

    /**
     * Commits staged changes. Multi-writer repositories pull and merge first and push afterwards.
     */
    public void persistChanges(String description) {
        String comment = jobArgs.getCommentHeader() + " - " + description;
        Optional<ChannelControl> control = repository.channelControl();
        if (control.isEmpty()) {
            repository.commit(comment);
            return;
        }
        ChannelControl channel = control.get();
        retryLoop.run(channel::pullAndMerge);
        repository.commit(comment);
        retryLoop.run(() -> channel.push(comment));
    }

    /**
     * Writes the tree and configuration as JSON, for diagnosis only.
     */
    public void save(Path path) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("tree", tree.toJson());
        snapshot.put("config", config().toJson());
        JsonSupport.writePretty(path, snapshot);
        log.info("Wrote tree snapshot to {}", path);
    }

    // ----- run caches, used by the nodes

    /**
     * Id of the code spec {@code name}, created if it does not exist yet.
     */
    public String getCodeSpecId(String name) {
        return repository.findCodeSpec(name).orElseGet(() -> repository.insertCodeSpec(name));
    }

    public void cacheContainer(String key, String id) {
        containerCache.put(key, id);
    }

    public String getContainerId(String key) {
        String id = containerCache.get(key);
        if (id == null) {
            throw new SyncException("Container " + key + " has not been synchronized");
        }
        return id;
    }

    public void cacheGroup(String key, String id) {
        groupCache.put(key, id);
    }

    public String getGroupId(String key) {
        String id = groupCache.get(key);
        if (id == null) {
            throw new SyncException("Group " + key + " has not been synchronized");
        }
        return id;
    }

    public void cacheRecord(String irKey, String id) {
        recordCache.put(irKey, id);
    }

    public Optional<String> getRecordId(String irKey) {
        return Optional.ofNullable(recordCache.get(irKey));
    }

    public void markSeen(String id) {
        seenIds.add(id);
    }
}
