package com.graphsync.node;

import com.graphsync.engine.JobArgs;
import com.graphsync.exception.ConstructionException;
import com.graphsync.schema.DynamicClassMap;
import lombok.Getter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns every node of a connector and derives the order in which they run.
 */
public class NodeTree {

    private final Map<String, Node> nodes = new LinkedHashMap<>();
    @Getter
    private final DynamicClassMap classMap = new DynamicClassMap();

    /**
     * Adds a node. Called by node constructors.
     *
     * @throws ConstructionException on a duplicate key, a second loader node in a container, or a class
     *                               definition clashing with one already declared
     */
    public void insert(Node node) {
        if (nodes.containsKey(node.getKey())) {
            throw new ConstructionException("Node key already exists in the tree: " + node.getKey());
        }
        switch (node.getKind()) {
            case CONTAINER, GROUP -> {
                // nothing to collect
            }
            case LOADER -> {
                Optional<LoaderNode> existing = findLoader(node.getContainer());
                if (existing.isPresent()) {
                    throw new ConstructionException("Container " + node.getContainer().getKey()
                            + " already has loader node " + existing.get().getKey());
                }
            }
            case RECORD, MODELED_RECORD -> classMap.register(((RecordNode) node).getMapping().getTargetClass());
            case ASPECT -> classMap.register(((AspectNode) node).getMapping().getTargetClass());
            case LINK -> classMap.register(((LinkNode) node).getMapping().getTargetClass());
            case FOREIGN_KEY -> classMap.register(((ForeignKeyNode) node).getMapping().getTargetClass());
        }
        nodes.put(node.getKey(), node);
    }

    public Optional<Node> find(String key, NodeKind kind) {
        Node node = nodes.get(key);
        return node != null && node.getKind() == kind ? Optional.of(node) : Optional.empty();
    }

    public Optional<ContainerNode> findContainer(String key) {
        return find(key, NodeKind.CONTAINER).map(ContainerNode.class::cast);
    }

    public Optional<LoaderNode> findLoader(ContainerNode container) {
        return nodes.values().stream()
                .filter(n -> n.getKind() == NodeKind.LOADER && n.getContainer() == container)
                .map(LoaderNode.class::cast)
                .findFirst();
    }

    /**
     * Nodes of a container in execution order: the loader (after its group), definition groups with their
     * records, the other groups with their records (parents before children), aspects, links, then foreign keys.
     * The container node itself is not included.
     */
    public List<Node> getNodes(String containerKey) {
        ContainerNode container = requireContainer(containerKey);
        List<Node> ordered = new ArrayList<>();

        findLoader(container).ifPresent(loader -> {
            ordered.add(loader.getGroup());
            ordered.add(loader);
        });

        List<GroupNode> groups = new ArrayList<>();
        List<RecordNode> records = new ArrayList<>();
        List<Node> aspects = new ArrayList<>();
        List<Node> links = new ArrayList<>();
        List<Node> foreignKeys = new ArrayList<>();
        for (Node node : nodes.values()) {
            if (node.getContainer() != container) {
                continue;
            }
            switch (node.getKind()) {
                case GROUP -> groups.add((GroupNode) node);
                case RECORD, MODELED_RECORD -> records.add((RecordNode) node);
                case ASPECT -> aspects.add(node);
                case LINK -> links.add(node);
                case FOREIGN_KEY -> foreignKeys.add(node);
                case CONTAINER, LOADER -> {
                    // placed above
                }
            }
        }

        List<GroupNode> groupOrder = new ArrayList<>();
        groups.stream().filter(GroupNode::isDefinition).forEach(groupOrder::add);
        groups.stream().filter(g -> !g.isDefinition()).forEach(groupOrder::add);
        for (GroupNode group : groupOrder) {
            if (!ordered.contains(group)) {
                ordered.add(group);
            }
            for (RecordNode record : records) {
                if (record.getPlacement() instanceof RecordPlacement.InGroup && record.getGroup() == group) {
                    addDepthFirst(record, records, ordered);
                }
            }
        }
        ordered.addAll(aspects);
        ordered.addAll(links);
        ordered.addAll(foreignKeys);
        return ordered;
    }

    private static void addDepthFirst(RecordNode record, List<RecordNode> records, List<Node> ordered) {
        ordered.add(record);
        for (RecordNode child : records) {
            if (child.getParent().filter(p -> p == record).isPresent()) {
                addDepthFirst(child, records, ordered);
            }
        }
    }

    /**
     * Checks that the job can run against this tree.
     */
    public LoaderNode validate(JobArgs jobArgs) {
        ContainerNode container = requireContainer(jobArgs.getContainerKey());
        LoaderNode loader = findLoader(container)
                .orElseThrow(() -> new ConstructionException("Container " + container.getKey()
                        + " has no loader node"));
        String wanted = jobArgs.getConnection().getLoaderNodeKey();
        if (!loader.getKey().equals(wanted)) {
            throw new ConstructionException("Connection targets loader node " + wanted + " but container "
                    + container.getKey() + " is loaded by " + loader.getKey());
        }
        return loader;
    }

    private ContainerNode requireContainer(String containerKey) {
        return findContainer(containerKey)
                .orElseThrow(() -> new ConstructionException("No container node named " + containerKey));
    }

    public void reset() {
        nodes.values().forEach(Node::reset);
    }

    public List<Map<String, Object>> toJson() {
        return nodes.values().stream().map(Node::toJson).toList();
    }
}
