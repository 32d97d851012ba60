package io.flowcheck.core.flow;

import io.flowcheck.core.check.CheckRegistry;
import io.flowcheck.core.exception.CheckNotFoundException;
import io.flowcheck.core.exception.FlowGraphException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Logger;

/// Validated dependency graph of {@link FlowNode}s with a deterministic execution order.
///
/// Built once from a list of {@link NodeDefinition}s. Construction fails with
/// {@link FlowGraphException} before any node exists if the definitions are
/// inconsistent, so a graph instance is always a DAG.
///
/// ### Ordering
/// The execution order is a Kahn reduction in which the ready set is kept sorted
/// and the lexicographically smallest ready id is removed first. Two builds of
/// the same definitions therefore produce the same order.
///
/// ### Layers
/// Layer `k` holds every node whose dependencies all sit in layers `< k` and at
/// least one sits in layer `k - 1`. Nodes of one layer never depend on each other
/// and may run concurrently. Ids within a layer are sorted.
///
/// @implNote The graph structure is immutable. The contained nodes are mutable
/// and owned by the engine run that executes the graph; build a fresh graph per run.
/// @see FlowNode
/// @see StandardFlow
public final class FlowGraph {

    private static final Logger logger = Logger.getLogger(FlowGraph.class.getName());

    private final Map<String, FlowNode> nodes;
    private final List<String> executionOrder;
    private final List<List<String>> layers;
    private final Map<String, Set<String>> dependents;

    private FlowGraph(
            Map<String, FlowNode> nodes,
            List<String> executionOrder,
            List<List<String>> layers,
            Map<String, Set<String>> dependents) {
        this.nodes = Collections.unmodifiableMap(nodes);
        this.executionOrder = List.copyOf(executionOrder);
        this.layers = layers.stream().map(List::copyOf).toList();
        this.dependents = Collections.unmodifiableMap(dependents);
    }

    /// Builds and validates a graph.
    ///
    /// Validation runs in this order: duplicate ids, self dependencies, unknown
    /// dependency ids, cycles, unknown check ids.
    ///
    /// @param definitions node definitions, not null, may be in any order
    /// @param registry resolves each definition's check id, not null
    /// @return the validated graph, never null
    /// @throws FlowGraphException if the definitions do not form a valid DAG or
    /// reference an unregistered check
    public static FlowGraph build(List<NodeDefinition> definitions, CheckRegistry registry) {
        Map<String, NodeDefinition> byId = new TreeMap<>();
        for (NodeDefinition definition : definitions) {
            if (byId.putIfAbsent(definition.getId(), definition) != null) {
                throw new FlowGraphException("Duplicate node id: " + definition.getId());
            }
        }

        Map<String, Set<String>> dependents = new HashMap<>();
        for (NodeDefinition definition : byId.values()) {
            dependents.putIfAbsent(definition.getId(), new TreeSet<>());
            for (String dependency : definition.getDependencies()) {
                if (dependency.equals(definition.getId())) {
                    throw new FlowGraphException(
                            "Node '" + definition.getId() + "' depends on itself");
                }
                if (!byId.containsKey(dependency)) {
                    throw new FlowGraphException(
                            "Node '"
                                    + definition.getId()
                                    + "' depends on unknown node '"
                                    + dependency
                                    + "'");
                }
                dependents.computeIfAbsent(dependency, k -> new TreeSet<>()).add(definition.getId());
            }
        }

        List<String> order = topologicalOrder(byId, dependents);
        List<List<String>> layers = layersOf(byId, order);

        Map<String, FlowNode> nodes = new LinkedHashMap<>();
        for (String id : order) {
            NodeDefinition definition = byId.get(id);
            try {
                nodes.put(id, new FlowNode(definition, registry.createCheck(definition.getCheckId())));
            } catch (CheckNotFoundException e) {
                throw new FlowGraphException(
                        "Node '" + id + "' references unknown check '" + definition.getCheckId() + "'",
                        e);
            }
        }

        Map<String, Set<String>> frozen = new HashMap<>();
        dependents.forEach((id, ids) -> frozen.put(id, Collections.unmodifiableSet(ids)));

        logger.info("Built flow graph: " + nodes.size() + " nodes in " + layers.size() + " layers");
        return new FlowGraph(nodes, order, layers, frozen);
    }

    private static List<String> topologicalOrder(
            Map<String, NodeDefinition> byId, Map<String, Set<String>> dependents) {
        Map<String, Integer> inDegree = new HashMap<>();
        TreeSet<String> ready = new TreeSet<>();
        for (NodeDefinition definition : byId.values()) {
            int degree = definition.getDependencies().size();
            inDegree.put(definition.getId(), degree);
            if (degree == 0) {
                ready.add(definition.getId());
            }
        }

        List<String> order = new ArrayList<>(byId.size());
        while (!ready.isEmpty()) {
            String next = ready.pollFirst();
            order.add(next);
            for (String dependent : dependents.getOrDefault(next, Set.of())) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (order.size() < byId.size()) {
            Set<String> remaining = new TreeSet<>(byId.keySet());
            order.forEach(remaining::remove);
            throw new FlowGraphException("Dependency cycle detected among nodes: " + remaining);
        }
        return order;
    }

    private static List<List<String>> layersOf(
            Map<String, NodeDefinition> byId, List<String> order) {
        Map<String, Integer> depth = new HashMap<>();
        TreeMap<Integer, List<String>> grouped = new TreeMap<>();
        for (String id : order) {
            int level = 0;
            for (String dependency : byId.get(id).getDependencies()) {
                level = Math.max(level, depth.get(dependency) + 1);
            }
            depth.put(id, level);
            grouped.computeIfAbsent(level, k -> new ArrayList<>()).add(id);
        }
        List<List<String>> layers = new ArrayList<>();
        for (List<String> layer : grouped.values()) {
            Collections.sort(layer);
            layers.add(layer);
        }
        return layers;
    }

    /// Returns the node with the given id.
    ///
    /// @param id node id, not null
    /// @return the node, never null
    /// @throws IllegalArgumentException if the graph has no such node
    public FlowNode getNode(String id) {
        FlowNode node = nodes.get(id);
        if (node == null) {
            throw new IllegalArgumentException("Unknown node: " + id);
        }
        return node;
    }

    public boolean contains(String id) {
        return nodes.containsKey(id);
    }

    /// Returns every node in execution order.
    public Collection<FlowNode> getNodes() {
        return nodes.values();
    }

    /// Returns node ids in deterministic topological order.
    public List<String> getExecutionOrder() {
        return executionOrder;
    }

    /// Returns node ids grouped into layers, lowest layer first.
    public List<List<String>> getLayers() {
        return layers;
    }

    /// Returns the ids of nodes that declare a direct dependency on the given node.
    ///
    /// @param id node id, not null
    /// @return sorted direct dependents, never null
    public Set<String> getDependents(String id) {
        return dependents.getOrDefault(id, Set.of());
    }

    /// Returns every node reachable from the given node along dependent edges.
    ///
    /// @param id node id, not null
    /// @return sorted transitive dependents, excluding the node itself, never null
    public Set<String> getTransitiveDependents(String id) {
        Set<String> seen = new TreeSet<>();
        Deque<String> pending = new ArrayDeque<>(getDependents(id));
        while (!pending.isEmpty()) {
            String next = pending.pop();
            if (seen.add(next)) {
                pending.addAll(getDependents(next));
            }
        }
        return seen;
    }

    public int size() {
        return nodes.size();
    }
}
