package com.vsharp.vgc.engine;

import com.vsharp.vgc.api.CycleDetectedException;
import com.vsharp.vgc.api.GraphNode;
import com.vsharp.vgc.api.SourceRef;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Dependency order of a node set, the schedule the code builder emits in.
 *
 * Built from the input bindings of the nodes: a node depends on every producer
 * named by one of its connected inputs. Sorting uses Kahn's algorithm; nodes
 * that are ready at the same time keep their input order, but callers must not
 * rely on any particular order between independent nodes.
 *
 * Data layout:
 * - topoOrder: nodes sorted so that every producer precedes its consumers.
 * - childrenList / childrenOffset: flattened dependents per node. The children
 * of node i are childrenList[childrenOffset[i]] inclusive to
 * childrenList[childrenOffset[i+1]] exclusive, as topological indices.
 *
 * Instances are immutable; sorting never mutates the nodes.
 */
@Log4j2
public final class TopologicalOrder {
    private final GraphNode[] topoOrder;
    private final int[] childrenOffset;
    private final int[] childrenList;
    private final int[] parentCount;
    private final Map<String, Integer> idToIndex;

    private TopologicalOrder(GraphNode[] topoOrder, int[] childrenOffset, int[] childrenList,
            int[] parentCount, Map<String, Integer> idToIndex) {
        this.topoOrder = topoOrder;
        this.childrenOffset = childrenOffset;
        this.childrenList = childrenList;
        this.parentCount = parentCount;
        this.idToIndex = idToIndex;
    }

    /**
     * Orders a node set by its recorded bindings.
     *
     * @param nodes Every node of the graph, definition nodes included.
     * @return The nodes, each exactly once, producers before consumers.
     * @throws CycleDetectedException   if the bindings contain a cycle.
     * @throws IllegalArgumentException if a binding names a producer that is
     *                                  not in the set, or an id appears twice.
     */
    public static List<GraphNode> sort(List<? extends GraphNode> nodes) {
        return of(nodes).nodes();
    }

    /** Builds the full order structure for a node set. See {@link #sort(List)}. */
    public static TopologicalOrder of(List<? extends GraphNode> nodes) {
        Builder builder = builder();
        for (GraphNode node : nodes)
            builder.addNode(node);
        for (GraphNode node : nodes) {
            Set<String> producers = new LinkedHashSet<>();
            for (SourceRef ref : node.connectedInputs().values())
                producers.add(ref.producerId());
            for (String producerId : producers)
                builder.addEdge(producerId, node.id());
        }
        return builder.build();
    }

    public int nodeCount() {
        return topoOrder.length;
    }

    /** Returns the node at the given topological index. */
    public GraphNode node(int ti) {
        return topoOrder[ti];
    }

    /** Nodes in topological order. */
    public List<GraphNode> nodes() {
        return List.of(topoOrder);
    }

    /** Resolves a node id to its topological index. */
    public int topoIndex(String id) {
        Integer idx = idToIndex.get(id);
        if (idx == null)
            throw new IllegalArgumentException("Unknown node: " + id);
        return idx;
    }

    public int childCount(int ti) {
        return childrenOffset[ti + 1] - childrenOffset[ti];
    }

    public int child(int ti, int i) {
        return childrenList[childrenOffset[ti] + i];
    }

    public int parentCount(int ti) {
        return parentCount[ti];
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for constructing the TopologicalOrder.
     * Handles cycle detection and topological sorting.
     */
    public static final class Builder {
        private final List<GraphNode> nodes = new ArrayList<>();
        private final Map<String, Integer> idToIdx = new HashMap<>();
        private final Map<Integer, List<Integer>> forwardEdges = new HashMap<>();

        public Builder addNode(GraphNode node) {
            if (idToIdx.containsKey(node.id()))
                throw new IllegalArgumentException("Duplicate node: " + node.label());
            int idx = nodes.size();
            nodes.add(node);
            idToIdx.put(node.id(), idx);
            forwardEdges.put(idx, new ArrayList<>());
            return this;
        }

        /** Records that {@code to} depends on {@code from}. A self-edge is a cycle. */
        public Builder addEdge(String from, String to) {
            forwardEdges.get(requireIndex(from)).add(requireIndex(to));
            return this;
        }

        private int requireIndex(String id) {
            Integer idx = idToIdx.get(id);
            if (idx == null)
                throw new IllegalArgumentException("Unknown node: " + id);
            return idx;
        }

        /**
         * Schedules the nodes producers-first, failing if some node can never
         * become ready.
         */
        public TopologicalOrder build() {
            int n = nodes.size();
            int[] inDegree = new int[n];

            // Pending producers per consumer
            for (var entry : forwardEdges.entrySet())
                for (int child : entry.getValue())
                    inDegree[child]++;

            // Nodes with no producers are ready immediately, in input order
            int[] queue = new int[n];
            int head = 0, tail = 0;
            for (int i = 0; i < n; i++)
                if (inDegree[i] == 0)
                    queue[tail++] = i;

            // Emit ready nodes; a consumer becomes ready when its last producer is emitted
            int[] positionOf = new int[n], nodeAt = new int[n];
            int scheduled = 0;
            while (head < tail) {
                int ready = queue[head++];
                positionOf[ready] = scheduled;
                nodeAt[scheduled++] = ready;
                for (int child : forwardEdges.get(ready))
                    if (--inDegree[child] == 0)
                        queue[tail++] = child;
            }
            if (scheduled != n) {
                List<String> unresolved = new ArrayList<>();
                for (int i = 0; i < n; i++)
                    if (inDegree[i] > 0)
                        unresolved.add(nodes.get(i).label());
                throw new CycleDetectedException(scheduled, n, unresolved);
            }

            // Reorder nodes by schedule position
            GraphNode[] schedule = new GraphNode[n];
            Map<String, Integer> position = new HashMap<>(n * 2);
            for (int ti = 0; ti < n; ti++) {
                schedule[ti] = nodes.get(nodeAt[ti]);
                position.put(schedule[ti].id(), ti);
            }

            // Consumers per node, flattened into one offset-indexed array
            int[] offsets = new int[n + 1];
            for (int ti = 0; ti < n; ti++)
                offsets[ti + 1] = offsets[ti] + forwardEdges.get(nodeAt[ti]).size();

            int[] flatChildren = new int[offsets[n]];
            int[] producerCounts = new int[n];
            for (int ti = 0; ti < n; ti++) {
                List<Integer> children = forwardEdges.get(nodeAt[ti]);
                int base = offsets[ti];
                for (int j = 0; j < children.size(); j++) {
                    int childTi = positionOf[children.get(j)];
                    flatChildren[base + j] = childTi;
                    producerCounts[childTi]++;
                }
            }
            log.debug("Scheduled {} nodes, {} edges", n, offsets[n]);
            return new TopologicalOrder(schedule, offsets, flatChildren, producerCounts, position);
        }
    }
}
