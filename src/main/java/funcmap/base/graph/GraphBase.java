package funcmap.base.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Adjacency-list directed graph keyed by node value.
 * The graph is simple: at most one edge per ordered pair of nodes.
 * Node and successor iteration follows insertion order.
 * @param <T> the node value type
 */
public abstract class GraphBase<T> implements GraphView<T> {

    /** Map from node's value to node */
    private final Map<T, NodeBase<T>> valueToNode = new LinkedHashMap<>();

    /** Number of nodes in the graph */
    protected int node_cnt = 0;

    /** Number of edges in the graph */
    protected int edge_cnt = 0;

    /**
     * Get a Node for the given value from the graph.
     * This may create a new node if needed.
     * @param value The node's value
     * @return the graph node.
     */
    public NodeBase<T> getNode(T value) {
        Objects.requireNonNull(value, "node value");
        return valueToNode.computeIfAbsent(value, v -> createNode(v, node_cnt++));
    }

    /**
     * Get the node of the given value without creating it.
     * @param value The node's value
     * @return the graph node, or null if the value is not in the graph
     */
    public NodeBase<T> findNode(T value) {
        return valueToNode.get(value);
    }

    /**
     * Create a graph edge with source and destination.
     * This also creates the graph node of the given parameters if needed.
     * @param from the source node's value
     * @param to the destination node's value
     * @return true if the edge is new, false if it already existed
     */
    public boolean addEdge(T from, T to) {
        NodeBase<T> src = getNode(from);
        NodeBase<T> dst = getNode(to);
        if (src.succ.contains(dst)) {
            return false;
        }
        src.succ.add(dst);
        dst.pred.add(src);
        edge_cnt++;
        return true;
    }

    @Override
    public Set<T> getNodes() {
        return Collections.unmodifiableSet(valueToNode.keySet());
    }

    /**
     * Return all graph nodes in insertion order.
     */
    public Iterable<NodeBase<T>> getAllNodes() {
        return Collections.unmodifiableCollection(valueToNode.values());
    }

    @Override
    public boolean containsNode(T value) {
        return valueToNode.containsKey(value);
    }

    @Override
    public boolean hasEdge(T from, T to) {
        NodeBase<T> src = findNode(from);
        NodeBase<T> dst = findNode(to);
        return src != null && dst != null && src.succ.contains(dst);
    }

    @Override
    public Set<T> getSuccs(T value) {
        NodeBase<T> tmp = findNode(value);
        Set<T> res = new LinkedHashSet<>();
        if (tmp == null) {
            return res;
        }
        for (NodeBase<T> node : tmp.succ) {
            res.add(node.value);
        }
        return res;
    }

    @Override
    public Set<T> getPreds(T value) {
        NodeBase<T> tmp = findNode(value);
        Set<T> res = new LinkedHashSet<>();
        if (tmp == null) {
            return res;
        }
        for (NodeBase<T> node : tmp.pred) {
            res.add(node.value);
        }
        return res;
    }

    @Override
    public boolean hasPath(T from, T to) {
        NodeBase<T> src = findNode(from);
        NodeBase<T> dst = findNode(to);
        if (src == null || dst == null) {
            return false;
        }

        LinkedList<NodeBase<T>> workList = new LinkedList<>();
        Set<NodeBase<T>> visited = new LinkedHashSet<>();
        workList.add(src);
        while (!workList.isEmpty()) {
            var cur = workList.remove();
            for (var succ : cur.succ) {
                if (succ == dst) {
                    return true;
                }
                if (visited.add(succ)) {
                    workList.add(succ);
                }
            }
        }
        return false;
    }

    @Override
    public int getNodeCount() {
        return node_cnt;
    }

    @Override
    public int getEdgeCount() {
        return edge_cnt;
    }

    /**
     * Create a graph node with the given value.
     * @param value the node's value
     * @return the graph node
     */
    protected abstract NodeBase<T> createNode(T value, int node_id);
}
