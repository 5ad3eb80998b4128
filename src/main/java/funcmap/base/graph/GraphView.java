package funcmap.base.graph;

import java.util.Set;

/**
 * Read-only access to a directed graph. None of these methods create nodes.
 * @param <T> the node value type
 */
public interface GraphView<T> {

    /** All node values, in the order they were first added. */
    Set<T> getNodes();

    boolean containsNode(T value);

    boolean hasEdge(T from, T to);

    /** Successor values, empty if the node is unknown. */
    Set<T> getSuccs(T value);

    /** Predecessor values, empty if the node is unknown. */
    Set<T> getPreds(T value);

    /** Check if there is a path of one or more edges from {@code from} to {@code to}. */
    boolean hasPath(T from, T to);

    int getNodeCount();

    int getEdgeCount();
}
