package funcmap.base.graph;

import funcmap.base.Address;

import java.util.List;
import java.util.Set;

import org.jgrapht.Graph;
import org.jgrapht.graph.DefaultEdge;

/**
 * Read-only access to the inter-procedural call graph.
 */
public interface CallGraphView extends GraphView<Address> {

    Set<Address> getCallees(Address caller);

    Set<Address> getCallers(Address callee);

    /** Nodes without any caller. */
    Set<Address> getRoots();

    /** Nodes without any callee. */
    Set<Address> getLeaves();

    /**
     * Groups of mutually recursive functions: strongly connected components
     * with more than one node, or a single node calling itself.
     */
    List<Set<Address>> getRecursiveGroups();

    /** A detached copy of the graph, safe to hand to graph algorithms. */
    Graph<Address, DefaultEdge> toJGraphT();
}
